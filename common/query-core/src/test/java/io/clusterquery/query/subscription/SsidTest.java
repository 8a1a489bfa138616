package io.clusterquery.query.subscription;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class SsidTest {

    @Test
    void rendersSegmentsAsUnsignedDecimal() {
        Ssid ssid = Ssid.of(0, (int) 3_939_663_052L, -1);

        assertThat(ssid.toString()).isEqualTo("0.3939663052.4294967295");
        assertThat(Ssid.parse(ssid.toString())).isEqualTo(ssid);
    }

    @Test
    void appendLeavesOriginalUntouched() {
        Ssid base = Ssid.of(1, 2);
        Ssid extended = base.append(3);

        assertThat(base.size()).isEqualTo(2);
        assertThat(extended.size()).isEqualTo(3);
        assertThat(extended.segment(2)).isEqualTo(3);
        assertThat(extended.startsWith(base)).isTrue();
        assertThat(base.startsWith(extended)).isFalse();
        assertThat(extended.prefix(2)).isEqualTo(base);
    }

    @Test
    void copiesInputSegments() {
        int[] segments = {1, 2};
        Ssid ssid = Ssid.of(segments);
        segments[0] = 9;

        assertThat(ssid.segment(0)).isEqualTo(1);
    }

    @Test
    void equalityFollowsSegments() {
        assertThat(Ssid.of(1, 2, 3)).isEqualTo(Ssid.of(1, 2, 3)).hasSameHashCodeAs(Ssid.of(1, 2, 3));
        assertThat(Ssid.of(1, 2, 3)).isNotEqualTo(Ssid.of(1, 2));
    }

    @Test
    void rejectsMalformedText() {
        assertThatThrownBy(() -> Ssid.parse("1.x.3"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("ssid segment 'x' is not an unsigned 32-bit number");
        assertThatThrownBy(() -> Ssid.parse("4294967296"))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Ssid.parse(" "))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("ssid must not be null or blank");
    }

    @Test
    void rejectsEmptySegments() {
        assertThatThrownBy(() -> Ssid.of())
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("ssid must have at least one segment");
    }
}
