package io.clusterquery.query;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class QueryChannelTest {

    @Test
    void encodesQueryTypeAndReplyAddress() {
        assertThat(QueryChannel.requestChannel("presence", 123456789012L)).isEqualTo("presence/123456789012");
    }

    @Test
    void parsesRequestChannel() {
        QueryChannel.RequestChannel channel = QueryChannel.parseRequest("stats/42");

        assertThat(channel.queryType()).isEqualTo("stats");
        assertThat(channel.replyAddress()).isEqualTo(42L);
    }

    @Test
    void parsesNegativeAddress() {
        assertThat(QueryChannel.parseRequest("stats/-5").replyAddress()).isEqualTo(-5L);
    }

    @Test
    void rejectsNonNumericReplyAddress() {
        assertThatThrownBy(() -> QueryChannel.parseRequest("stats/abc"))
            .isInstanceOf(MalformedReplyAddressException.class)
            .hasMessage("Malformed reply address in query channel 'stats/abc'");
    }

    @Test
    void rejectsChannelWithoutReplyAddress() {
        assertThatThrownBy(() -> QueryChannel.parseRequest("stats"))
            .isInstanceOf(MalformedReplyAddressException.class);
        assertThatThrownBy(() -> QueryChannel.parseRequest("stats/"))
            .isInstanceOf(MalformedReplyAddressException.class);
        assertThatThrownBy(() -> QueryChannel.parseRequest(null))
            .isInstanceOf(MalformedReplyAddressException.class);
    }

    @Test
    void recognisesResponseChannel() {
        assertThat(QueryChannel.isResponse("response")).isTrue();
        assertThat(QueryChannel.isResponse("response/1")).isFalse();
        assertThat(QueryChannel.isResponse(null)).isFalse();
    }

    @Test
    void rejectsBlankQueryType() {
        assertThatThrownBy(() -> QueryChannel.requestChannel(" ", 1L))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("queryType must not be null or blank");
    }
}
