package io.clusterquery.query.spring;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class QueryPropertiesTest {

    @Test
    void defaultsMatchDocumentedValues() {
        QueryProperties properties = new QueryProperties();

        assertThat(properties.isEnabled()).isTrue();
        assertThat(properties.isDeclareTopology()).isTrue();
        assertThat(properties.getExchange()).isEqualTo("cq.query");
        assertThat(properties.getQueuePrefix()).isEqualTo("cq.query");
        assertThat(properties.getDefaultTimeout()).isEqualTo(Duration.ofSeconds(2));
        assertThat(properties.getPeers()).isEmpty();
    }

    @Test
    void queueNameCombinesPrefixAndNodeAddress() {
        QueryProperties properties = new QueryProperties();
        properties.setQueuePrefix("cq.nodes");
        properties.setNodeAddress(12L);

        assertThat(properties.queueName()).isEqualTo("cq.nodes.12");
    }

    @Test
    void queueNameRequiresNodeAddress() {
        assertThatThrownBy(() -> new QueryProperties().queueName())
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("clusterquery.query.node-address must not be null");
    }

    @Test
    void rejectsBlankExchange() {
        assertThatThrownBy(() -> new QueryProperties().setExchange(" "))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("clusterquery.query.exchange must not be null or blank");
    }

    @Test
    void rejectsNonPositiveTimeout() {
        QueryProperties properties = new QueryProperties();

        assertThatThrownBy(() -> properties.setDefaultTimeout(Duration.ZERO))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("clusterquery.query.default-timeout must be positive");
    }

    @Test
    void copiesPeerList() {
        QueryProperties properties = new QueryProperties();
        List<Long> peers = new ArrayList<>(List.of(1L, 2L));

        properties.setPeers(peers);
        peers.add(3L);

        assertThat(properties.getPeers()).containsExactly(1L, 2L);
    }
}
