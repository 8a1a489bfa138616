package io.clusterquery.query.spring;

import static org.assertj.core.api.Assertions.assertThat;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class MicrometerQueryMetricsTest {

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final MicrometerQueryMetrics metrics = new MicrometerQueryMetrics(registry);

    @Test
    void countsRequestsPerQueryType() {
        metrics.requestIssued("presence");
        metrics.requestIssued("presence");
        metrics.requestHandled("stats");
        metrics.requestRejected("unknown-peer");

        assertThat(registry.get("cq_query_requests_issued").tag("query_type", "presence").counter().count())
            .isEqualTo(2.0);
        assertThat(registry.get("cq_query_requests_handled").tag("query_type", "stats").counter().count())
            .isEqualTo(1.0);
        assertThat(registry.get("cq_query_requests_rejected").tag("reason", "unknown-peer").counter().count())
            .isEqualTo(1.0);
    }

    @Test
    void countsDeliveredAndDroppedResponses() {
        metrics.responseDelivered();
        metrics.responseDropped();
        metrics.responseDropped();

        assertThat(registry.get("cq_query_responses_delivered").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("cq_query_responses_dropped").counter().count()).isEqualTo(2.0);
    }

    @Test
    void recordsGatherDurationAndPartialResults() {
        metrics.gatherCompleted(3, 3, Duration.ofMillis(20));
        metrics.gatherCompleted(3, 1, Duration.ofMillis(100));

        assertThat(registry.get("cq_query_gather").timer().count()).isEqualTo(2);
        assertThat(registry.get("cq_query_gather_partial").counter().count()).isEqualTo(1.0);
    }
}
