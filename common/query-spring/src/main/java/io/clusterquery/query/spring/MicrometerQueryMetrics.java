package io.clusterquery.query.spring;

import io.clusterquery.query.QueryMetrics;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.Objects;

/**
 * Publishes query traffic counters and gather timings to Micrometer.
 */
public final class MicrometerQueryMetrics implements QueryMetrics {

    private final MeterRegistry meterRegistry;
    private final Counter delivered;
    private final Counter dropped;
    private final Counter partial;
    private final Timer gather;

    public MicrometerQueryMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry");
        this.delivered = Counter.builder("cq_query_responses_delivered")
            .description("Responses routed to a pending query")
            .register(meterRegistry);
        this.dropped = Counter.builder("cq_query_responses_dropped")
            .description("Responses for queries that were no longer pending")
            .register(meterRegistry);
        this.partial = Counter.builder("cq_query_gather_partial")
            .description("Gathers that completed with fewer responses than expected")
            .register(meterRegistry);
        this.gather = Timer.builder("cq_query_gather")
            .description("Time spent gathering query responses")
            .register(meterRegistry);
    }

    @Override
    public void requestIssued(String queryType) {
        meterRegistry.counter("cq_query_requests_issued", "query_type", queryType).increment();
    }

    @Override
    public void requestHandled(String queryType) {
        meterRegistry.counter("cq_query_requests_handled", "query_type", queryType).increment();
    }

    @Override
    public void requestRejected(String reason) {
        meterRegistry.counter("cq_query_requests_rejected", "reason", reason).increment();
    }

    @Override
    public void responseDelivered() {
        delivered.increment();
    }

    @Override
    public void responseDropped() {
        dropped.increment();
    }

    @Override
    public void gatherCompleted(int expected, int received, Duration elapsed) {
        gather.record(elapsed);
        if (received < expected) {
            partial.increment();
        }
    }
}
