package io.clusterquery.query;

import java.time.Duration;

/**
 * Metrics sink for query traffic.
 */
public interface QueryMetrics {

    QueryMetrics NOOP = new QueryMetrics() {
    };

    default void requestIssued(String queryType) {
    }

    default void requestHandled(String queryType) {
    }

    default void requestRejected(String reason) {
    }

    default void responseDelivered() {
    }

    default void responseDropped() {
    }

    default void gatherCompleted(int expected, int received, Duration elapsed) {
    }
}
