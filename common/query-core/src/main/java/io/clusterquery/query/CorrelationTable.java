package io.clusterquery.query;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Pending queries keyed by correlation id.
 * <p>
 * Inserts are last-write-wins; removal is conditional on the awaiter so that an awaiter never evicts
 * a newer one registered under a reused id.
 */
final class CorrelationTable {

    private final ConcurrentMap<Integer, QueryAwaiter> awaiters = new ConcurrentHashMap<>();

    void register(QueryAwaiter awaiter) {
        QueryAwaiter previous = awaiters.put(awaiter.id(), awaiter);
        if (previous != null) {
            previous.close();
        }
    }

    QueryAwaiter find(int correlationId) {
        return awaiters.get(correlationId);
    }

    boolean remove(QueryAwaiter awaiter) {
        return awaiters.remove(awaiter.id(), awaiter);
    }

    int size() {
        return awaiters.size();
    }
}
