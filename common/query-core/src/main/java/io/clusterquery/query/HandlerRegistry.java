package io.clusterquery.query;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Ordered, first-match list of query handlers.
 */
final class HandlerRegistry {

    private final List<QueryHandler> handlers = new CopyOnWriteArrayList<>();

    void register(QueryHandler handler) {
        handlers.add(Objects.requireNonNull(handler, "handler"));
    }

    Optional<byte[]> dispatch(String queryType, byte[] request) {
        for (QueryHandler handler : handlers) {
            Optional<byte[]> response = handler.handle(queryType, request);
            if (response != null && response.isPresent()) {
                return response;
            }
        }
        return Optional.empty();
    }

    int size() {
        return handlers.size();
    }
}
