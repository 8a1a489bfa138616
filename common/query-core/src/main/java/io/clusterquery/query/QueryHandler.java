package io.clusterquery.query;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Answers queries received from cluster peers.
 * <p>
 * Handlers are tried in registration order. A handler claims a query by returning a response; the
 * first claim wins and later handlers are not consulted.
 */
@FunctionalInterface
public interface QueryHandler {

    /**
     * @return the response payload if this handler claims the query, otherwise empty
     */
    Optional<byte[]> handle(String queryType, byte[] request);

    /**
     * Handler that claims exactly one query type and always answers it.
     */
    static QueryHandler forType(String queryType, Function<byte[], byte[]> responder) {
        String type = QueryChannel.requireQueryType(queryType);
        Objects.requireNonNull(responder, "responder");
        return (candidate, request) -> type.equals(candidate)
            ? Optional.of(Objects.requireNonNull(responder.apply(request), "response"))
            : Optional.empty();
    }
}
