package io.clusterquery.query.json;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.clusterquery.query.QueryHandler;
import io.clusterquery.query.QueryPayloadException;
import java.io.IOException;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Adapts a typed responder to a {@link QueryHandler} that exchanges JSON payloads.
 * <p>
 * The handler claims a single query type. A responder returning {@code null} declines the query so
 * that later handlers get a chance to answer it.
 */
public final class JsonQueryHandler<Q, R> implements QueryHandler {

    private final String queryType;
    private final ObjectMapper objectMapper;
    private final Class<Q> requestType;
    private final Function<Q, R> responder;

    private JsonQueryHandler(String queryType, ObjectMapper objectMapper, Class<Q> requestType,
                             Function<Q, R> responder) {
        if (queryType == null || queryType.isBlank()) {
            throw new IllegalArgumentException("queryType must not be null or blank");
        }
        this.queryType = queryType;
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.requestType = Objects.requireNonNull(requestType, "requestType");
        this.responder = Objects.requireNonNull(responder, "responder");
    }

    public static <Q, R> JsonQueryHandler<Q, R> of(String queryType, ObjectMapper objectMapper,
                                                  Class<Q> requestType, Function<Q, R> responder) {
        return new JsonQueryHandler<>(queryType, objectMapper, requestType, responder);
    }

    public String queryType() {
        return queryType;
    }

    @Override
    public Optional<byte[]> handle(String candidate, byte[] request) {
        if (!queryType.equals(candidate)) {
            return Optional.empty();
        }
        Q decoded = decode(request);
        R response = responder.apply(decoded);
        if (response == null) {
            return Optional.empty();
        }
        return Optional.of(JsonQueryPayloads.encode(objectMapper, response));
    }

    private Q decode(byte[] request) {
        if (request == null || request.length == 0) {
            throw new QueryPayloadException("Empty payload for query '" + queryType + "'", null);
        }
        try {
            return objectMapper.readValue(request, requestType);
        } catch (IOException ex) {
            throw new QueryPayloadException("Cannot decode payload for query '" + queryType + "' as "
                + requestType.getSimpleName(), ex);
        }
    }
}
