package io.clusterquery.query.spring;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.clusterquery.query.QueryManager;
import io.clusterquery.query.json.JsonQueryPayloads;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Issues cluster queries with the configured default timeout, optionally exchanging JSON payloads.
 */
public final class QueryTemplate {

    private final QueryManager manager;
    private final ObjectMapper objectMapper;
    private final Duration defaultTimeout;

    public QueryTemplate(QueryManager manager, ObjectMapper objectMapper, Duration defaultTimeout) {
        this.manager = Objects.requireNonNull(manager, "manager");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.defaultTimeout = Objects.requireNonNull(defaultTimeout, "defaultTimeout");
    }

    public List<byte[]> query(String queryType, byte[] payload) {
        return manager.query(queryType, payload, defaultTimeout);
    }

    public List<byte[]> query(String queryType, byte[] payload, Duration timeout) {
        return manager.query(queryType, payload, timeout);
    }

    /**
     * Sends {@code request} as JSON and decodes every response as {@code responseType}.
     */
    public <T> List<T> query(String queryType, Object request, Class<T> responseType) {
        byte[] payload = JsonQueryPayloads.encode(objectMapper, request);
        List<byte[]> responses = manager.query(queryType, payload, defaultTimeout);
        return JsonQueryPayloads.decodeAll(objectMapper, responses, responseType);
    }

    public Duration defaultTimeout() {
        return defaultTimeout;
    }
}
