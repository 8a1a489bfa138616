package io.clusterquery.query.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.clusterquery.query.QueryPayloadException;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * JSON helpers for building query payloads and reading gathered responses.
 */
public final class JsonQueryPayloads {

    private JsonQueryPayloads() {
    }

    public static byte[] encode(ObjectMapper objectMapper, Object value) {
        Objects.requireNonNull(objectMapper, "objectMapper");
        Objects.requireNonNull(value, "value");
        try {
            return objectMapper.writeValueAsBytes(value);
        } catch (JsonProcessingException ex) {
            throw new QueryPayloadException("Cannot encode " + value.getClass().getSimpleName() + " as JSON", ex);
        }
    }

    /**
     * Decodes every gathered response, preserving arrival order.
     */
    public static <T> List<T> decodeAll(ObjectMapper objectMapper, List<byte[]> payloads, Class<T> type) {
        Objects.requireNonNull(objectMapper, "objectMapper");
        Objects.requireNonNull(payloads, "payloads");
        Objects.requireNonNull(type, "type");
        List<T> decoded = new ArrayList<>(payloads.size());
        for (byte[] payload : payloads) {
            try {
                decoded.add(objectMapper.readValue(payload, type));
            } catch (IOException ex) {
                throw new QueryPayloadException("Cannot decode response as " + type.getSimpleName(), ex);
            }
        }
        return decoded;
    }
}
