package io.clusterquery.query.json;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.clusterquery.query.QueryPayloadException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class JsonQueryHandlerTest {

    private final ObjectMapper mapper = new ObjectMapper().findAndRegisterModules();

    @Test
    void answersClaimedQueryWithEncodedResponse() {
        JsonQueryHandler<PresenceRequest, PresenceResponse> handler = JsonQueryHandler.of(
            "presence", mapper, PresenceRequest.class,
            request -> new PresenceResponse(request.channel(), 3));

        Optional<byte[]> response = handler.handle("presence", json("{\"channel\":\"chat/lobby\"}"));

        assertThat(response).isPresent();
        assertThat(new String(response.get(), StandardCharsets.UTF_8))
            .isEqualTo("{\"channel\":\"chat/lobby\",\"subscribers\":3}");
    }

    @Test
    void declinesOtherQueryTypes() {
        JsonQueryHandler<PresenceRequest, PresenceResponse> handler = JsonQueryHandler.of(
            "presence", mapper, PresenceRequest.class,
            request -> new PresenceResponse(request.channel(), 3));

        assertThat(handler.handle("stats", json("{}"))).isEmpty();
    }

    @Test
    void declinesWhenResponderReturnsNull() {
        JsonQueryHandler<PresenceRequest, PresenceResponse> handler = JsonQueryHandler.of(
            "presence", mapper, PresenceRequest.class, request -> null);

        assertThat(handler.handle("presence", json("{\"channel\":\"a\"}"))).isEmpty();
    }

    @Test
    void rejectsUndecodablePayload() {
        JsonQueryHandler<PresenceRequest, PresenceResponse> handler = JsonQueryHandler.of(
            "presence", mapper, PresenceRequest.class,
            request -> new PresenceResponse(request.channel(), 3));

        assertThatThrownBy(() -> handler.handle("presence", json("{not-json")))
            .isInstanceOf(QueryPayloadException.class)
            .hasMessage("Cannot decode payload for query 'presence' as PresenceRequest");
        assertThatThrownBy(() -> handler.handle("presence", new byte[0]))
            .isInstanceOf(QueryPayloadException.class)
            .hasMessage("Empty payload for query 'presence'");
    }

    @Test
    void decodesGatheredResponsesInOrder() {
        List<byte[]> payloads = List.of(
            JsonQueryPayloads.encode(mapper, new PresenceResponse("a", 1)),
            JsonQueryPayloads.encode(mapper, new PresenceResponse("a", 4)));

        List<PresenceResponse> decoded = JsonQueryPayloads.decodeAll(mapper, payloads, PresenceResponse.class);

        assertThat(decoded).extracting(PresenceResponse::subscribers).containsExactly(1, 4);
    }

    @Test
    void decodeAllFailsOnMalformedResponse() {
        assertThatThrownBy(() -> JsonQueryPayloads.decodeAll(mapper, List.of(json("[")), PresenceResponse.class))
            .isInstanceOf(QueryPayloadException.class)
            .hasMessage("Cannot decode response as PresenceResponse");
    }

    private static byte[] json(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }

    record PresenceRequest(String channel) {
    }

    record PresenceResponse(String channel, int subscribers) {
    }
}
