package com.surrealsimple.core.session;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Request and reply frames as exchanged with a SurrealDB 1.x server.
 */
public class RpcCodecTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final RpcCodec codec = new RpcCodec(mapper);

    @Test
    void testEncodeQueryRequest() throws Exception {
        String frame = codec.encode("7", "query", List.of("SELECT * FROM type::thing($tb, $id)", Map.of("id", "1")));

        JsonNode request = mapper.readTree(frame);
        assertEquals("7", request.get("id").asText());
        assertEquals("query", request.get("method").asText());
        assertEquals("SELECT * FROM type::thing($tb, $id)", request.get("params").get(0).asText());
        assertEquals("1", request.get("params").get(1).get("id").asText());
    }

    @Test
    void testEncodeSigninRequest() throws Exception {
        String frame = codec.encode("1", "signin", List.of(Map.of("user", "surreal", "pass", "password")));

        JsonNode credentials = mapper.readTree(frame).get("params").get(0);
        assertEquals("surreal", credentials.get("user").asText());
        assertEquals("password", credentials.get("pass").asText());
    }

    @Test
    void testDecodeQueryReply() throws Exception {
        String frame = "{\"id\":\"7\",\"result\":[{\"result\":[{\"id\":\"person:1\",\"name\":\"John\"}],"
            + "\"status\":\"OK\",\"time\":\"112.5µs\"}]}";

        RpcCodec.RpcReply reply = codec.decode(frame);

        assertEquals("7", reply.getId());
        assertFalse(reply.isError());
        QueryResponse response = QueryResponse.fromJson(reply.getResult());
        assertEquals(1, response.size());
        assertEquals("John", response.get(0).getResult().get(0).get("name").asText());
        assertEquals("112.5µs", response.get(0).getTime());
    }

    @Test
    void testDecodeErrorReply() throws Exception {
        String frame = "{\"id\":\"3\",\"error\":{\"code\":-32000,\"message\":\"There was a problem with authentication\"}}";

        RpcCodec.RpcReply reply = codec.decode(frame);

        assertTrue(reply.isError());
        assertEquals("3", reply.getId());
        assertEquals(-32000, reply.getErrorCode());
        assertEquals("There was a problem with authentication", reply.getErrorMessage());
    }

    @Test
    void testDecodeNullResult() throws Exception {
        RpcCodec.RpcReply reply = codec.decode("{\"id\":\"2\",\"result\":null}");

        assertFalse(reply.isError());
        assertTrue(QueryResponse.fromJson(reply.getResult()).isEmpty());
    }

    @Test
    void testDecodeNotificationWithoutId() throws Exception {
        RpcCodec.RpcReply reply = codec.decode("{\"result\":{\"action\":\"CREATE\"}}");
        assertNull(reply.getId());
    }
}
