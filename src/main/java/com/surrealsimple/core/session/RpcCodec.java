package com.surrealsimple.core.session;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

/**
 * JSON framing for SurrealDB's RPC protocol.
 *
 * Request:  {@code {"id": "7", "method": "query", "params": [...]}}
 * Reply:    {@code {"id": "7", "result": ...}} or {@code {"id": "7", "error": {"code": -32000, "message": "..."}}}
 */
final class RpcCodec {

    private final ObjectMapper mapper;

    RpcCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    String encode(String id, String method, List<?> params) throws JsonProcessingException {
        ObjectNode request = mapper.createObjectNode();
        request.put("id", id);
        request.put("method", method);
        request.set("params", mapper.valueToTree(params));
        return mapper.writeValueAsString(request);
    }

    RpcReply decode(String frame) throws JsonProcessingException {
        JsonNode node = mapper.readTree(frame);
        String id = node.hasNonNull("id") ? node.get("id").asText() : null;
        JsonNode error = node.get("error");
        if (error != null && !error.isNull()) {
            return new RpcReply(id, null, error.path("code").asInt(0), error.path("message").asText("unknown error"));
        }
        return new RpcReply(id, node.get("result"), null, null);
    }

    @Getter
    @AllArgsConstructor
    static final class RpcReply {
        private final String id;
        private final JsonNode result;
        private final Integer errorCode;
        private final String errorMessage;

        boolean isError() {
            return errorMessage != null;
        }
    }
}
