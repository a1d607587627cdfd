package com.surrealsimple.core.session;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Result slots returned for a submitted script, indexed by statement position.
 */
public class QueryResponse {

    private static final QueryResponse EMPTY = new QueryResponse(List.of());

    private final List<QueryResult> results;

    public QueryResponse(List<QueryResult> results) {
        this.results = Collections.unmodifiableList(new ArrayList<>(results));
    }

    public static QueryResponse empty() {
        return EMPTY;
    }

    /**
     * Build a response from the engine's JSON reply: an array of
     * {@code {"status": "OK"|"ERR", "time": ..., "result": ...}} objects.
     * Error text is read from {@code detail} when present, otherwise from {@code result}.
     */
    public static QueryResponse fromJson(JsonNode reply) {
        if (reply == null || reply.isNull() || reply.isMissingNode()) {
            return EMPTY;
        }
        if (!reply.isArray()) {
            throw new IllegalArgumentException("Expected an array of statement results but got " + reply.getNodeType());
        }
        List<QueryResult> slots = new ArrayList<>(reply.size());
        for (JsonNode slot : reply) {
            String time = slot.path("time").asText(null);
            if ("OK".equalsIgnoreCase(slot.path("status").asText())) {
                slots.add(new QueryResult(QueryResult.Status.OK, time, slot.get("result"), null));
            } else {
                String detail = slot.hasNonNull("detail")
                    ? slot.get("detail").asText()
                    : slot.path("result").asText("unknown error");
                slots.add(new QueryResult(QueryResult.Status.ERR, time, null, detail));
            }
        }
        return new QueryResponse(slots);
    }

    public List<QueryResult> getResults() {
        return results;
    }

    public QueryResult get(int index) {
        return results.get(index);
    }

    public int size() {
        return results.size();
    }

    public boolean isEmpty() {
        return results.isEmpty();
    }

    public boolean hasErrors() {
        return results.stream().anyMatch(r -> !r.isOk());
    }

    public Optional<QueryResult> firstError() {
        return results.stream().filter(r -> !r.isOk()).findFirst();
    }

    @Override
    public String toString() {
        return String.format("QueryResponse{slots=%d, errors=%s}", results.size(), hasErrors());
    }
}
