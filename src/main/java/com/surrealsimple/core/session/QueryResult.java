package com.surrealsimple.core.session;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import lombok.Getter;

/**
 * Outcome of one statement inside a submitted script.
 */
@Getter
public class QueryResult {

    public enum Status {
        OK,
        ERR
    }

    private final Status status;
    private final String time;
    private final JsonNode result;
    private final String detail;

    public QueryResult(Status status, String time, JsonNode result, String detail) {
        this.status = status;
        this.time = time;
        this.result = result != null ? result : NullNode.getInstance();
        this.detail = detail;
    }

    public static QueryResult ok(JsonNode result) {
        return new QueryResult(Status.OK, null, result, null);
    }

    public static QueryResult error(String detail) {
        return new QueryResult(Status.ERR, null, null, detail);
    }

    public boolean isOk() {
        return status == Status.OK;
    }

    @Override
    public String toString() {
        return isOk()
            ? String.format("QueryResult{OK, time=%s}", time)
            : String.format("QueryResult{ERR, detail=%s}", detail);
    }
}
