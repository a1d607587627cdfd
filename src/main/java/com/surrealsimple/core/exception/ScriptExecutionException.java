package com.surrealsimple.core.exception;

import com.surrealsimple.core.session.QueryResponse;

/**
 * The database rejected or failed a submitted script, or the session could
 * not deliver it.
 */
public class ScriptExecutionException extends QueryException {

    private final transient QueryResponse response;

    public ScriptExecutionException(String message, String script, Throwable cause) {
        super(message, script, cause);
        this.response = null;
    }

    public ScriptExecutionException(String message, String script, QueryResponse response) {
        super(message, script);
        this.response = response;
    }

    /**
     * The response the engine returned, when the failure was reported in one
     * or more result slots. Null when the session itself failed.
     */
    public QueryResponse getResponse() {
        return response;
    }
}
