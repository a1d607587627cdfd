package com.surrealsimple.core.exception;

/**
 * Base class for the checked failures raised by the query layer.
 * Every subclass carries the statement or script text it failed on.
 */
public class QueryException extends Exception {

    private final String queryText;

    public QueryException(String message, String queryText) {
        super(message);
        this.queryText = queryText;
    }

    public QueryException(String message, String queryText, Throwable cause) {
        super(message, cause);
        this.queryText = queryText;
    }

    /**
     * The statement or script this failure refers to. May be null when the
     * failure happened before any text was submitted.
     */
    public String getQueryText() {
        return queryText;
    }
}
