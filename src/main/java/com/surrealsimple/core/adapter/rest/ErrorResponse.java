package com.surrealsimple.core.adapter.rest;

/**
 * JSON error body returned by the REST adapters.
 */
public class ErrorResponse {

    public static final String PARSE_ERROR = "PARSE_ERROR";
    public static final String STATE_ERROR = "STATE_ERROR";
    public static final String OUTCOME_UNKNOWN = "OUTCOME_UNKNOWN";
    public static final String EXECUTION_ERROR = "EXECUTION_ERROR";
    public static final String NOT_FOUND = "NOT_FOUND";
    public static final String INVALID_REQUEST = "INVALID_REQUEST";
    public static final String INTERNAL_ERROR = "INTERNAL_ERROR";

    private final String code;
    private final String message;

    private ErrorResponse(String code, String message) {
        this.code = code;
        this.message = message;
    }

    public static ErrorResponse of(String code, String message) {
        return new ErrorResponse(code, message);
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return String.format("ErrorResponse{code=%s, message=%s}", code, message);
    }
}
