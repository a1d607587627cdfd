package com.surrealsimple.core.exception;

import com.surrealsimple.core.session.QueryResponse;

/**
 * Failure of a transaction boundary: begin, commit or rollback.
 */
public class TransactionException extends ScriptExecutionException {

    public TransactionException(String message, String marker, Throwable cause) {
        super(message, marker, cause);
    }

    public TransactionException(String message, String marker, QueryResponse response) {
        super(message, marker, response);
    }
}
