package com.surrealsimple.core.exception;

/**
 * A request was sent but its reply was never observed (the caller was
 * interrupted, the request timed out or the connection dropped). The engine
 * may or may not have applied it; re-read state before deciding to retry.
 */
public class IndeterminateOutcomeException extends TransactionException {

    public IndeterminateOutcomeException(String message, String script, Throwable cause) {
        super(message, script, cause);
    }
}
