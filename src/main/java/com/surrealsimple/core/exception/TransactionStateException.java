package com.surrealsimple.core.exception;

/**
 * A transaction handle was used outside the OPEN state.
 * This is a caller bug, not a runtime condition to recover from.
 */
public class TransactionStateException extends IllegalStateException {

    public TransactionStateException(String message) {
        super(message);
    }
}
