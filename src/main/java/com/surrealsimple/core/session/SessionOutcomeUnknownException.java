package com.surrealsimple.core.session;

/**
 * The request left this process but its reply never arrived.
 */
public class SessionOutcomeUnknownException extends SessionException {

    public SessionOutcomeUnknownException(String message, Throwable cause) {
        super(message, cause);
    }
}
