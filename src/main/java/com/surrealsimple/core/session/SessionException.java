package com.surrealsimple.core.session;

/**
 * Transport or protocol level failure of a session call.
 */
public class SessionException extends Exception {

    public SessionException(String message) {
        super(message);
    }

    public SessionException(String message, Throwable cause) {
        super(message, cause);
    }
}
