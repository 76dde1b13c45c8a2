package com.campus.messaging.exception;

/**
 * A connection attempt cannot succeed no matter how often it is retried
 * (missing credential, missing conversation id, unusable endpoint, no transport).
 */
public class SessionPreconditionException extends RuntimeException {

    public SessionPreconditionException(String message) {
        super(message);
    }

    public SessionPreconditionException(String message, Throwable cause) {
        super(message, cause);
    }
}
