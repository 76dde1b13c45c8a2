package com.campus.messaging.exception;

/**
 * Thrown when a frame cannot be handed to the transport.
 */
public class FrameSendException extends RuntimeException {

    public FrameSendException(String message) {
        super(message);
    }

    public FrameSendException(String message, Throwable cause) {
        super(message, cause);
    }
}
