package com.campus.messaging.infrastructure;

/**
 * One physical connection attempt.
 */
public interface ConnectionHandle {

    int NORMAL_CLOSURE = 1000;
    int ABNORMAL_CLOSURE = 1006;

    /**
     * Hand a text frame to the transport. Delivery is not confirmed.
     *
     * @throws com.campus.messaging.exception.FrameSendException if the connection is not open or the write fails
     */
    void send(String frame);

    /**
     * Idempotent. Closing a handle that never opened or already closed does nothing.
     */
    void close(int code, String reason);

    boolean isOpen();
}
