package com.campus.messaging.infrastructure;

/**
 * Lifecycle events of a {@link ConnectionHandle}.
 *
 * {@code onClosed} is reported exactly once per handle and covers graceful and
 * abnormal termination alike. Errors are not terminal on their own.
 */
public interface ConnectionListener {

    void onOpened(ConnectionHandle handle);

    void onMessage(ConnectionHandle handle, String payload);

    void onError(ConnectionHandle handle, Throwable error);

    void onClosed(ConnectionHandle handle, int code, String reason);
}
