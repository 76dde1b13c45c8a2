package com.campus.messaging.infrastructure;

import com.campus.messaging.domain.ConnectionTarget;

public interface ConnectionFactory {

    /**
     * Start connecting asynchronously. Lifecycle events arrive on {@code listener}.
     *
     * @throws com.campus.messaging.exception.SessionPreconditionException when the
     *         target can never be connected (no token, no conversation id, bad endpoint,
     *         no transport); no network call is made in that case
     */
    ConnectionHandle open(ConnectionTarget target, ConnectionListener listener);
}
