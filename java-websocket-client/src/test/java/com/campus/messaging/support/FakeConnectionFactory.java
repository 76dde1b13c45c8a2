package com.campus.messaging.support;

import com.campus.messaging.domain.ConnectionTarget;
import com.campus.messaging.infrastructure.ConnectionFactory;
import com.campus.messaging.infrastructure.ConnectionHandle;
import com.campus.messaging.infrastructure.ConnectionListener;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * Hands out {@link FakeConnection}s that the test drives by hand.
 */
public class FakeConnectionFactory implements ConnectionFactory {

    private final List<FakeConnection> connections = new ArrayList<>();
    private final List<ConnectionTarget> targets = new ArrayList<>();
    private Supplier<RuntimeException> failure;

    @Override
    public ConnectionHandle open(ConnectionTarget target, ConnectionListener listener) {
        targets.add(target);
        if (failure != null) {
            throw failure.get();
        }
        FakeConnection connection = new FakeConnection(listener);
        connections.add(connection);
        return connection;
    }

    /**
     * Make every following {@link #open} throw.
     */
    public void failWith(Supplier<RuntimeException> failure) {
        this.failure = failure;
    }

    public int openCount() {
        return targets.size();
    }

    public List<ConnectionTarget> targets() {
        return targets;
    }

    public FakeConnection last() {
        if (connections.isEmpty()) {
            throw new IllegalStateException("No connection was opened");
        }
        return connections.get(connections.size() - 1);
    }

    public List<FakeConnection> connections() {
        return connections;
    }

    public long liveCount() {
        return connections.stream().filter(FakeConnection::isOpen).count();
    }
}
