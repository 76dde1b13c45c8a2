package com.campus.messaging.domain;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Lifecycle state of a messaging session.
 *
 * <pre>
 * Idle -> Connecting(0) -> Connected
 * Connecting(n) | Connected -> Disconnected(reason, n) -> Connecting(n + 1)
 * Disconnected(reason, n) -> ConnectionFailed(reason)   when the attempt ceiling is reached
 * any -> Idle                                             on stop() or a normal (1000) close
 * </pre>
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class SessionState {

    private static final SessionState IDLE = new SessionState(Phase.IDLE, 0, null);
    private static final SessionState CONNECTED = new SessionState(Phase.CONNECTED, 0, null);

    Phase phase;
    int attempt;
    String reason;

    public enum Phase {
        IDLE,
        CONNECTING,
        CONNECTED,
        DISCONNECTED,
        CONNECTION_FAILED
    }

    public static SessionState idle() {
        return IDLE;
    }

    public static SessionState connecting(int attempt) {
        return new SessionState(Phase.CONNECTING, attempt, null);
    }

    public static SessionState connected() {
        return CONNECTED;
    }

    public static SessionState disconnected(String reason, int attempt) {
        return new SessionState(Phase.DISCONNECTED, attempt, reason);
    }

    public static SessionState connectionFailed(String reason) {
        return new SessionState(Phase.CONNECTION_FAILED, 0, reason);
    }

    public boolean is(Phase candidate) {
        return phase == candidate;
    }

    /**
     * No automatic transition leaves this state.
     */
    public boolean isTerminal() {
        return phase == Phase.IDLE || phase == Phase.CONNECTION_FAILED;
    }

    @Override
    public String toString() {
        return switch (phase) {
            case IDLE -> "Idle";
            case CONNECTING -> "Connecting(" + attempt + ")";
            case CONNECTED -> "Connected";
            case DISCONNECTED -> "Disconnected(" + reason + ", " + attempt + ")";
            case CONNECTION_FAILED -> "ConnectionFailed(" + reason + ")";
        };
    }
}
