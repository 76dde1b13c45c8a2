package com.campus.messaging.infrastructure;

import com.campus.messaging.domain.TypingPresence;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;

/**
 * Turns keystroke-rate local input into at most one "typing" frame per debounce
 * window plus a guaranteed trailing "stopped" frame, and expires the remote
 * typing indicator when its sender goes quiet.
 *
 * Not thread-safe on its own; the owning session calls it under its monitor and
 * the timers fire under the same monitor.
 */
@Slf4j
public class TypingPresenceDebouncer {

    /**
     * Writes a presence frame. Implementations swallow and log send failures.
     */
    public interface TypingSignalSender {
        void sendTyping(boolean typing);
    }

    private final SessionTimer debounceTimer;
    private final SessionTimer stopTimer;
    private final SessionTimer remoteExpiryTimer;
    private final TypingSettings settings;
    private final BooleanSupplier connected;
    private final TypingSignalSender sender;
    private final Consumer<TypingPresence> presenceListener;

    private TypingPresence remote = TypingPresence.nobody();

    public TypingPresenceDebouncer(SessionTimer debounceTimer,
                                   SessionTimer stopTimer,
                                   SessionTimer remoteExpiryTimer,
                                   TypingSettings settings,
                                   BooleanSupplier connected,
                                   TypingSignalSender sender,
                                   Consumer<TypingPresence> presenceListener) {
        this.debounceTimer = debounceTimer;
        this.stopTimer = stopTimer;
        this.remoteExpiryTimer = remoteExpiryTimer;
        this.settings = settings;
        this.connected = connected;
        this.sender = sender;
        this.presenceListener = presenceListener;
    }

    // ===== Local side =====

    public void onLocalInput() {
        if (!connected.getAsBoolean()) {
            return;
        }
        debounceTimer.arm(settings.getDebounce(), this::announceTyping);
    }

    private void announceTyping() {
        if (!connected.getAsBoolean()) {
            return;
        }
        sender.sendTyping(true);
        stopTimer.arm(settings.getStopAfter(), this::announceStopped);
    }

    private void announceStopped() {
        if (connected.getAsBoolean()) {
            sender.sendTyping(false);
        }
    }

    public void cancelLocal() {
        debounceTimer.cancel();
        stopTimer.cancel();
    }

    public boolean isLocalTypingPending() {
        return debounceTimer.isArmed() || stopTimer.isArmed();
    }

    // ===== Remote side =====

    public void remoteStarted(String remoteUserId) {
        remoteExpiryTimer.arm(settings.getRemoteExpiry(), this::remoteExpired);
        update(TypingPresence.typing(remoteUserId));
    }

    public void remoteStopped() {
        remoteExpiryTimer.cancel();
        update(TypingPresence.nobody());
    }

    private void remoteExpired() {
        log.debug("Remote typing indicator expired: user={}", remote.getRemoteUserId());
        update(TypingPresence.nobody());
    }

    public TypingPresence current() {
        return remote;
    }

    public void cancelAll() {
        cancelLocal();
        remoteExpiryTimer.cancel();
    }

    private void update(TypingPresence next) {
        if (next.equals(remote)) {
            return;
        }
        remote = next;
        presenceListener.accept(next);
    }
}
