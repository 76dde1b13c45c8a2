package com.campus.messaging.infrastructure;

import com.campus.messaging.domain.ChatMessage;
import com.campus.messaging.domain.SessionState;
import com.campus.messaging.domain.TypingPresence;

/**
 * Caller-facing notifications of a {@link MessagingSession}.
 *
 * Callbacks run on whichever thread completed the triggering event (caller,
 * transport or scheduler) while the session monitor is held. They may call back
 * into the session. Exceptions thrown here are logged and otherwise ignored.
 */
public interface SessionListener {

    default void onStateChange(SessionState state) {
    }

    default void onMessage(ChatMessage message) {
    }

    default void onPresenceChange(TypingPresence presence) {
    }

    /**
     * The session gave up; no automatic action follows.
     *
     * @param message text suitable for showing to the user
     */
    default void onFatalError(String message) {
    }
}
