package com.campus.messaging.domain;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Synchronous outcome of submitting outbound text to a session.
 * The caller clears its input buffer only when {@link #isSent()}.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class SubmitResult {

    Status status;
    ChatMessage message;
    String errorMessage;

    public enum Status {
        SENT,
        EMPTY,
        NOT_READY,
        FAILED
    }

    public static SubmitResult sent(ChatMessage provisional) {
        return new SubmitResult(Status.SENT, provisional, null);
    }

    public static SubmitResult empty() {
        return new SubmitResult(Status.EMPTY, null, "Nothing to send");
    }

    public static SubmitResult notReady(SessionState state) {
        return new SubmitResult(Status.NOT_READY, null, "Not connected: " + state);
    }

    public static SubmitResult failed(String errorMessage) {
        return new SubmitResult(Status.FAILED, null, errorMessage);
    }

    public boolean isSent() {
        return status == Status.SENT;
    }
}
