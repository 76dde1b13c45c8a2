package com.campus.messaging.model;

import com.campus.messaging.domain.ChatMessage;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * A decoded server frame. Exactly one of the payload groups is meaningful,
 * selected by {@link #getKind()}.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class InboundFrame {

    Kind kind;

    // TYPING
    boolean typing;
    String userId;

    // CHAT
    ChatMessage message;

    public enum Kind {
        TYPING,
        CHAT,
        IGNORED
    }

    public static InboundFrame typing(boolean typing, String userId) {
        return new InboundFrame(Kind.TYPING, typing, userId, null);
    }

    public static InboundFrame chat(ChatMessage message) {
        return new InboundFrame(Kind.CHAT, false, null, message);
    }

    public static InboundFrame ignored() {
        return new InboundFrame(Kind.IGNORED, false, null, null);
    }
}
