package com.campus.messaging.domain;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Whether the remote side of the conversation is currently typing.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class TypingPresence {

    private static final TypingPresence NOBODY = new TypingPresence(false, null);

    boolean remoteTyping;
    String remoteUserId;

    public static TypingPresence nobody() {
        return NOBODY;
    }

    public static TypingPresence typing(String remoteUserId) {
        return new TypingPresence(true, remoteUserId);
    }
}
