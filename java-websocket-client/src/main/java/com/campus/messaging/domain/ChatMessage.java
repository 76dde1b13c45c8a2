package com.campus.messaging.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * One chat message of a conversation.
 *
 * Instances are immutable. A message is either parsed from an inbound frame
 * (server assigned {@code id}) or produced locally when the transport accepted
 * locally authored text, in which case {@code provisional} is set and
 * {@code id} stays null until the server echo arrives as its own message.
 */
@Value
@Builder
public class ChatMessage {

    String id;
    String conversationId;
    String senderId;
    String senderDisplayName;
    String content;
    Instant createdAt;
    boolean provisional;

    public static ChatMessage provisional(String conversationId, String senderId, String content) {
        return ChatMessage.builder()
            .conversationId(conversationId)
            .senderId(senderId)
            .content(content)
            .createdAt(Instant.now())
            .provisional(true)
            .build();
    }
}
