package com.campus.messaging.model;

import com.campus.messaging.domain.ChatMessage;
import com.campus.messaging.domain.Participant;
import com.campus.messaging.infrastructure.FrameCodec;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A persisted message as returned by {@code GET /api/messages/?group={id}}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class MessageRecord {

    private String id;

    private Participant sender;

    private String content;

    @JsonProperty("created_at")
    private String createdAt;

    private Boolean read;

    public ChatMessage toChatMessage(String conversationId) {
        return ChatMessage.builder()
            .id(id)
            .conversationId(conversationId)
            .senderId(sender != null ? sender.getId() : null)
            .senderDisplayName(sender != null ? sender.displayName() : null)
            .content(content)
            .createdAt(FrameCodec.parseTimestamp(createdAt))
            .build();
    }
}
