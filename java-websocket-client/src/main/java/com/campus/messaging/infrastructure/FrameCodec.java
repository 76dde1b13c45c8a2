package com.campus.messaging.infrastructure;

import com.campus.messaging.domain.ChatMessage;
import com.campus.messaging.domain.Participant;
import com.campus.messaging.exception.FrameSendException;
import com.campus.messaging.exception.MalformedFrameException;
import com.campus.messaging.model.InboundFrame;
import com.campus.messaging.model.OutboundFrame;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;

/**
 * JSON framing for the chat socket.
 */
@Slf4j
@Component
public class FrameCodec {

    private final ObjectMapper objectMapper;

    public FrameCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String encode(OutboundFrame frame) {
        try {
            return objectMapper.writeValueAsString(frame);
        } catch (JsonProcessingException e) {
            throw new FrameSendException("Cannot serialize frame", e);
        }
    }

    /**
     * Classify a text frame. A {@code type: "typing"} frame is presence, any
     * other frame carrying a non-empty string {@code content} is a chat message,
     * everything else is ignored.
     *
     * @throws MalformedFrameException when the payload is not a JSON object
     */
    public InboundFrame decode(String payload, String conversationId) {
        JsonNode root;
        try {
            root = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            throw new MalformedFrameException("Frame is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new MalformedFrameException("Frame is not a JSON object");
        }

        if (OutboundFrame.TYPE_TYPING.equals(root.path("type").asText(null))) {
            return InboundFrame.typing(root.path("typing").asBoolean(false), textOrNull(root.get("user_id")));
        }

        JsonNode content = root.get("content");
        if (content == null || !content.isTextual() || content.asText().isEmpty()) {
            return InboundFrame.ignored();
        }

        return InboundFrame.chat(toChatMessage(root, conversationId));
    }

    private ChatMessage toChatMessage(JsonNode root, String conversationId) {
        ChatMessage.ChatMessageBuilder builder = ChatMessage.builder()
            .id(textOrNull(root.get("id")))
            .conversationId(conversationId)
            .content(root.get("content").asText())
            .createdAt(parseTimestamp(textOrNull(root.get("created_at"))));

        JsonNode sender = root.get("sender");
        if (sender != null && sender.isObject()) {
            Participant participant = readParticipant(sender);
            builder.senderId(participant.getId())
                .senderDisplayName(participant.displayName());
        } else {
            builder.senderId(textOrNull(sender));
        }
        return builder.build();
    }

    private Participant readParticipant(JsonNode sender) {
        try {
            return objectMapper.treeToValue(sender, Participant.class);
        } catch (JsonProcessingException e) {
            throw new MalformedFrameException("Unreadable sender", e);
        }
    }

    private static String textOrNull(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode() || node.isContainerNode()) {
            return null;
        }
        return node.asText();
    }

    public static Instant parseTimestamp(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException e) {
            try {
                return Instant.parse(value);
            } catch (DateTimeParseException ignored) {
                log.debug("Unparseable created_at: {}", value);
                return null;
            }
        }
    }
}
