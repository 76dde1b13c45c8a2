package com.campus.messaging.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Frames the client writes to the socket.
 *
 * <pre>
 * chat:     {"content": "...", "group_id": "42"}
 * presence: {"type": "typing", "typing": true, "group_id": "42"}
 * </pre>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class OutboundFrame {

    public static final String TYPE_TYPING = "typing";

    private String type;

    private Boolean typing;

    private String content;

    @JsonProperty("group_id")
    private String groupId;

    public static OutboundFrame chat(String groupId, String content) {
        return OutboundFrame.builder()
            .content(content)
            .groupId(groupId)
            .build();
    }

    public static OutboundFrame typing(String groupId, boolean typing) {
        return OutboundFrame.builder()
            .type(TYPE_TYPING)
            .typing(typing)
            .groupId(groupId)
            .build();
    }
}
