package com.campus.messaging.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Conversation metadata as served by {@code /api/message-groups/{id}/}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class GroupInfo {

    private static final String FALLBACK_NAME = "Chat";

    private String id;
    private String name;

    @Builder.Default
    private List<Participant> members = new ArrayList<>();

    public static GroupInfo empty(String conversationId) {
        return GroupInfo.builder().id(conversationId).build();
    }

    /**
     * Header title for a conversation: its own name, else the first member
     * other than the local participant (direct messages), else "Chat".
     */
    public String displayNameFor(String localUserId) {
        if (name != null && !name.isBlank()) {
            return name;
        }
        if (members != null) {
            for (Participant member : members) {
                if (member == null || Objects.equals(member.getId(), localUserId)) {
                    continue;
                }
                String displayName = member.displayName();
                if (displayName != null && !displayName.isBlank()) {
                    return displayName;
                }
            }
        }
        return FALLBACK_NAME;
    }
}
