package com.campus.messaging.service;

import com.campus.messaging.domain.ChatMessage;
import com.campus.messaging.domain.GroupInfo;

import java.util.List;

/**
 * Request/response access to what the backend has already persisted.
 */
public interface ConversationHistoryClient {

    /**
     * Messages of the conversation, oldest first. Empty when unavailable.
     */
    List<ChatMessage> fetchHistory(String conversationId);

    /**
     * Name and members of the conversation. Never null; an unavailable lookup
     * yields {@link GroupInfo#empty(String)}.
     */
    GroupInfo fetchGroupMetadata(String conversationId);
}
