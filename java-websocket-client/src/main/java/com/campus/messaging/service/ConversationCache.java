package com.campus.messaging.service;

import com.campus.messaging.domain.GroupInfo;

import java.util.Optional;

/**
 * Optional cache in front of {@link ConversationHistoryClient#fetchGroupMetadata}.
 * {@link NoOpConversationCache} is used unless caching is enabled.
 */
public interface ConversationCache {

    Optional<GroupInfo> getGroup(String conversationId);

    void putGroup(String conversationId, GroupInfo groupInfo);
}
