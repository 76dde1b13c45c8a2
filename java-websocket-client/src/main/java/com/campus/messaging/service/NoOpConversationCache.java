package com.campus.messaging.service;

import com.campus.messaging.domain.GroupInfo;

import java.util.Optional;

public class NoOpConversationCache implements ConversationCache {

    @Override
    public Optional<GroupInfo> getGroup(String conversationId) {
        return Optional.empty();
    }

    @Override
    public void putGroup(String conversationId, GroupInfo groupInfo) {
    }
}
