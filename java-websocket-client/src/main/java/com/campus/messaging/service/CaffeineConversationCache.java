package com.campus.messaging.service;

import com.campus.messaging.domain.GroupInfo;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Optional;

/**
 * In-memory conversation metadata cache backed by Caffeine.
 */
@Slf4j
public class CaffeineConversationCache implements ConversationCache {

    private final Cache<String, GroupInfo> groups;
    private final MetricsService metricsService;

    public CaffeineConversationCache(long maximumSize, Duration ttl, MetricsService metricsService) {
        this.metricsService = metricsService;
        this.groups = Caffeine.newBuilder()
            .maximumSize(maximumSize)
            .expireAfterWrite(ttl)
            .recordStats()
            .build();
        log.info("Conversation cache enabled: maximumSize={}, ttl={}s", maximumSize, ttl.toSeconds());
    }

    @Override
    public Optional<GroupInfo> getGroup(String conversationId) {
        GroupInfo cached = groups.getIfPresent(conversationId);
        if (cached != null) {
            metricsService.incrementCounter("cache.hits");
            log.debug("Cache hit: conversationId={}", conversationId);
            return Optional.of(cached);
        }
        metricsService.incrementCounter("cache.misses");
        return Optional.empty();
    }

    @Override
    public void putGroup(String conversationId, GroupInfo groupInfo) {
        groups.put(conversationId, groupInfo);
    }

    public CacheStats getStats() {
        return groups.stats();
    }

    public long getSize() {
        groups.cleanUp();
        return groups.estimatedSize();
    }
}
