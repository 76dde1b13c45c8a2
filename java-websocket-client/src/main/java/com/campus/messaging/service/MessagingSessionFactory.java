package com.campus.messaging.service;

import com.campus.messaging.domain.ChatMessage;
import com.campus.messaging.infrastructure.BackoffPolicy;
import com.campus.messaging.infrastructure.ConnectionFactory;
import com.campus.messaging.infrastructure.FrameCodec;
import com.campus.messaging.infrastructure.MessagingSession;
import com.campus.messaging.infrastructure.SessionListener;
import com.campus.messaging.infrastructure.TypingSettings;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Builds independent sessions, one per conversation. Sessions share nothing
 * but the read-only credential store and the scheduler.
 */
@Slf4j
@Service
public class MessagingSessionFactory {

    private final CredentialAccessor credentials;
    private final ConnectionFactory connectionFactory;
    private final FrameCodec frameCodec;
    private final BackoffPolicy backoffPolicy;
    private final TypingSettings typingSettings;
    private final TaskScheduler scheduler;
    private final MetricsService metricsService;
    private final ConversationHistoryClient historyClient;
    private final String endpointBaseUrl;

    public MessagingSessionFactory(CredentialAccessor credentials,
                                   ConnectionFactory connectionFactory,
                                   FrameCodec frameCodec,
                                   BackoffPolicy backoffPolicy,
                                   TypingSettings typingSettings,
                                   TaskScheduler scheduler,
                                   MetricsService metricsService,
                                   ConversationHistoryClient historyClient,
                                   @Value("${messaging.endpoint.base-url:http://localhost:8000}") String endpointBaseUrl) {
        this.credentials = credentials;
        this.connectionFactory = connectionFactory;
        this.frameCodec = frameCodec;
        this.backoffPolicy = backoffPolicy;
        this.typingSettings = typingSettings;
        this.scheduler = scheduler;
        this.metricsService = metricsService;
        this.historyClient = historyClient;
        this.endpointBaseUrl = endpointBaseUrl;
    }

    /**
     * A new Idle session. Nothing is fetched or connected yet.
     */
    public MessagingSession create(String conversationId, String localUserId, SessionListener listener) {
        return new MessagingSession(conversationId, localUserId, endpointBaseUrl, credentials, connectionFactory,
                frameCodec, backoffPolicy, typingSettings, scheduler, metricsService, listener);
    }

    /**
     * Create a session, preload the persisted history and start connecting.
     */
    public MessagingSession open(String conversationId, String localUserId, SessionListener listener) {
        MessagingSession session = create(conversationId, localUserId, listener);

        List<ChatMessage> history = historyClient.fetchHistory(conversationId);
        int seeded = session.seedHistory(history);
        log.info("Opening conversation: conversationId={}, historyMessages={}", conversationId, seeded);

        session.start();
        return session;
    }
}
