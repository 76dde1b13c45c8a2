package com.campus.messaging.config;

import com.campus.messaging.infrastructure.BackoffPolicy;
import com.campus.messaging.infrastructure.TypingSettings;
import com.campus.messaging.service.CaffeineConversationCache;
import com.campus.messaging.service.ConversationCache;
import com.campus.messaging.service.MetricsService;
import com.campus.messaging.service.NoOpConversationCache;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.websocket.ContainerProvider;
import jakarta.websocket.WebSocketContainer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.web.socket.client.WebSocketClient;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;

import java.time.Duration;

@Slf4j
@Configuration
public class MessagingClientConfig {

    /**
     * JSR-356 container for outbound sockets. Whole text frames are buffered, so
     * the buffer bounds the largest inbound chat message.
     */
    @Bean
    public WebSocketContainer webSocketContainer(
            @Value("${messaging.socket.max-text-message-bytes:1048576}") int maxTextMessageBytes) {
        WebSocketContainer container = ContainerProvider.getWebSocketContainer();
        container.setDefaultMaxTextMessageBufferSize(maxTextMessageBytes);
        log.info("WebSocket container: maxTextMessageBytes={}", maxTextMessageBytes);
        return container;
    }

    @Bean
    public WebSocketClient webSocketClient(WebSocketContainer webSocketContainer) {
        return new StandardWebSocketClient(webSocketContainer);
    }

    /**
     * Shared timer engine for reconnect and typing timers of every session.
     * Primary over the SockJS scheduler a server-side {@code @EnableWebSocket} may declare.
     */
    @Bean
    @Primary
    public ThreadPoolTaskScheduler messagingTaskScheduler(@Value("${messaging.scheduler.pool-size:2}") int poolSize) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(poolSize);
        scheduler.setThreadNamePrefix("messaging-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        return scheduler;
    }

    @Bean
    public BackoffPolicy backoffPolicy(@Value("${messaging.backoff.base-ms:1000}") long baseMs,
                                       @Value("${messaging.backoff.max-ms:10000}") long maxMs,
                                       @Value("${messaging.backoff.max-attempts:5}") int maxAttempts) {
        BackoffPolicy policy = new BackoffPolicy(Duration.ofMillis(baseMs), Duration.ofMillis(maxMs), maxAttempts);
        log.info("Reconnect policy: {}", policy);
        return policy;
    }

    @Bean
    public TypingSettings typingSettings(@Value("${messaging.typing.debounce-ms:300}") long debounceMs,
                                         @Value("${messaging.typing.stop-after-ms:3000}") long stopAfterMs,
                                         @Value("${messaging.typing.remote-expiry-ms:3000}") long remoteExpiryMs) {
        return TypingSettings.builder()
            .debounce(Duration.ofMillis(debounceMs))
            .stopAfter(Duration.ofMillis(stopAfterMs))
            .remoteExpiry(Duration.ofMillis(remoteExpiryMs))
            .build();
    }

    @Bean
    public ConversationCache conversationCache(MetricsService metricsService,
                                               @Value("${messaging.cache.enabled:true}") boolean enabled,
                                               @Value("${messaging.cache.maximum-size:1000}") long maximumSize,
                                               @Value("${messaging.cache.ttl-seconds:300}") long ttlSeconds) {
        if (!enabled) {
            log.info("Conversation cache disabled");
            return new NoOpConversationCache();
        }
        return new CaffeineConversationCache(maximumSize, Duration.ofSeconds(ttlSeconds), metricsService);
    }

    /**
     * ObjectMapper for frame and REST payloads with Java time support.
     */
    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }
}
