package com.campus.messaging;

import com.campus.messaging.infrastructure.BackoffPolicy;
import com.campus.messaging.service.CaffeineConversationCache;
import com.campus.messaging.service.ConversationCache;
import com.campus.messaging.service.MessagingSessionFactory;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = {
    "messaging.backoff.max-attempts=3",
    "messaging.auth.token=test-token"
})
class RealtimeMessagingApplicationTests {

    @Autowired
    private MessagingSessionFactory sessionFactory;

    @Autowired
    private BackoffPolicy backoffPolicy;

    @Autowired
    private ConversationCache conversationCache;

    @Test
    void contextLoads() {
        assertThat(sessionFactory).isNotNull();
        assertThat(backoffPolicy.getMaxAttempts()).isEqualTo(3);
        assertThat(backoffPolicy.getBaseDelay()).isEqualTo(Duration.ofSeconds(1));
        assertThat(conversationCache).isInstanceOf(CaffeineConversationCache.class);
    }
}
