package com.campus.messaging.infrastructure;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BackoffPolicyTest {

    private final BackoffPolicy policy = BackoffPolicy.defaults();

    @Test
    void shouldDoubleFromBaseDelay() {
        assertThat(policy.delay(0)).isEqualTo(Duration.ofSeconds(1));
        assertThat(policy.delay(1)).isEqualTo(Duration.ofSeconds(2));
        assertThat(policy.delay(2)).isEqualTo(Duration.ofSeconds(4));
        assertThat(policy.delay(3)).isEqualTo(Duration.ofSeconds(8));
    }

    @Test
    void shouldCapDelay() {
        assertThat(policy.delay(4)).isEqualTo(Duration.ofSeconds(10));
        assertThat(policy.delay(50)).isEqualTo(Duration.ofSeconds(10));
        assertThat(policy.delay(Integer.MAX_VALUE)).isEqualTo(Duration.ofSeconds(10));
    }

    @Test
    void shouldNeverShrinkOrExceedCap() {
        for (int attempt = 0; attempt < 100; attempt++) {
            assertThat(policy.delay(attempt)).isLessThanOrEqualTo(policy.delay(attempt + 1));
            assertThat(policy.delay(attempt)).isLessThanOrEqualTo(policy.getMaxDelay());
        }
    }

    @Test
    void shouldNotOverflowWithLargeBase() {
        BackoffPolicy large = new BackoffPolicy(Duration.ofDays(1), Duration.ofDays(3), 5);

        assertThat(large.delay(40)).isEqualTo(Duration.ofDays(3));
        assertThat(large.delay(1)).isEqualTo(Duration.ofDays(2));
    }

    @Test
    void shouldAllowFiveAttempts() {
        assertThat(policy.allowsAttempt(0)).isTrue();
        assertThat(policy.allowsAttempt(4)).isTrue();
        assertThat(policy.allowsAttempt(5)).isFalse();
        assertThat(policy.allowsAttempt(-1)).isFalse();
    }

    @Test
    void shouldRejectNegativeAttempt() {
        assertThatThrownBy(() -> policy.delay(-1))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldRejectInconsistentConfiguration() {
        assertThatThrownBy(() -> new BackoffPolicy(Duration.ofSeconds(5), Duration.ofSeconds(1), 5))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new BackoffPolicy(Duration.ofSeconds(1), Duration.ofSeconds(10), 0))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
