package com.campus.messaging.infrastructure;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

@Value
@Builder
public class TypingSettings {

    /** Quiet period after the last keystroke before "typing" is announced. */
    @Builder.Default
    Duration debounce = Duration.ofMillis(300);

    /** Silence after which a trailing "stopped" frame is sent. */
    @Builder.Default
    Duration stopAfter = Duration.ofMillis(3000);

    /** How long a remote "typing" signal is trusted without a refresh. */
    @Builder.Default
    Duration remoteExpiry = Duration.ofMillis(3000);

    public static TypingSettings defaults() {
        return TypingSettings.builder().build();
    }
}
