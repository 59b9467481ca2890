package com.example.dutybot.config;

import com.example.dutybot.notification.RetryPolicy;
import com.example.dutybot.notification.SinkKind;

import java.time.Duration;

/**
 * A notification target and how hard to try delivering to it.
 */
public record SinkConfig(
        SinkKind kind,
        String url,
        String channel,
        int maxAttempts,
        Duration initialBackoff,
        Duration maxBackoff,
        Duration timeout
) {

    public String name() {
        return kind == SinkKind.LOOP ? "loop:" + channel : "webhook:" + url;
    }

    public RetryPolicy retryPolicy() {
        return RetryPolicy.builder()
                .initialDelay(initialBackoff)
                .maxDelay(maxBackoff)
                .multiplier(2.0)
                .maxAttempts(maxAttempts)
                .build();
    }
}
