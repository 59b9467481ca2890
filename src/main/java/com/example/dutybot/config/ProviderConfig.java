package com.example.dutybot.config;

import com.example.dutybot.provider.ProviderKind;

import java.time.Duration;

/**
 * Connection settings of one duty provider lane.
 */
public record ProviderConfig(
        ProviderKind kind,
        String providerId,
        String baseUrl,
        String token,
        String scheduleId,
        String team,
        Duration pollInterval,
        Duration timeout
) {

    @Override
    public String toString() {
        return "ProviderConfig[kind=" + kind + ", providerId=" + providerId + ", baseUrl=" + baseUrl
                + ", token=****, scheduleId=" + scheduleId + ", team=" + team
                + ", pollInterval=" + pollInterval + ", timeout=" + timeout + "]";
    }
}
