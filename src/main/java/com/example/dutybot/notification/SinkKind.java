package com.example.dutybot.notification;

import com.example.dutybot.config.DutyConfig;
import com.example.dutybot.config.ProviderConfig;
import com.example.dutybot.config.SinkConfig;
import com.example.dutybot.loop.LoopApi;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.OkHttpClient;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Supported notification sinks, keyed by the {@code kind} of a [[sinks]] entry.
 */
public enum SinkKind {

    WEBHOOK("webhook") {
        @Override
        public NotificationSink createSink(SinkConfig config, DutyConfig dutyConfig,
                                           OkHttpClient httpClient, ObjectMapper objectMapper) {
            return new WebhookSink(config, httpClient, objectMapper);
        }
    },

    LOOP("loop") {
        @Override
        public NotificationSink createSink(SinkConfig config, DutyConfig dutyConfig,
                                           OkHttpClient httpClient, ObjectMapper objectMapper) {
            ProviderConfig loop = dutyConfig.loop();
            LoopApi api = new LoopApi(loop.baseUrl(), loop.token(), loop.team(), config.timeout(),
                    httpClient, objectMapper);
            return new LoopChannelSink(config, api);
        }
    };

    private final String configName;

    SinkKind(String configName) {
        this.configName = configName;
    }

    public String configName() {
        return configName;
    }

    public static Optional<SinkKind> fromName(String name) {
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values()).filter(kind -> kind.configName.equals(normalized)).findFirst();
    }

    public abstract NotificationSink createSink(SinkConfig config, DutyConfig dutyConfig,
                                                OkHttpClient httpClient, ObjectMapper objectMapper);
}
