package com.example.dutybot.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Process-level settings of the duty bot.
 * Maps to the 'duty-bot' prefix in application.yml. Provider and sink settings
 * live in config.toml, see {@link ConfigLoader}.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "duty-bot")
public class BotProperties {

    private String configPath = "config.toml";
    private ReconcilerConfig reconciler = new ReconcilerConfig();
    private DispatcherConfig dispatcher = new DispatcherConfig();
    private ReminderSettings reminder = new ReminderSettings();

    @Data
    public static class ReconcilerConfig {
        private boolean enabled = true;
        private long tickMillis = 1000;
        /** Added on top of the slowest provider timeout to bound a whole cycle */
        private int cycleTimeoutMarginSeconds = 2;
        private int shutdownGraceSeconds = 5;
    }

    @Data
    public static class DispatcherConfig {
        private int shutdownTimeoutSeconds = 10;
    }

    @Data
    public static class ReminderSettings {
        private boolean enabled = true;
        private long checkIntervalMillis = 30000;
    }
}
