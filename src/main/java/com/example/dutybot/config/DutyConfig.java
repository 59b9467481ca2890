package com.example.dutybot.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Parsed {@code config.toml}. Loaded once at startup, never mutated.
 */
public record DutyConfig(ProviderConfig loop, ProviderConfig oncall, List<SinkConfig> sinks, ReminderConfig reminder,
                         Roster roster) {

    public DutyConfig {
        sinks = List.copyOf(sinks);
        roster = roster == null ? Roster.empty() : roster;
    }

    public List<ProviderConfig> providers() {
        List<ProviderConfig> providers = new ArrayList<>();
        providers.add(loop);
        if (oncall != null) {
            providers.add(oncall);
        }
        return List.copyOf(providers);
    }

    public Optional<ProviderConfig> getOncall() {
        return Optional.ofNullable(oncall);
    }

    public Optional<ReminderConfig> getReminder() {
        return Optional.ofNullable(reminder);
    }
}
