package com.example.dutybot.config;

import java.time.Duration;
import java.time.LocalTime;
import java.time.ZoneId;

/**
 * Daily duty reminder posted to a Loop channel.
 */
public record ReminderConfig(String channel, LocalTime dailyTime, ZoneId timezone, Duration reminderInterval) {
}
