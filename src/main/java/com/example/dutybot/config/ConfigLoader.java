package com.example.dutybot.config;

import com.example.dutybot.notification.SinkKind;
import com.example.dutybot.provider.ProviderKind;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;

/**
 * Reads {@code config.toml} into a validated {@link DutyConfig}.
 *
 * Provider tokens, urls and schedules can be overridden from the environment
 * ({@code LOOP_TOKEN}, {@code ONCALL_URL}, ...) so that Kubernetes secrets do not
 * have to be rendered into the file.
 */
@Slf4j
public class ConfigLoader {

    static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(60);
    static final Duration DEFAULT_PROVIDER_TIMEOUT = Duration.ofSeconds(30);
    static final Duration DEFAULT_SINK_TIMEOUT = Duration.ofSeconds(10);
    static final int DEFAULT_MAX_ATTEMPTS = 5;
    static final long DEFAULT_INITIAL_BACKOFF_MILLIS = 500;
    static final long DEFAULT_MAX_BACKOFF_MILLIS = 30_000;
    static final String DEFAULT_DAILY_TIME = "08:50";
    static final String DEFAULT_TIMEZONE = "Europe/Moscow";
    static final int DEFAULT_REMINDER_INTERVAL_MINUTES = 15;

    private final TomlMapper tomlMapper = new TomlMapper();
    private final Function<String, String> env;

    public ConfigLoader(Function<String, String> env) {
        this.env = env;
    }

    public DutyConfig load(Path path) {
        if (!Files.isReadable(path)) {
            throw new ConfigException("Config file " + path.toAbsolutePath() + " does not exist or is not readable");
        }
        try {
            DutyConfig config = parse(Files.readString(path), path.toString());
            log.info("Loaded config from {}: providers={}, sinks={}, reminder={}, contacts={}",
                    path, config.providers().stream().map(ProviderConfig::providerId).toList(),
                    config.sinks().size(), config.getReminder().isPresent(), config.roster().contacts().keySet());
            return config;
        } catch (IOException e) {
            throw new ConfigException("Failed to read config file " + path + ": " + e.getMessage(), e);
        }
    }

    public DutyConfig parse(String toml, String source) {
        JsonNode root;
        try {
            root = tomlMapper.readTree(toml);
        } catch (IOException e) {
            throw new ConfigException("Malformed TOML in " + source + ": " + e.getMessage(), e);
        }
        if (root == null || !root.isObject()) {
            root = tomlMapper.createObjectNode();
        }

        ProviderConfig loop = loadLoop(root.get(ProviderKind.LOOP.tableName()));
        ProviderConfig oncall = loadOncall(root.get(ProviderKind.ONCALL.tableName()));
        List<SinkConfig> sinks = loadSinks(root.get("sinks"));
        ReminderConfig reminder = loadReminder(root.get("notification"));
        Roster roster = loadRoster(root.get("contacts"), root.get("schedule"));
        return new DutyConfig(loop, oncall, sinks, reminder, roster);
    }

    private ProviderConfig loadLoop(JsonNode table) {
        if (table == null || !table.isObject()) {
            throw new ConfigException("Missing mandatory [loop] section");
        }
        String token = override("LOOP_TOKEN", text(table, "token"));
        if (isBlank(token)) {
            throw new ConfigException("[loop] token must not be empty");
        }
        String url = override("LOOP_URL", override("LOOP_SERVER_URL", text(table, "url")));
        if (isBlank(url)) {
            throw new ConfigException("[loop] url must not be empty");
        }
        String schedule = override("LOOP_SCHEDULE", text(table, "schedule"));
        if (isBlank(schedule)) {
            throw new ConfigException("[loop] schedule must not be empty");
        }
        String team = override("LOOP_TEAM", text(table, "team"));
        return new ProviderConfig(ProviderKind.LOOP, ProviderKind.LOOP.tableName(), normalizeUrl(url, "[loop]"), token,
                schedule, isBlank(team) ? null : team,
                seconds(table, "poll_interval", DEFAULT_POLL_INTERVAL, "[loop]"),
                seconds(table, "timeout", DEFAULT_PROVIDER_TIMEOUT, "[loop]"));
    }

    private ProviderConfig loadOncall(JsonNode table) {
        JsonNode section = table != null && table.isObject() ? table : tomlMapper.createObjectNode();
        String url = override("ONCALL_URL", text(section, "url"));
        String token = override("ONCALL_TOKEN", text(section, "token"));
        String schedule = override("ONCALL_SCHEDULE", text(section, "schedule"));

        List<String> missing = new ArrayList<>();
        if (isBlank(url)) missing.add("url");
        if (isBlank(token)) missing.add("token");
        if (isBlank(schedule)) missing.add("schedule");

        if (missing.size() == 3) {
            return null;
        }
        if (!missing.isEmpty()) {
            throw new ConfigException("[oncall] must define url, token and schedule together; missing " + missing);
        }
        return new ProviderConfig(ProviderKind.ONCALL, ProviderKind.ONCALL.tableName(), normalizeUrl(url, "[oncall]"),
                token,
                schedule, null,
                seconds(section, "poll_interval", DEFAULT_POLL_INTERVAL, "[oncall]"),
                seconds(section, "timeout", DEFAULT_PROVIDER_TIMEOUT, "[oncall]"));
    }

    private List<SinkConfig> loadSinks(JsonNode sinks) {
        List<SinkConfig> result = new ArrayList<>();
        if (sinks == null) {
            return result;
        }
        if (!sinks.isArray()) {
            throw new ConfigException("sinks must be an array of tables ([[sinks]])");
        }
        int index = 0;
        for (JsonNode sink : sinks) {
            String where = "[[sinks]] #" + index++;
            String kindName = text(sink, "kind");
            SinkKind kind = SinkKind.fromName(isBlank(kindName) ? SinkKind.WEBHOOK.configName() : kindName)
                    .orElseThrow(() -> new ConfigException(where + ": unknown kind '" + kindName + "'"));
            String url = text(sink, "url");
            String channel = text(sink, "channel");
            if (kind == SinkKind.WEBHOOK) {
                if (isBlank(url)) {
                    throw new ConfigException(where + ": webhook sink requires url");
                }
                url = normalizeUrl(url, where);
            }
            if (kind == SinkKind.LOOP && isBlank(channel)) {
                throw new ConfigException(where + ": loop sink requires channel");
            }
            int maxAttempts = sink.path("max_attempts").asInt(DEFAULT_MAX_ATTEMPTS);
            if (maxAttempts < 1) {
                throw new ConfigException(where + ": max_attempts must be at least 1");
            }
            Duration initial = millis(sink, "initial_backoff_millis", DEFAULT_INITIAL_BACKOFF_MILLIS, where);
            Duration max = millis(sink, "max_backoff_millis", DEFAULT_MAX_BACKOFF_MILLIS, where);
            if (max.compareTo(initial) < 0) {
                throw new ConfigException(where + ": max_backoff_millis must not be below initial_backoff_millis");
            }
            result.add(new SinkConfig(kind, url, channel, maxAttempts, initial, max,
                    seconds(sink, "timeout", DEFAULT_SINK_TIMEOUT, where)));
        }
        return result;
    }

    private ReminderConfig loadReminder(JsonNode table) {
        if (table == null || !table.isObject()) {
            return null;
        }
        String channel = text(table, "channel");
        if (isBlank(channel)) {
            throw new ConfigException("[notification] channel must not be empty");
        }
        String time = table.path("time").asText(DEFAULT_DAILY_TIME);
        LocalTime dailyTime;
        try {
            dailyTime = LocalTime.parse(time);
        } catch (DateTimeParseException e) {
            throw new ConfigException("[notification] time must be HH:MM, got '" + time + "'", e);
        }
        String zone = table.path("timezone").asText(DEFAULT_TIMEZONE);
        ZoneId timezone;
        try {
            timezone = ZoneId.of(zone);
        } catch (DateTimeException e) {
            throw new ConfigException("[notification] unknown timezone '" + zone + "'", e);
        }
        int minutes = table.path("reminder_interval_minutes").asInt(DEFAULT_REMINDER_INTERVAL_MINUTES);
        if (minutes <= 0) {
            throw new ConfigException("[notification] reminder_interval_minutes must be positive");
        }
        return new ReminderConfig(channel, dailyTime, timezone, Duration.ofMinutes(minutes));
    }

    private Roster loadRoster(JsonNode contactsTable, JsonNode scheduleTable) {
        Map<String, Contact> contacts = new LinkedHashMap<>();
        if (contactsTable != null) {
            if (!contactsTable.isObject()) {
                throw new ConfigException("[contacts] must be a table of contact tables");
            }
            Iterator<Map.Entry<String, JsonNode>> entries = contactsTable.fields();
            while (entries.hasNext()) {
                Map.Entry<String, JsonNode> entry = entries.next();
                String key = entry.getKey();
                JsonNode contact = entry.getValue();
                String ldap = contact.isObject() ? text(contact, "ldap") : null;
                if (isBlank(ldap)) {
                    throw new ConfigException("[contacts." + key + "] ldap must not be empty");
                }
                String fullName = text(contact, "full_name");
                contacts.put(key, new Contact(key, ldap, isBlank(fullName) ? ldap : fullName));
            }
        }

        Map<DayOfWeek, Contact> weekdays = new EnumMap<>(DayOfWeek.class);
        if (scheduleTable != null) {
            if (!scheduleTable.isObject()) {
                throw new ConfigException("[schedule] must map weekdays to contact keys");
            }
            Iterator<Map.Entry<String, JsonNode>> entries = scheduleTable.fields();
            while (entries.hasNext()) {
                Map.Entry<String, JsonNode> entry = entries.next();
                DayOfWeek day;
                try {
                    day = DayOfWeek.valueOf(entry.getKey().trim().toUpperCase(Locale.ROOT));
                } catch (IllegalArgumentException e) {
                    throw new ConfigException("[schedule] unknown weekday '" + entry.getKey() + "'", e);
                }
                String key = entry.getValue().asText("");
                Contact contact = contacts.get(key);
                if (contact == null) {
                    throw new ConfigException("[schedule] " + entry.getKey() + " refers to unknown contact '" + key + "'");
                }
                weekdays.put(day, contact);
            }
        }
        return new Roster(contacts, weekdays);
    }

    private String override(String variable, String fileValue) {
        String value = env.apply(variable);
        return isBlank(value) ? fileValue : value.trim();
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        return value.asText().trim();
    }

    private static Duration seconds(JsonNode node, String field, Duration fallback, String where) {
        if (!node.has(field)) {
            return fallback;
        }
        long value = node.get(field).asLong(-1);
        if (value <= 0) {
            throw new ConfigException(where + " " + field + " must be a positive number of seconds");
        }
        return Duration.ofSeconds(value);
    }

    private static Duration millis(JsonNode node, String field, long fallback, String where) {
        long value = node.has(field) ? node.get(field).asLong(-1) : fallback;
        if (value <= 0) {
            throw new ConfigException(where + " " + field + " must be a positive number of milliseconds");
        }
        return Duration.ofMillis(value);
    }

    /**
     * Trailing slashes removed, {@code https://} assumed when no scheme is given.
     */
    private static String normalizeUrl(String url, String where) {
        String trimmed = url.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        String lower = trimmed.toLowerCase(Locale.ROOT);
        if (!lower.startsWith("http://") && !lower.startsWith("https://")) {
            trimmed = "https://" + trimmed;
        }
        if (HttpUrl.parse(trimmed) == null) {
            throw new ConfigException(where + " url '" + url + "' is not a valid http(s) url");
        }
        return trimmed;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
