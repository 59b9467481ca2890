package com.example.dutybot.provider;

import com.example.dutybot.config.ProviderConfig;
import com.example.dutybot.domain.DutyState;
import com.example.dutybot.domain.Person;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.springframework.util.DigestUtils;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Grafana OnCall client. Resolves the configured schedule by name, then asks
 * who is on call for it.
 */
@Slf4j
public class OnCallProviderClient implements ProviderClient {

    private static final List<String> ITEM_KEYS = List.of("results", "data", "on_call", "oncall", "users");
    private static final List<String> USER_KEYS = List.of("username", "user_name", "login", "name", "email");

    private final ProviderConfig config;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;

    public OnCallProviderClient(ProviderConfig config, OkHttpClient httpClient, ObjectMapper objectMapper) {
        this.config = config;
        this.httpClient = httpClient.newBuilder()
                .callTimeout(config.timeout())
                .readTimeout(config.timeout())
                .build();
        this.objectMapper = objectMapper;
    }

    @Override
    public ProviderConfig config() {
        return config;
    }

    /**
     * Schedule lookup, the schedule's on_call endpoint and possibly the on_call query fallback.
     */
    @Override
    public Duration fetchBudget() {
        return config.timeout().multipliedBy(3);
    }

    @Override
    public DutyState fetch() {
        String scheduleId = resolveScheduleId(config.scheduleId());
        if (scheduleId.isEmpty()) {
            throw new MalformedResponseException(providerId(),
                    "Schedule " + config.scheduleId() + " not found in Grafana OnCall");
        }

        List<JsonNode> users = fetchOnCallUsers(scheduleId);
        List<String> identifiers = new ArrayList<>();
        JsonNode first = null;
        for (JsonNode item : users) {
            String identifier = extractIdentifier(item);
            if (!identifier.isEmpty() && !identifiers.contains(identifier)) {
                identifiers.add(identifier);
                if (first == null) {
                    first = item;
                }
            }
        }
        if (first == null) {
            throw new MalformedResponseException(providerId(), "Nobody is on call for schedule " + config.scheduleId());
        }

        JsonNode user = first.has("user") && first.get("user").isObject() ? first.get("user") : first;
        String displayName = user.path("name").asText(identifiers.get(0));
        String revision = DigestUtils.md5DigestAsHex(
                (scheduleId + ":" + String.join(",", identifiers)).getBytes(StandardCharsets.UTF_8));
        return DutyState.fresh(providerId(), new Person(identifiers.get(0), displayName),
                timestamp(first, "shift_start", "start"), timestamp(first, "shift_end", "end"), revision);
    }

    private String resolveScheduleId(String scheduleName) {
        String normalized = scheduleName.trim().toLowerCase(Locale.ROOT);
        for (JsonNode schedule : extractItems(getJson(url("api", "v1", "schedules").build()))) {
            String name = firstText(schedule, "name", "title", "display_name");
            if (name.toLowerCase(Locale.ROOT).equals(normalized)) {
                return firstText(schedule, "id", "pk", "uid");
            }
        }
        return "";
    }

    private List<JsonNode> fetchOnCallUsers(String scheduleId) {
        try {
            List<JsonNode> items = extractItems(getJson(url("api", "v1", "schedules", scheduleId, "on_call").build()));
            if (!items.isEmpty()) {
                return items;
            }
        } catch (MalformedResponseException e) {
            if (!(e.getCause() instanceof NotFound)) {
                throw e;
            }
            log.debug("Schedule on_call endpoint not available, falling back to on_call query");
        }
        HttpUrl fallback = url("api", "v1", "on_call", "").addQueryParameter("schedule", scheduleId).build();
        return extractItems(getJson(fallback));
    }

    private JsonNode getJson(HttpUrl url) {
        Request request = new Request.Builder()
                .url(url)
                .addHeader("Authorization", config.token())
                .get()
                .build();
        try (Response response = httpClient.newCall(request).execute()) {
            String body = response.body() != null ? response.body().string() : "";
            int code = response.code();
            if (code == 401 || code == 403) {
                throw new ProviderAuthException(providerId(), "Grafana OnCall rejected the token: HTTP " + code);
            }
            if (code == 404) {
                throw new MalformedResponseException(providerId(), "Not found: " + url.encodedPath(), new NotFound());
            }
            if (!response.isSuccessful()) {
                log.error("HTTP error while getting {}: {} {}", url, code, body.isEmpty() ? "<empty body>" : body);
                throw new ProviderUnavailableException(providerId(), "GET " + url.encodedPath() + " returned HTTP " + code);
            }
            log.debug("Response {} {}", code, body);
            try {
                return objectMapper.readTree(body);
            } catch (IOException e) {
                throw new MalformedResponseException(providerId(), "Malformed JSON from " + url.encodedPath(), e);
            }
        } catch (InterruptedIOException e) {
            throw new ProviderTimeoutException(providerId(), "Timed out calling " + url, e);
        } catch (IOException e) {
            log.error("Failed to reach {}: {}", url, e.getMessage());
            throw new ProviderUnavailableException(providerId(), "Failed to reach " + url + ": " + e.getMessage(), e);
        }
    }

    private HttpUrl.Builder url(String... segments) {
        HttpUrl base = HttpUrl.parse(config.baseUrl());
        if (base == null) {
            throw new ProviderUnavailableException(providerId(), "Invalid base url " + config.baseUrl());
        }
        HttpUrl.Builder builder = base.newBuilder();
        for (String segment : segments) {
            builder.addPathSegment(segment);
        }
        return builder;
    }

    private static List<JsonNode> extractItems(JsonNode payload) {
        List<JsonNode> items = new ArrayList<>();
        JsonNode list = payload;
        if (payload != null && payload.isObject()) {
            list = null;
            for (String key : ITEM_KEYS) {
                if (payload.path(key).isArray()) {
                    list = payload.get(key);
                    break;
                }
            }
        }
        if (list != null && list.isArray()) {
            list.forEach(item -> {
                if (item.isObject()) {
                    items.add(item);
                }
            });
        }
        return items;
    }

    private static String extractIdentifier(JsonNode item) {
        JsonNode user = item.has("user") && item.get("user").isObject() ? item.get("user") : item;
        for (String key : USER_KEYS) {
            String value = user.path(key).asText("").trim();
            if (!value.isEmpty()) {
                return value;
            }
        }
        return "";
    }

    private static Instant timestamp(JsonNode item, String... fields) {
        for (String field : fields) {
            String value = item.path(field).asText("");
            if (!value.isEmpty()) {
                try {
                    return OffsetDateTime.parse(value).toInstant();
                } catch (DateTimeParseException e) {
                    log.debug("Ignoring unparsable {} '{}'", field, value);
                }
            }
        }
        return null;
    }

    private static String firstText(JsonNode node, String... fields) {
        for (String field : fields) {
            String value = node.path(field).asText("").trim();
            if (!value.isEmpty()) {
                return value;
            }
        }
        return "";
    }

    /** Marker cause for a 404, which is a valid answer for some endpoints. */
    private static final class NotFound extends RuntimeException {
        NotFound() {
            super("HTTP 404", null, false, false);
        }
    }
}
