package com.example.dutybot.notification;

import com.example.dutybot.config.SinkConfig;
import com.example.dutybot.domain.DutyState;
import com.example.dutybot.domain.Person;
import com.example.dutybot.domain.Transition;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import okhttp3.*;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * POSTs every transition as JSON to a configured URL.
 * Receivers should deduplicate on (provider_id, source_revision).
 */
@Slf4j
public class WebhookSink implements NotificationSink {

    private static final MediaType JSON = MediaType.get("application/json");

    private final SinkConfig config;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;

    public WebhookSink(SinkConfig config, OkHttpClient httpClient, ObjectMapper objectMapper) {
        this.config = config;
        this.httpClient = httpClient.newBuilder()
                .callTimeout(config.timeout())
                .readTimeout(config.timeout())
                .build();
        this.objectMapper = objectMapper;
    }

    @Override
    public SinkConfig config() {
        return config;
    }

    @Override
    public void deliver(Transition transition) throws DispatchException {
        HttpUrl url = HttpUrl.parse(config.url());
        if (url == null) {
            throw new DispatchException(name(), "Invalid webhook url", false);
        }

        String json;
        try {
            json = objectMapper.writeValueAsString(payload(transition));
        } catch (IOException e) {
            throw new DispatchException(name(), "Failed to encode payload: " + e.getMessage(), false, e);
        }

        Request request = new Request.Builder()
                .url(url)
                .post(RequestBody.create(json, JSON))
                .build();

        try (Response response = httpClient.newCall(request).execute()) {
            if (response.isSuccessful()) {
                log.info("Webhook notified for {} ({})", transition.providerId(), transition.current().sourceRevision());
                return;
            }
            throw new DispatchException(name(), "Webhook answered HTTP " + response.code(),
                    DispatchException.isTransientStatus(response.code()));
        } catch (IOException e) {
            throw new DispatchException(name(), "Webhook call failed: " + e.getMessage(), true, e);
        }
    }

    Map<String, Object> payload(Transition transition) {
        DutyState current = transition.current();
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("provider_id", transition.providerId());
        payload.put("person", person(current.person()));
        payload.put("previous_person", transition.previous() != null ? person(transition.previous().person()) : null);
        payload.put("source_revision", current.sourceRevision());
        payload.put("valid_from", current.validFrom());
        payload.put("valid_until", current.validUntil());
        payload.put("detected_at", transition.detectedAt());
        return payload;
    }

    private static Map<String, String> person(Person person) {
        return Map.of("id", person.id(), "display_name", person.displayName());
    }
}
