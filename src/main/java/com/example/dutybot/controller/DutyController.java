package com.example.dutybot.controller;

import com.example.dutybot.domain.DutyState;
import com.example.dutybot.reconciler.ScheduleReconciler;
import com.example.dutybot.reminder.DutyReminderService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.InvalidMediaTypeException;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.MultiValueMap;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Duty REST API: the current duty per provider and the inbound event hook.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class DutyController {

    private final ScheduleReconciler reconciler;
    private final DutyReminderService reminderService;
    private final ObjectMapper objectMapper;

    /**
     * Current duty per provider from the latest published snapshot.
     */
    @GetMapping("/duty")
    public ResponseEntity<Map<String, Map<String, Object>>> getDuty() {
        Map<String, Map<String, Object>> body = new LinkedHashMap<>();
        for (DutyState state : reconciler.getSnapshot().states().values()) {
            Map<String, Object> lane = new LinkedHashMap<>();
            lane.put("person", state.person().id());
            lane.put("display_name", state.person().displayName());
            if (state.validFrom() != null) lane.put("valid_from", state.validFrom().toString());
            if (state.validUntil() != null) lane.put("valid_until", state.validUntil().toString());
            lane.put("stale", state.stale());
            body.put(state.providerId(), lane);
        }
        return ResponseEntity.ok(body);
    }

    /**
     * Push hook for providers. Triggers an out-of-band refresh of the provider;
     * a Loop message event in the body may also acknowledge the daily reminder.
     * Any content type is accepted: JSON bodies are parsed, form-encoded
     * outgoing webhooks are mapped to a message event, anything else is ignored.
     */
    @PostMapping("/events/{providerId}")
    public ResponseEntity<Map<String, Object>> receiveEvent(
            @PathVariable String providerId,
            @RequestHeader(value = HttpHeaders.CONTENT_TYPE, required = false) String contentType,
            @RequestParam MultiValueMap<String, String> parameters,
            @RequestBody(required = false) String body) throws JsonProcessingException {
        JsonNode event = toEvent(mediaType(contentType), parameters, body);
        if (!reconciler.requestRefresh(providerId)) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(Map.of("error", "Unknown provider: " + providerId));
        }
        boolean acknowledged = event != null && reminderService.handleEvent(event);
        log.debug("Event for {} accepted (acknowledged reminder: {})", providerId, acknowledged);
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(Map.of("status", "accepted", "provider", providerId));
    }

    private JsonNode toEvent(MediaType mediaType, MultiValueMap<String, String> parameters, String body)
            throws JsonProcessingException {
        if (MediaType.APPLICATION_FORM_URLENCODED.includes(mediaType)) {
            return formEvent(parameters);
        }
        if (body == null || body.isBlank()) {
            return null;
        }
        if (mediaType != null && (MediaType.APPLICATION_JSON.includes(mediaType)
                || mediaType.getSubtype().endsWith("+json"))) {
            return objectMapper.readTree(body);
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            log.debug("Ignoring non-JSON event body of type {}", mediaType);
            return null;
        }
    }

    /**
     * Loop outgoing webhooks post {@code text}, {@code user_name} and friends as form fields.
     */
    private JsonNode formEvent(MultiValueMap<String, String> parameters) {
        ObjectNode event = objectMapper.createObjectNode();
        event.put("type", parameters.getFirst("type") != null ? parameters.getFirst("type") : "message");
        event.put("text", Objects.toString(parameters.getFirst("text"), ""));
        String rootId = parameters.getFirst("root_id");
        if (rootId != null) {
            event.put("root_id", rootId);
        }
        ObjectNode user = event.putObject("user");
        user.put("username", Objects.toString(parameters.getFirst("user_name"), ""));
        return event;
    }

    private static MediaType mediaType(String contentType) {
        if (contentType == null || contentType.isBlank()) {
            return null;
        }
        try {
            return MediaType.parseMediaType(contentType);
        } catch (InvalidMediaTypeException e) {
            log.debug("Unparsable Content-Type '{}'", contentType);
            return null;
        }
    }
}
