package com.example.dutybot.controller;

import com.example.dutybot.domain.DutyState;
import com.example.dutybot.reconciler.ScheduleReconciler;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Liveness and readiness checks for Kubernetes.
 */
@RestController
@RequiredArgsConstructor
public class HealthController {

    private final ScheduleReconciler reconciler;

    /**
     * Liveness: the process is up and serving.
     */
    @GetMapping("/healthz")
    public ResponseEntity<Map<String, String>> healthz() {
        return ResponseEntity.ok(Map.of("status", "UP"));
    }

    /**
     * Readiness: at least one reconciliation cycle succeeded. Degraded lanes
     * are reported through their stale flag instead of failing readiness.
     */
    @GetMapping("/ready")
    public ResponseEntity<Map<String, Object>> ready() {
        if (!reconciler.isReady()) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(Map.of("status", "WARMING_UP"));
        }
        Map<String, Object> providers = new LinkedHashMap<>();
        for (DutyState state : reconciler.getSnapshot().states().values()) {
            providers.put(state.providerId(), Map.of("stale", state.stale()));
        }
        return ResponseEntity.ok(Map.of("status", "READY", "providers", providers));
    }
}
