package com.example.dutybot.domain;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable snapshot of every provider lane at one point in time.
 * The reconciler replaces it as a whole; readers never observe a partial update.
 */
public record AggregatedState(Map<String, DutyState> states, Instant observedAt) {

    public AggregatedState {
        states = Collections.unmodifiableMap(new LinkedHashMap<>(states));
    }

    public static AggregatedState empty() {
        return new AggregatedState(Map.of(), Instant.EPOCH);
    }

    public Optional<DutyState> get(String providerId) {
        return Optional.ofNullable(states.get(providerId));
    }

    public boolean isEmpty() {
        return states.isEmpty();
    }

    /**
     * Per-lane changes from {@code previous} to this snapshot.
     * Lanes that only flipped their stale flag produce nothing.
     */
    public List<Transition> diff(AggregatedState previous) {
        List<Transition> transitions = new ArrayList<>();
        for (DutyState current : states.values()) {
            DutyState before = previous.states().get(current.providerId());
            if (!current.sameDutyAs(before)) {
                transitions.add(new Transition(current.providerId(), before, current, observedAt));
            }
        }
        return transitions;
    }
}
