package com.example.dutybot.domain;

import java.time.Instant;

/**
 * A change of duty on one lane. {@code previous} is null the first time a lane is seen.
 */
public record Transition(String providerId, DutyState previous, DutyState current, Instant detectedAt) {

    /**
     * Collapses two pending transitions of the same lane into one that spans both.
     */
    public Transition coalesceWith(Transition newer) {
        return new Transition(providerId, previous, newer.current(), newer.detectedAt());
    }

    /**
     * True when the transition ends where it started, e.g. after a flicker that settled back.
     */
    public boolean isNoop() {
        return current.sameDutyAs(previous);
    }
}
