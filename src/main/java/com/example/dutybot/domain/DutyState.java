package com.example.dutybot.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * Who is on duty for one provider lane, as last fetched.
 * At most one instance per provider id lives in an {@link AggregatedState}.
 */
public record DutyState(
        String providerId,
        Person person,
        Instant validFrom,
        Instant validUntil,
        String sourceRevision,
        Instant fetchedAt,
        boolean stale
) {

    public DutyState {
        Objects.requireNonNull(providerId, "providerId");
        Objects.requireNonNull(person, "person");
        Objects.requireNonNull(sourceRevision, "sourceRevision");
        Objects.requireNonNull(fetchedAt, "fetchedAt");
    }

    public static DutyState fresh(String providerId, Person person, Instant validFrom, Instant validUntil,
                                  String sourceRevision) {
        return new DutyState(providerId, person, validFrom, validUntil, sourceRevision, Instant.now(), false);
    }

    public DutyState withStale(boolean stale) {
        if (this.stale == stale) {
            return this;
        }
        return new DutyState(providerId, person, validFrom, validUntil, sourceRevision, fetchedAt, stale);
    }

    /**
     * Same person and same revision. Freshness and the stale flag are ignored.
     */
    public boolean sameDutyAs(DutyState other) {
        return other != null
                && person.id().equals(other.person.id())
                && sourceRevision.equals(other.sourceRevision);
    }
}
