package com.example.dutybot.domain;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AggregatedStateTest {

    private static final Instant T0 = Instant.parse("2026-10-01T08:00:00Z");

    private static DutyState state(String provider, String person, String revision) {
        return new DutyState(provider, Person.of(person), null, null, revision, T0, false);
    }

    @Test
    void firstObservationIsATransition() {
        AggregatedState next = new AggregatedState(Map.of("loop", state("loop", "alice", "r1")), T0);

        List<Transition> transitions = next.diff(AggregatedState.empty());

        assertThat(transitions).hasSize(1);
        assertThat(transitions.get(0).previous()).isNull();
        assertThat(transitions.get(0).current().person().id()).isEqualTo("alice");
    }

    @Test
    void revisionChangeWithSamePersonIsATransition() {
        AggregatedState previous = new AggregatedState(Map.of("loop", state("loop", "alice", "r1")), T0);
        AggregatedState next = new AggregatedState(Map.of("loop", state("loop", "alice", "r2")), T0.plusSeconds(60));

        assertThat(next.diff(previous)).singleElement()
                .satisfies(t -> assertThat(t.current().sourceRevision()).isEqualTo("r2"));
    }

    @Test
    void staleFlagAloneIsNotATransition() {
        DutyState good = state("loop", "bob", "r1");
        AggregatedState previous = new AggregatedState(Map.of("loop", good), T0);
        AggregatedState next = new AggregatedState(Map.of("loop", good.withStale(true)), T0.plusSeconds(60));

        assertThat(next.diff(previous)).isEmpty();
    }

    @Test
    void coalescedFlickerIsNoop() {
        DutyState alice = state("loop", "alice", "r1");
        DutyState bob = state("loop", "bob", "r2");
        Transition first = new Transition("loop", alice, bob, T0);
        Transition back = new Transition("loop", bob, alice, T0.plusSeconds(1));

        Transition coalesced = first.coalesceWith(back);

        assertThat(coalesced.previous()).isEqualTo(alice);
        assertThat(coalesced.current()).isEqualTo(alice);
        assertThat(coalesced.isNoop()).isTrue();
    }

    @Test
    void snapshotIsImmutable() {
        AggregatedState snapshot = new AggregatedState(Map.of("loop", state("loop", "alice", "r1")), T0);

        assertThatThrownBy(() -> snapshot.states().put("oncall", state("oncall", "eve", "r9")))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void blankDisplayNameFallsBackToId() {
        assertThat(new Person("alice", " ").displayName()).isEqualTo("alice");
    }
}
