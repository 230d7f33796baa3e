package io.fieldledger.core.conflict;

import io.fieldledger.core.ActorContext;
import io.fieldledger.core.Determinism;
import io.fieldledger.core.Event;
import io.fieldledger.core.EventFactory;
import io.fieldledger.core.EventKind;
import io.fieldledger.core.payload.PersonUnassigned;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConflictResolverTest {

    private static final Instant T0 = Instant.parse("2025-09-16T12:00:00Z");

    private EventFactory compensator;
    private InMemoryConflictQueue queue;
    private ConflictResolver resolver;

    @BeforeEach
    void setUp() {
        compensator = new EventFactory(Determinism.seeded(0));
        queue = new InMemoryConflictQueue(2);
        resolver = new ConflictResolver(ConflictPolicyTable.defaults(), queue, compensator);
    }

    @Test
    void lww_picksLatestTimestampThenActorOnEveryReplica() {
        var early = at(0, "alice", "tablet-1", EventKind.IAP_SECTION_UPDATED, iap("draft"));
        var lateB = at(5, "bob", "phone-2", EventKind.IAP_SECTION_UPDATED, iap("bob's text"));
        var lateC = at(5, "carol", "laptop-3", EventKind.IAP_SECTION_UPDATED, iap("carol's text"));
        var other = new ConflictResolver(ConflictPolicyTable.defaults(), new InMemoryConflictQueue(), compensator);

        var here = (Resolution.Selected) resolver.resolve(List.of(early, lateB, lateC));
        var there = (Resolution.Selected) other.resolve(List.of(lateC, early, lateB));

        assertThat(here.winner()).isEqualTo(lateC);
        assertThat(there.winner()).isEqualTo(lateC);
        assertThat(here.losers()).containsExactlyInAnyOrder(early, lateB);
    }

    @Test
    void fww_picksEarliestWriter() {
        var first = at(1, "alice", "tablet-1", EventKind.WORK_ASSIGNMENT_COMPLETED, Map.of("assignmentId", "w-1"));
        var second = at(2, "bob", "phone-2", EventKind.WORK_ASSIGNMENT_COMPLETED, Map.of("assignmentId", "w-1"));

        var resolution = resolver.resolve(List.of(second, first));

        assertThat(resolution).isInstanceOfSatisfying(Resolution.Selected.class, s -> {
            assertThat(s.policy()).isEqualTo(ConflictPolicy.FWW);
            assertThat(s.winner()).isEqualTo(first);
        });
    }

    @Test
    void counter_isCommutativeAndIgnoresRedelivery() {
        var events = new ArrayList<Event>();
        for (int i = 0; i < 8; i++) {
            events.add(at(i, "user-" + i, "dev-" + i, EventKind.MEALS_SERVED_INCREMENT, Map.of("count", 10)));
        }
        var random = new Random(3);

        for (int round = 0; round < 20; round++) {
            var shuffled = new ArrayList<>(events);
            Collections.shuffle(shuffled, random);
            shuffled.add(shuffled.get(0));

            var merged = (Resolution.Merged) resolver.resolve(shuffled);

            assertThat(merged.value()).isEqualTo(new MergeValue.Counter(80));
            assertThat(merged.inputs()).hasSize(8);
        }
    }

    @Test
    void orSet_concurrentAddWinsOverRemove() {
        var add = at(1, "alice", "tablet-1", EventKind.COUNTY_ADDED,
                Map.of("countyId", "c-1", "countyName", "Lee", "state", "FL", "fips", "12071"));
        var remove = at(2, "bob", "phone-2", EventKind.COUNTY_REMOVED, Map.of("countyId", "c-1"));

        var merged = (Resolution.Merged) resolver.resolve(List.of(remove, add));
        var removedOnly = (Resolution.Merged) resolver.resolve(List.of(remove));

        assertThat(merged.value()).isEqualTo(new MergeValue.Membership(Set.of("c-1")));
        assertThat(removedOnly.value()).isEqualTo(new MergeValue.Membership(Set.of()));
    }

    @Test
    void singleActiveAssignment_keepsEarliestAndCompensatesLoser() {
        var first = at(1, "alice", "tablet-1", EventKind.PERSON_ASSIGNED, assignment("Shelter Manager"));
        var second = at(2, "bob", "phone-2", EventKind.PERSON_ASSIGNED, assignment("Feeding Lead"));

        var here = (Resolution.Compensated) resolver.resolve(List.of(second, first));
        var there = (Resolution.Compensated) resolver.resolve(List.of(first, second));

        assertThat(here.winner()).isEqualTo(first);
        assertThat(here.compensations()).hasSize(1).isEqualTo(there.compensations());
        var compensation = here.compensations().get(0);
        assertThat(compensation.kind()).isEqualTo(EventKind.PERSON_UNASSIGNED);
        assertThat(compensation.causationId()).isEqualTo(second.id());
        assertThat(((PersonUnassigned) compensation.payload()).assignmentEventId()).isEqualTo(second.id().toString());
    }

    @Test
    void manual_queuesOnceAndFillsUp() {
        var open = at(1, "alice", "tablet-1", EventKind.FACILITY_STATUS_CHANGED, Map.of("facilityId", "f-1", "status", "open"));
        var closed = at(2, "bob", "phone-2", EventKind.FACILITY_STATUS_CHANGED, Map.of("facilityId", "f-1", "status", "closed"));

        var queued = (Resolution.Queued) resolver.resolve(List.of(open, closed));
        var again = (Resolution.Queued) resolver.resolve(List.of(closed, open));

        assertThat(again.conflict().conflictId()).isEqualTo(queued.conflict().conflictId());
        assertThat(queue.pending("op-7")).containsExactly(queued.conflict());
        assertThat(queued.conflict().target()).isEqualTo("facility:f-1:status");
        assertThat(resolver.winnerOf(List.of(closed, open))).isEqualTo(open);

        resolver.resolve(List.of(open, at(3, "carol", "laptop-3", EventKind.FACILITY_STATUS_CHANGED,
                Map.of("facilityId", "f-1", "status", "standby"))));
        assertThatThrownBy(() -> resolver.resolve(List.of(closed, at(4, "dan", "radio-4",
                EventKind.FACILITY_STATUS_CHANGED, Map.of("facilityId", "f-1", "status", "planned")))))
                .isInstanceOf(ConflictQueueFullException.class);
    }

    @Test
    void manualConflictId_dependsOnlyOnTheCandidateIds() {
        var open = at(1, "alice", "tablet-1", EventKind.FACILITY_STATUS_CHANGED, Map.of("facilityId", "f-1", "status", "open"));
        var closed = at(2, "bob", "phone-2", EventKind.FACILITY_STATUS_CHANGED, Map.of("facilityId", "f-1", "status", "closed"));
        var standby = at(3, "carol", "laptop-3", EventKind.FACILITY_STATUS_CHANGED, Map.of("facilityId", "f-1", "status", "standby"));

        var here = ManualConflict.of(List.of(open, closed));
        var there = ManualConflict.of(List.of(closed, open));
        var wider = ManualConflict.of(List.of(open, closed, standby));

        assertThat(here.conflictId()).isEqualTo(there.conflictId());
        assertThat(wider.conflictId()).isNotEqualTo(here.conflictId());
        var ids = List.of(open.id(), closed.id()).stream().sorted().toList();
        assertThat(here.conflictId())
                .isEqualTo(Determinism.derivedUUID("conflict", ids.get(0), ids.get(1)).toString());
    }

    @Test
    void missingPolicy_isNeverDefaulted() {
        var partial = new ConflictResolver(
                ConflictPolicyTable.partial(Map.of("operation.updated", "LWW"), List.of()), queue, compensator);
        var event = at(1, "alice", "tablet-1", EventKind.IAP_SECTION_UPDATED, iap("text"));

        assertThatThrownBy(() -> partial.resolve(List.of(event)))
                .isInstanceOf(UnconfiguredPolicyException.class);
    }

    @Test
    void resolve_rejectsMixedKinds() {
        var a = at(1, "alice", "tablet-1", EventKind.IAP_SECTION_UPDATED, iap("text"));
        var b = at(1, "alice", "tablet-1", EventKind.MEALS_SERVED_INCREMENT, Map.of("count", 1));

        assertThatThrownBy(() -> resolver.resolve(List.of(a, b))).isInstanceOf(IllegalArgumentException.class);
    }

    private static Event at(long seconds, String actor, String device, EventKind kind, Map<String, ?> payload) {
        var determinism = Determinism.of(Clock.fixed(T0.plusSeconds(seconds), ZoneOffset.UTC), Determinism.seedFrom(actor, device, seconds, kind));
        return new EventFactory(determinism).create(kind, payload, new ActorContext(actor, device, "s-" + actor, "op-7"));
    }

    private static Map<String, ?> iap(String content) {
        return Map.of("iapNumber", 1, "section", "objectives", "content", content);
    }

    private static Map<String, ?> assignment(String position) {
        return Map.of("personId", "p-9", "position", position, "section", "mass-care");
    }
}
