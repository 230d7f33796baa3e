package io.fieldledger.engine;

import io.fieldledger.core.CausalityTracker;
import io.fieldledger.core.ConflictUnresolvedException;
import io.fieldledger.core.Determinism;
import io.fieldledger.core.Event;
import io.fieldledger.core.EventFactory;
import io.fieldledger.core.EventHasher;
import io.fieldledger.core.EventKind;
import io.fieldledger.core.SyncStatus;
import io.fieldledger.core.ValidationException;
import io.fieldledger.core.conflict.ConflictPolicyTable;
import io.fieldledger.core.conflict.ConflictResolver;
import io.fieldledger.core.conflict.InMemoryConflictQueue;
import io.fieldledger.core.payload.ConflictResolved;
import io.fieldledger.engine.projection.MigrationRegistry;
import io.fieldledger.engine.projection.Projector;
import io.fieldledger.engine.projection.Register;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Map;
import java.util.UUID;

import static io.fieldledger.engine.Replica.OP;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LedgerTest {

    private Replica a;
    private Replica b;

    @BeforeEach
    void setUp() {
        a = new Replica("tablet-1");
        b = new Replica("phone-2");
    }

    @Test
    void submit_appendsLinkedEventsAndProjectsThem() {
        var first = a.submit("alice", EventKind.FACILITY_CREATED, shelter("f-1"));
        a.tick(1);
        var second = a.submit("alice", EventKind.FACILITY_UPDATED, Map.of("facilityId", "f-1", "capacity", 80));

        assertThat(first.previousHash()).isEqualTo(EventHasher.GENESIS);
        assertThat(second.previousHash()).isEqualTo(first.hash());
        assertThat(second.sequence()).isEqualTo(first.sequence() + 1);
        assertThat(a.store.verifyChain(OP).valid()).isTrue();
        assertThat(Register.valueOf(a.ledger.view(OP).facilities().get("f-1").capacity())).isEqualTo(80);
    }

    @Test
    void invalidIntent_isRejectedBeforeAnythingIsStored() {
        assertThatThrownBy(() -> a.submit("alice", EventKind.MEALS_SERVED_INCREMENT, Map.of("count", -3)))
                .isInstanceOfSatisfying(ValidationException.class, e -> assertThat(e.field()).isEqualTo("count"));
        assertThat(a.store.size(OP)).isZero();
    }

    @Test
    void unknownCause_isRejected() {
        assertThatThrownBy(() -> a.submit("alice", EventKind.MEALS_SERVED_INCREMENT, Map.of("count", 3), UUID.randomUUID()))
                .isInstanceOfSatisfying(ValidationException.class, e -> assertThat(e.field()).isEqualTo("causationId"));
        assertThat(a.store.size(OP)).isZero();
    }

    @Test
    void effects_inheritTheCorrelationOfTheirCause() {
        var root = a.submit("alice", EventKind.FACILITY_CREATED, shelter("f-1"));
        var effect = a.submit("alice", EventKind.FACILITY_RESOURCE_ADDED,
                Map.of("facilityId", "f-1", "resourceType", "cots", "quantity", 40), root.id());

        assertThat(root.correlationId()).isEqualTo(root.id());
        assertThat(effect.causationId()).isEqualTo(root.id());
        assertThat(effect.correlationId()).isEqualTo(root.id());
    }

    @Test
    void mergeRemote_linksToTheLocalTailOnceAndOnlyOnce() {
        var local = b.submit("bob", EventKind.MEALS_SERVED_INCREMENT, Map.of("count", 4));
        var remote = a.submit("alice", EventKind.MEALS_SERVED_INCREMENT, Map.of("count", 6));

        assertThat(b.ledger.mergeRemote(remote)).isTrue();
        assertThat(b.ledger.mergeRemote(remote)).isFalse();

        var stored = b.store.find(remote.id()).orElseThrow();
        assertThat(stored.previousHash()).isEqualTo(local.hash());
        assertThat(stored.syncStatus()).isEqualTo(SyncStatus.SYNCED);
        assertThat(b.store.size(OP)).isEqualTo(2);
        assertThat(b.ledger.view(OP).metrics().mealsServed()).isEqualTo(10);
    }

    @Test
    void concurrentStatusChanges_waitForAHumanDecision() {
        var created = a.submit("alice", EventKind.FACILITY_CREATED, shelter("f-1"));
        b.ledger.mergeRemote(created);
        a.tick(1);
        b.tick(2);
        var open = a.submit("alice", EventKind.FACILITY_STATUS_CHANGED, Map.of("facilityId", "f-1", "status", "open"));
        var standby = b.submit("bob", EventKind.FACILITY_STATUS_CHANGED, Map.of("facilityId", "f-1", "status", "standby"));

        a.ledger.mergeRemote(standby);

        var view = a.ledger.view(OP);
        assertThat(view.conflicts()).hasSize(1);
        var conflict = view.conflicts().values().iterator().next();
        assertThat(conflict.candidateEventIds()).containsExactlyInAnyOrder(open.id().toString(), standby.id().toString());
        assertThat(conflict.provisionalWinnerId()).isEqualTo(open.id().toString());
        assertThat(Register.valueOf(view.facilities().get("f-1").status())).isEqualTo("open");
        assertThat(a.ledger.openConflicts(OP)).hasSize(1);

        a.tick(60);
        var decision = a.ledger.resolveConflict(conflict.conflictId(), standby.id(), a.as("ic-carol"));

        assertThat(decision.causationId()).isEqualTo(standby.id());
        assertThat(((ConflictResolved) decision.payload()).rejectedEventIds()).containsExactly(open.id().toString());
        var settled = a.ledger.view(OP);
        assertThat(settled.conflicts()).isEmpty();
        assertThat(Register.valueOf(settled.facilities().get("f-1").status())).isEqualTo("standby");
        assertThat(a.projector.project(OP)).isEqualTo(settled);
    }

    @Test
    void decisionsMustNameAnOpenConflictAndOneOfItsCandidates() {
        var created = a.submit("alice", EventKind.FACILITY_CREATED, shelter("f-1"));
        b.ledger.mergeRemote(created);
        a.submit("alice", EventKind.FACILITY_STATUS_CHANGED, Map.of("facilityId", "f-1", "status", "open"));
        a.ledger.mergeRemote(b.submit("bob", EventKind.FACILITY_STATUS_CHANGED, Map.of("facilityId", "f-1", "status", "closed")));
        var conflictId = a.ledger.view(OP).conflicts().firstKey();

        assertThatThrownBy(() -> a.ledger.resolveConflict("no-such-conflict", created.id(), a.as("ic-carol")))
                .isInstanceOf(ConflictUnresolvedException.class);
        assertThatThrownBy(() -> a.ledger.resolveConflict(conflictId, created.id(), a.as("ic-carol")))
                .isInstanceOf(ConflictUnresolvedException.class)
                .hasMessageContaining("not a candidate");
        assertThat(a.ledger.view(OP).conflicts()).containsOnlyKeys(conflictId);
    }

    @Test
    void bootstrap_restoresViewsAndDeviceSequences() {
        a.submit("alice", EventKind.FACILITY_CREATED, shelter("f-1"));
        var last = a.submit("alice", EventKind.MEALS_SERVED_INCREMENT, Map.of("count", 12));

        var factory = new EventFactory(Determinism.of(a.clock, 99));
        var tracker = new CausalityTracker();
        var resolver = new ConflictResolver(ConflictPolicyTable.defaults(), new InMemoryConflictQueue(), factory);
        var projector = new Projector(a.store, resolver, tracker, MigrationRegistry.defaults());
        var restarted = new Ledger(factory, tracker, a.store, projector, resolver);

        restarted.bootstrap();

        assertThat(restarted.view(OP)).isEqualTo(a.ledger.view(OP));
        assertThat(tracker.knows(last.id())).isTrue();
        var next = restarted.submit(EventKind.MEALS_SERVED_INCREMENT, Map.of("count", 1), a.as("alice"));
        assertThat(next.sequence()).isEqualTo(last.sequence() + 1);
        assertThat(restarted.view(OP).metrics().mealsServed()).isEqualTo(13);
    }

    @Test
    void listeners_seeEveryAppend() {
        var seen = new ArrayList<Event>();
        a.ledger.addListener(seen::add);

        var e = a.submit("alice", EventKind.MEALS_SERVED_INCREMENT, Map.of("count", 2));

        assertThat(seen).containsExactly(e);
    }

    @Test
    void mergeUnit_announcesItsAppendsOnlyOnceTheUnitIsDone() {
        var first = a.submit("alice", EventKind.MEALS_SERVED_INCREMENT, Map.of("count", 2));
        var second = a.submit("alice", EventKind.MEALS_SERVED_INCREMENT, Map.of("count", 3));
        var seen = new ArrayList<Event>();
        b.ledger.addListener(seen::add);

        var merged = b.ledger.mergeUnit(() -> true, () -> {
            b.ledger.mergeRemote(first);
            b.ledger.mergeRemote(second);
            return seen.size();
        });

        assertThat(merged).contains(0);
        assertThat(seen).extracting(Event::id).containsExactly(first.id(), second.id());
    }

    @Test
    void mergeUnit_runsNothingOnceItIsNoLongerCurrent() {
        var remote = a.submit("alice", EventKind.MEALS_SERVED_INCREMENT, Map.of("count", 2));

        var merged = b.ledger.mergeUnit(() -> false, () -> b.ledger.mergeRemote(remote));

        assertThat(merged).isEmpty();
        assertThat(b.store.size(OP)).isZero();
    }

    private static Map<String, Object> shelter(String id) {
        return Map.of("facilityId", id, "facilityType", "shelter", "name", "Shelter 1", "capacity", 100);
    }
}
