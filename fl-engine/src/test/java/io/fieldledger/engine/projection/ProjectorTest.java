package io.fieldledger.engine.projection;

import io.fieldledger.core.CausalityTracker;
import io.fieldledger.core.Event;
import io.fieldledger.core.EventHasher;
import io.fieldledger.core.EventKind;
import io.fieldledger.core.SyncStatus;
import io.fieldledger.core.payload.FacilityCreated;
import io.fieldledger.engine.Replica;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Flow;
import java.util.concurrent.TimeUnit;

import static io.fieldledger.engine.Replica.OP;
import static org.assertj.core.api.Assertions.assertThat;

class ProjectorTest {

    private Replica a;
    private Replica b;

    @BeforeEach
    void setUp() {
        a = new Replica("tablet-1");
        b = new Replica("phone-2");
    }

    @Test
    void replayOfTheChain_equalsTheIncrementalView() {
        a.submit("alice", EventKind.OPERATION_CREATED, Map.of("operationNumber", "DR-212-25",
                "operationName", "Harvey Response", "disasterType", "hurricane", "activationLevel", "level-2"));
        a.tick(1);
        a.submit("alice", EventKind.FACILITY_CREATED, facility("f-1", "Shelter 1", 120));
        a.tick(1);
        a.submit("alice", EventKind.COUNTY_ADDED, county("harris"));
        a.tick(1);
        a.submit("alice", EventKind.MEALS_SERVED_INCREMENT, Map.of("count", 50, "mealType", "lunch"));
        a.tick(1);
        a.submit("alice", EventKind.PERSON_ASSIGNED, Map.of("personId", "p-7", "position", "Shelter Manager", "section", "Operations"));

        var live = a.projector.view(OP);
        var replay = a.projector.project(OP);

        assertThat(replay).isEqualTo(live);
        assertThat(live.version()).isEqualTo(5);
        assertThat(Register.valueOf(live.operation().operationName())).isEqualTo("Harvey Response");
        assertThat(Register.valueOf(live.facilities().get("f-1").capacity())).isEqualTo(120);
        assertThat(live.geography().counties()).containsOnlyKeys("harris");
        assertThat(live.metrics().mealsByType()).containsEntry("lunch", 50L);
        assertThat(live.roster().get("p-7").active().position()).isEqualTo("Shelter Manager");
        assertThat(a.projector.selfTest(OP)).isTrue();
    }

    @Test
    void concurrentEvents_foldToTheSameViewInAnyCausalOrder() {
        var created = a.submit("alice", EventKind.FACILITY_CREATED, facility("f-1", "Shelter 1", 100));
        b.ledger.mergeRemote(created);
        a.tick(3);
        b.tick(5);
        a.submit("alice", EventKind.FACILITY_UPDATED, Map.of("facilityId", "f-1", "capacity", 120));
        b.submit("bob", EventKind.FACILITY_UPDATED, Map.of("facilityId", "f-1", "capacity", 150), created.id());
        a.submit("alice", EventKind.MEALS_SERVED_INCREMENT, Map.of("count", 50));
        b.submit("bob", EventKind.MEALS_SERVED_INCREMENT, Map.of("count", 30));
        a.submit("alice", EventKind.COUNTY_ADDED, county("harris"));
        b.submit("bob", EventKind.COUNTY_REMOVED, Map.of("countyId", "harris"));
        b.submit("bob", EventKind.COUNTY_ADDED, county("galveston"));
        b.submit("bob", EventKind.COUNTY_REMOVED, Map.of("countyId", "galveston"));
        a.tick(5);
        b.tick(7);
        var first = a.submit("alice", EventKind.PERSON_ASSIGNED, Map.of("personId", "p-1", "position", "Driver", "section", "Logistics"));
        b.submit("bob", EventKind.PERSON_ASSIGNED, Map.of("personId", "p-1", "position", "Feeding Lead", "section", "Mass Care"));

        var events = new LinkedHashMap<UUID, Event>();
        a.store.readRange(OP, 0).forEach(e -> events.put(e.id(), e));
        b.store.readRange(OP, 0).forEach(e -> events.putIfAbsent(e.id(), e));
        var all = new ArrayList<>(events.values());

        var random = new Random(11);
        var reference = fold(randomCausalOrder(all, random), events);
        for (int round = 0; round < 25; round++) {
            assertThat(fold(randomCausalOrder(all, random), events)).isEqualTo(reference);
        }

        assertThat(Register.valueOf(reference.facilities().get("f-1").capacity())).isEqualTo(150);
        assertThat(Register.valueOf(reference.facilities().get("f-1").name())).isEqualTo("Shelter 1");
        assertThat(reference.metrics().mealsServed()).isEqualTo(80);
        assertThat(reference.geography().counties()).containsOnlyKeys("harris");
        assertThat(reference.roster().get("p-1").active().assignmentEventId()).isEqualTo(first.id().toString());
    }

    @Test
    void retainedHistory_isBoundedByConcurrentWriters() {
        for (int i = 0; i < 200; i++) {
            a.submit("alice", EventKind.SHELTERED_COUNT_SET, Map.of("count", i, "facilityId", "f-1"));
            a.submit("alice", i % 2 == 0 ? EventKind.COUNTY_ADDED : EventKind.COUNTY_REMOVED,
                    i % 2 == 0 ? county("harris") : Map.of("countyId", "harris"));
            a.submit("alice", i % 2 == 0 ? EventKind.PERSON_ASSIGNED : EventKind.PERSON_UNASSIGNED,
                    i % 2 == 0 ? Map.of("personId", "p-1", "position", "Driver", "section", "Logistics")
                            : Map.of("personId", "p-1"));
            a.tick(1);
        }
        var concurrent = b.submit("bob", EventKind.SHELTERED_COUNT_SET, Map.of("count", 999, "facilityId", "f-1"));
        a.ledger.mergeRemote(concurrent);

        var live = a.projector.view(OP);

        var sheltered = live.metrics().sheltered().get("f-1");
        assertThat(sheltered.writes()).hasSize(2);
        assertThat(live.geography().adds()).isEmpty();
        assertThat(live.geography().counties()).isEmpty();
        assertThat(live.roster().get("p-1").assignments()).isEmpty();
        assertThat(live.roster().get("p-1").releases()).isEmpty();
        assertThat(live.roster().get("p-1").status()).isEqualTo("unassigned");
        assertThat(a.projector.project(OP)).isEqualTo(live);
    }

    @Test
    void manualConflicts_carryTheSameIdOnEveryReplicaAndReplay() {
        var created = a.submit("alice", EventKind.FACILITY_CREATED, facility("f-1", "Shelter 1", 100));
        b.ledger.mergeRemote(created);
        var open = a.submit("alice", EventKind.FACILITY_STATUS_CHANGED, Map.of("facilityId", "f-1", "status", "open"));
        var closed = b.submit("bob", EventKind.FACILITY_STATUS_CHANGED, Map.of("facilityId", "f-1", "status", "closed"));
        a.ledger.mergeRemote(closed);
        b.ledger.mergeRemote(open);

        var onA = a.projector.view(OP);
        var onB = b.projector.view(OP);

        assertThat(onA.conflicts()).hasSize(1);
        assertThat(onA.conflicts().keySet()).isEqualTo(onB.conflicts().keySet());
        assertThat(onA).isEqualTo(onB);
        assertThat(a.projector.project(OP)).isEqualTo(a.projector.project(OP)).isEqualTo(onA);
        assertThat(a.projector.selfTest(OP)).isTrue();
        assertThat(b.projector.selfTest(OP)).isTrue();
    }

    @Test
    void olderPayloadsAreUpgraded_andUnknownVersionsDeferred() {
        var legacyPayload = new FacilityCreated("f-9", "shelter", "Old School", null, null, null);
        var legacy = handcrafted(1, legacyPayload, 1, EventHasher.GENESIS);
        a.store.append(legacy);
        var future = handcrafted(3, new FacilityCreated("f-10", "shelter", "New Gym", null, null, 40), 2, legacy.hash());
        a.store.append(future);

        var view = a.projector.rebuild(OP);

        assertThat(Register.valueOf(view.facilities().get("f-9").capacity())).isZero();
        assertThat(view.facilities()).doesNotContainKey("f-10");
        assertThat(a.projector.deferredEvents(OP)).extracting(Event::id).containsExactly(future.id());
    }

    @Test
    void selfTest_replacesALiveViewThatMissedAnEvent() {
        a.submit("alice", EventKind.MEALS_SERVED_INCREMENT, Map.of("count", 10));
        var bypass = a.factory.create(EventKind.MEALS_SERVED_INCREMENT, Map.of("count", 5), a.as("alice"));
        a.store.append(bypass.linkedTo(a.store.tailHash(OP)));

        assertThat(a.projector.view(OP).metrics().mealsServed()).isEqualTo(10);
        assertThat(a.projector.selfTest(OP)).isFalse();
        assertThat(a.projector.view(OP).metrics().mealsServed()).isEqualTo(15);
        assertThat(a.projector.selfTest(OP)).isTrue();
    }

    @Test
    void applyingTheSameEventTwice_changesNothing() {
        var meals = a.submit("alice", EventKind.MEALS_SERVED_INCREMENT, Map.of("count", 10));

        var again = a.projector.apply(meals);

        assertThat(again.metrics().mealsServed()).isEqualTo(10);
        assertThat(again.version()).isEqualTo(1);
    }

    @Test
    void subscribers_receiveChangesOfTheirSectionOnly() throws Exception {
        var received = new CopyOnWriteArrayList<ViewChange>();
        var latch = new CountDownLatch(1);
        a.projector.subscribe(OP, ViewKey.METRICS, new Flow.Subscriber<>() {
            @Override public void onSubscribe(Flow.Subscription s) { s.request(Long.MAX_VALUE); }
            @Override public void onNext(ViewChange change) { received.add(change); latch.countDown(); }
            @Override public void onError(Throwable t) { }
            @Override public void onComplete() { }
        });

        a.submit("alice", EventKind.FACILITY_CREATED, facility("f-1", "Shelter 1", 100));
        a.submit("alice", EventKind.MEALS_SERVED_INCREMENT, Map.of("count", 25));

        assertThat(latch.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(received.get(0).key()).isEqualTo(ViewKey.METRICS);
        assertThat(received.get(0).version()).isEqualTo(2);
        assertThat(((OperationView.Metrics) received.get(0).section()).mealsServed()).isEqualTo(25);
        a.projector.close();
    }

    @Test
    void causalOrder_putsCausesAndDevicePredecessorsFirst() {
        var parent = a.submit("alice", EventKind.FACILITY_CREATED, facility("f-1", "Shelter 1", 100));
        a.clock.advance(Duration.ofMinutes(-10));
        var skewed = a.submit("alice", EventKind.MEALS_SERVED_INCREMENT, Map.of("count", 5));
        b.ledger.mergeRemote(parent);
        b.clock.advance(Duration.ofMinutes(-20));
        var child = b.submit("bob", EventKind.FACILITY_UPDATED, Map.of("facilityId", "f-1", "name", "Annex"), parent.id());

        var ordered = Projector.causalOrder(List.of(child, skewed, parent));

        assertThat(ordered).extracting(Event::id).containsExactly(parent.id(), child.id(), skewed.id());
    }

    private OperationView fold(List<Event> order, Map<UUID, Event> byId) {
        var tracker = new CausalityTracker();
        var reducer = new OperationReducer(a.resolver, tracker, id -> Optional.ofNullable(byId.get(id)));
        var view = OperationView.empty(OP);
        for (var e : order) {
            tracker.record(e);
            view = reducer.apply(view, e);
        }
        return view;
    }

    private static List<Event> randomCausalOrder(List<Event> events, Random random) {
        var remaining = new ArrayList<>(events);
        var out = new ArrayList<Event>();
        while (!remaining.isEmpty()) {
            var ready = remaining.stream()
                    .filter(e -> remaining.stream().noneMatch(o -> mustPrecede(o, e)))
                    .toList();
            var pick = ready.get(random.nextInt(ready.size()));
            remaining.remove(pick);
            out.add(pick);
        }
        return out;
    }

    private static boolean mustPrecede(Event o, Event e) {
        return o.id().equals(e.causationId()) || (o.deviceId().equals(e.deviceId()) && o.sequence() < e.sequence());
    }

    private Event handcrafted(int version, FacilityCreated payload, long sequence, String previous) {
        var id = UUID.nameUUIDFromBytes(("legacy-" + payload.facilityId()).getBytes());
        long ts = Replica.T0.toEpochMilli() + sequence;
        return new Event(id, EventKind.FACILITY_CREATED, version, "alice", a.deviceId, "session-old", OP, ts, sequence,
                payload, null, null, EventHasher.hash(id, EventKind.FACILITY_CREATED, "alice", ts, payload), previous,
                SyncStatus.SYNCED, 0, null);
    }

    static Map<String, Object> facility(String id, String name, int capacity) {
        var m = new HashMap<String, Object>();
        m.put("facilityId", id);
        m.put("facilityType", "shelter");
        m.put("name", name);
        m.put("address", "100 Main St");
        m.put("county", "harris");
        m.put("capacity", capacity);
        return m;
    }

    static Map<String, Object> county(String id) {
        return Map.of("countyId", id, "countyName", id.substring(0, 1).toUpperCase() + id.substring(1),
                "state", "TX", "fips", "48" + Math.abs(id.hashCode() % 1000));
    }
}
