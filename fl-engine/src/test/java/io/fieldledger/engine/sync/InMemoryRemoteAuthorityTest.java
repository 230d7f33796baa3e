package io.fieldledger.engine.sync;

import io.fieldledger.core.ActorContext;
import io.fieldledger.core.Determinism;
import io.fieldledger.core.Event;
import io.fieldledger.core.EventFactory;
import io.fieldledger.core.EventHasher;
import io.fieldledger.core.EventKind;
import io.fieldledger.core.payload.MealsServedIncrement;
import io.fieldledger.store.HashChainedEventStore;
import io.fieldledger.store.InMemoryEventPersistence;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryRemoteAuthorityTest {

    private static final String OP = "op-1";

    private final InMemoryRemoteAuthority authority = new InMemoryRemoteAuthority();
    private final EventFactory factory = new EventFactory(Determinism.seeded(5));
    private final ActorContext ctx = new ActorContext("alice", "tablet-1", "s-1", OP);

    @Test
    void acceptedEvents_areRelinkedIntoTheCanonicalChain() {
        var first = meals(3);
        var second = meals(4);

        var receipt = authority.push(SyncBatch.of(OP, List.of(first, second)));

        assertThat(receipt.count(PushOutcome.ACCEPTED)).isEqualTo(2);
        var canonical = authority.canonical().readRange(OP, 0);
        assertThat(canonical.get(0).previousHash()).isEqualTo(EventHasher.GENESIS);
        assertThat(canonical.get(1).previousHash()).isEqualTo(first.hash());
        assertThat(authority.canonical().verifyChain(OP).valid()).isTrue();
    }

    @Test
    void eachEventGetsItsOwnOutcome() {
        var ok = meals(1);
        var forged = new Event(UUID.randomUUID(), EventKind.MEALS_SERVED_INCREMENT, 1, "mallory", "tablet-9", "s-9", OP,
                0L, 1, new MealsServedIncrement(9L, null, null), null, null, "0".repeat(64), null, null, 0, null);
        var orphan = factory.create(EventKind.MEALS_SERVED_INCREMENT, Map.of("count", 2), ctx)
                .withCausality(UUID.randomUUID(), null);
        var tooNew = new Event(UUID.randomUUID(), EventKind.MEALS_SERVED_INCREMENT, 7, "alice", "tablet-1", "s-1", OP,
                0L, 9, new MealsServedIncrement(1L, null, null), null, null, "", null, null, 0, null);
        tooNew = withHash(tooNew);
        authority.push(SyncBatch.of(OP, List.of(ok)));

        var receipt = authority.push(SyncBatch.of(OP, List.of(ok, forged, orphan, tooNew)));

        assertThat(receipt.resultFor(ok.id()).orElseThrow().outcome()).isEqualTo(PushOutcome.DUPLICATE);
        assertThat(receipt.resultFor(forged.id()).orElseThrow().outcome()).isEqualTo(PushOutcome.REJECTED_CHAIN);
        assertThat(receipt.resultFor(orphan.id()).orElseThrow().outcome()).isEqualTo(PushOutcome.REJECTED_CHAIN);
        assertThat(receipt.resultFor(tooNew.id()).orElseThrow().outcome()).isEqualTo(PushOutcome.REJECTED_VALIDATION);
        assertThat(authority.canonical().size(OP)).isEqualTo(1);
    }

    @Test
    void truncatedBatch_isRejectedWhole() {
        var first = meals(1);
        var second = meals(2);

        var receipt = authority.push(new SyncBatch(OP, List.of(first), second.hash()));

        assertThat(receipt.count(PushOutcome.REJECTED_CHAIN)).isEqualTo(1);
        assertThat(authority.canonical().size(OP)).isZero();
    }

    @Test
    void pull_pagesFromTheRequestedPosition() {
        var small = new InMemoryRemoteAuthority(new HashChainedEventStore(new InMemoryEventPersistence()), 2);
        var events = List.of(meals(1), meals(2), meals(3));
        small.push(SyncBatch.of(OP, events));

        var page = small.pull(new PullRequest(OP, 1));
        var rest = small.pull(new PullRequest(OP, 3));

        assertThat(page.events()).extracting(Event::id).containsExactly(events.get(1).id(), events.get(2).id());
        assertThat(page.lastSequence()).isEqualTo(3);
        assertThat(page.tailDigest()).isEqualTo(events.get(2).hash());
        assertThat(rest.isEmpty()).isTrue();
        assertThat(rest.tailDigest()).isEqualTo(events.get(2).hash());
    }

    private Event meals(long count) {
        return factory.create(EventKind.MEALS_SERVED_INCREMENT, Map.of("count", count), ctx);
    }

    private static Event withHash(Event e) {
        return new Event(e.id(), e.kind(), e.schemaVersion(), e.actorId(), e.deviceId(), e.sessionId(), e.operationId(),
                e.timestamp(), e.sequence(), e.payload(), e.causationId(), e.correlationId(), EventHasher.hash(e),
                e.previousHash(), e.syncStatus(), e.syncAttempts(), e.syncError());
    }
}
