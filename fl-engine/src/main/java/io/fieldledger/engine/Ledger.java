package io.fieldledger.engine;

import io.fieldledger.core.ActorContext;
import io.fieldledger.core.CausalityTracker;
import io.fieldledger.core.ConflictUnresolvedException;
import io.fieldledger.core.Event;
import io.fieldledger.core.EventFactory;
import io.fieldledger.core.EventKind;
import io.fieldledger.core.LedgerException;
import io.fieldledger.core.SyncStatus;
import io.fieldledger.core.conflict.ConflictResolver;
import io.fieldledger.core.conflict.ManualConflict;
import io.fieldledger.core.payload.ConflictResolved;
import io.fieldledger.core.payload.Payload;
import io.fieldledger.engine.projection.OperationView;
import io.fieldledger.engine.projection.Projector;
import io.fieldledger.store.EventStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * The local replica: one critical section serializes validation, causality stamping,
 * chain append and incremental projection, for local intents and for events merged from sync.
 */
public final class Ledger {
    private static final Logger log = LoggerFactory.getLogger(Ledger.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final EventFactory factory;
    private final CausalityTracker tracker;
    private final EventStore store;
    private final Projector projector;
    private final ConflictResolver resolver;
    private final List<Consumer<Event>> listeners = new CopyOnWriteArrayList<>();
    // guarded by lock
    private int unitDepth;
    private final List<Event> heldBack = new ArrayList<>();

    public Ledger(EventFactory factory, CausalityTracker tracker, EventStore store, Projector projector,
                  ConflictResolver resolver) {
        this.factory = Objects.requireNonNull(factory);
        this.tracker = Objects.requireNonNull(tracker);
        this.store = Objects.requireNonNull(store);
        this.projector = Objects.requireNonNull(projector);
        this.resolver = Objects.requireNonNull(resolver);
    }

    /**
     * Record a collaborator's intent.
     *
     * @return the appended event
     * @throws io.fieldledger.core.ValidationException       when the payload or the cited cause is invalid
     * @throws io.fieldledger.core.ChainIntegrityException   when the stream is halted
     */
    public Event submit(EventKind kind, Map<String, ?> rawPayload, ActorContext ctx) {
        return submit(kind, rawPayload, ctx, null, null);
    }

    public Event submit(EventKind kind, Map<String, ?> rawPayload, ActorContext ctx, UUID causationId, UUID correlationId) {
        return exclusive(() -> commit(factory.create(kind, rawPayload, ctx), causationId, correlationId));
    }

    public Event submit(EventKind kind, Payload payload, ActorContext ctx) {
        return submit(kind, payload, ctx, null, null);
    }

    public Event submit(EventKind kind, Payload payload, ActorContext ctx, UUID causationId, UUID correlationId) {
        return exclusive(() -> commit(factory.create(kind, payload, ctx), causationId, correlationId));
    }

    /**
     * Merge an event received from the authority. The event keeps its identity and is linked
     * to the local tail as SYNCED.
     *
     * @return false when the event was already present
     */
    public boolean mergeRemote(Event event) {
        return exclusive(() -> {
            if (store.contains(event.id())) return false;
            var local = event.linkedTo(store.tailHash(event.operationId())).withSync(SyncStatus.SYNCED, 0, null);
            store.append(local);
            tracker.record(local);
            factory.observe(local);
            projector.apply(local);
            announce(local);
            return true;
        });
    }

    /**
     * Run {@code merge} as one unit inside the critical section. Nothing runs unless
     * {@code stillCurrent} holds once the lock is taken, and listeners hear about the
     * events appended by {@code merge} only after it returned or failed.
     *
     * @return the result of {@code merge}, empty when {@code stillCurrent} no longer held
     */
    public <T> Optional<T> mergeUnit(BooleanSupplier stillCurrent, Supplier<T> merge) {
        return exclusive(() -> {
            if (!stillCurrent.getAsBoolean()) return Optional.empty();
            unitDepth++;
            try {
                return Optional.of(merge.get());
            } finally {
                if (--unitDepth == 0) {
                    var appended = new ArrayList<>(heldBack);
                    heldBack.clear();
                    appended.forEach(this::notifyListeners);
                }
            }
        });
    }

    /** Append an event the engine derived itself, such as a compensation. Idempotent. */
    public boolean appendDerived(Event derived) {
        return exclusive(() -> {
            if (store.contains(derived.id())) return false;
            commitLinked(derived.linkedTo(store.tailHash(derived.operationId())));
            return true;
        });
    }

    /**
     * Apply a human decision on a MANUAL conflict.
     *
     * @throws ConflictUnresolvedException when the conflict is unknown or the chosen event is not one of its candidates
     */
    public Event resolveConflict(String conflictId, UUID chosenEventId, ActorContext ctx) {
        return exclusive(() -> {
            var conflict = findConflict(ctx.operationId(), conflictId)
                    .orElseThrow(() -> new ConflictUnresolvedException(conflictId, "no open conflict " + conflictId));
            var chosen = conflict.candidate(chosenEventId)
                    .orElseThrow(() -> new ConflictUnresolvedException(conflictId,
                            chosenEventId + " is not a candidate of conflict " + conflictId));
            var rejected = conflict.rejectedBy(chosenEventId).stream().map(e -> e.id().toString()).toList();
            var payload = new ConflictResolved(conflictId, conflict.kind().wireName(), conflict.target(),
                    chosenEventId.toString(), rejected);
            var decision = commit(factory.create(EventKind.CONFLICT_RESOLVED, payload, ctx), chosen.id(), null);
            resolver.queue().remove(conflictId);
            log.info("Conflict {} on {} resolved by {}: kept {}", conflictId, conflict.target(), ctx.actorId(), chosenEventId);
            return decision;
        });
    }

    /** Open conflicts of an operation: queued ones, then any only the view knows about. */
    public List<ManualConflict> openConflicts(String operationId) {
        var result = new ArrayList<>(resolver.queue().pending(operationId));
        var queued = result.stream().map(ManualConflict::conflictId).toList();
        for (var id : projector.view(operationId).conflicts().keySet()) {
            if (!queued.contains(id)) findConflict(operationId, id).ifPresent(result::add);
        }
        return result;
    }

    /**
     * Reload every stored stream: causality, device counters and views.
     * A stream that fails verification is logged and left out; the others still load.
     */
    public void bootstrap() {
        exclusive(() -> {
            for (var operationId : store.operationIds()) {
                try {
                    for (var event : Projector.causalOrder(store.readRange(operationId, 0))) {
                        tracker.record(event);
                        factory.observe(event);
                    }
                    var view = projector.rebuild(operationId);
                    log.info("Loaded operation {} at version {}", operationId, view.version());
                } catch (LedgerException e) {
                    log.error("Operation {} could not be loaded: {}", operationId, e.getMessage());
                }
            }
            return null;
        });
    }

    public OperationView view(String operationId) {
        return projector.view(operationId);
    }

    /** Run {@code action} inside the ledger's critical section. */
    public <T> T exclusive(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Called after every append, inside the critical section; keep it short. Appends of a
     * {@link #mergeUnit} are announced together once the unit is done.
     */
    public void addListener(Consumer<Event> listener) {
        listeners.add(listener);
    }

    public EventFactory factory() {
        return factory;
    }

    public CausalityTracker tracker() {
        return tracker;
    }

    public EventStore store() {
        return store;
    }

    public Projector projector() {
        return projector;
    }

    public ConflictResolver resolver() {
        return resolver;
    }

    private Event commit(Event created, UUID causationId, UUID correlationId) {
        var stamped = tracker.stamp(created, causationId, correlationId);
        return commitLinked(stamped.linkedTo(store.tailHash(stamped.operationId())));
    }

    private Event commitLinked(Event linked) {
        store.append(linked);
        tracker.record(linked);
        projector.apply(linked);
        log.debug("Appended {} {} to {}", linked.kind().wireName(), linked.id(), linked.operationId());
        announce(linked);
        return linked;
    }

    private Optional<ManualConflict> findConflict(String operationId, String conflictId) {
        var queued = resolver.queue().find(conflictId);
        if (queued.isPresent()) return queued;
        var open = projector.view(operationId).conflicts().get(conflictId);
        if (open == null) return Optional.empty();
        var candidates = new ArrayList<Event>();
        for (var id : open.candidateEventIds()) {
            store.find(UUID.fromString(id)).ifPresent(candidates::add);
        }
        return candidates.isEmpty() ? Optional.empty() : Optional.of(ManualConflict.of(candidates));
    }

    private void announce(Event event) {
        if (unitDepth > 0) heldBack.add(event);
        else notifyListeners(event);
    }

    private void notifyListeners(Event event) {
        for (var listener : listeners) {
            try {
                listener.accept(event);
            } catch (RuntimeException e) {
                log.warn("Listener failed on {}: {}", event.id(), e.getMessage());
            }
        }
    }
}
