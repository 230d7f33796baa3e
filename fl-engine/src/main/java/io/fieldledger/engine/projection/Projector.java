package io.fieldledger.engine.projection;

import io.fieldledger.core.CausalOrdering;
import io.fieldledger.core.CausalityTracker;
import io.fieldledger.core.Event;
import io.fieldledger.core.SchemaVersionMismatchException;
import io.fieldledger.core.conflict.ConflictResolver;
import io.fieldledger.store.EventStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Flow;
import java.util.concurrent.SubmissionPublisher;

/**
 * Owns the live {@link OperationView} of every operation and publishes section changes.
 * <p>
 * {@link #project} is a pure replay of the stored chain; {@link #apply} is the incremental
 * path the ledger drives. {@link #selfTest} checks that both agree.
 */
public final class Projector implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(Projector.class);

    /** Tie-break among causally unordered events during replay. */
    public static final Comparator<Event> REPLAY_ORDER = Comparator
            .comparingLong(Event::timestamp)
            .thenComparingLong(Event::sequence)
            .thenComparing(Event::deviceId)
            .thenComparing(Event::id);

    private static final class Live {
        OperationView view;
        final Set<UUID> applied = new HashSet<>();
        final List<Event> deferred = new ArrayList<>();

        Live(OperationView view) {
            this.view = view;
        }
    }

    private record Topic(String operationId, ViewKey key) {}

    private final EventStore store;
    private final ConflictResolver resolver;
    private final OperationReducer liveReducer;
    private final MigrationRegistry migrations;
    private final Map<String, Live> live = new HashMap<>();
    private final Map<Topic, SubmissionPublisher<ViewChange>> topics = new ConcurrentHashMap<>();

    /**
     * @param liveOrdering causal order over everything already applied live; the ledger's tracker
     */
    public Projector(EventStore store, ConflictResolver resolver, CausalOrdering liveOrdering, MigrationRegistry migrations) {
        this.store = Objects.requireNonNull(store);
        this.resolver = Objects.requireNonNull(resolver);
        this.migrations = Objects.requireNonNull(migrations);
        this.liveReducer = new OperationReducer(resolver, liveOrdering, store::find);
    }

    /**
     * Fresh view from the stored chain. Pure: the live view is not touched.
     *
     * @throws io.fieldledger.core.ChainIntegrityException when the chain does not verify
     */
    public OperationView project(String operationId) {
        return replay(operationId).view;
    }

    private Live replay(String operationId) {
        store.verifyChain(operationId).orThrow();
        var tracker = new CausalityTracker();
        var reducer = new OperationReducer(resolver, tracker, store::find);
        var result = new Live(OperationView.empty(operationId));
        for (var event : causalOrder(store.readRange(operationId, 0))) {
            tracker.record(event);
            result.applied.add(event.id());
            try {
                result.view = reducer.apply(result.view, migrations.upgrade(event));
            } catch (SchemaVersionMismatchException e) {
                result.deferred.add(event);
            }
        }
        if (!result.deferred.isEmpty()) {
            log.warn("{} events of {} deferred: no migration to the current schema", result.deferred.size(), operationId);
        }
        return result;
    }

    /** Incremental step; pure. */
    public OperationView applyOne(OperationView view, Event event) {
        return liveReducer.apply(view, migrations.upgrade(event));
    }

    /**
     * Fold an appended event into the live view and notify subscribers of the sections it
     * changed. Applying an event twice is a no-op. Events needing an unknown migration are
     * deferred, not applied.
     */
    public OperationView apply(Event event) {
        var operationId = event.operationId();
        List<ViewChange> changes;
        OperationView next;
        synchronized (this) {
            var state = live.get(operationId);
            var previous = state == null ? OperationView.empty(operationId) : state.view;
            if (state == null) {
                // first sight of the operation; the replay normally holds the event already
                state = replay(operationId);
                live.put(operationId, state);
            }
            if (state.applied.add(event.id())) {
                try {
                    state.view = liveReducer.apply(state.view, migrations.upgrade(event));
                } catch (SchemaVersionMismatchException e) {
                    log.warn("Deferring {}: {}", event.id(), e.getMessage());
                    state.deferred.add(event);
                }
            }
            next = state.view;
            changes = diff(previous, next);
        }
        changes.forEach(this::publish);
        return next;
    }

    /** Current live view, built from the store on first access. */
    public OperationView view(String operationId) {
        synchronized (this) {
            return state(operationId).view;
        }
    }

    public Object view(String operationId, ViewKey key) {
        return view(operationId).section(key);
    }

    public void subscribe(String operationId, ViewKey key, Flow.Subscriber<? super ViewChange> subscriber) {
        topics.computeIfAbsent(new Topic(operationId, key), t -> new SubmissionPublisher<>()).subscribe(subscriber);
    }

    /**
     * Compare the live view with a fresh replay. On divergence the replay wins.
     *
     * @return true when both agreed
     */
    public boolean selfTest(String operationId) {
        var fresh = replay(operationId);
        List<ViewChange> changes;
        synchronized (this) {
            var current = state(operationId);
            if (current.view.equals(fresh.view)) return true;
            log.error("Live view of {} diverged from replay (live v{}, replay v{}); replacing it",
                    operationId, current.view.version(), fresh.view.version());
            changes = diff(current.view, fresh.view);
            live.put(operationId, fresh);
        }
        changes.forEach(this::publish);
        return false;
    }

    /** Replace the live view with a fresh replay. */
    public OperationView rebuild(String operationId) {
        var fresh = replay(operationId);
        List<ViewChange> changes;
        synchronized (this) {
            var previous = live.put(operationId, fresh);
            changes = diff(previous == null ? OperationView.empty(operationId) : previous.view, fresh.view);
        }
        changes.forEach(this::publish);
        return fresh.view;
    }

    public synchronized List<Event> deferredEvents(String operationId) {
        return List.copyOf(state(operationId).deferred);
    }

    @Override
    public void close() {
        topics.values().forEach(SubmissionPublisher::close);
    }

    /**
     * Causes before effects, earlier events of a device before later ones; otherwise
     * {@link #REPLAY_ORDER}. Links to events outside the list are ignored.
     */
    public static List<Event> causalOrder(List<Event> events) {
        var byId = new HashMap<UUID, Event>();
        events.forEach(e -> byId.putIfAbsent(e.id(), e));
        var pending = new HashMap<UUID, Integer>();
        var dependents = new HashMap<UUID, List<Event>>();
        var byDevice = new HashMap<String, TreeMap<Long, Event>>();
        byId.values().forEach(e -> byDevice.computeIfAbsent(e.deviceId(), d -> new TreeMap<>()).put(e.sequence(), e));

        for (var e : byId.values()) {
            int deps = 0;
            if (e.causationId() != null && byId.containsKey(e.causationId())) {
                dependents.computeIfAbsent(e.causationId(), k -> new ArrayList<>()).add(e);
                deps++;
            }
            var predecessor = byDevice.get(e.deviceId()).lowerEntry(e.sequence());
            if (predecessor != null) {
                dependents.computeIfAbsent(predecessor.getValue().id(), k -> new ArrayList<>()).add(e);
                deps++;
            }
            pending.put(e.id(), deps);
        }

        var ready = new PriorityQueue<>(REPLAY_ORDER);
        byId.values().stream().filter(e -> pending.get(e.id()) == 0).forEach(ready::add);
        var out = new ArrayList<Event>(byId.size());
        while (!ready.isEmpty()) {
            var next = ready.poll();
            out.add(next);
            for (var d : dependents.getOrDefault(next.id(), List.of())) {
                if (pending.merge(d.id(), -1, Integer::sum) == 0) ready.add(d);
            }
        }
        if (out.size() < byId.size()) {
            // a cycle can only come from corrupt links; keep the rest in tie-break order
            byId.values().stream().filter(e -> pending.get(e.id()) > 0).sorted(REPLAY_ORDER).forEach(out::add);
        }
        return out;
    }

    private Live state(String operationId) {
        var state = live.get(operationId);
        if (state == null) {
            state = replay(operationId);
            live.put(operationId, state);
        }
        return state;
    }

    private static List<ViewChange> diff(OperationView before, OperationView after) {
        var changes = new ArrayList<ViewChange>();
        for (var key : ViewKey.values()) {
            if (before.section(key) != after.section(key) && !Objects.equals(before.section(key), after.section(key))) {
                changes.add(new ViewChange(after.operationId(), key, after.version(), after.section(key)));
            }
        }
        return changes;
    }

    private void publish(ViewChange change) {
        var topic = topics.get(new Topic(change.operationId(), change.key()));
        if (topic != null) topic.submit(change);
    }
}
