package io.fieldledger.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Causation/correlation stamping and the partial order derived from it.
 * <p>
 * {@code a} happens before {@code b} when {@code a} is reachable from {@code b} through
 * causation links or earlier events of the same device. Each known event carries a
 * {@link VectorClock} joined from its cause and its device predecessor.
 * <p>
 * Events whose cause has not arrived yet are parked in a bounded awaiting-parent buffer
 * and released, parents first, once the cause is admitted.
 */
public final class CausalityTracker implements CausalOrdering {
    private static final Logger log = LoggerFactory.getLogger(CausalityTracker.class);

    public static final int DEFAULT_CAPACITY = 1024;
    public static final Duration DEFAULT_PARENT_TIMEOUT = Duration.ofMinutes(10);

    private record Known(UUID correlationId, VectorClock clock) {}

    private record Waiting(Event event, Instant since) {}

    private final Map<UUID, Known> known = new HashMap<>();
    private final Map<String, TreeMap<Long, UUID>> byDevice = new HashMap<>();
    private final Map<UUID, List<Waiting>> waitingOnParent = new HashMap<>();
    private final Set<UUID> waitingIds = new HashSet<>();

    private final int capacity;
    private final Duration parentTimeout;
    private final Clock clock;

    public CausalityTracker() {
        this(DEFAULT_CAPACITY, DEFAULT_PARENT_TIMEOUT, Clock.systemUTC());
    }

    public CausalityTracker(int capacity, Duration parentTimeout, Clock clock) {
        if (capacity <= 0) throw new IllegalArgumentException("capacity must be positive");
        this.capacity = capacity;
        this.parentTimeout = parentTimeout;
        this.clock = clock;
    }

    /**
     * Attach causation and correlation to a freshly built event.
     * Correlation defaults to the cause's correlation, or to the event itself for a root.
     *
     * @throws ValidationException when the cited cause is not known locally
     */
    public synchronized Event stamp(Event event, UUID causationId, UUID correlationId) {
        UUID correlation = correlationId;
        if (causationId != null) {
            var parent = known.get(causationId);
            if (parent == null) {
                throw new ValidationException("causationId", "unknown cause " + causationId);
            }
            if (correlation == null) correlation = parent.correlationId();
        }
        return event.withCausality(causationId, correlation == null ? event.id() : correlation);
    }

    /** Register an event as applied. Idempotent. */
    public synchronized void record(Event event) {
        if (known.containsKey(event.id())) return;
        known.put(event.id(), new Known(event.correlationId(), compute(event)));
        byDevice.computeIfAbsent(event.deviceId(), d -> new TreeMap<>()).put(event.sequence(), event.id());
    }

    public synchronized boolean knows(UUID id) {
        return known.containsKey(id);
    }

    /**
     * Offer an event that arrived from elsewhere.
     *
     * @return the events now applicable in causal order: the event itself followed by any
     *         buffered descendants it unblocks; empty when the event has to wait
     * @throws MissingParentException when the awaiting-parent buffer is full
     */
    public synchronized List<Event> admit(Event event) {
        if (known.containsKey(event.id()) || waitingIds.contains(event.id())) return List.of();

        if (!event.isRoot() && !known.containsKey(event.causationId())) {
            if (waitingIds.size() >= capacity) {
                throw new MissingParentException(event.id(), event.causationId(),
                        "awaiting-parent buffer full (" + capacity + ")");
            }
            waitingOnParent.computeIfAbsent(event.causationId(), k -> new ArrayList<>())
                    .add(new Waiting(event, clock.instant()));
            waitingIds.add(event.id());
            log.debug("Parked {} until parent {} arrives", event.id(), event.causationId());
            return List.of();
        }

        var ready = new ArrayList<Event>();
        var queue = new ArrayDeque<Event>();
        queue.add(event);
        while (!queue.isEmpty()) {
            var next = queue.poll();
            ready.add(next);
            var children = waitingOnParent.remove(next.id());
            if (children == null) continue;
            for (var w : children) {
                waitingIds.remove(w.event().id());
                queue.add(w.event());
            }
        }
        if (ready.size() > 1) log.debug("Released {} buffered descendants of {}", ready.size() - 1, event.id());
        return ready;
    }

    /**
     * Drop buffered events that waited longer than the parent timeout, together with
     * anything waiting on them.
     */
    public synchronized List<Event> expire() {
        var cutoff = clock.instant().minus(parentTimeout);
        var expired = new ArrayList<Event>();
        for (Iterator<Map.Entry<UUID, List<Waiting>>> it = waitingOnParent.entrySet().iterator(); it.hasNext(); ) {
            var entry = it.next();
            entry.getValue().removeIf(w -> {
                if (w.since().isAfter(cutoff)) return false;
                expired.add(w.event());
                return true;
            });
            if (entry.getValue().isEmpty()) it.remove();
        }
        // descendants of expired events can never be released either
        var queue = new ArrayDeque<>(expired);
        while (!queue.isEmpty()) {
            var children = waitingOnParent.remove(queue.poll().id());
            if (children == null) continue;
            children.forEach(w -> {
                expired.add(w.event());
                queue.add(w.event());
            });
        }
        expired.forEach(e -> waitingIds.remove(e.id()));
        if (!expired.isEmpty()) log.warn("{} events expired waiting for their parent", expired.size());
        return expired;
    }

    public synchronized int awaitingParent() {
        return waitingIds.size();
    }

    public synchronized VectorClock clockOf(Event event) {
        var k = known.get(event.id());
        return k != null ? k.clock() : compute(event);
    }

    @Override
    public synchronized VectorClock.Order order(Event a, Event b) {
        if (a.id().equals(b.id())) return VectorClock.Order.EQUAL;
        return clockOf(a).order(clockOf(b));
    }

    private VectorClock compute(Event event) {
        var vc = VectorClock.empty();
        if (event.causationId() != null) {
            var parent = known.get(event.causationId());
            if (parent != null) vc = vc.join(parent.clock());
        }
        var sameDevice = byDevice.get(event.deviceId());
        if (sameDevice != null) {
            var pred = sameDevice.lowerEntry(event.sequence());
            if (pred != null) vc = vc.join(known.get(pred.getValue()).clock());
        }
        return vc.advance(event.deviceId(), event.sequence());
    }
}
