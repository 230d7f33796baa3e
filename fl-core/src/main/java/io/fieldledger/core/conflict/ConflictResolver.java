package io.fieldledger.core.conflict;

import io.fieldledger.core.Event;
import io.fieldledger.core.EventKind;
import io.fieldledger.core.payload.CounterDelta;
import io.fieldledger.core.payload.MembershipChange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;
import java.util.UUID;

/**
 * Applies the configured policy to concurrent events of one kind on one target.
 * Deterministic: the same candidate set yields the same resolution in any input order
 * and on any replica.
 */
public final class ConflictResolver {
    private static final Logger log = LoggerFactory.getLogger(ConflictResolver.class);

    /** Ascending; the last element is the last writer. */
    public static final Comparator<Event> LAST_WRITE = Comparator
            .comparingLong(Event::timestamp)
            .thenComparing(Event::actorId)
            .thenComparing(Event::id);

    /** Ascending; the first element is the first writer. */
    public static final Comparator<Event> FIRST_WRITE = Comparator
            .comparingLong(Event::timestamp)
            .thenComparingLong(Event::sequence)
            .thenComparing(Event::deviceId)
            .thenComparing(Event::id);

    private final ConflictPolicyTable policies;
    private final ConflictQueue queue;
    private final Compensator compensator;

    public ConflictResolver(ConflictPolicyTable policies, ConflictQueue queue, Compensator compensator) {
        this.policies = Objects.requireNonNull(policies);
        this.queue = Objects.requireNonNull(queue);
        this.compensator = Objects.requireNonNull(compensator);
    }

    /**
     * @param candidates concurrent events of a single kind touching a single target;
     *                   repeated ids count once
     * @throws UnconfiguredPolicyException when the kind has no policy
     * @throws ConflictQueueFullException  when a MANUAL conflict cannot be queued
     */
    public Resolution resolve(List<Event> candidates) {
        var distinct = distinct(candidates);
        var kind = distinct.get(0).kind();
        var binding = policies.bindingFor(kind);

        var resolution = switch (binding.policy()) {
            case LWW, FWW -> {
                var winner = winnerOf(distinct);
                yield new Resolution.Selected(binding.policy(), winner, others(distinct, winner));
            }
            case CRDT -> new Resolution.Merged(merge(kind, distinct), distinct);
            case DOMAIN -> {
                var fn = policies.mergeFunction(kind).orElseThrow(() -> new UnconfiguredPolicyException(kind));
                var winner = fn.selectWinner(distinct);
                var losers = others(distinct, winner);
                yield new Resolution.Compensated(fn.name(), winner, losers, fn.compensate(winner, losers, compensator));
            }
            case MANUAL -> new Resolution.Queued(queue.offer(ManualConflict.of(distinct)));
        };

        if (resolution instanceof Resolution.Queued q) {
            log.warn("Manual conflict {} on {} ({}): {} candidates await a decision",
                    q.conflict().conflictId(), q.conflict().target(), kind.wireName(), distinct.size());
        } else {
            log.info("Resolved {} concurrent {} on {} by {}", distinct.size(), kind.wireName(),
                    distinct.get(0).target(), binding);
        }
        return resolution;
    }

    /**
     * Winner under the kind's policy without side effects (no queueing, no compensation).
     * For MANUAL kinds this is the provisional value shown until a human decides.
     *
     * @throws IllegalStateException for CRDT kinds, which have no single winner
     */
    public Event winnerOf(List<Event> candidates) {
        var distinct = distinct(candidates);
        var kind = distinct.get(0).kind();
        return switch (policies.policyFor(kind)) {
            case LWW -> distinct.stream().max(LAST_WRITE).orElseThrow();
            case FWW, MANUAL -> distinct.stream().min(FIRST_WRITE).orElseThrow();
            case DOMAIN -> policies.mergeFunction(kind).orElseThrow(() -> new UnconfiguredPolicyException(kind))
                    .selectWinner(distinct);
            case CRDT -> throw new IllegalStateException(kind.wireName() + " merges, it has no winner");
        };
    }

    public ConflictPolicy policyFor(EventKind kind) {
        return policies.policyFor(kind);
    }

    public ConflictQueue queue() {
        return queue;
    }

    private static MergeValue merge(EventKind kind, List<Event> events) {
        var sample = events.get(0).payload();
        if (sample instanceof CounterDelta) {
            long total = 0;
            for (var e : events) total = Math.addExact(total, ((CounterDelta) e.payload()).delta());
            return new MergeValue.Counter(total);
        }
        if (sample instanceof MembershipChange) {
            var present = new TreeSet<String>();
            for (var e : events) {
                var change = (MembershipChange) e.payload();
                if (change.adds()) present.add(change.element());
            }
            return new MergeValue.Membership(present);
        }
        throw new IllegalStateException(kind.wireName() + " has no commutative merge");
    }

    private List<Event> distinct(List<Event> candidates) {
        if (candidates == null || candidates.isEmpty()) throw new IllegalArgumentException("no candidates");
        var byId = new LinkedHashMap<UUID, Event>();
        candidates.stream().sorted(Comparator.comparing(Event::id)).forEach(e -> byId.putIfAbsent(e.id(), e));
        var kinds = byId.values().stream().map(Event::kind).distinct().toList();
        // adds and removes of one set element are different kinds on the same target
        if (kinds.size() > 1 && !kinds.stream().allMatch(k -> MembershipChange.class.isAssignableFrom(k.payloadType())
                && policies.policyFor(k) == ConflictPolicy.CRDT)) {
            throw new IllegalArgumentException("candidates mix event kinds " + kinds);
        }
        return new ArrayList<>(byId.values());
    }

    private static List<Event> others(List<Event> all, Event winner) {
        return all.stream().filter(e -> !e.id().equals(winner.id())).toList();
    }
}
