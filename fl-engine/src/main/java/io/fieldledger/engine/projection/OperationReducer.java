package io.fieldledger.engine.projection;

import io.fieldledger.core.CausalOrdering;
import io.fieldledger.core.Event;
import io.fieldledger.core.SyncStatus;
import io.fieldledger.core.conflict.ConflictPolicy;
import io.fieldledger.core.conflict.ConflictResolver;
import io.fieldledger.core.conflict.ManualConflict;
import io.fieldledger.core.payload.ConflictResolved;
import io.fieldledger.core.payload.CountyAdded;
import io.fieldledger.core.payload.CountyRemoved;
import io.fieldledger.core.payload.FacilityCreated;
import io.fieldledger.core.payload.FacilityResourceAdded;
import io.fieldledger.core.payload.FacilityStatusChanged;
import io.fieldledger.core.payload.FacilityUpdated;
import io.fieldledger.core.payload.IapSectionUpdated;
import io.fieldledger.core.payload.MealsServedIncrement;
import io.fieldledger.core.payload.MembershipChange;
import io.fieldledger.core.payload.OperationClosed;
import io.fieldledger.core.payload.OperationCreated;
import io.fieldledger.core.payload.OperationUpdated;
import io.fieldledger.core.payload.PersonAssigned;
import io.fieldledger.core.payload.PersonUnassigned;
import io.fieldledger.core.payload.ShelteredCountSet;
import io.fieldledger.core.payload.SuppliesDistributedAdd;
import io.fieldledger.core.payload.WorkAssignmentCompleted;
import io.fieldledger.core.payload.WorkAssignmentCreated;
import io.fieldledger.core.payload.WorkAssignmentUpdated;
import io.fieldledger.engine.projection.OperationView.Assignment;
import io.fieldledger.engine.projection.OperationView.County;
import io.fieldledger.engine.projection.OperationView.Facility;
import io.fieldledger.engine.projection.OperationView.Geography;
import io.fieldledger.engine.projection.OperationView.Header;
import io.fieldledger.engine.projection.OperationView.IapSection;
import io.fieldledger.engine.projection.OperationView.Metrics;
import io.fieldledger.engine.projection.OperationView.OpenConflict;
import io.fieldledger.engine.projection.OperationView.RosterEntry;
import io.fieldledger.engine.projection.OperationView.WorkAssignment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedMap;
import java.util.UUID;
import java.util.function.Function;

import static io.fieldledger.engine.projection.OperationView.put;
import static io.fieldledger.engine.projection.OperationView.remove;

/**
 * Folds one event into an {@link OperationView}.
 * <p>
 * The result depends on the set of events applied, not on the order concurrent events
 * arrive in. Attributes keep only their causally maximal writes and expose the winner
 * among them: a later-declared kind beats an earlier one (an update beats a concurrent
 * create), otherwise the kind's conflict policy decides. Superseded writes, observed adds
 * and applied releases are dropped, so the work per event is bounded by concurrency,
 * not by history. Counters add. County membership is
 * an observed-remove set. A person's active assignment is the merge function's winner
 * among assignments neither released nor superseded.
 * <p>
 * Callers must not apply the same event twice; counters are not idempotent on their own.
 * Events must arrive causes first, as {@link Projector} delivers them.
 */
public final class OperationReducer {
    private static final Logger log = LoggerFactory.getLogger(OperationReducer.class);
    private static final String UNSPECIFIED = "unspecified";

    private final ConflictResolver resolver;
    private final CausalOrdering ordering;
    private final Function<UUID, Optional<Event>> lookup;

    /**
     * @param lookup finds the chosen candidate named by a {@code conflict.resolved} event
     */
    public OperationReducer(ConflictResolver resolver, CausalOrdering ordering, Function<UUID, Optional<Event>> lookup) {
        this.resolver = Objects.requireNonNull(resolver);
        this.ordering = Objects.requireNonNull(ordering);
        this.lookup = Objects.requireNonNull(lookup);
    }

    public OperationView apply(OperationView view, Event raw) {
        if (!view.operationId().equals(raw.operationId())) {
            throw new IllegalArgumentException("event " + raw.id() + " belongs to " + raw.operationId() + ", not " + view.operationId());
        }
        var event = normalize(raw);
        var step = new Step(view.conflicts());
        var next = fold(step, view.next(), event, event);
        return step.conflicts == view.conflicts() ? next : next.withConflicts(step.conflicts);
    }

    /**
     * @param writer event recorded as the writer
     * @param source event whose payload and author supply the values; differs from
     *               {@code writer} only for a manual decision
     */
    private OperationView fold(Step step, OperationView v, Event writer, Event source) {
        step.basis = source;
        var payload = source.payload();
        if (payload instanceof OperationCreated p) {
            var h = v.operation();
            return v.withOperation(new Header(
                    step.write(h.operationNumber(), writer, p.operationNumber()),
                    step.write(h.operationName(), writer, p.operationName()),
                    step.write(h.disasterType(), writer, p.disasterType()),
                    step.write(h.activationLevel(), writer, p.activationLevel()),
                    step.write(h.drNumber(), writer, p.drNumber()),
                    h.closedReason()));
        }
        if (payload instanceof OperationUpdated p) {
            var h = v.operation();
            return v.withOperation(new Header(h.operationNumber(),
                    step.write(h.operationName(), writer, p.operationName()),
                    step.write(h.disasterType(), writer, p.disasterType()),
                    step.write(h.activationLevel(), writer, p.activationLevel()),
                    h.drNumber(), h.closedReason()));
        }
        if (payload instanceof OperationClosed p) {
            var h = v.operation();
            return v.withOperation(new Header(h.operationNumber(), h.operationName(), h.disasterType(),
                    h.activationLevel(), h.drNumber(), step.write(h.closedReason(), writer, p.reason())));
        }
        if (payload instanceof CountyAdded || payload instanceof CountyRemoved) {
            return v.withGeography(membership(v.geography(), writer));
        }
        if (payload instanceof PersonAssigned p) {
            return v.withRoster(roster(v.roster(), p.personId(), writer, true));
        }
        if (payload instanceof PersonUnassigned p) {
            return v.withRoster(roster(v.roster(), p.personId(), writer, false));
        }
        if (payload instanceof FacilityCreated p) {
            var f = facility(v, p.facilityId());
            return v.withFacilities(put(v.facilities(), p.facilityId(), new Facility(f.facilityId(),
                    step.write(f.facilityType(), writer, p.facilityType()),
                    step.write(f.name(), writer, p.name()),
                    step.write(f.address(), writer, p.address()),
                    step.write(f.county(), writer, p.county()),
                    step.write(f.capacity(), writer, p.capacity()),
                    f.status(), f.resources())));
        }
        if (payload instanceof FacilityUpdated p) {
            var f = facility(v, p.facilityId());
            return v.withFacilities(put(v.facilities(), p.facilityId(), new Facility(f.facilityId(), f.facilityType(),
                    step.write(f.name(), writer, p.name()),
                    step.write(f.address(), writer, p.address()),
                    f.county(),
                    step.write(f.capacity(), writer, p.capacity()),
                    f.status(), f.resources())));
        }
        if (payload instanceof FacilityStatusChanged p) {
            var f = facility(v, p.facilityId());
            return v.withFacilities(put(v.facilities(), p.facilityId(), new Facility(f.facilityId(), f.facilityType(),
                    f.name(), f.address(), f.county(), f.capacity(),
                    step.write(f.status(), writer, p.status()), f.resources())));
        }
        if (payload instanceof FacilityResourceAdded p) {
            var f = facility(v, p.facilityId());
            return v.withFacilities(put(v.facilities(), p.facilityId(), new Facility(f.facilityId(), f.facilityType(),
                    f.name(), f.address(), f.county(), f.capacity(), f.status(),
                    add(f.resources(), p.resourceType(), p.delta()))));
        }
        if (payload instanceof WorkAssignmentCreated p) {
            var w = work(v, p.assignmentId());
            return v.withWorkAssignments(put(v.workAssignments(), p.assignmentId(), new WorkAssignment(w.assignmentId(),
                    step.write(w.title(), writer, p.title()),
                    step.write(w.priority(), writer, p.priority()),
                    step.write(w.facilityId(), writer, p.facilityId()),
                    w.completedBy())));
        }
        if (payload instanceof WorkAssignmentUpdated p) {
            var w = work(v, p.assignmentId());
            return v.withWorkAssignments(put(v.workAssignments(), p.assignmentId(), new WorkAssignment(w.assignmentId(),
                    step.write(w.title(), writer, p.title()),
                    step.write(w.priority(), writer, p.priority()),
                    w.facilityId(), w.completedBy())));
        }
        if (payload instanceof WorkAssignmentCompleted p) {
            var w = work(v, p.assignmentId());
            return v.withWorkAssignments(put(v.workAssignments(), p.assignmentId(), new WorkAssignment(w.assignmentId(),
                    w.title(), w.priority(), w.facilityId(),
                    step.write(w.completedBy(), writer, source.actorId()))));
        }
        if (payload instanceof IapSectionUpdated p) {
            var key = p.iapNumber() + ":" + p.section();
            var current = v.iap().get(key);
            var content = step.write(current == null ? null : current.content(), writer, p.content());
            return v.withIap(put(v.iap(), key, new IapSection(p.iapNumber(), p.section(), content)));
        }
        if (payload instanceof MealsServedIncrement p) {
            var m = v.metrics();
            var type = p.mealType() == null ? UNSPECIFIED : p.mealType();
            return v.withMetrics(new Metrics(Math.addExact(m.mealsServed(), p.delta()), add(m.mealsByType(), type, p.delta()),
                    m.sheltered(), m.suppliesDistributed()));
        }
        if (payload instanceof ShelteredCountSet p) {
            var m = v.metrics();
            var register = step.write(m.sheltered().get(p.scope()), writer, p.count());
            return v.withMetrics(new Metrics(m.mealsServed(), m.mealsByType(), put(m.sheltered(), p.scope(), register),
                    m.suppliesDistributed()));
        }
        if (payload instanceof SuppliesDistributedAdd p) {
            var m = v.metrics();
            return v.withMetrics(new Metrics(m.mealsServed(), m.mealsByType(), m.sheltered(),
                    add(m.suppliesDistributed(), p.item(), p.delta())));
        }
        if (payload instanceof ConflictResolved p) {
            return decision(step, v, writer, p);
        }
        throw new IllegalStateException("no reducer for " + source.kind());
    }

    /** A manual decision re-applies the chosen candidate's values with the decision as writer. */
    private OperationView decision(Step step, OperationView v, Event decision, ConflictResolved p) {
        UUID chosenId;
        try {
            chosenId = UUID.fromString(p.chosenEventId());
        } catch (IllegalArgumentException e) {
            log.warn("Decision {} names malformed candidate {}", decision.id(), p.chosenEventId());
            return v;
        }
        var chosen = lookup.apply(chosenId).map(OperationReducer::normalize);
        if (chosen.isEmpty()) {
            log.warn("Decision {} names unknown candidate {}", decision.id(), chosenId);
            return v;
        }
        var policy = resolver.policyFor(chosen.get().kind());
        if (policy == ConflictPolicy.CRDT || policy == ConflictPolicy.DOMAIN) {
            log.debug("Decision {} on {} kind has no attribute to settle", decision.id(), policy);
            return v;
        }
        return fold(step, v, decision, chosen.get());
    }

    private Geography membership(Geography g, Event event) {
        var change = (MembershipChange) event.payload();
        var countyId = change.element();
        // a later add supersedes the adds it saw, a remove drops them
        var live = g.adds().getOrDefault(countyId, List.of()).stream()
                .filter(a -> !ordering.happenedBefore(a, event))
                .toList();
        if (change.adds()) live = with(live, event);

        var adds = live.isEmpty() ? remove(g.adds(), countyId) : put(g.adds(), countyId, live);
        var counties = g.counties();
        if (live.isEmpty()) {
            counties = remove(counties, countyId);
        } else {
            var p = (CountyAdded) live.stream().max(ConflictResolver.LAST_WRITE).orElseThrow().payload();
            counties = put(counties, countyId, new County(p.countyId(), p.countyName(), p.state(), p.fips()));
        }
        var states = counties.values().stream().map(County::state).distinct().sorted().toList();
        return new Geography(counties, states, adds);
    }

    private SortedMap<String, RosterEntry> roster(SortedMap<String, RosterEntry> roster, String personId, Event event, boolean assigns) {
        var current = roster.get(personId);
        var assignments = current == null ? List.<Event>of() : current.assignments();
        var releases = current == null ? List.<Event>of() : current.releases();
        if (assigns) {
            var standing = assignments.stream().filter(a -> !ordering.happenedBefore(a, event)).toList();
            var waiting = releases.stream().filter(u -> releases(u, event)).toList();
            if (waiting.isEmpty()) {
                assignments = with(standing, event);
            } else {
                assignments = standing;
                releases = releases.stream().filter(u -> !waiting.contains(u)).toList();
            }
        } else {
            var released = assignments.stream().filter(a -> releases(event, a)).toList();
            assignments = assignments.stream().filter(a -> !released.contains(a)).toList();
            var named = ((PersonUnassigned) event.payload()).assignmentEventId();
            if (released.isEmpty() && named != null) releases = with(releases, event);
        }

        Assignment active = null;
        if (!assignments.isEmpty()) {
            var winner = assignments.size() == 1 ? assignments.get(0) : resolver.winnerOf(assignments);
            var p = (PersonAssigned) winner.payload();
            active = new Assignment(winner.id().toString(), p.position(), p.section(), p.facilityId(), p.reportingTo(),
                    winner.actorId(), winner.timestamp());
        }
        return put(roster, personId, new RosterEntry(personId, active, assignments, releases));
    }

    /** An unassignment naming an assignment releases exactly that one, otherwise every assignment it has seen. */
    private boolean releases(Event unassignment, Event assignment) {
        var named = ((PersonUnassigned) unassignment.payload()).assignmentEventId();
        if (named != null) return named.equals(assignment.id().toString());
        return ordering.happenedBefore(assignment, unassignment);
    }

    private static Facility facility(OperationView v, String facilityId) {
        var f = v.facilities().get(facilityId);
        return f != null ? f : Facility.empty(facilityId);
    }

    private static WorkAssignment work(OperationView v, String assignmentId) {
        var w = v.workAssignments().get(assignmentId);
        return w != null ? w : WorkAssignment.empty(assignmentId);
    }

    private static SortedMap<String, Long> add(SortedMap<String, Long> counters, String key, long delta) {
        return put(counters, key, Math.addExact(counters.getOrDefault(key, 0L), delta));
    }

    private static List<Event> with(List<Event> events, Event e) {
        var out = new ArrayList<Event>(events);
        out.add(e);
        out.sort(Comparator.comparing(Event::id));
        return out;
    }

    /**
     * Chain position and sync bookkeeping are per replica, not part of the fact; views of
     * the same events compare equal on every replica, before and after sync.
     */
    private static Event normalize(Event e) {
        if (e.previousHash() == null && e.syncStatus() == SyncStatus.LOCAL && e.syncAttempts() == 0 && e.syncError() == null) {
            return e;
        }
        return e.linkedTo(null).withSync(SyncStatus.LOCAL, 0, null);
    }

    /** Register arithmetic for one applied event, collecting changes to the open conflicts. */
    private final class Step {
        SortedMap<String, OpenConflict> conflicts;
        /** Event ranking the writes of the current fold. */
        Event basis;

        Step(SortedMap<String, OpenConflict> conflicts) {
            this.conflicts = conflicts;
        }

        /** New register state after {@code writer} sets {@code value}; a null value leaves it untouched. */
        <T> Register<T> write(Register<T> current, Event writer, T value) {
            if (value == null) return current;
            var writes = new ArrayList<Register.Write<T>>();
            if (current != null) writes.addAll(current.writes());
            if (writes.stream().anyMatch(w -> w.event().id().equals(writer.id()) || dominates(w.event(), writer))) {
                return current;
            }
            writes.removeIf(w -> dominates(writer, w.event()));
            writes.add(new Register.Write<>(writer, value, basis));
            writes.sort(Comparator.comparing(w -> w.event().id()));

            // a decision competes with its chosen candidate's kind and tie-break key
            var candidates = new LinkedHashMap<UUID, Register.Write<T>>();
            for (var w : writes) {
                candidates.putIfAbsent(w.basis().id(), new Register.Write<>(w.basis(), w.value(), w.basis()));
            }
            int top = candidates.values().stream().mapToInt(w -> w.event().kind().ordinal()).max().orElseThrow();
            var contenders = candidates.values().stream().filter(w -> w.event().kind().ordinal() == top).toList();
            var winnerEvent = contenders.size() == 1
                    ? contenders.get(0).event()
                    : resolver.winnerOf(contenders.stream().map(Register.Write::event).toList());
            var winner = contenders.stream().filter(w -> w.event().id().equals(winnerEvent.id())).findFirst().orElseThrow();
            var contested = contenders.size() > 1 && resolver.policyFor(winnerEvent.kind()) == ConflictPolicy.MANUAL
                    ? contenders.stream().map(Register.Write::event).toList()
                    : List.<Event>of();

            var next = new Register<>(winner.value(), winner.event(), writes, contested);
            track(current, next);
            return next;
        }

        private void track(Register<?> before, Register<?> after) {
            if (before != null && before.isContested()) {
                conflicts = remove(conflicts, ManualConflict.of(before.contested()).conflictId());
            }
            if (after.isContested()) {
                var conflict = ManualConflict.of(after.contested());
                conflicts = put(conflicts, conflict.conflictId(), new OpenConflict(conflict.conflictId(),
                        conflict.kind().wireName(), conflict.target(),
                        conflict.candidates().stream().map(e -> e.id().toString()).toList(),
                        after.writer().id().toString()));
            }
        }
    }

    /** {@code later} supersedes {@code earlier}: it saw it, or it is a decision naming it. */
    private boolean dominates(Event later, Event earlier) {
        if (later.id().equals(earlier.id())) return false;
        if (later.payload() instanceof ConflictResolved d) {
            var id = earlier.id().toString();
            if (id.equals(d.chosenEventId()) || d.rejectedEventIds().contains(id)) return true;
        }
        return ordering.happenedBefore(earlier, later);
    }
}
