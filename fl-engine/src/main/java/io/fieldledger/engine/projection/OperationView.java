package io.fieldledger.engine.projection;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.fieldledger.core.Event;

import java.util.Collections;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Read model of one operation. Immutable: every applied event yields a new value and
 * sections the event did not touch are shared with the previous one.
 *
 * @param version number of events folded into this view
 */
public record OperationView(
        String operationId,
        long version,
        Header operation,
        SortedMap<String, Facility> facilities,
        SortedMap<String, RosterEntry> roster,
        Geography geography,
        Metrics metrics,
        SortedMap<String, WorkAssignment> workAssignments,
        SortedMap<String, IapSection> iap,
        SortedMap<String, OpenConflict> conflicts
) {

    public static OperationView empty(String operationId) {
        return new OperationView(operationId, 0, Header.EMPTY, sorted(), sorted(), Geography.EMPTY, Metrics.EMPTY,
                sorted(), sorted(), sorted());
    }

    /** The section addressed by {@code key}, as exposed to readers. */
    public Object section(ViewKey key) {
        return switch (key) {
            case OPERATION -> operation;
            case FACILITIES -> facilities;
            case ROSTER -> roster;
            case GEOGRAPHY -> geography;
            case METRICS -> metrics;
            case WORK_ASSIGNMENTS -> workAssignments;
            case IAP -> iap;
            case CONFLICTS -> conflicts;
        };
    }

    OperationView next() {
        return new OperationView(operationId, version + 1, operation, facilities, roster, geography, metrics,
                workAssignments, iap, conflicts);
    }

    OperationView withOperation(Header h) {
        return new OperationView(operationId, version, h, facilities, roster, geography, metrics, workAssignments, iap, conflicts);
    }

    OperationView withFacilities(SortedMap<String, Facility> f) {
        return new OperationView(operationId, version, operation, f, roster, geography, metrics, workAssignments, iap, conflicts);
    }

    OperationView withRoster(SortedMap<String, RosterEntry> r) {
        return new OperationView(operationId, version, operation, facilities, r, geography, metrics, workAssignments, iap, conflicts);
    }

    OperationView withGeography(Geography g) {
        return new OperationView(operationId, version, operation, facilities, roster, g, metrics, workAssignments, iap, conflicts);
    }

    OperationView withMetrics(Metrics m) {
        return new OperationView(operationId, version, operation, facilities, roster, geography, m, workAssignments, iap, conflicts);
    }

    OperationView withWorkAssignments(SortedMap<String, WorkAssignment> w) {
        return new OperationView(operationId, version, operation, facilities, roster, geography, metrics, w, iap, conflicts);
    }

    OperationView withIap(SortedMap<String, IapSection> i) {
        return new OperationView(operationId, version, operation, facilities, roster, geography, metrics, workAssignments, i, conflicts);
    }

    OperationView withConflicts(SortedMap<String, OpenConflict> c) {
        return new OperationView(operationId, version, operation, facilities, roster, geography, metrics, workAssignments, iap, c);
    }

    /* ---------- Sections ---------- */

    public record Header(Register<String> operationNumber,
                         Register<String> operationName,
                         Register<String> disasterType,
                         Register<String> activationLevel,
                         Register<String> drNumber,
                         Register<String> closedReason) {
        static final Header EMPTY = new Header(null, null, null, null, null, null);

        @JsonProperty
        public String status() {
            if (operationNumber == null) return "unknown";
            return closedReason == null ? "active" : "closed";
        }

        @JsonProperty
        public String createdBy() {
            return operationNumber == null ? null : operationNumber.writer().actorId();
        }

        @JsonProperty
        public Long createdAt() {
            return operationNumber == null ? null : operationNumber.writer().timestamp();
        }

        @JsonProperty
        public String closedBy() {
            return closedReason == null ? null : closedReason.writer().actorId();
        }
    }

    public record Facility(String facilityId,
                           Register<String> facilityType,
                           Register<String> name,
                           Register<String> address,
                           Register<String> county,
                           Register<Integer> capacity,
                           Register<String> status,
                           SortedMap<String, Long> resources) {
        static Facility empty(String facilityId) {
            return new Facility(facilityId, null, null, null, null, null, null, sorted());
        }

        /** False while only updates for the facility have been seen. */
        @JsonProperty
        public boolean created() {
            return facilityType != null;
        }
    }

    /**
     * @param active            the person's current position, {@code null} when unassigned
     * @param assignments       assignments neither released nor superseded by a later one
     * @param releases          unassignments naming an assignment not seen yet
     */
    public record RosterEntry(String personId,
                              Assignment active,
                              @JsonIgnore List<Event> assignments,
                              @JsonIgnore List<Event> releases) {
        public RosterEntry {
            assignments = List.copyOf(assignments);
            releases = List.copyOf(releases);
        }

        @JsonProperty
        public String status() {
            return active == null ? "unassigned" : "assigned";
        }
    }

    public record Assignment(String assignmentEventId, String position, String section, String facilityId,
                             String reportingTo, String assignedBy, long assignedAt) {}

    /**
     * @param counties present counties, observed-remove semantics
     * @param states   distinct states of the present counties
     * @param adds     per county, the adds no remove has observed and no later add superseded
     */
    public record Geography(SortedMap<String, County> counties,
                            List<String> states,
                            @JsonIgnore SortedMap<String, List<Event>> adds) {
        static final Geography EMPTY = new Geography(sorted(), List.of(), sorted());

        public Geography {
            states = List.copyOf(states);
        }
    }

    public record County(String countyId, String countyName, String state, String fips) {}

    public record Metrics(long mealsServed,
                          SortedMap<String, Long> mealsByType,
                          SortedMap<String, Register<Long>> sheltered,
                          SortedMap<String, Long> suppliesDistributed) {
        static final Metrics EMPTY = new Metrics(0, sorted(), sorted(), sorted());
    }

    public record WorkAssignment(String assignmentId,
                                 Register<String> title,
                                 Register<String> priority,
                                 Register<String> facilityId,
                                 Register<String> completedBy) {
        static WorkAssignment empty(String assignmentId) {
            return new WorkAssignment(assignmentId, null, null, null, null);
        }

        @JsonProperty
        public boolean completed() {
            return completedBy != null;
        }
    }

    public record IapSection(int iapNumber, String section, Register<String> content) {}

    /** Concurrent writes a human still has to decide between; the provisional winner is shown meanwhile. */
    public record OpenConflict(String conflictId, String kind, String target, List<String> candidateEventIds,
                               String provisionalWinnerId) {
        public OpenConflict {
            candidateEventIds = List.copyOf(candidateEventIds);
        }
    }

    static <K extends Comparable<K>, V> SortedMap<K, V> sorted() {
        return Collections.unmodifiableSortedMap(new TreeMap<>());
    }

    static <K extends Comparable<K>, V> SortedMap<K, V> put(SortedMap<K, V> map, K key, V value) {
        var copy = new TreeMap<>(map);
        copy.put(key, value);
        return Collections.unmodifiableSortedMap(copy);
    }

    static <K extends Comparable<K>, V> SortedMap<K, V> remove(SortedMap<K, V> map, K key) {
        if (!map.containsKey(key)) return map;
        var copy = new TreeMap<>(map);
        copy.remove(key);
        return Collections.unmodifiableSortedMap(copy);
    }
}
