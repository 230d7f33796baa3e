package io.fieldledger.core;

import com.fasterxml.jackson.annotation.JsonValue;
import io.fieldledger.core.payload.ConflictResolved;
import io.fieldledger.core.payload.CountyAdded;
import io.fieldledger.core.payload.CountyRemoved;
import io.fieldledger.core.payload.FacilityCreated;
import io.fieldledger.core.payload.FacilityResourceAdded;
import io.fieldledger.core.payload.FacilityStatusChanged;
import io.fieldledger.core.payload.FacilityUpdated;
import io.fieldledger.core.payload.IapSectionUpdated;
import io.fieldledger.core.payload.MealsServedIncrement;
import io.fieldledger.core.payload.OperationClosed;
import io.fieldledger.core.payload.OperationCreated;
import io.fieldledger.core.payload.OperationUpdated;
import io.fieldledger.core.payload.Payload;
import io.fieldledger.core.payload.PersonAssigned;
import io.fieldledger.core.payload.PersonUnassigned;
import io.fieldledger.core.payload.ShelteredCountSet;
import io.fieldledger.core.payload.SuppliesDistributedAdd;
import io.fieldledger.core.payload.WorkAssignmentCompleted;
import io.fieldledger.core.payload.WorkAssignmentCreated;
import io.fieldledger.core.payload.WorkAssignmentUpdated;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Closed set of facts the ledger records.
 * <p>
 * Declaration order matters: within one entity, a later-declared kind outranks an
 * earlier one when two concurrent writers of different kinds touch the same attribute
 * (an update beats a concurrent create).
 */
public enum EventKind {
    OPERATION_CREATED("operation.created", OperationCreated.class, 1),
    OPERATION_UPDATED("operation.updated", OperationUpdated.class, 1),
    OPERATION_CLOSED("operation.closed", OperationClosed.class, 1),

    COUNTY_ADDED("geography.county_added", CountyAdded.class, 1),
    COUNTY_REMOVED("geography.county_removed", CountyRemoved.class, 1),

    PERSON_ASSIGNED("roster.person_assigned", PersonAssigned.class, 1),
    PERSON_UNASSIGNED("roster.person_unassigned", PersonUnassigned.class, 1),

    FACILITY_CREATED("facility.created", FacilityCreated.class, 2),
    FACILITY_UPDATED("facility.updated", FacilityUpdated.class, 1),
    FACILITY_STATUS_CHANGED("facility.status_changed", FacilityStatusChanged.class, 1),
    FACILITY_RESOURCE_ADDED("facility.resource_added", FacilityResourceAdded.class, 1),

    WORK_ASSIGNMENT_CREATED("work_assignment.created", WorkAssignmentCreated.class, 1),
    WORK_ASSIGNMENT_UPDATED("work_assignment.updated", WorkAssignmentUpdated.class, 1),
    WORK_ASSIGNMENT_COMPLETED("work_assignment.completed", WorkAssignmentCompleted.class, 1),

    IAP_SECTION_UPDATED("iap.section_updated", IapSectionUpdated.class, 1),

    MEALS_SERVED_INCREMENT("metrics.meals_served.increment", MealsServedIncrement.class, 1),
    SHELTERED_COUNT_SET("metrics.sheltered_count.set", ShelteredCountSet.class, 1),
    SUPPLIES_DISTRIBUTED_ADD("metrics.supplies_distributed.add", SuppliesDistributedAdd.class, 1),

    CONFLICT_RESOLVED("conflict.resolved", ConflictResolved.class, 1);

    private static final Map<String, EventKind> BY_WIRE_NAME = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(EventKind::wireName, Function.identity()));

    private final String wireName;
    private final Class<? extends Payload> payloadType;
    private final int currentVersion;

    EventKind(String wireName, Class<? extends Payload> payloadType, int currentVersion) {
        this.wireName = wireName;
        this.payloadType = payloadType;
        this.currentVersion = currentVersion;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public Class<? extends Payload> payloadType() {
        return payloadType;
    }

    /** Schema version written by this build. */
    public int currentVersion() {
        return currentVersion;
    }

    public boolean accepts(Payload payload) {
        return payloadType.isInstance(payload);
    }

    /** @throws ValidationException on an unknown wire name */
    public static EventKind fromWire(String wireName) {
        if (wireName == null) throw new ValidationException("kind", "is required");
        var kind = BY_WIRE_NAME.get(wireName);
        if (kind == null) throw new ValidationException("kind", "unknown event kind '" + wireName + "'");
        return kind;
    }

    /** Kind whose payload variant is {@code payload}'s class. */
    public static EventKind of(Payload payload) {
        for (var kind : values()) {
            if (kind.accepts(payload)) return kind;
        }
        throw new IllegalArgumentException("no kind for payload " + payload.getClass().getName());
    }
}
