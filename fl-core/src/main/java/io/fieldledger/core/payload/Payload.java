package io.fieldledger.core.payload;

/**
 * Kind-specific body of an event. One record per {@link io.fieldledger.core.EventKind};
 * new kinds are added as new variants, never by loosening an existing one.
 */
public sealed interface Payload permits
        OperationCreated, OperationUpdated, OperationClosed,
        CountyAdded, CountyRemoved,
        PersonAssigned, PersonUnassigned,
        FacilityCreated, FacilityUpdated, FacilityStatusChanged, FacilityResourceAdded,
        WorkAssignmentCreated, WorkAssignmentUpdated, WorkAssignmentCompleted,
        IapSectionUpdated,
        MealsServedIncrement, ShelteredCountSet, SuppliesDistributedAdd,
        ConflictResolved {

    /** Logical entity this fact touches; events conflict only when targets match. */
    String target();

    /**
     * Structural check against the shape declared for {@code schemaVersion}.
     *
     * @throws io.fieldledger.core.ValidationException naming the first offending field
     */
    void validate(int schemaVersion);
}
