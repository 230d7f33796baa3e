package io.fieldledger.core.conflict;

import java.util.List;
import java.util.Optional;

/** Bounded holding area for conflicts a human has to decide. */
public interface ConflictQueue {

    /**
     * Enqueue, or return the already queued conflict with the same id.
     *
     * @throws ConflictQueueFullException when at capacity
     */
    ManualConflict offer(ManualConflict conflict);

    Optional<ManualConflict> find(String conflictId);

    /** Open conflicts of one operation, oldest detection first. */
    List<ManualConflict> pending(String operationId);

    Optional<ManualConflict> remove(String conflictId);

    int size();
}
