package io.fieldledger.store;

import java.util.Optional;

public interface SyncCursorStore {

    Optional<SyncCursor> find(String deviceId, String operationId);

    void save(SyncCursor cursor);

    /** Forget the cursor so the next pull starts from the beginning of the remote stream. */
    void reset(String deviceId, String operationId);
}
