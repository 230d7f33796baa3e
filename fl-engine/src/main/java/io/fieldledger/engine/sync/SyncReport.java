package io.fieldledger.engine.sync;

/** What one sync cycle did for one operation. */
public record SyncReport(
        String operationId,
        int pushed,
        int synced,
        int failed,
        int stuck,
        int pulled,
        int merged,
        int resolutions,
        int unresolved,
        boolean fullSyncRequested,
        boolean cancelled
) {
    public static SyncReport skipped(String operationId) {
        return new SyncReport(operationId, 0, 0, 0, 0, 0, 0, 0, 0, false, true);
    }
}
