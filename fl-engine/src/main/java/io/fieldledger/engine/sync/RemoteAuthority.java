package io.fieldledger.engine.sync;

/**
 * The canonical stream every replica pushes to and pulls from.
 * Implementations signal unreachability with {@link io.fieldledger.core.SyncTransportException}.
 */
public interface RemoteAuthority {

    PushReceipt push(SyncBatch batch);

    PullResponse pull(PullRequest request);
}
