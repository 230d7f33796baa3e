package io.fieldledger.api;

import io.fieldledger.engine.sync.SyncSettings;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * {@code fieldledger.*} settings.
 *
 * @param deviceId device this node writes as when a request names none
 * @param conflictQueueCapacity open manual conflicts kept before new ones are refused
 */
@ConfigurationProperties("fieldledger")
public record FieldLedgerProperties(String deviceId, int conflictQueueCapacity, Authority authority, Sync sync) {

    public FieldLedgerProperties {
        if (deviceId == null || deviceId.isBlank()) deviceId = "node-local";
        if (conflictQueueCapacity <= 0) conflictQueueCapacity = 256;
        if (authority == null) authority = new Authority(true, 100);
        if (sync == null) sync = new Sync(false, null, null, null, null, null, null, null, null);
    }

    /** This node serving as the remote authority for other devices. */
    public record Authority(boolean enabled, int pageSize) {
        public Authority {
            if (pageSize <= 0) pageSize = 100;
        }
    }

    /** This node syncing against a remote authority at {@code remoteUrl}. */
    public record Sync(boolean enabled, String remoteUrl, String operationId, Duration debounce, Duration interval,
                       Integer batchSize, Integer maxAttempts, Duration baseBackoff, Duration maxBackoff) {

        public SyncSettings settings() {
            var b = SyncSettings.builder();
            if (debounce != null) b.debounce(debounce);
            if (interval != null) b.interval(interval);
            if (batchSize != null) b.batchSize(batchSize);
            if (maxAttempts != null) b.maxAttempts(maxAttempts);
            if (baseBackoff != null) b.baseBackoff(baseBackoff);
            if (maxBackoff != null) b.maxBackoff(maxBackoff);
            return b.build();
        }
    }
}
