package io.fieldledger.engine.sync;

import java.time.Duration;
import java.util.Objects;

/** Timing and batching of the sync loop. Immutable; build with {@link #builder()}. */
public final class SyncSettings {
    private final Duration debounce;
    private final Duration interval;
    private final int batchSize;
    private final int maxAttempts;
    private final Duration baseBackoff;
    private final Duration maxBackoff;

    private SyncSettings(Builder b) {
        this.debounce = b.debounce;
        this.interval = b.interval;
        this.batchSize = b.batchSize;
        this.maxAttempts = b.maxAttempts;
        this.baseBackoff = b.baseBackoff;
        this.maxBackoff = b.maxBackoff;
    }

    public static SyncSettings defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Quiet period after a local append before its events become pending. */
    public Duration debounce() { return debounce; }
    public Duration interval() { return interval; }
    public int batchSize() { return batchSize; }
    /** Attempts after which a failed event is terminal. */
    public int maxAttempts() { return maxAttempts; }
    public Duration baseBackoff() { return baseBackoff; }
    public Duration maxBackoff() { return maxBackoff; }

    /** Wait before retry number {@code attempts}: {@code base * 2^(attempts-1)}, capped. */
    public Duration backoff(int attempts) {
        if (attempts <= 0) return Duration.ZERO;
        int shift = Math.min(attempts - 1, 30);
        var delay = baseBackoff.multipliedBy(1L << shift);
        return delay.compareTo(maxBackoff) > 0 ? maxBackoff : delay;
    }

    @Override
    public String toString() {
        return "SyncSettings[debounce=" + debounce + ", interval=" + interval + ", batchSize=" + batchSize
                + ", maxAttempts=" + maxAttempts + ", backoff=" + baseBackoff + ".." + maxBackoff + "]";
    }

    public static final class Builder {
        private Duration debounce = Duration.ofSeconds(2);
        private Duration interval = Duration.ofSeconds(30);
        private int batchSize = 100;
        private int maxAttempts = 5;
        private Duration baseBackoff = Duration.ofSeconds(1);
        private Duration maxBackoff = Duration.ofMinutes(5);

        private Builder() {}

        public Builder debounce(Duration v) { this.debounce = Objects.requireNonNull(v); return this; }
        public Builder interval(Duration v) { this.interval = Objects.requireNonNull(v); return this; }
        public Builder batchSize(int v) { this.batchSize = v; return this; }
        public Builder maxAttempts(int v) { this.maxAttempts = v; return this; }
        public Builder baseBackoff(Duration v) { this.baseBackoff = Objects.requireNonNull(v); return this; }
        public Builder maxBackoff(Duration v) { this.maxBackoff = Objects.requireNonNull(v); return this; }

        public SyncSettings build() {
            if (batchSize <= 0) throw new IllegalArgumentException("batchSize must be positive");
            if (maxAttempts <= 0) throw new IllegalArgumentException("maxAttempts must be positive");
            if (baseBackoff.isNegative() || maxBackoff.compareTo(baseBackoff) < 0) {
                throw new IllegalArgumentException("backoff bounds out of order: " + baseBackoff + ".." + maxBackoff);
            }
            return new SyncSettings(this);
        }
    }
}
