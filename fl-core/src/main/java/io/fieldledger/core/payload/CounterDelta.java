package io.fieldledger.core.payload;

/** Payloads that add a signed delta to a counter; merged by summing. */
public interface CounterDelta {
    long delta();
}
