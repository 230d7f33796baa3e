package io.fieldledger.engine.sync;

/** @param sinceSequence number of remote events the caller already merged */
public record PullRequest(String operationId, long sinceSequence) {
    public PullRequest {
        if (sinceSequence < 0) throw new IllegalArgumentException("sinceSequence must not be negative");
    }
}
