package io.fieldledger.store;

import io.fieldledger.core.Event;
import io.fieldledger.core.EventHasher;

import java.util.List;
import java.util.Objects;

/**
 * Walks events in stream order checking each content hash and each link to the previous
 * event. Used on the local store and on batches received during sync.
 */
public final class ChainVerifier {
    private final String operationId;
    private long position;
    private String previous;
    private ChainVerification failure;

    /**
     * @param expectedPrevious hash the first event must link to; {@code null} trusts the
     *                         first event's own link
     */
    public ChainVerifier(String operationId, long startPosition, String expectedPrevious) {
        this.operationId = operationId;
        this.position = startPosition;
        this.previous = expectedPrevious;
    }

    /** @return false once a break was found; later events are not looked at */
    public boolean accept(Event event) {
        if (failure != null) return false;
        if (!operationId.equals(event.operationId())) {
            return fail("event " + event.id() + " belongs to operation " + event.operationId());
        }
        if (!EventHasher.matches(event)) {
            return fail("hash mismatch for event " + event.id());
        }
        if (previous != null && !previous.equals(event.previousHash())) {
            return fail("event " + event.id() + " links to " + event.previousHash() + ", expected " + previous);
        }
        previous = event.hash();
        position++;
        return true;
    }

    /** Hash of the last accepted event. */
    public String tail() {
        return previous;
    }

    public ChainVerification result() {
        return failure != null ? failure : ChainVerification.intact(operationId, position);
    }

    /**
     * Check a received batch: internal links, the link to what the receiver already holds,
     * and the sender's declared tail digest.
     */
    public static ChainVerification verifyBatch(String operationId, List<Event> events,
                                                String expectedPrevious, String tailDigest) {
        var verifier = new ChainVerifier(operationId, 0, expectedPrevious);
        for (var e : events) {
            if (!verifier.accept(e)) return verifier.result();
        }
        if (tailDigest != null && !events.isEmpty() && !Objects.equals(verifier.tail(), tailDigest)) {
            return ChainVerification.broken(operationId, events.size(), events.size() - 1,
                    "batch ends at " + verifier.tail() + " but sender declared " + tailDigest);
        }
        return verifier.result();
    }

    private boolean fail(String reason) {
        failure = ChainVerification.broken(operationId, position, position, reason);
        return false;
    }
}
