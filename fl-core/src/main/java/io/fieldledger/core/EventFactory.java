package io.fieldledger.core;

import io.fieldledger.core.conflict.Compensator;
import io.fieldledger.core.payload.Payload;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Builds well-formed events from intents: decodes and validates the payload, assigns
 * identity, time and device sequence, and computes the content hash.
 * <p>
 * Events leave the factory unlinked ({@code previousHash == null}); the ledger links them
 * to the chain tail inside its critical section.
 */
public final class EventFactory implements Compensator {

    /** Actor recorded on events the engine derives on its own. */
    public static final String SYSTEM_ACTOR = "system:conflict-resolver";
    /** Derived events get their own device lane so they never collide with the cause's sequence. */
    public static final String DERIVED_DEVICE_PREFIX = "derived:";

    private final Determinism determinism;
    private final PayloadCodec codec;
    private final Map<String, AtomicLong> sequences = new ConcurrentHashMap<>();

    public EventFactory(Determinism determinism) {
        this(determinism, new PayloadCodec());
    }

    public EventFactory(Determinism determinism, PayloadCodec codec) {
        this.determinism = Objects.requireNonNull(determinism);
        this.codec = Objects.requireNonNull(codec);
    }

    /**
     * Intent from a collaborator: raw payload as entered.
     *
     * @throws ValidationException naming the offending field
     */
    public Event create(EventKind kind, Map<String, ?> rawPayload, ActorContext ctx) {
        Objects.requireNonNull(kind, "kind");
        return create(kind, codec.decode(kind, rawPayload, kind.currentVersion()), ctx);
    }

    /** Typed intent; the payload is still validated. */
    public Event create(EventKind kind, Payload payload, ActorContext ctx) {
        Objects.requireNonNull(ctx, "ctx");
        if (payload == null) throw new ValidationException("payload", "is required");
        if (!kind.accepts(payload)) {
            throw new ValidationException("payload", kind.wireName() + " cannot carry " + payload.getClass().getSimpleName());
        }
        payload.validate(kind.currentVersion());

        var id = determinism.randomUUID();
        long timestamp = determinism.nowMillis();
        return new Event(id, kind, kind.currentVersion(), ctx.actorId(), ctx.deviceId(), ctx.sessionId(),
                ctx.operationId(), timestamp, nextSequence(ctx.deviceId()), payload,
                null, null, EventHasher.hash(id, kind, ctx.actorId(), timestamp, payload), null,
                SyncStatus.LOCAL, 0, null);
    }

    /**
     * Event derived from {@code cause} by the engine itself. Identity, time and sequence come
     * from the cause, so every replica that derives it builds the very same event.
     */
    @Override
    public Event derive(Event cause, EventKind kind, Payload payload) {
        payload.validate(kind.currentVersion());
        var id = Determinism.derivedUUID("derived", kind.wireName(), cause.id());
        return new Event(id, kind, kind.currentVersion(), SYSTEM_ACTOR, DERIVED_DEVICE_PREFIX + cause.deviceId(), cause.sessionId(),
                cause.operationId(), cause.timestamp(), cause.sequence(), payload,
                cause.id(), cause.correlationId(), EventHasher.hash(id, kind, SYSTEM_ACTOR, cause.timestamp(), payload),
                null, SyncStatus.LOCAL, 0, null);
    }

    /** Raise the device counter after reloading a stream, so sequences keep increasing. */
    public void observe(Event event) {
        sequences.computeIfAbsent(event.deviceId(), d -> new AtomicLong())
                .accumulateAndGet(event.sequence(), Math::max);
    }

    public PayloadCodec codec() {
        return codec;
    }

    public Determinism determinism() {
        return determinism;
    }

    private long nextSequence(String deviceId) {
        return sequences.computeIfAbsent(deviceId, d -> new AtomicLong()).incrementAndGet();
    }
}
