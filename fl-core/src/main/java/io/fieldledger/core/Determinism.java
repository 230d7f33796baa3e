package io.fieldledger.core;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Objects;
import java.util.UUID;
import java.util.random.RandomGenerator;
import java.util.random.RandomGeneratorFactory;

/**
 * Source of time and identifiers for event construction.
 *
 * An instance provides:
 *  - a Clock (system UTC, or fixed for reproducible runs)
 *  - an RNG (seeded L64X256MixRandom for reproducible ids)
 *
 * Handed to the factory explicitly; there is no ambient scope.
 */
public final class Determinism {

    private final Clock clock;
    private final RandomGenerator rng;

    private Determinism(Clock clock, RandomGenerator rng) {
        this.clock = Objects.requireNonNull(clock);
        this.rng = Objects.requireNonNull(rng);
    }

    /* ---------- Construction ---------- */

    /** Wall clock and default RNG. */
    public static Determinism system() {
        return new Determinism(Clock.systemUTC(), RandomGenerator.getDefault());
    }

    /** Clock = EPOCH + seed seconds (UTC), RNG = L64X256MixRandom(seed). */
    public static Determinism seeded(long seed) {
        return of(Clock.fixed(Instant.EPOCH.plusSeconds(seed), ZoneOffset.UTC), seed);
    }

    /** Given clock, seeded RNG. */
    public static Determinism of(Clock clock, long seed) {
        return new Determinism(clock, RandomGeneratorFactory.of("L64X256MixRandom").create(seed));
    }

    /** Derive a 64-bit seed from arbitrary parts (stable). */
    public static long seedFrom(Object... parts) {
        var md = sha256();
        for (Object p : parts) md.update(Objects.toString(p, "null").getBytes(StandardCharsets.UTF_8));
        // first 8 bytes as signed long
        return ByteBuffer.wrap(md.digest(), 0, 8).getLong();
    }

    /* ---------- Accessors ---------- */

    public Clock clock() { return clock; }

    public Instant now() { return clock.instant(); }

    public long nowMillis() { return clock.millis(); }

    /* ---------- Identifiers ---------- */

    /** UUID v4 drawn from this instance's RNG. */
    public synchronized UUID randomUUID() {
        return randomUUID(rng);
    }

    /** UUID v4 from a specific RNG (sets version+variant bits). */
    public static UUID randomUUID(RandomGenerator r) {
        byte[] b = new byte[16];
        r.nextBytes(b);
        b[6] = (byte) ((b[6] & 0x0f) | 0x40); // version 4
        b[8] = (byte) ((b[8] & 0x3f) | 0x80); // variant 2
        var bb = ByteBuffer.wrap(b);
        return new UUID(bb.getLong(), bb.getLong());
    }

    /** Name-based UUID (v3): identical on every replica for identical parts. */
    public static UUID derivedUUID(Object... parts) {
        var sb = new StringBuilder();
        for (Object p : parts) sb.append(Objects.toString(p, "null")).append('|');
        return UUID.nameUUIDFromBytes(sb.toString().getBytes(StandardCharsets.UTF_8));
    }

    static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }
}
