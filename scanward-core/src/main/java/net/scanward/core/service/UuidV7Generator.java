package net.scanward.core.service;

import net.scanward.core.error.IdentifierAllocationException;
import net.scanward.core.spi.Clock;
import net.scanward.core.spi.IdGenerator;

import java.security.SecureRandom;
import java.time.Instant;
import java.util.UUID;

/**
 * Time-ordered identifiers: 48-bit unix millis, version 7, IETF variant, 74 random bits.
 * Ids from different callers never need coordination; ordering is by millisecond.
 */
public final class UuidV7Generator implements IdGenerator {
    private static final long MAX_MILLIS = 0xFFFF_FFFF_FFFFL;

    private final Clock clock;
    private final SecureRandom random;

    public UuidV7Generator() {
        this(Instant::now, new SecureRandom());
    }

    public UuidV7Generator(Clock clock, SecureRandom random) {
        this.clock = clock;
        this.random = random;
    }

    @Override
    public UUID next() {
        long millis;
        byte[] r = new byte[10];
        try {
            millis = clock.now().toEpochMilli();
            random.nextBytes(r);
        } catch (RuntimeException e) {
            throw new IdentifierAllocationException("Failed to generate scan id", e);
        }
        if (millis < 0 || millis > MAX_MILLIS) {
            throw new IdentifierAllocationException("Clock out of range for a v7 id: " + millis, null);
        }

        long msb = (millis << 16)
                | 0x7000L
                | ((r[0] & 0x0FL) << 8)
                | (r[1] & 0xFFL);
        long lsb = 0;
        for (int i = 2; i < 10; i++) lsb = (lsb << 8) | (r[i] & 0xFFL);
        lsb = (lsb & 0x3FFF_FFFF_FFFF_FFFFL) | 0x8000_0000_0000_0000L;
        return new UUID(msb, lsb);
    }

    /** Millisecond timestamp embedded in a v7 id. */
    public static long timestampOf(UUID id) {
        if (id.version() != 7) throw new IllegalArgumentException("not a version 7 id: " + id);
        return id.getMostSignificantBits() >>> 16;
    }
}
