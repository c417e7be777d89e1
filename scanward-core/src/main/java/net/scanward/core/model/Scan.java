package net.scanward.core.model;

import java.time.Instant;
import java.util.UUID;

public record Scan(
        UUID id,
        String target,
        ScanStatus status,
        Instant createdAt,
        Instant startedAt,       // null until the first progress or terminal signal
        Instant completedAt,     // null until terminal
        Instant dispatchedAt,    // null until the queue confirmed the dispatch message
        int dispatchAttempts
) {
    public static Scan ofNew(UUID id, String target, Instant createdAt) {
        return new Scan(id, target, ScanStatus.PENDING, createdAt, null, null, null, 0);
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }
}
