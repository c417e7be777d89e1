package net.scanward.core.model;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/** Final signal for a scan, optionally carrying the full result batch. */
public record TerminalSubmission(
        UUID scanId,
        ScanStatus status,
        Instant startedAt,
        Instant completedAt,
        List<ResultItem> results
) {
    public TerminalSubmission {
        results = results == null ? List.of() : List.copyOf(results);
    }
}
