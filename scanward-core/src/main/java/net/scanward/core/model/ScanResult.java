package net.scanward.core.model;

import java.util.UUID;

/** One check outcome recorded against a scan. {@code id} is assigned by the store. */
public record ScanResult(
        Long id,
        UUID scanId,
        String testId,
        String name,
        String category,
        String severity,
        boolean passed,
        String message,
        String reference,
        String remediation,
        String metadata          // opaque JSON, stored as given
) {
    public static ScanResult of(UUID scanId, ResultItem item) {
        return new ScanResult(null, scanId, item.testId(), item.name(), item.category(), item.severity(),
                item.passed(), item.message(), item.reference(), item.remediation(), item.metadata());
    }
}
