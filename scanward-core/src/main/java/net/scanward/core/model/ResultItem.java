package net.scanward.core.model;

/**
 * A single check outcome as submitted by a worker, before it is bound to a stored scan.
 * {@code passed} is already resolved; see {@link net.scanward.core.service.ThreatLevels}
 * for submissions that only carry a threat level.
 */
public record ResultItem(
        String testId,
        String name,
        String category,
        String severity,
        boolean passed,
        String message,
        String reference,
        String remediation,
        String metadata
) {}
