package net.scanward.core.model;

import java.util.UUID;

/**
 * Result of applying one submission.
 *
 * @param applied  false when the submission was absorbed without changes (repeated finalize,
 *                 duplicate progress result)
 * @param started  true when this submission moved the scan out of PENDING
 */
public record IngestOutcome(UUID scanId, ScanStatus status, boolean applied, boolean started, int resultsInserted) {}
