package net.scanward.core.spi;

import net.scanward.core.model.Scan;
import net.scanward.core.model.ScanStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/** Scan rows. Every method runs on the transaction bound by {@link TxRunner}. */
public interface ScanRepository {
    void insert(Scan scan) throws Exception;

    Optional<Scan> findById(UUID id) throws Exception;

    /** Reads the row and holds its lock until the surrounding transaction ends (FOR UPDATE). */
    Optional<Scan> lockById(UUID id) throws Exception;

    /** PENDING → RUNNING in one conditional update. True only for the caller that moved it. */
    boolean markRunningIfPending(UUID id, Instant startedAt) throws Exception;

    /**
     * PENDING|RUNNING → terminal in one conditional update; fills STARTED_AT only when absent.
     * True only for the caller that finalized it.
     */
    boolean finalizeIfActive(UUID id, ScanStatus terminal, Instant startedAt, Instant completedAt) throws Exception;

    long countByStatus(ScanStatus status) throws Exception;

    // --- dispatch bookkeeping

    void markDispatched(UUID id, Instant at) throws Exception;

    /** attempt + 1 and returns the new count */
    int recordDispatchAttempt(UUID id) throws Exception;

    /** PENDING scans whose dispatch was never confirmed, created before {@code createdBefore}, oldest first */
    List<Scan> findPendingUndispatched(Instant createdBefore, int limit) throws Exception;
}
