package net.scanward.core.service;

import net.scanward.core.error.InvalidStateException;
import net.scanward.core.error.NotFoundException;
import net.scanward.core.error.PersistenceException;
import net.scanward.core.error.ScanwardException;
import net.scanward.core.error.ValidationException;
import net.scanward.core.model.IngestOutcome;
import net.scanward.core.model.ResultItem;
import net.scanward.core.model.Scan;
import net.scanward.core.model.ScanResult;
import net.scanward.core.model.ScanStatus;
import net.scanward.core.model.TerminalSubmission;
import net.scanward.core.spi.Clock;
import net.scanward.core.spi.ScanRepository;
import net.scanward.core.spi.ScanResultRepository;
import net.scanward.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.Callable;

/**
 * Applies worker-reported outcomes to a scan.
 *
 * <p>Each submission is one transaction: lock the scan row, decide against its current status,
 * then a conditional status update plus the result insert(s). The conditional update
 * ({@code ... WHERE STATUS = 'PENDING'} / {@code STATUS IN ('PENDING','RUNNING')}) makes each
 * transition fire once even when the row lock is not honoured by the store; the insert and the
 * transition commit or roll back together.
 *
 * <pre>
 * PENDING --progress--> RUNNING --terminal--> COMPLETED | FAILED
 * PENDING --terminal--> COMPLETED | FAILED
 * terminal --progress--> InvalidStateException
 * terminal --terminal--> no-op (completed_at unchanged)
 * </pre>
 */
public final class ResultIngestService {
    private static final Logger log = LoggerFactory.getLogger(ResultIngestService.class);

    private final ScanRepository scans;
    private final ScanResultRepository results;
    private final TxRunner tx;
    private final Clock clock;
    private final boolean dedupeProgress;
    private final int conflictRetries;

    public ResultIngestService(ScanRepository scans,
                               ScanResultRepository results,
                               TxRunner tx,
                               Clock clock,
                               boolean dedupeProgress,
                               int conflictRetries) {
        this.scans = scans;
        this.results = results;
        this.tx = tx;
        this.clock = clock;
        this.dedupeProgress = dedupeProgress;
        this.conflictRetries = Math.max(0, conflictRetries);
    }

    /** Records one result; the first one moves the scan PENDING → RUNNING. */
    public IngestOutcome recordProgress(UUID scanId, ResultItem item) {
        requireId(scanId);
        validate(item);

        return withConflictRetry("record result for scan " + scanId, () -> {
            Scan scan = scans.lockById(scanId).orElseThrow(() -> new NotFoundException(scanId));
            if (scan.isTerminal()) {
                throw new InvalidStateException(scanId, scan.status());
            }

            boolean started = scan.status() == ScanStatus.PENDING
                    && scans.markRunningIfPending(scanId, clock.now());

            ScanResult row = ScanResult.of(scanId, item);
            boolean inserted;
            if (dedupeProgress) {
                inserted = results.insertIfAbsent(row);
            } else {
                results.insert(row);
                inserted = true;
            }

            if (started) log.info("Scan started: id={}", scanId);
            if (!inserted) log.debug("Duplicate result ignored: scan={} test={}", scanId, item.testId());
            return new IngestOutcome(scanId, ScanStatus.RUNNING, started || inserted, started, inserted ? 1 : 0);
        });
    }

    /**
     * Moves the scan to its terminal status and stores the batch in the same transaction.
     * Repeating it against a terminal scan changes nothing and reports {@code applied=false}.
     */
    public IngestOutcome finalizeScan(TerminalSubmission submission) {
        if (submission == null) throw new ValidationException("submission is required");
        UUID scanId = submission.scanId();
        requireId(scanId);
        ScanStatus target = submission.status();
        if (target == null || !target.isTerminal()) {
            throw new ValidationException("status must be COMPLETED or FAILED");
        }
        if (submission.startedAt() != null && submission.completedAt() != null
                && submission.completedAt().isBefore(submission.startedAt())) {
            throw new ValidationException("completed_at is before started_at");
        }
        submission.results().forEach(this::validate);

        return withConflictRetry("finalize scan " + scanId, () -> {
            Scan scan = scans.lockById(scanId).orElseThrow(() -> new NotFoundException(scanId));
            if (!scan.status().canTransitionTo(target)) {
                log.debug("Finalize ignored, scan already {}: id={}", scan.status(), scanId);
                return new IngestOutcome(scanId, scan.status(), false, false, 0);
            }

            Instant completedAt = submission.completedAt() != null ? submission.completedAt() : clock.now();
            Instant startedAt = scan.startedAt() != null ? scan.startedAt()
                    : submission.startedAt() != null ? submission.startedAt()
                    : completedAt;

            if (!scans.finalizeIfActive(scanId, target, startedAt, completedAt)) {
                // lost to a concurrent finalize between the read and the update
                ScanStatus now = scans.findById(scanId).map(Scan::status).orElse(target);
                return new IngestOutcome(scanId, now, false, false, 0);
            }

            int inserted = 0;
            for (ResultItem item : submission.results()) {
                results.insert(ScanResult.of(scanId, item));
                inserted++;
            }
            log.info("Scan finalized: id={} status={} results={}", scanId, target, inserted);
            return new IngestOutcome(scanId, target, true, scan.status() == ScanStatus.PENDING, inserted);
        });
    }

    private <T> T withConflictRetry(String what, Callable<T> body) {
        for (int attempt = 0; ; attempt++) {
            try {
                return tx.requiresNew(body);
            } catch (ScanwardException e) {
                throw e;
            } catch (Exception e) {
                if (attempt < conflictRetries && Transactions.isConflict(e)) {
                    log.warn("Store conflict on {} (attempt {}), retrying", what, attempt + 1);
                    continue;
                }
                throw new PersistenceException("Failed to " + what, e);
            }
        }
    }

    private static void requireId(UUID scanId) {
        if (scanId == null) throw new ValidationException("job_id is required");
    }

    private void validate(ResultItem item) {
        if (item == null) throw new ValidationException("result is required");
        if (item.testId() == null || item.testId().isBlank()) {
            throw new ValidationException("test_id is required");
        }
        FieldLimits.check("test_id", item.testId(), FieldLimits.TEST_ID);
        FieldLimits.check("test_name", item.name(), FieldLimits.TEST_NAME);
        FieldLimits.check("category", item.category(), FieldLimits.CATEGORY);
        FieldLimits.check("severity", item.severity(), FieldLimits.SEVERITY);
    }
}
