package net.scanward.core.service;

import net.scanward.core.error.BackpressureException;
import net.scanward.core.error.DispatchException;
import net.scanward.core.error.IdentifierAllocationException;
import net.scanward.core.error.ValidationException;
import net.scanward.core.model.DispatchMessage;
import net.scanward.core.model.Scan;
import net.scanward.core.model.ScanStatus;
import net.scanward.core.model.ScanTicket;
import net.scanward.core.spi.Clock;
import net.scanward.core.spi.IdGenerator;
import net.scanward.core.spi.ScanRepository;
import net.scanward.core.spi.TxRunner;
import net.scanward.core.spi.WorkQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.UUID;

/**
 * Admits new scans: allocate id → store PENDING row (committed) → publish dispatch message.
 * Every call allocates a fresh id; callers retrying a failed submit create a new scan.
 */
public final class DispatchService {
    private static final Logger log = LoggerFactory.getLogger(DispatchService.class);

    private final ScanRepository scans;
    private final WorkQueue queue;
    private final TxRunner tx;
    private final Clock clock;
    private final IdGenerator ids;
    private final RetryPolicy retry;
    private final int maxPublishAttempts;
    private final long maxPending;          // 0 = no limit

    public DispatchService(ScanRepository scans,
                           WorkQueue queue,
                           TxRunner tx,
                           Clock clock,
                           IdGenerator ids,
                           RetryPolicy retry,
                           int maxPublishAttempts,
                           long maxPending) {
        this.scans = scans;
        this.queue = queue;
        this.tx = tx;
        this.clock = clock;
        this.ids = ids;
        this.retry = retry;
        this.maxPublishAttempts = Math.max(1, maxPublishAttempts);
        this.maxPending = Math.max(0, maxPending);
    }

    public ScanTicket submit(String target) {
        if (target == null || target.isBlank()) {
            throw new ValidationException("target is required");
        }
        String t = target.trim();
        FieldLimits.check("target", t, FieldLimits.TARGET);

        if (maxPending > 0) {
            long pending = Transactions.required(tx, "Failed to count pending scans",
                    () -> scans.countByStatus(ScanStatus.PENDING));
            if (pending >= maxPending) {
                log.warn("Rejecting scan submission, backpressure active: pending={} threshold={}", pending, maxPending);
                throw new BackpressureException(pending, maxPending);
            }
        }

        // 1) id
        UUID id = allocateId();

        // 2) store write, committed before anything is published
        Scan scan = Scan.ofNew(id, t, clock.now());
        Transactions.required(tx, "Failed to create scan", () -> {
            scans.insert(scan);
            return null;
        });

        // 3) publish
        publishOrFail(scan);
        log.info("Scan dispatched: id={} target={}", id, t);
        return new ScanTicket(id, ScanStatus.PENDING);
    }

    private UUID allocateId() {
        try {
            UUID id = ids.next();
            if (id == null) throw new IllegalStateException("id generator returned null");
            return id;
        } catch (IdentifierAllocationException e) {
            log.error("Failed to generate scan id", e);
            throw e;
        } catch (Exception e) {
            log.error("Failed to generate scan id", e);
            throw new IdentifierAllocationException("Failed to generate scan id", e);
        }
    }

    private void publishOrFail(Scan scan) {
        DispatchMessage message = DispatchMessage.of(scan);
        Exception last = null;
        for (int attempt = 1; attempt <= maxPublishAttempts; attempt++) {
            try {
                queue.publish(message);
                confirmDispatched(scan.id());
                return;
            } catch (Exception e) {
                last = e;
                if (e instanceof InterruptedException || Thread.currentThread().isInterrupted()) {
                    Thread.currentThread().interrupt();
                    log.warn("Publish for scan {} interrupted (attempt {}/{}), not retrying",
                            scan.id(), attempt, maxPublishAttempts);
                    break;
                }
                if (attempt < maxPublishAttempts) {
                    Duration backoff = retry.nextBackoff(attempt);
                    log.warn("Publish failed for scan {} (attempt {}/{}), retrying in {}",
                            scan.id(), attempt, maxPublishAttempts, backoff, e);
                    if (!sleep(backoff)) break;
                }
            }
        }

        // stored but not queued: PENDING with no worker notified until the sweep republishes it
        log.error("Scan {} persisted but dispatch failed; left PENDING for redispatch", scan.id(), last);
        try {
            tx.required(() -> scans.recordDispatchAttempt(scan.id()));
        } catch (Exception e) {
            log.error("Failed to record dispatch attempt for scan {}", scan.id(), e);
        }
        throw new DispatchException(scan.id(), last);
    }

    private void confirmDispatched(UUID id) {
        try {
            tx.required(() -> {
                scans.markDispatched(id, clock.now());
                return null;
            });
        } catch (Exception e) {
            log.warn("Scan {} queued but dispatch confirmation not recorded", id, e);
        }
    }

    private static boolean sleep(Duration d) {
        if (d.isZero() || d.isNegative()) return true;
        try {
            Thread.sleep(d.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
