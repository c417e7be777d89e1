package net.scanward.core.maintenance;

import net.scanward.core.model.DispatchMessage;
import net.scanward.core.model.Scan;
import net.scanward.core.model.ScanStatus;
import net.scanward.core.spi.Clock;
import net.scanward.core.spi.ScanRepository;
import net.scanward.core.spi.TxRunner;
import net.scanward.core.spi.WorkQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Reconciliation sweep for scans stored without a confirmed dispatch.
 * Republishes them; after {@code maxDispatchAttempts} failed rounds the scan is abandoned as FAILED,
 * so no scan stays PENDING forever with no worker told about it.
 */
public final class MaintenanceService {
    private static final Logger log = LoggerFactory.getLogger(MaintenanceService.class);

    private final ScanRepository scans;
    private final WorkQueue queue;
    private final TxRunner tx;
    private final Clock clock;

    public MaintenanceService(ScanRepository scans, WorkQueue queue, TxRunner tx, Clock clock) {
        this.scans = scans;
        this.queue = queue;
        this.tx = tx;
        this.clock = clock;
    }

    /**
     * 주기 점검 메인 루틴.
     * - PENDING + 미확인 디스패치 + staleAfter 경과 → 재발행
     * - 재발행 실패 누적이 한도에 닿으면 FAILED 처리
     */
    public MaintenanceReport runOnce(Duration staleAfter, int maxDispatchAttempts, int batchSize) throws Exception {
        Instant now = clock.now();
        MaintenanceReport r = new MaintenanceReport();

        List<Scan> stale = tx.required(() -> scans.findPendingUndispatched(now.minus(staleAfter), batchSize));
        for (Scan scan : stale) {
            try {
                queue.publish(DispatchMessage.of(scan));
                tx.required(() -> {
                    scans.markDispatched(scan.id(), clock.now());
                    return null;
                });
                r.redispatched++;
                log.info("Scan redispatched: id={}", scan.id());
            } catch (InterruptedException e) {
                // 종료 중: 브로커 실패로 세지 않고 중단
                Thread.currentThread().interrupt();
                throw e;
            } catch (Exception e) {
                r.failedAttempts++;
                int attempts = tx.required(() -> scans.recordDispatchAttempt(scan.id()));
                if (attempts >= maxDispatchAttempts && abandon(scan)) {
                    r.abandoned++;
                    log.error("Scan abandoned after {} dispatch attempts: id={}", attempts, scan.id(), e);
                } else {
                    log.warn("Redispatch failed for scan {} (attempt {}/{})", scan.id(), attempts, maxDispatchAttempts, e);
                }
            }
        }

        r.timestamp = now;
        r.examined = stale.size();
        return r;
    }

    private boolean abandon(Scan scan) throws Exception {
        return tx.required(() -> {
            var current = scans.lockById(scan.id());
            if (current.isEmpty() || current.get().status() != ScanStatus.PENDING) return false;
            Instant at = clock.now();
            return scans.finalizeIfActive(scan.id(), ScanStatus.FAILED, at, at);
        });
    }

    public static final class MaintenanceReport {
        public Instant timestamp;
        public int examined;
        public int redispatched;
        public int failedAttempts;
        public int abandoned;

        @Override public String toString() {
            return "MaintenanceReport{" +
                    "timestamp=" + timestamp +
                    ", examined=" + examined +
                    ", redispatched=" + redispatched +
                    ", failedAttempts=" + failedAttempts +
                    ", abandoned=" + abandoned +
                    '}';
        }
    }
}
