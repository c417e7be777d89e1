package net.scanward.integration.spring.sched;

import net.scanward.core.maintenance.MaintenanceService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;

import java.time.Duration;

/** Periodic redispatch / abandonment sweep. The delay is read from {@code scanward.maintenance.delay-ms}. */
public class ScanwardSchedulers {
    private static final Logger log = LoggerFactory.getLogger(ScanwardSchedulers.class);

    private final MaintenanceService maintenance;

    private Duration staleAfter = Duration.ofSeconds(30);
    private int maxDispatchAttempts = 5;
    private int batchSize = 100;

    public ScanwardSchedulers(MaintenanceService maintenance) {
        this.maintenance = maintenance;
    }

    @Scheduled(fixedDelayString = "${scanward.maintenance.delay-ms:10000}",
               initialDelayString = "${scanward.maintenance.initial-delay-ms:10000}")
    public void maintenance() throws Exception {
        var report = maintenance.runOnce(staleAfter, maxDispatchAttempts, batchSize);
        if (report.examined > 0) {
            log.info("Maintenance sweep: {}", report);
        }
    }

    public void setStaleAfter(Duration staleAfter) {
        this.staleAfter = staleAfter;
    }

    public void setMaxDispatchAttempts(int maxDispatchAttempts) {
        this.maxDispatchAttempts = maxDispatchAttempts;
    }

    public void setBatchSize(int batchSize) {
        this.batchSize = batchSize;
    }
}
