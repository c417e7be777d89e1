package net.scanward.core.service;

import net.scanward.core.error.NotFoundException;
import net.scanward.core.error.ValidationException;
import net.scanward.core.model.ScanDetails;
import net.scanward.core.spi.ScanRepository;
import net.scanward.core.spi.ScanResultRepository;
import net.scanward.core.spi.TxRunner;

import java.util.UUID;

/**
 * Read path: the scan row and its results in one transaction.
 *
 * <p>Results are read before the scan row. Status only moves forward and every result commits
 * with (or after) the transition that started the scan, so the later row read is never older
 * than the results already seen.
 */
public final class ScanQueryService {
    private final ScanRepository scans;
    private final ScanResultRepository results;
    private final TxRunner tx;

    public ScanQueryService(ScanRepository scans, ScanResultRepository results, TxRunner tx) {
        this.scans = scans;
        this.results = results;
        this.tx = tx;
    }

    public ScanDetails get(UUID id) {
        if (id == null) throw new ValidationException("id is required");
        return Transactions.required(tx, "Failed to retrieve scan " + id, () -> {
            var rows = results.findAllByScan(id);
            var scan = scans.findById(id).orElseThrow(() -> new NotFoundException(id));
            return new ScanDetails(scan, rows);
        });
    }
}
