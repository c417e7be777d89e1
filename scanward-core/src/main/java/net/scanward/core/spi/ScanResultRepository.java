package net.scanward.core.spi;

import net.scanward.core.model.ScanResult;

import java.util.List;
import java.util.UUID;

public interface ScanResultRepository {
    /** Inserts and returns the store-assigned id. */
    long insert(ScanResult result) throws Exception;

    /** Inserts unless a row with the same (scan id, test id) exists. True when a row was written. */
    boolean insertIfAbsent(ScanResult result) throws Exception;

    /** Arrival order. */
    List<ScanResult> findAllByScan(UUID scanId) throws Exception;
}
