package net.scanward.core.error;

import net.scanward.core.model.ScanStatus;

import java.util.UUID;

/** Submission against a scan whose status does not accept it (progress after completion). */
public class InvalidStateException extends ScanwardException {
    private final UUID scanId;
    private final ScanStatus status;

    public InvalidStateException(UUID scanId, ScanStatus status) {
        super("Scan " + scanId + " is " + status + " and accepts no further results");
        this.scanId = scanId;
        this.status = status;
    }

    public UUID getScanId() { return scanId; }

    public ScanStatus getStatus() { return status; }

    @Override
    public boolean retryable() { return false; }
}
