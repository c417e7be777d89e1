package net.scanward.core.error;

import java.util.UUID;

/**
 * The scan was stored but the dispatch message could not be published.
 * The scan stays PENDING and is picked up by the maintenance sweep.
 */
public class DispatchException extends ScanwardException {
    private final UUID scanId;

    public DispatchException(UUID scanId, Throwable cause) {
        super("Scan " + scanId + " stored but could not be queued", cause);
        this.scanId = scanId;
    }

    public UUID getScanId() { return scanId; }

    @Override
    public boolean retryable() { return true; }
}
