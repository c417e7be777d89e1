package net.scanward.core.error;

import java.util.UUID;

/** Unknown scan id. Never mutates state. */
public class NotFoundException extends ScanwardException {
    private final UUID scanId;

    public NotFoundException(UUID scanId) {
        super("Scan not found: " + scanId);
        this.scanId = scanId;
    }

    public UUID getScanId() { return scanId; }

    @Override
    public boolean retryable() { return false; }
}
