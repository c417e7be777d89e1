package net.scanward.core.error;

/** Store unavailable or transaction conflict. The operation was rolled back as a whole. */
public class PersistenceException extends ScanwardException {
    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean retryable() { return true; }
}
