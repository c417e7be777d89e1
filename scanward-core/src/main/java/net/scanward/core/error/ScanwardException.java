package net.scanward.core.error;

/**
 * Root of the failures the scan core reports to its callers.
 * {@link #retryable()} tells a boundary whether repeating the same request is safe and may succeed.
 */
public abstract class ScanwardException extends RuntimeException {
    protected ScanwardException(String message) {
        super(message);
    }

    protected ScanwardException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract boolean retryable();
}
