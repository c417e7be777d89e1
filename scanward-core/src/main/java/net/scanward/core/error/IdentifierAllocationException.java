package net.scanward.core.error;

public class IdentifierAllocationException extends ScanwardException {
    public IdentifierAllocationException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean retryable() { return true; }
}
