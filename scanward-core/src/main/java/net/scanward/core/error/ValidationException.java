package net.scanward.core.error;

/** Malformed or missing input. Never mutates state. */
public class ValidationException extends ScanwardException {
    public ValidationException(String message) {
        super(message);
    }

    @Override
    public boolean retryable() { return false; }
}
