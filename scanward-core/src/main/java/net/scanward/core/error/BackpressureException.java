package net.scanward.core.error;

/**
 * New submissions are refused while too many scans wait for a worker.
 * Clients should retry after a delay.
 */
public class BackpressureException extends ScanwardException {
    private final long pending;
    private final long threshold;

    public BackpressureException(long pending, long threshold) {
        super("Too many pending scans: " + pending + "/" + threshold);
        this.pending = pending;
        this.threshold = threshold;
    }

    public long getPending() { return pending; }

    public long getThreshold() { return threshold; }

    @Override
    public boolean retryable() { return true; }
}
