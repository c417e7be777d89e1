package net.scanward.core.model;

/**
 * Scan lifecycle. Moves forward only: PENDING → RUNNING → COMPLETED | FAILED,
 * PENDING may jump straight to a terminal state. Terminal states absorb.
 */
public enum ScanStatus {
    PENDING, RUNNING, COMPLETED, FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    public boolean canTransitionTo(ScanStatus next) {
        if (next == null || isTerminal()) return false;
        return switch (this) {
            case PENDING -> next != PENDING;
            case RUNNING -> next.isTerminal();
            default -> false;
        };
    }

    /** Parses a persisted or submitted code; unknown codes are rejected rather than mapped. */
    public static ScanStatus from(String s) {
        if (s == null) throw new IllegalArgumentException("status is null");
        return ScanStatus.valueOf(s.trim().toUpperCase());
    }

    public String code() { return name(); }
}
