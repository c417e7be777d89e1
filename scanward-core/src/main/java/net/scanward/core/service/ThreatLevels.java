package net.scanward.core.service;

import net.scanward.core.error.ValidationException;

import java.util.Locale;
import java.util.Set;

/**
 * Pass/fail policy for workers that report a qualitative threat level instead of a boolean.
 * Only "none" and "info" count as passing; every other level is a failing finding.
 */
public final class ThreatLevels {
    private static final Set<String> PASSING = Set.of("none", "info");

    private ThreatLevels() {}

    public static boolean passed(String level) {
        if (level == null || level.isBlank()) {
            throw new ValidationException("threat level is required");
        }
        return PASSING.contains(level.trim().toLowerCase(Locale.ROOT));
    }

    /** An explicit {@code passed} flag wins; otherwise the threat level decides. */
    public static boolean resolve(Boolean passed, String level) {
        if (passed != null) return passed;
        if (level == null || level.isBlank()) {
            throw new ValidationException("either passed or threat_level is required");
        }
        return passed(level);
    }
}
