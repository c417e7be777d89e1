package net.scanward.app.web;

import net.scanward.core.error.ValidationException;

import java.util.UUID;
import java.util.regex.Pattern;

/** Canonical 8-4-4-4-12 hex form only; {@link UUID#fromString} alone accepts shortened groups. */
final class ScanIds {
    private static final Pattern CANONICAL =
            Pattern.compile("^[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}$");

    private ScanIds() {}

    static UUID parse(String raw, String field) {
        if (raw == null || raw.isBlank()) {
            throw new ValidationException(field + " is required");
        }
        String s = raw.trim();
        if (!CANONICAL.matcher(s).matches()) {
            throw new ValidationException("Invalid " + field + " format");
        }
        return UUID.fromString(s);
    }
}
