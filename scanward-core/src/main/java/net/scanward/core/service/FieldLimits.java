package net.scanward.core.service;

import net.scanward.core.error.ValidationException;

/** Column widths of TB_SCAN / TB_SCAN_RESULT, checked before any write. */
final class FieldLimits {
    static final int TARGET = 2048;
    static final int TEST_ID = 255;
    static final int TEST_NAME = 512;
    static final int CATEGORY = 255;
    static final int SEVERITY = 32;

    private FieldLimits() {}

    /** null passes; the caller decides whether the field is required. */
    static void check(String field, String value, int max) {
        if (value != null && value.length() > max) {
            throw new ValidationException(field + " exceeds " + max + " characters (got " + value.length() + ")");
        }
    }
}
