package com.shelfmark.app.inventory;

import java.util.Locale;

/**
 * What the scanner does with a file whose content is already cataloged elsewhere.
 */
public enum DuplicatePolicy {
    /** Count it and write nothing. */
    REJECT,
    /** Catalog it as a flagged duplicate of the existing row. */
    WARN,
    /** Treat it as the existing row having moved, when the original is gone. */
    MERGE;

    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static DuplicatePolicy parse(String value) {
        if (value == null || value.isBlank()) {
            return MERGE;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown duplicate policy: " + value + " (expected merge, warn or reject)", e);
        }
    }
}
