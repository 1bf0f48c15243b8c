package com.shelfmark.app.database;

import java.util.Locale;

public enum IndexStatus {
    INDEXED,
    MISSING,
    ERROR;

    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static IndexStatus fromDb(String value) {
        return value == null ? INDEXED : valueOf(value.toUpperCase(Locale.ROOT));
    }
}
