package com.shelfmark.app.database;

import java.util.Locale;

public enum VolumeStatus {
    ONLINE,
    OFFLINE,
    ERROR;

    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static VolumeStatus fromDb(String value) {
        return value == null ? OFFLINE : valueOf(value.toUpperCase(Locale.ROOT));
    }
}
