package com.shelfmark.app.database;

import java.util.Locale;

/**
 * The two asset catalogs. Both tables share one shape; the table name doubles as the
 * preview store subdirectory.
 */
public enum CatalogKind {
    DOCUMENT("documents"),
    MODEL("models");

    private final String table;

    CatalogKind(String table) {
        this.table = table;
    }

    public String table() {
        return table;
    }

    public static CatalogKind parse(String value) {
        String v = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
        for (CatalogKind k : values()) {
            if (k.table.equals(v) || k.name().toLowerCase(Locale.ROOT).equals(v)) {
                return k;
            }
        }
        throw new IllegalArgumentException("Unknown catalog: " + value + " (expected documents or models)");
    }
}
