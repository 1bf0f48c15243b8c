package com.shelfmark.app.inventory;

/**
 * Outcome of one scanned item.
 */
public enum ScanAction {
    NEW,
    UNCHANGED,
    UPDATE,
    MOVED,
    DUPLICATE,
    SKIP,
    ERROR
}
