package com.shelfmark.app.inventory;

/**
 * Counters of a finished scan. {@code flagged} rows (warn policy) are also counted in {@code created}.
 * {@code total} covers every visited item; {@code missing} rows were not visited and are not in it.
 */
public record ScanResult(
        long jobId,
        long created,
        long updated,
        long moved,
        long duplicate,
        long unchanged,
        long skipped,
        long errors,
        long missing,
        long flagged,
        boolean cancelled
) {

    public long total() {
        return created + updated + moved + duplicate + unchanged + skipped + errors;
    }

    @Override
    public String toString() {
        return "new=" + created + " update=" + updated + " moved=" + moved + " duplicate=" + duplicate
                + " unchanged=" + unchanged + " skip=" + skipped + " errors=" + errors
                + " missing=" + missing + " flagged=" + flagged + " total=" + total()
                + (cancelled ? " (cancelled)" : "");
    }
}
