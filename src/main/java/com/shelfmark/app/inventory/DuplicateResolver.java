package com.shelfmark.app.inventory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import com.shelfmark.app.database.AssetRow;

/**
 * Decides what a partial-hash match means for a file with no row at its own path.
 * Pure: no I/O, no catalog access.
 */
public final class DuplicateResolver {

    /**
     * @param target  the row the decision refers to; null for NEW without a match
     * @param flagged NEW row that must be written as a duplicate of {@code target}
     */
    public record Resolution(ScanAction action, AssetRow target, boolean flagged) {

        static Resolution fresh() {
            return new Resolution(ScanAction.NEW, null, false);
        }
    }

    private static final Comparator<AssetRow> MOST_RECENTLY_SEEN =
            Comparator.comparingLong((AssetRow r) -> r.lastSeenAt() == null ? Long.MIN_VALUE : r.lastSeenAt())
                    .reversed()
                    .thenComparingLong(AssetRow::id);

    private DuplicateResolver() {}

    /**
     * Candidate targets in the order they should be tried: most recently confirmed first,
     * duplicates never.
     */
    public static List<AssetRow> rankTargets(List<AssetRow> matches) {
        List<AssetRow> out = new ArrayList<>();
        for (AssetRow r : matches) {
            if (!r.duplicate()) {
                out.add(r);
            }
        }
        out.sort(MOST_RECENTLY_SEEN);
        return out;
    }

    /**
     * @param match best surviving match, or null
     */
    public static Resolution resolve(AssetRow match, DuplicatePolicy policy) {
        if (match == null) {
            return Resolution.fresh();
        }
        return switch (policy) {
            case REJECT -> new Resolution(ScanAction.DUPLICATE, match, false);
            case WARN -> new Resolution(ScanAction.NEW, match, true);
            case MERGE -> new Resolution(ScanAction.MOVED, match, false);
        };
    }
}
