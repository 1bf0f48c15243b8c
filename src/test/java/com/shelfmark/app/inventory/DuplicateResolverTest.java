package com.shelfmark.app.inventory;

import com.shelfmark.app.database.AssetRow;
import com.shelfmark.app.database.IndexStatus;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class DuplicateResolverTest {

    private static AssetRow row(long id, Long lastSeenAt, boolean duplicate) {
        return new AssetRow(id, "lib", "a/" + id + ".stl", id + ".stl", "stl", "" + id, "a",
                100, 1_000, "p", null, null, null, "a", null, null, null, null, IndexStatus.INDEXED,
                lastSeenAt, null, null, null, null, null, null, null, false,
                duplicate, duplicate ? 1L : null, 0);
    }

    @Test
    void noMatchIsNew() {
        for (DuplicatePolicy policy : DuplicatePolicy.values()) {
            DuplicateResolver.Resolution r = DuplicateResolver.resolve(null, policy);
            assertEquals(ScanAction.NEW, r.action(), policy.name());
            assertNull(r.target());
            assertFalse(r.flagged());
        }
    }

    @Test
    void rejectCountsADuplicate() {
        AssetRow match = row(1, 10L, false);
        DuplicateResolver.Resolution r = DuplicateResolver.resolve(match, DuplicatePolicy.REJECT);
        assertEquals(ScanAction.DUPLICATE, r.action());
        assertSame(match, r.target());
    }

    @Test
    void warnCatalogsAFlaggedCopy() {
        AssetRow match = row(1, 10L, false);
        DuplicateResolver.Resolution r = DuplicateResolver.resolve(match, DuplicatePolicy.WARN);
        assertEquals(ScanAction.NEW, r.action());
        assertTrue(r.flagged());
        assertSame(match, r.target());
    }

    @Test
    void mergeRepointsTheMatch() {
        AssetRow match = row(1, 10L, false);
        DuplicateResolver.Resolution r = DuplicateResolver.resolve(match, DuplicatePolicy.MERGE);
        assertEquals(ScanAction.MOVED, r.action());
        assertSame(match, r.target());
        assertFalse(r.flagged());
    }

    @Test
    void targetsAreRankedByLastSeen_duplicatesExcluded() {
        List<AssetRow> ranked = DuplicateResolver.rankTargets(List.of(
                row(5, 100L, false),
                row(3, null, false),
                row(4, 300L, true),
                row(2, 300L, false),
                row(1, 100L, false)));

        assertEquals(List.of(2L, 1L, 5L, 3L), ranked.stream().map(AssetRow::id).toList());
    }

    @Test
    void policyNamesParseLeniently() {
        assertEquals(DuplicatePolicy.MERGE, DuplicatePolicy.parse(null));
        assertEquals(DuplicatePolicy.MERGE, DuplicatePolicy.parse(" "));
        assertEquals(DuplicatePolicy.REJECT, DuplicatePolicy.parse(" Reject "));
        assertEquals("warn", DuplicatePolicy.WARN.dbValue());
        assertThrows(IllegalArgumentException.class, () -> DuplicatePolicy.parse("ignore"));
    }
}
