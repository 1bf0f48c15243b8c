package com.shelfmark.app.inventory;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.LongAdder;

final class ScanMetrics {

    private final Map<ScanAction, LongAdder> counts = new EnumMap<>(ScanAction.class);
    final LongAdder flagged = new LongAdder();
    final LongAdder missing = new LongAdder();
    final long startNanos = System.nanoTime();

    ScanMetrics() {
        for (ScanAction a : ScanAction.values()) {
            counts.put(a, new LongAdder());
        }
    }

    void count(ScanAction action) {
        counts.get(action).increment();
    }

    long get(ScanAction action) {
        return counts.get(action).sum();
    }

    long visited() {
        long sum = 0;
        for (LongAdder a : counts.values()) {
            sum += a.sum();
        }
        return sum;
    }

    /** Items that reached a catalog decision. */
    long processed() {
        return get(ScanAction.NEW) + get(ScanAction.UNCHANGED) + get(ScanAction.UPDATE)
                + get(ScanAction.MOVED) + get(ScanAction.DUPLICATE);
    }

    long elapsedMillis() {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }

    ScanResult toResult(long jobId, boolean cancelled) {
        return new ScanResult(jobId,
                get(ScanAction.NEW), get(ScanAction.UPDATE), get(ScanAction.MOVED), get(ScanAction.DUPLICATE),
                get(ScanAction.UNCHANGED), get(ScanAction.SKIP), get(ScanAction.ERROR),
                missing.sum(), flagged.sum(), cancelled);
    }
}
