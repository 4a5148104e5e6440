package com.marketsim.core.execution;

import com.marketsim.api.Fill;

import java.util.ArrayList;
import java.util.List;

/**
 * Append-only record of one symbol's most recent fills.
 */
public class FillLedger {

    private final Fill[] fills;
    private int next;
    private int size;
    private long total;

    public FillLedger(int capacity) {
        this.fills = new Fill[capacity];
    }

    public void append(Fill fill) {
        fills[next] = fill;
        next = (next + 1) % fills.length;
        if (size < fills.length) {
            size++;
        }
        total++;
    }

    /**
     * Up to {@code limit} newest fills, oldest first.
     */
    public List<Fill> recent(int limit) {
        int n = Math.min(Math.max(limit, 0), size);
        List<Fill> out = new ArrayList<>(n);
        for (int i = n; i > 0; i--) {
            out.add(fills[Math.floorMod(next - i, fills.length)]);
        }
        return out;
    }

    public int size() {
        return size;
    }

    /**
     * Fills ever appended, including evicted ones.
     */
    public long totalAppended() {
        return total;
    }
}
