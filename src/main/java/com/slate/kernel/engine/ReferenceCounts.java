package com.slate.kernel.engine;

import com.slate.kernel.node.TensorBase;

import java.util.Collections;
import java.util.Map;

/**
 * Number of incoming operand edges per node of an expression graph.
 * Nodes nothing points to (the roots) have a count of zero.
 */
public final class ReferenceCounts {
    private final Map<TensorBase, Integer> counts;

    ReferenceCounts(Map<TensorBase, Integer> counts) {
        this.counts = Collections.unmodifiableMap(counts);
    }

    public int count(TensorBase node) {
        return counts.getOrDefault(node, 0);
    }

    /** True when more than one edge points at {@code node}. */
    public boolean isShared(TensorBase node) {
        return count(node) > 1;
    }

    /** Unmodifiable view, in order of first reference. */
    public Map<TensorBase, Integer> asMap() {
        return counts;
    }

    public int size() {
        return counts.size();
    }

    @Override
    public String toString() {
        return "ReferenceCounts(" + counts.size() + " referenced nodes)";
    }
}
