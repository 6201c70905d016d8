package com.slate.kernel.engine;

import com.slate.kernel.node.TensorBase;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collects reference counts over a whole expression graph.
 *
 * <p>
 * Each distinct reachable node contributes one count to every operand edge it
 * owns, with multiplicity: in {@code A + A} the tensor {@code A} is counted
 * twice. The result does not depend on the traversal order.
 */
public final class ReferenceCounter {

    private ReferenceCounter() {
        // Utility class
    }

    public static ReferenceCounts collect(List<? extends TensorBase> roots) {
        Map<TensorBase, Integer> counts = new LinkedHashMap<>();
        for (TensorBase node : DagTraversal.traverse(roots)) {
            for (TensorBase operand : node.operands())
                counts.merge(operand, 1, Integer::sum);
        }
        return new ReferenceCounts(counts);
    }

    public static ReferenceCounts collect(TensorBase root) {
        return collect(List.of(root));
    }
}
