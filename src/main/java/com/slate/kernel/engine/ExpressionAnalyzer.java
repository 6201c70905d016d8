package com.slate.kernel.engine;

import com.slate.kernel.ast.Symbol;
import com.slate.kernel.node.Action;
import com.slate.kernel.node.Tensor;
import com.slate.kernel.node.TensorBase;
import com.slate.kernel.node.TensorOp;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Assigns temporaries to terminal tensors and collects the operator nodes
 * that need extra driver work.
 *
 * <p>
 * Temporary names are embedded in generated source and must agree between
 * independent compilations of the same expression, so they are assigned in
 * {@link DagTraversal} order and nowhere else.
 */
public final class ExpressionAnalyzer {

    /** Prefix of terminal temporaries: {@code T0, T1, ...}. */
    public static final String TEMPORARY_PREFIX = "T";

    private ExpressionAnalyzer() {
        // Utility class
    }

    /**
     * Walks {@code expression} once.
     *
     * @return temporaries for every distinct terminal tensor and all operator
     *         nodes, the latter stable-sorted by ascending operand count.
     */
    public static ExpressionData analyze(TensorBase expression) {
        if (expression == null)
            throw new IllegalArgumentException("Cannot analyse a null expression");

        Map<Tensor, Symbol> temps = new LinkedHashMap<>();
        List<TensorOp> ops = new ArrayList<>();
        for (TensorBase node : DagTraversal.traverse(expression)) {
            if (node instanceof Tensor t) {
                if (!temps.containsKey(t))
                    temps.put(t, new Symbol(TEMPORARY_PREFIX + temps.size()));
            } else if (node instanceof TensorOp op) {
                ops.add(op);
            }
        }

        // List.sort is stable: ties keep traversal order.
        Map<TensorOp, Integer> sizes = new HashMap<>();
        for (TensorOp op : ops)
            sizes.put(op, countOperands(op));
        ops.sort(Comparator.comparingInt(sizes::get));

        return new ExpressionData(temps, ops);
    }

    /**
     * Structural size of an expression: the number of operand edges in its
     * sub-DAG, each distinct node counted once. A node always counts more than
     * any of its descendants.
     */
    public static int countOperands(TensorBase expression) {
        int count = 0;
        for (TensorBase node : DagTraversal.traverse(expression))
            count += node.operands().size();
        return count;
    }

    /**
     * Selects the operators that must be materialized into temporaries by the
     * driver: those referenced more than once, and every action.
     *
     * @param sortedOps operator nodes in the order of {@link #analyze}; the
     *                  order is preserved.
     */
    public static List<TensorOp> auxiliaryExpressions(List<TensorOp> sortedOps, ReferenceCounts counts) {
        List<TensorOp> aux = new ArrayList<>();
        for (TensorOp op : sortedOps) {
            if (counts.count(op) > 1 || op instanceof Action)
                aux.add(op);
        }
        return aux;
    }
}
