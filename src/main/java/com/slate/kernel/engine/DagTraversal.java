package com.slate.kernel.engine;

import com.slate.kernel.node.TensorBase;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Reproducible depth-first traversal of expression DAGs.
 *
 * <p>
 * The order is a function of the graph shape only: roots are pushed on an
 * explicit stack in the given order, and every popped node is emitted before
 * its unseen operands are pushed in operand order. The last root and the last
 * operand are therefore visited first. No hash iteration order is involved,
 * so independent processes building the same graph observe the same sequence.
 *
 * <p>
 * Every reachable node is emitted exactly once, however many parents it has.
 */
public final class DagTraversal {

    private DagTraversal() {
        // Utility class
    }

    /**
     * Returns every node reachable from {@code roots}, each once, in traversal
     * order.
     *
     * @throws IllegalArgumentException if {@code roots} is null or contains null.
     */
    public static List<TensorBase> traverse(List<? extends TensorBase> roots) {
        if (roots == null)
            throw new IllegalArgumentException("Traversal needs a root list");

        // TensorBase equality is identity, so a plain HashSet is an identity set.
        Set<TensorBase> seen = new HashSet<>();
        Deque<TensorBase> stack = new ArrayDeque<>();
        for (TensorBase root : roots) {
            if (root == null)
                throw new IllegalArgumentException("Null root in traversal");
            if (seen.add(root))
                stack.addLast(root);
        }

        List<TensorBase> order = new ArrayList<>();
        while (!stack.isEmpty()) {
            TensorBase node = stack.pollLast();
            order.add(node);
            for (TensorBase operand : node.operands()) {
                if (seen.add(operand))
                    stack.addLast(operand);
            }
        }
        return Collections.unmodifiableList(order);
    }

    public static List<TensorBase> traverse(TensorBase root) {
        return traverse(List.of(root));
    }
}
