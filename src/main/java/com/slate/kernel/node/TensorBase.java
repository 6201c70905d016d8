package com.slate.kernel.node;

import com.slate.kernel.form.Coefficient;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * A vertex in a local linear algebra expression DAG.
 *
 * <p>
 * Nodes are identified by object identity. Two structurally identical
 * subexpressions built from distinct instances are distinct vertices; one
 * instance used as the operand of several parents is a single shared vertex.
 * For this reason {@link #equals(Object)} and {@link #hashCode()} are final
 * and identity based, which makes every {@code HashMap}/{@code LinkedHashMap}
 * keyed by nodes an identity map.
 *
 * <p>
 * Nodes are immutable once built.
 */
public abstract class TensorBase {
    private final int[] shape;
    private final List<TensorBase> operands;

    protected TensorBase(int[] shape, List<TensorBase> operands) {
        for (TensorBase op : operands) {
            if (op == null)
                throw new IllegalArgumentException(getClass().getSimpleName() + " has a null operand");
        }
        this.shape = shape.clone();
        this.operands = List.copyOf(operands);
    }

    /** Ordered operand edges. Empty for terminal tensors. */
    public final List<TensorBase> operands() {
        return operands;
    }

    public final int[] shape() {
        return shape.clone();
    }

    public final int rank() {
        return shape.length;
    }

    /** Short operator name used in diagnostics, e.g. {@code "Add"}. */
    public String label() {
        return getClass().getSimpleName();
    }

    public abstract boolean isTerminal();

    /**
     * Coefficients referenced by this node itself, not by its operands.
     */
    protected List<Coefficient> ownCoefficients() {
        return List.of();
    }

    /**
     * All external coefficients the expression depends on, each once, in
     * canonical order (ascending creation count).
     */
    public final List<Coefficient> coefficients() {
        Set<Coefficient> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        Set<TensorBase> visited = Collections.newSetFromMap(new IdentityHashMap<>());
        List<Coefficient> result = new ArrayList<>();
        Deque<TensorBase> stack = new ArrayDeque<>();
        stack.push(this);
        visited.add(this);
        while (!stack.isEmpty()) {
            TensorBase node = stack.pop();
            for (Coefficient c : node.ownCoefficients()) {
                if (seen.add(c))
                    result.add(c);
            }
            for (TensorBase op : node.operands) {
                if (visited.add(op))
                    stack.push(op);
            }
        }
        result.sort(Coefficient.BY_COUNT);
        return Collections.unmodifiableList(result);
    }

    // ── Expression construction ────────────────────────────────────

    public Add add(TensorBase other) {
        return new Add(this, other);
    }

    public Sub sub(TensorBase other) {
        return new Sub(this, other);
    }

    public Mul mul(TensorBase other) {
        return new Mul(this, other);
    }

    public Negative negate() {
        return new Negative(this);
    }

    public Transpose transpose() {
        return new Transpose(this);
    }

    public Inverse inverse() {
        return new Inverse(this);
    }

    public Action action(Coefficient coefficient) {
        return new Action(this, coefficient);
    }

    @Override
    public final boolean equals(Object o) {
        return this == o;
    }

    @Override
    public final int hashCode() {
        return System.identityHashCode(this);
    }

    @Override
    public String toString() {
        return label() + Arrays.toString(shape) + "@" + Integer.toHexString(hashCode());
    }
}
