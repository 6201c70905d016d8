package com.slate.kernel.util;

import com.slate.kernel.ast.Symbol;
import com.slate.kernel.engine.DagTraversal;
import com.slate.kernel.engine.KernelBuilder;
import com.slate.kernel.engine.ReferenceCounts;
import com.slate.kernel.node.Action;
import com.slate.kernel.node.Tensor;
import com.slate.kernel.node.TensorBase;
import com.slate.kernel.node.TensorOp;

import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Diagnostic views of a {@link KernelBuilder}'s expression analysis.
 *
 * <p>
 * Intended for debugging sessions and error reports. Nodes are numbered in
 * traversal order ({@code n0} is the root), which is stable across runs.
 */
public final class KernelExplain {
    private final KernelBuilder builder;
    private final List<TensorBase> order;
    private final Map<TensorBase, String> ids = new HashMap<>();

    public KernelExplain(KernelBuilder builder) {
        this.builder = builder;
        this.order = DagTraversal.traverse(builder.expression());
        for (int i = 0; i < order.size(); i++)
            ids.put(order.get(i), "n" + i);
    }

    /** Node id in the dumps, e.g. {@code n3}. */
    public String id(TensorBase node) {
        String id = ids.get(node);
        if (id == null)
            throw new IllegalArgumentException("Node is not part of the expression: " + node);
        return id;
    }

    public String summary() {
        return "Expression: " + describe(builder.expression())
                + ", nodes: " + order.size()
                + ", temporaries: " + builder.temporaries().size()
                + ", auxiliary: " + builder.auxiliaryExpressions().size()
                + ", state: " + builder.state();
    }

    /**
     * Dumps state of a single node.
     */
    public String explainNode(TensorBase node) {
        ReferenceCounts counts = builder.referenceCounts();
        StringBuilder sb = new StringBuilder(256);
        sb.append("Node: ").append(id(node)).append('\n')
                .append("  Type: ").append(node.label()).append('\n')
                .append("  Shape: ").append(Arrays.toString(node.shape())).append('\n')
                .append("  References: ").append(counts.count(node)).append('\n');
        if (node instanceof Tensor t)
            sb.append("  Temporary: ").append(builder.temporaries().get(t).name()).append('\n');
        else if (node instanceof TensorOp op)
            sb.append("  Auxiliary: ").append(builder.auxiliaryExpressions().contains(op)).append('\n');
        List<TensorBase> operands = node.operands();
        sb.append("  Operands (").append(operands.size()).append("): ");
        for (int i = 0; i < operands.size(); i++) {
            sb.append(id(operands.get(i)));
            if (i < operands.size() - 1)
                sb.append(", ");
        }
        return sb.append('\n').toString();
    }

    /** One line per temporary: {@code T0 = n2 Tensor(mass)[3, 3]}. */
    public String dumpTemporaries() {
        StringBuilder sb = new StringBuilder(512);
        sb.append("Temporaries (").append(builder.temporaries().size()).append("):\n");
        for (Map.Entry<Tensor, Symbol> e : builder.temporaries().entrySet())
            sb.append("  ").append(e.getValue().name()).append(" = ").append(id(e.getKey()))
                    .append(' ').append(describe(e.getKey())).append('\n');
        return sb.toString();
    }

    public String dumpAuxiliaryExpressions() {
        ReferenceCounts counts = builder.referenceCounts();
        StringBuilder sb = new StringBuilder(512);
        sb.append("Auxiliary expressions (").append(builder.auxiliaryExpressions().size()).append("):\n");
        for (TensorOp op : builder.auxiliaryExpressions()) {
            sb.append("  ").append(id(op)).append(' ').append(describe(op))
                    .append(" refs=").append(counts.count(op));
            if (op instanceof Action a)
                sb.append(" coefficient=").append(a.coefficient().name());
            sb.append('\n');
        }
        return sb.toString();
    }

    /**
     * Generates a Mermaid graph of the expression, operators pointing at their
     * operands. Auxiliary expressions are highlighted.
     */
    public String toMermaid() {
        StringBuilder sb = new StringBuilder(2048);
        sb.append("graph TD;\n");
        for (TensorBase node : order) {
            String label = node instanceof Tensor t
                    ? builder.temporaries().get(t).name() + ": " + node.label()
                    : node.label();
            sb.append("  ").append(id(node)).append("[\"").append(label.replace("\"", "'")).append("\"];\n");
        }
        for (TensorBase node : order) {
            Set<TensorBase> linked = new HashSet<>();
            for (TensorBase operand : node.operands()) {
                if (linked.add(operand))
                    sb.append("  ").append(id(node)).append(" --> ").append(id(operand)).append(";\n");
            }
        }
        for (TensorOp op : builder.auxiliaryExpressions())
            sb.append("  style ").append(id(op)).append(" fill:#f96;\n");
        return sb.toString();
    }

    private static String describe(TensorBase node) {
        return node.label() + Arrays.toString(node.shape());
    }
}
