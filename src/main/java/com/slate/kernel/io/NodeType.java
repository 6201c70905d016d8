package com.slate.kernel.io;

import com.slate.kernel.form.Coefficient;
import com.slate.kernel.node.Action;
import com.slate.kernel.node.Add;
import com.slate.kernel.node.Inverse;
import com.slate.kernel.node.Mul;
import com.slate.kernel.node.Negative;
import com.slate.kernel.node.Sub;
import com.slate.kernel.node.TensorBase;
import com.slate.kernel.node.TensorOp;
import com.slate.kernel.node.Transpose;

/**
 * Operator node types available in expression definitions, with the factory
 * that builds each one.
 */
public enum NodeType {
    ADD(2, (ops, c) -> new Add(ops[0], ops[1])),
    SUB(2, (ops, c) -> new Sub(ops[0], ops[1])),
    MUL(2, (ops, c) -> new Mul(ops[0], ops[1])),
    NEGATIVE(1, (ops, c) -> new Negative(ops[0])),
    TRANSPOSE(1, (ops, c) -> new Transpose(ops[0])),
    INVERSE(1, (ops, c) -> new Inverse(ops[0])),
    ACTION(1, (ops, c) -> {
        if (c == null)
            throw new IllegalArgumentException("action node needs a 'coefficient'");
        return new Action(ops[0], c);
    });

    private final int arity;
    private final OpFactory factory;

    NodeType(int arity, OpFactory factory) {
        this.arity = arity;
        this.factory = factory;
    }

    public int arity() {
        return arity;
    }

    /**
     * @throws IllegalArgumentException on a wrong operand count or shape.
     */
    public TensorOp create(String name, TensorBase[] operands, Coefficient coefficient) {
        if (operands.length != arity)
            throw new IllegalArgumentException("Node " + name + " of type " + this + " needs " + arity
                    + " operand(s), got " + operands.length);
        return factory.create(operands, coefficient);
    }

    public static NodeType fromString(String s) {
        if (s == null)
            throw new IllegalArgumentException("Missing node type");
        try {
            return valueOf(s.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown node type: " + s, e);
        }
    }

    @FunctionalInterface
    private interface OpFactory {
        TensorOp create(TensorBase[] operands, Coefficient coefficient);
    }
}
