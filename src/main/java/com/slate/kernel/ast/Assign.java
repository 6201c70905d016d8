package com.slate.kernel.ast;

import java.util.List;

/** {@code lhs = rhs}, or {@code lhs += rhs} when {@code increment} is set. */
public record Assign(Node lhs, Node rhs, boolean increment) implements Node {

    public Assign {
        if (lhs == null || rhs == null)
            throw new IllegalArgumentException("Assign needs both sides");
    }

    public Assign(Node lhs, Node rhs) {
        this(lhs, rhs, false);
    }

    public static Assign incr(Node lhs, Node rhs) {
        return new Assign(lhs, rhs, true);
    }

    @Override
    public List<Node> children() {
        return List.of(lhs, rhs);
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitAssign(this);
    }
}
