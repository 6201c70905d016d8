package com.slate.kernel.ast;

import java.util.List;

/** {@code for (int var = start; var < end; ++var) body}. */
public record For(String var, int start, int end, Block body) implements Node {

    public For {
        if (var == null || var.isBlank())
            throw new IllegalArgumentException("For needs a loop variable");
        if (body == null)
            throw new IllegalArgumentException("For needs a body");
    }

    @Override
    public List<Node> children() {
        return List.of(body);
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitFor(this);
    }
}
