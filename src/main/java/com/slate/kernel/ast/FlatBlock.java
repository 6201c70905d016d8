package com.slate.kernel.ast;

import java.util.List;

/** Verbatim source text, emitted unchanged. */
public record FlatBlock(String code) implements Node {

    public FlatBlock {
        if (code == null)
            throw new IllegalArgumentException("FlatBlock needs code");
    }

    @Override
    public List<Node> children() {
        return List.of();
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitFlatBlock(this);
    }
}
