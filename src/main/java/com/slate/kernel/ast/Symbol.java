package com.slate.kernel.ast;

import java.util.List;

/**
 * An identifier, optionally indexed. {@code Symbol("A", ["i", "j"])} renders
 * as {@code A[i][j]}. Literals are symbols without indices.
 */
public record Symbol(String name, List<String> rank) implements Node {

    public Symbol {
        if (name == null || name.isBlank())
            throw new IllegalArgumentException("Symbol needs a name");
        rank = rank == null ? List.of() : List.copyOf(rank);
    }

    public Symbol(String name) {
        this(name, List.of());
    }

    public static Symbol indexed(String name, String... indices) {
        return new Symbol(name, List.of(indices));
    }

    public boolean isIndexed() {
        return !rank.isEmpty();
    }

    @Override
    public List<Node> children() {
        return List.of();
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitSymbol(this);
    }
}
