package com.slate.kernel.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * A variable declaration: {@code qualifiers type symbol [= init]}. Array
 * extents are carried by the symbol's rank, e.g. {@code double A[3][3]}.
 */
public record Decl(String type, Symbol symbol, Node init, List<String> qualifiers) implements Node {

    public Decl {
        if (type == null || type.isBlank())
            throw new IllegalArgumentException("Decl needs a type");
        if (symbol == null)
            throw new IllegalArgumentException("Decl needs a symbol");
        qualifiers = qualifiers == null ? List.of() : List.copyOf(qualifiers);
    }

    public Decl(String type, Symbol symbol) {
        this(type, symbol, null, List.of());
    }

    public Decl(String type, Symbol symbol, Node init) {
        this(type, symbol, init, List.of());
    }

    @Override
    public List<Node> children() {
        List<Node> out = new ArrayList<>(2);
        out.add(symbol);
        if (init != null)
            out.add(init);
        return List.copyOf(out);
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitDecl(this);
    }
}
