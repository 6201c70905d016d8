package com.slate.kernel.ast;

import java.util.List;

/** A call expression {@code function(args...)}. */
public record FunCall(String function, List<Node> args) implements Node {

    public FunCall {
        if (function == null || function.isBlank())
            throw new IllegalArgumentException("FunCall needs a function name");
        args = args == null ? List.of() : List.copyOf(args);
    }

    public static FunCall of(String function, Node... args) {
        return new FunCall(function, List.of(args));
    }

    @Override
    public List<Node> children() {
        return args;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitFunCall(this);
    }
}
