package com.slate.kernel.ast;

import java.util.List;

/**
 * A sequence of statements. With {@code openScope} the statements are wrapped
 * in braces when rendered.
 */
public record Block(List<Node> statements, boolean openScope) implements Node {

    public Block {
        if (statements == null)
            throw new IllegalArgumentException("Block needs a statement list");
        for (Node s : statements) {
            if (s == null)
                throw new IllegalArgumentException("Block contains a null statement");
        }
        statements = List.copyOf(statements);
    }

    public Block(List<Node> statements) {
        this(statements, false);
    }

    public static Block of(Node... statements) {
        return new Block(List.of(statements), false);
    }

    @Override
    public List<Node> children() {
        return statements;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitBlock(this);
    }
}
