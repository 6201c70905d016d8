package com.slate.kernel.ast;

import java.util.List;

/** An infix arithmetic expression, rendered parenthesised. */
public record BinaryExpr(String op, Node left, Node right) implements Node {

    public BinaryExpr {
        if (op == null || op.isBlank())
            throw new IllegalArgumentException("BinaryExpr needs an operator");
        if (left == null || right == null)
            throw new IllegalArgumentException("BinaryExpr needs both operands");
    }

    public static BinaryExpr prod(Node left, Node right) {
        return new BinaryExpr("*", left, right);
    }

    public static BinaryExpr sum(Node left, Node right) {
        return new BinaryExpr("+", left, right);
    }

    @Override
    public List<Node> children() {
        return List.of(left, right);
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitBinaryExpr(this);
    }
}
