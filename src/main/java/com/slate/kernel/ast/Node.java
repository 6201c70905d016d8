package com.slate.kernel.ast;

import java.util.List;

/**
 * A node of the structural C/C++ AST that subkernels and driver functions are
 * built from.
 *
 * <p>
 * All node types are immutable records, so two nodes are equal exactly when
 * they have the same structure. Rewriting passes build new trees rather than
 * modify existing ones.
 */
public interface Node {

    /** Direct child nodes in source order. */
    List<Node> children();

    <R> R accept(AstVisitor<R> visitor);

    /** Renders this node as C/C++ source text. */
    default String gencode() {
        return new CodePrinter().print(this);
    }
}
