package com.slate.kernel.ast;

import java.util.List;

/**
 * Top-level container of a complete kernel: every finalized subkernel
 * followed by the driver functions that call them.
 */
public record CompilationUnit(List<Node> children) implements Node {

    public CompilationUnit {
        if (children == null)
            throw new IllegalArgumentException("CompilationUnit needs a node list");
        children = List.copyOf(children);
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitCompilationUnit(this);
    }
}
