package com.slate.kernel.ast;

/**
 * Visitor over all AST node types.
 *
 * @param <R> Result type of a visit.
 */
public interface AstVisitor<R> {

    R visitSymbol(Symbol node);

    R visitDecl(Decl node);

    R visitBlock(Block node);

    R visitFunDecl(FunDecl node);

    R visitFunCall(FunCall node);

    R visitAssign(Assign node);

    R visitBinaryExpr(BinaryExpr node);

    R visitFor(For node);

    R visitFlatBlock(FlatBlock node);

    R visitCompilationUnit(CompilationUnit node);
}
