package com.slate.kernel.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * Base class for rewriting passes. Each visit rebuilds its node from the
 * rewritten children and returns the original instance when nothing below it
 * changed, so unchanged subtrees are shared between input and output.
 */
public abstract class AstRewriter implements AstVisitor<Node> {

    public Node rewrite(Node node) {
        return node.accept(this);
    }

    @Override
    public Node visitSymbol(Symbol node) {
        return node;
    }

    @Override
    public Node visitDecl(Decl node) {
        Symbol sym = (Symbol) rewrite(node.symbol());
        Node init = node.init() == null ? null : rewrite(node.init());
        if (sym == node.symbol() && init == node.init())
            return node;
        return new Decl(node.type(), sym, init, node.qualifiers());
    }

    @Override
    public Node visitBlock(Block node) {
        List<Node> stmts = rewriteAll(node.statements());
        return stmts == null ? node : new Block(stmts, node.openScope());
    }

    @Override
    public Node visitFunDecl(FunDecl node) {
        List<Node> args = rewriteAll(node.args());
        Block body = (Block) rewrite(node.body());
        if (args == null && body == node.body())
            return node;
        List<Decl> newArgs = new ArrayList<>();
        for (Node a : args == null ? node.args() : args)
            newArgs.add((Decl) a);
        return new FunDecl(node.returnType(), node.name(), newArgs, body, node.pred(), node.template());
    }

    @Override
    public Node visitFunCall(FunCall node) {
        List<Node> args = rewriteAll(node.args());
        return args == null ? node : new FunCall(node.function(), args);
    }

    @Override
    public Node visitAssign(Assign node) {
        Node lhs = rewrite(node.lhs());
        Node rhs = rewrite(node.rhs());
        if (lhs == node.lhs() && rhs == node.rhs())
            return node;
        return new Assign(lhs, rhs, node.increment());
    }

    @Override
    public Node visitBinaryExpr(BinaryExpr node) {
        Node left = rewrite(node.left());
        Node right = rewrite(node.right());
        if (left == node.left() && right == node.right())
            return node;
        return new BinaryExpr(node.op(), left, right);
    }

    @Override
    public Node visitFor(For node) {
        Block body = (Block) rewrite(node.body());
        return body == node.body() ? node : new For(node.var(), node.start(), node.end(), body);
    }

    @Override
    public Node visitFlatBlock(FlatBlock node) {
        return node;
    }

    @Override
    public Node visitCompilationUnit(CompilationUnit node) {
        List<Node> children = rewriteAll(node.children());
        return children == null ? node : new CompilationUnit(children);
    }

    /** Rewrites every node; returns null when none of them changed. */
    protected List<Node> rewriteAll(List<? extends Node> nodes) {
        List<Node> out = new ArrayList<>(nodes.size());
        boolean changed = false;
        for (Node n : nodes) {
            Node r = rewrite(n);
            changed |= r != n;
            out.add(r);
        }
        return changed ? out : null;
    }
}
