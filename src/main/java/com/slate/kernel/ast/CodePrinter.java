package com.slate.kernel.ast;

import java.util.StringJoiner;

/**
 * Renders an AST as C/C++ source text. Two-space indentation, braces on their
 * own line.
 */
public final class CodePrinter implements AstVisitor<String> {
    private static final String INDENT = "  ";

    public String print(Node node) {
        return node.accept(this);
    }

    @Override
    public String visitSymbol(Symbol node) {
        StringBuilder sb = new StringBuilder(node.name());
        for (String idx : node.rank())
            sb.append('[').append(idx).append(']');
        return sb.toString();
    }

    @Override
    public String visitDecl(Decl node) {
        StringBuilder sb = new StringBuilder();
        for (String q : node.qualifiers())
            sb.append(q).append(' ');
        sb.append(node.type()).append(' ').append(print(node.symbol()));
        if (node.init() != null)
            sb.append(" = ").append(print(node.init()));
        return sb.toString();
    }

    @Override
    public String visitBlock(Block node) {
        StringJoiner lines = new StringJoiner("\n");
        for (Node s : node.statements())
            lines.add(statement(s));
        if (!node.openScope())
            return lines.toString();
        return "{\n" + indent(lines.toString()) + "\n}";
    }

    @Override
    public String visitFunDecl(FunDecl node) {
        StringBuilder sb = new StringBuilder();
        if (node.template() != null)
            sb.append(node.template()).append('\n');
        for (String p : node.pred())
            sb.append(p).append(' ');
        sb.append(node.returnType()).append(' ').append(node.name()).append('(');
        StringJoiner args = new StringJoiner(", ");
        for (Decl d : node.args())
            args.add(print(d));
        sb.append(args).append(")\n{\n");
        String body = new Block(node.body().statements(), false).accept(this);
        if (!body.isEmpty())
            sb.append(indent(body)).append('\n');
        return sb.append('}').toString();
    }

    @Override
    public String visitFunCall(FunCall node) {
        StringJoiner args = new StringJoiner(", ", node.function() + "(", ")");
        for (Node a : node.args())
            args.add(print(a));
        return args.toString();
    }

    @Override
    public String visitAssign(Assign node) {
        return print(node.lhs()) + (node.increment() ? " += " : " = ") + print(node.rhs());
    }

    @Override
    public String visitBinaryExpr(BinaryExpr node) {
        return "(" + print(node.left()) + " " + node.op() + " " + print(node.right()) + ")";
    }

    @Override
    public String visitFor(For node) {
        String header = "for (int " + node.var() + " = " + node.start() + "; " + node.var() + " < " + node.end()
                + "; ++" + node.var() + ")";
        return header + "\n" + new Block(node.body().statements(), true).accept(this);
    }

    @Override
    public String visitFlatBlock(FlatBlock node) {
        return node.code();
    }

    @Override
    public String visitCompilationUnit(CompilationUnit node) {
        StringJoiner out = new StringJoiner("\n\n");
        for (Node n : node.children())
            out.add(statement(n));
        return out.toString();
    }

    private String statement(Node n) {
        String code = print(n);
        boolean compound = n instanceof Block || n instanceof For || n instanceof FunDecl || n instanceof FlatBlock;
        return compound ? code : code + ";";
    }

    private static String indent(String text) {
        StringJoiner out = new StringJoiner("\n");
        for (String line : text.split("\n", -1))
            out.add(line.isEmpty() ? line : INDENT + line);
        return out.toString();
    }
}
