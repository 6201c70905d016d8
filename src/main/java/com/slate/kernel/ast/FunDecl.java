package com.slate.kernel.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * A function definition.
 *
 * @param returnType Return type, e.g. {@code void}.
 * @param name       Function name.
 * @param args       Formal parameters.
 * @param body       Function body.
 * @param pred       Predicates printed before the return type, e.g.
 *                   {@code static}, {@code inline}.
 * @param template   Template header printed on its own line before the
 *                   signature, or {@code null}.
 */
public record FunDecl(String returnType, String name, List<Decl> args, Block body, List<String> pred,
        String template) implements Node {

    public FunDecl {
        if (name == null || name.isBlank())
            throw new IllegalArgumentException("FunDecl needs a name");
        if (body == null)
            throw new IllegalArgumentException("FunDecl " + name + " needs a body");
        returnType = returnType == null ? "void" : returnType;
        args = args == null ? List.of() : List.copyOf(args);
        pred = pred == null ? List.of() : List.copyOf(pred);
    }

    public FunDecl(String returnType, String name, List<Decl> args, Block body, List<String> pred) {
        this(returnType, name, args, body, pred, null);
    }

    public FunDecl withArgs(List<Decl> newArgs) {
        return new FunDecl(returnType, name, newArgs, body, pred, template);
    }

    public FunDecl withBody(Block newBody) {
        return new FunDecl(returnType, name, args, newBody, pred, template);
    }

    public FunDecl withTemplate(String newTemplate) {
        return new FunDecl(returnType, name, args, body, pred, newTemplate);
    }

    @Override
    public List<Node> children() {
        List<Node> out = new ArrayList<>(args);
        out.add(body);
        return List.copyOf(out);
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitFunDecl(this);
    }
}
