package com.slate.kernel.engine;

import com.slate.kernel.ast.Block;
import com.slate.kernel.ast.Decl;
import com.slate.kernel.ast.FunDecl;
import com.slate.kernel.ast.Node;

import java.util.List;

/**
 * Builds the driver functions that call subkernels and perform the local
 * linear algebra.
 */
public final class MacroKernels {

    /** Predicates of every driver function. */
    public static final List<String> PREDICATES = List.of("static", "inline");

    private MacroKernels() {
        // Utility class
    }

    /**
     * Wraps {@code body} into {@code static inline void name(args) { body }}.
     *
     * @param name Function name.
     * @param args Formal parameters, in call order.
     * @param body Driver statements: temporaries, subkernel calls and any
     *             auxiliary loops. Must be a {@link Block}.
     * @throws IllegalArgumentException if the body is not a block, or the name
     *                                  or argument list is missing.
     */
    public static FunDecl construct(String name, List<Decl> args, Node body) {
        if (name == null || name.isBlank())
            throw new IllegalArgumentException("Macro kernel needs a name");
        if (args == null)
            throw new IllegalArgumentException("Macro kernel " + name + " needs an argument list");
        if (!(body instanceof Block block))
            throw new IllegalArgumentException("Body statements of macro kernel " + name
                    + " must be wrapped in a Block, got "
                    + (body == null ? "null" : body.getClass().getSimpleName()));
        return new FunDecl("void", name, args, block, PREDICATES);
    }
}
