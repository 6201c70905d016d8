package com.slate.kernel.transform;

import com.slate.kernel.api.KernelTransformer;
import com.slate.kernel.ast.AstRewriter;
import com.slate.kernel.ast.Block;
import com.slate.kernel.ast.Decl;
import com.slate.kernel.ast.FlatBlock;
import com.slate.kernel.ast.FunCall;
import com.slate.kernel.ast.FunDecl;
import com.slate.kernel.ast.Node;
import com.slate.kernel.ast.Symbol;

import java.util.ArrayList;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Rewrites generated subkernels into Eigen template functions.
 *
 * <p>
 * The form compiler emits plain C functions whose first argument is the
 * output element tensor, e.g. {@code void k(double A[3][3], ...)}. The driver
 * wants to pass Eigen matrices (and blocks of them) instead, so each kernel
 * becomes
 *
 * <pre>{@code
 * template <typename Derived>
 * static inline void k(Eigen::MatrixBase<Derived> const & A_, ...)
 * {
 *   Eigen::MatrixBase<Derived> & A = const_cast<Eigen::MatrixBase<Derived> &>(A_);
 *   ... A(i, j) += ...;
 * }
 * }</pre>
 *
 * Every indexed access to the output tensor turns into an Eigen coefficient
 * access; rank-1 outputs are treated as column vectors ({@code A(i, 0)}).
 * Anything that is not a function, or a function whose first argument is not
 * an array, is returned unchanged.
 */
public final class EigenTransformer implements KernelTransformer {
    private static final Logger log = LogManager.getLogger(EigenTransformer.class);

    public static final String TEMPLATE = "template <typename Derived>";
    public static final String MATRIX_TYPE = "Eigen::MatrixBase<Derived>";

    @Override
    public Node transform(Node kernel) {
        if (!(kernel instanceof FunDecl fun) || fun.args().isEmpty())
            return kernel;

        Decl output = fun.args().get(0);
        Symbol outSym = output.symbol();
        int rank = outSym.rank().size();
        if (rank == 0 || rank > 2) {
            log.debug("Leaving {} unchanged: output {} has rank {}", fun.name(), outSym.name(), rank);
            return kernel;
        }

        String name = outSym.name();
        String refName = name + "_";

        List<Decl> args = new ArrayList<>(fun.args());
        args.set(0, new Decl(MATRIX_TYPE + " const &", new Symbol(refName)));

        Block body = (Block) new OutputAccessRewriter(name).rewrite(fun.body());
        List<Node> stmts = new ArrayList<>(body.statements().size() + 1);
        stmts.add(new Decl(MATRIX_TYPE + " &", new Symbol(name),
                new FlatBlock("const_cast<" + MATRIX_TYPE + " &>(" + refName + ")")));
        stmts.addAll(body.statements());

        List<String> pred = fun.pred().isEmpty() ? List.of("static", "inline") : fun.pred();
        return new FunDecl(fun.returnType(), fun.name(), args, new Block(stmts, body.openScope()), pred, TEMPLATE);
    }

    /** Turns {@code A[i][j]} into {@code A(i, j)} and {@code A[i]} into {@code A(i, 0)}. */
    private static final class OutputAccessRewriter extends AstRewriter {
        private final String name;

        OutputAccessRewriter(String name) {
            this.name = name;
        }

        @Override
        public Node visitSymbol(Symbol node) {
            if (!node.name().equals(name) || !node.isIndexed())
                return node;
            List<Node> indices = new ArrayList<>(2);
            for (String idx : node.rank())
                indices.add(new Symbol(idx));
            if (indices.size() == 1)
                indices.add(new Symbol("0"));
            return new FunCall(name, indices);
        }

        @Override
        public Node visitDecl(Decl node) {
            // Declared names are left alone; only initialisers are rewritten.
            if (node.init() == null)
                return node;
            Node init = rewrite(node.init());
            return init == node.init() ? node : new Decl(node.type(), node.symbol(), init, node.qualifiers());
        }
    }
}
