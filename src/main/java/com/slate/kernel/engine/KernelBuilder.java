package com.slate.kernel.engine;

import com.slate.kernel.api.CompilerParameters;
import com.slate.kernel.api.ContextKernel;
import com.slate.kernel.api.IntegralType;
import com.slate.kernel.api.KernelInfo;
import com.slate.kernel.api.KernelTransformer;
import com.slate.kernel.api.SplitKernel;
import com.slate.kernel.api.TerminalFormCompiler;
import com.slate.kernel.ast.CompilationUnit;
import com.slate.kernel.ast.Decl;
import com.slate.kernel.ast.FunDecl;
import com.slate.kernel.ast.Node;
import com.slate.kernel.ast.Symbol;
import com.slate.kernel.form.Coefficient;
import com.slate.kernel.node.Tensor;
import com.slate.kernel.node.TensorBase;
import com.slate.kernel.node.TensorOp;
import com.slate.kernel.transform.EigenTransformer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

import lombok.extern.log4j.Log4j2;

/**
 * Per-expression compilation state for one local linear algebra kernel.
 *
 * <p>
 * The builder gives access to every temporary and subkernel of an expression,
 * and to the operator nodes that need special handling in the driver (shared
 * subexpressions and actions on assembled data).
 *
 * <h3>Protocol</h3>
 * <ol>
 * <li>Construct: temporaries and auxiliary expressions are computed eagerly.</li>
 * <li>Record requirements ({@link #requireCellFacets()},
 * {@link #requireMeshLayers()}) while the driver is generated.</li>
 * <li>{@link #finalizeKernels()}: compiles, checks and rewrites every
 * subkernel, exactly once.</li>
 * <li>{@link #construct(List)}: emits the compilation unit, any number of
 * times.</li>
 * </ol>
 *
 * <h3>Threading</h3>
 * Not thread-safe. {@link #coefficientMap()} and {@link #contextKernels()} are
 * computed on first access into plain fields without locking; one thread is
 * expected to drive a builder from construction to {@link #construct(List)}.
 */
@Log4j2
public final class KernelBuilder {
    /** Prefix of the subkernel names generated for the i-th temporary. */
    public static final String SUBKERNEL_PREFIX = "subkernel";

    private final TensorBase expression;
    private final CompilerParameters parameters;
    private final TerminalFormCompiler formCompiler;
    private final KernelTransformer transformer;

    private final Map<Tensor, Symbol> temporaries;
    private final List<TensorOp> auxiliaryExpressions;
    private final ReferenceCounts referenceCounts;

    private boolean needsCellFacets;
    private boolean needsMeshLayers;
    private boolean oriented;

    private BuildState state = BuildState.CONSTRUCTED;
    private List<Node> finalizedKernels;

    // Lazily computed, see class docs.
    private Map<Coefficient, List<Symbol>> coefficientMap;
    private List<ContextKernel> contextKernels;

    /**
     * Creates a builder that rewrites subkernels with {@link EigenTransformer}.
     */
    public KernelBuilder(TensorBase expression, CompilerParameters parameters, TerminalFormCompiler formCompiler) {
        this(expression, parameters, formCompiler, new EigenTransformer());
    }

    /**
     * @param expression   Root of the expression DAG.
     * @param parameters   Form compiler parameters, forwarded unchanged; may be
     *                     null for none.
     * @param formCompiler Lowers terminal tensors to subkernels.
     * @param transformer  Rewrites subkernels for the target library.
     * @throws IllegalArgumentException if the expression or a collaborator is
     *                                  missing.
     */
    public KernelBuilder(TensorBase expression, CompilerParameters parameters, TerminalFormCompiler formCompiler,
            KernelTransformer transformer) {
        if (expression == null)
            throw new IllegalArgumentException("KernelBuilder needs an expression");
        if (formCompiler == null)
            throw new IllegalArgumentException("KernelBuilder needs a terminal form compiler");
        if (transformer == null)
            throw new IllegalArgumentException("KernelBuilder needs a kernel transformer");
        this.expression = expression;
        this.parameters = parameters == null ? CompilerParameters.empty() : parameters;
        this.formCompiler = formCompiler;
        this.transformer = transformer;

        ExpressionData data = ExpressionAnalyzer.analyze(expression);
        this.temporaries = data.temporaries();

        // Counts cover the full graph, not only the operator list.
        this.referenceCounts = ReferenceCounter.collect(expression);
        this.auxiliaryExpressions = Collections.unmodifiableList(
                ExpressionAnalyzer.auxiliaryExpressions(data.tensorOps(), referenceCounts));

        log.debug("Analysed {}: {} temporaries, {} operators, {} auxiliary expressions",
                expression, temporaries.size(), data.tensorOps().size(), auxiliaryExpressions.size());
    }

    // ── Accessors ───────────────────────────────────────────────

    public TensorBase expression() {
        return expression;
    }

    public CompilerParameters parameters() {
        return parameters;
    }

    /** Terminal tensor to temporary symbol, in first-encounter order. */
    public Map<Tensor, Symbol> temporaries() {
        return temporaries;
    }

    /**
     * Operators the driver must materialize: shared ones and every action,
     * smallest first.
     */
    public List<TensorOp> auxiliaryExpressions() {
        return auxiliaryExpressions;
    }

    public ReferenceCounts referenceCounts() {
        return referenceCounts;
    }

    public BuildState state() {
        return state;
    }

    public boolean isFinalized() {
        return state == BuildState.FINALIZED;
    }

    /**
     * Slate kernels are always cell kernels: they perform element-local linear
     * algebra. Facet data may still be requested through
     * {@link #requireCellFacets()}.
     */
    public IntegralType integralType() {
        return IntegralType.CELL;
    }

    // ── Requirements ────────────────────────────────────────────

    public void requireCellFacets() {
        needsCellFacets = true;
    }

    public void requireMeshLayers() {
        needsMeshLayers = true;
    }

    /**
     * Marks the kernel as needing cell orientations regardless of what the
     * subkernels report.
     *
     * @throws IllegalStateException once finalized, since orientation has
     *                               already been aggregated.
     */
    public void requireOrientation() {
        if (state == BuildState.FINALIZED)
            throw new IllegalStateException("Orientation is fixed once the kernel is finalized");
        oriented = true;
    }

    public boolean needsCellFacets() {
        return needsCellFacets;
    }

    public boolean needsMeshLayers() {
        return needsMeshLayers;
    }

    public boolean isOriented() {
        return oriented;
    }

    // ── Coefficients ────────────────────────────────────────────

    /**
     * Maps every coefficient of the expression to its kernel argument
     * symbols: {@code w_i} for a coefficient on a plain space, and
     * {@code w_i_0 ... w_i_{N-1}} for one on a mixed space with N components.
     * Computed once; later calls return the same map.
     */
    public Map<Coefficient, List<Symbol>> coefficientMap() {
        if (coefficientMap == null) {
            Map<Coefficient, List<Symbol>> map = new LinkedHashMap<>();
            List<Coefficient> coefficients = expression.coefficients();
            for (int i = 0; i < coefficients.size(); i++) {
                Coefficient c = coefficients.get(i);
                List<Symbol> symbols;
                if (c.space().isMixed()) {
                    int parts = c.space().split().size();
                    List<Symbol> split = new ArrayList<>(parts);
                    for (int j = 0; j < parts; j++)
                        split.add(new Symbol("w_" + i + "_" + j));
                    symbols = List.copyOf(split);
                } else {
                    symbols = List.of(new Symbol("w_" + i));
                }
                map.put(c, symbols);
            }
            coefficientMap = Collections.unmodifiableMap(map);
        }
        return coefficientMap;
    }

    /**
     * Kernel argument symbols of one coefficient; several for a mixed space.
     *
     * @throws NoSuchElementException if the coefficient is not part of the
     *                                expression.
     */
    public List<Symbol> coefficient(Coefficient coefficient) {
        List<Symbol> symbols = coefficientMap().get(coefficient);
        if (symbols == null)
            throw new NoSuchElementException("Coefficient " + coefficient + " is not part of " + expression);
        return symbols;
    }

    // ── Subkernels ──────────────────────────────────────────────

    /**
     * Compiles every terminal tensor, in temporaries order, with the prefix
     * {@code subkernel<i>_}. Computed once; a failure in the form compiler
     * propagates and leaves nothing cached.
     */
    public List<ContextKernel> contextKernels() {
        if (contextKernels == null) {
            List<ContextKernel> all = new ArrayList<>();
            int i = 0;
            for (Tensor tensor : temporaries.keySet()) {
                String prefix = SUBKERNEL_PREFIX + i++ + "_";
                List<ContextKernel> compiled = formCompiler.compile(tensor, prefix, parameters);
                if (compiled == null)
                    throw new IllegalStateException("Form compiler returned no context kernels for " + tensor);
                all.addAll(compiled);
            }
            contextKernels = Collections.unmodifiableList(all);
            log.debug("Compiled {} terminal tensors into {} context kernels", temporaries.size(), all.size());
        }
        return contextKernels;
    }

    /**
     * Rewrites all subkernels for the target library and aggregates the
     * orientation requirement. Runs once; later calls are ignored.
     *
     * <p>
     * Nothing is recorded unless every subkernel passes, so a failed call
     * leaves the builder in {@link BuildState#CONSTRUCTED}.
     *
     * @throws UnsupportedOperationException if a subkernel targets a subdomain
     *                                       other than
     *                                       {@value KernelInfo#DEFAULT_SUBDOMAIN}.
     */
    public void finalizeKernels() {
        if (state == BuildState.FINALIZED) {
            log.warn("Kernel for {} is already finalized; ignoring repeated finalize", expression);
            return;
        }

        List<SplitKernel> splitKernels = new ArrayList<>();
        for (ContextKernel cxt : contextKernels())
            splitKernels.addAll(cxt.kernels());

        boolean anyOriented = oriented;
        List<Node> kernels = new ArrayList<>(splitKernels.size());
        for (SplitKernel split : splitKernels) {
            KernelInfo kinfo = split.kinfo();
            anyOriented |= kinfo.oriented();
            // TODO: support integrals over marked subdomains
            if (!kinfo.isDefaultSubdomain())
                throw new UnsupportedOperationException("Subdomain '" + kinfo.subdomainId() + "' in "
                        + kernelName(kinfo.kernel()) + " is not supported");
            Node rewritten = transformer.transform(kinfo.kernel());
            if (rewritten == null)
                throw new IllegalStateException("Transformer returned null for " + kernelName(kinfo.kernel()));
            kernels.add(rewritten);
        }

        oriented = anyOriented;
        finalizedKernels = List.copyOf(kernels);
        state = BuildState.FINALIZED;
        log.debug("Finalized {} subkernels (oriented={})", kernels.size(), oriented);
    }

    /**
     * Rewritten subkernels in context-kernel order.
     *
     * @throws IllegalStateException before {@link #finalizeKernels()}.
     */
    public List<Node> finalizedKernels() {
        requireFinalized();
        return finalizedKernels;
    }

    /**
     * Wraps driver statements into a {@code static inline void} function.
     *
     * @see MacroKernels#construct(String, List, Node)
     */
    public FunDecl constructMacroKernel(String name, List<Decl> args, Node body) {
        return MacroKernels.construct(name, args, body);
    }

    /**
     * Builds the complete kernel: every finalized subkernel followed by the
     * given driver functions. Each call returns a new unit with the same
     * content; the builder is not modified.
     *
     * @param macroKernels Driver functions calling the subkernels.
     * @throws IllegalArgumentException if the list is missing or holds null.
     * @throws IllegalStateException    before {@link #finalizeKernels()}.
     */
    public CompilationUnit construct(List<? extends Node> macroKernels) {
        if (macroKernels == null)
            throw new IllegalArgumentException("Macro kernel functions must be given as a list");
        for (Node n : macroKernels) {
            if (n == null)
                throw new IllegalArgumentException("Macro kernel list contains null");
        }
        requireFinalized();

        List<Node> nodes = new ArrayList<>(finalizedKernels.size() + macroKernels.size());
        nodes.addAll(finalizedKernels);
        nodes.addAll(macroKernels);
        return new CompilationUnit(nodes);
    }

    private void requireFinalized() {
        if (state != BuildState.FINALIZED)
            throw new IllegalStateException("Kernel AST not finalized. Call finalizeKernels() first");
    }

    private static String kernelName(Node kernel) {
        return kernel instanceof FunDecl f ? f.name() : kernel.getClass().getSimpleName();
    }
}
