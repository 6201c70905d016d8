package com.slate.kernel;

import com.slate.kernel.api.CompilerParameters;
import com.slate.kernel.api.KernelTransformer;
import com.slate.kernel.api.TerminalFormCompiler;
import com.slate.kernel.ast.CompilationUnit;
import com.slate.kernel.ast.Node;
import com.slate.kernel.engine.KernelBuilder;
import com.slate.kernel.io.CompiledExpression;
import com.slate.kernel.io.ExpressionLoader;
import com.slate.kernel.io.JsonExpressionCompiler;
import com.slate.kernel.node.TensorBase;
import com.slate.kernel.transform.EigenTransformer;
import com.slate.kernel.util.KernelExplain;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * High-level entry point: loads expression definitions and turns them into
 * kernel compilation units.
 * <p>
 * This class handles:
 * <ul>
 * <li>Parsing JSON expression definitions</li>
 * <li>Building the expression DAG with {@link JsonExpressionCompiler}</li>
 * <li>Merging the default form compiler parameters with the definition's</li>
 * <li>Driving a {@link KernelBuilder} through finalize and construct</li>
 * </ul>
 */
public class SlateKernelCompiler {
    private static final Logger log = LogManager.getLogger(SlateKernelCompiler.class);

    private final TerminalFormCompiler formCompiler;
    private final KernelTransformer transformer;
    private final CompilerParameters defaults;

    /** Uses {@link EigenTransformer} for subkernels. */
    public SlateKernelCompiler(TerminalFormCompiler formCompiler) {
        this(formCompiler, new EigenTransformer());
    }

    public SlateKernelCompiler(TerminalFormCompiler formCompiler, KernelTransformer transformer) {
        this(formCompiler, transformer, CompilerParameters.defaults());
    }

    /**
     * @param defaults Parameters every definition starts from.
     */
    public SlateKernelCompiler(TerminalFormCompiler formCompiler, KernelTransformer transformer,
            CompilerParameters defaults) {
        if (formCompiler == null || transformer == null)
            throw new IllegalArgumentException("SlateKernelCompiler needs a form compiler and a transformer");
        this.formCompiler = formCompiler;
        this.transformer = transformer;
        this.defaults = defaults == null ? CompilerParameters.empty() : defaults;
    }

    public CompilerParameters defaults() {
        return defaults;
    }

    /**
     * Loads and compiles an expression definition.
     *
     * @throws IllegalArgumentException if the file cannot be read or is not a
     *                                  valid definition.
     */
    public CompiledExpression load(Path jsonPath) {
        try {
            return new JsonExpressionCompiler().compile(ExpressionLoader.parseFile(jsonPath));
        } catch (IOException e) {
            throw new IllegalArgumentException("Failed to load expression definition from " + jsonPath, e);
        }
    }

    public KernelBuilder builder(Path jsonPath) {
        return builder(load(jsonPath));
    }

    /** Builder for the expression root; definition parameters override the defaults. */
    public KernelBuilder builder(CompiledExpression expression) {
        return builder(expression.root(), expression.parameters());
    }

    public KernelBuilder builder(TensorBase expression, CompilerParameters parameters) {
        return new KernelBuilder(expression, defaults.merge(parameters), formCompiler, transformer);
    }

    /**
     * Finalizes a fresh builder for {@code expression} and constructs the
     * compilation unit with {@code macroKernels} appended.
     */
    public CompilationUnit compile(CompiledExpression expression, List<? extends Node> macroKernels) {
        KernelBuilder kb = builder(expression);
        kb.finalizeKernels();
        CompilationUnit unit = kb.construct(macroKernels);
        log.info("Compiled expression {}: {}, {} subkernels, {} macro kernels",
                expression.name(), new KernelExplain(kb).summary(),
                kb.finalizedKernels().size(), macroKernels.size());
        return unit;
    }

    public CompilationUnit compile(Path jsonPath, List<? extends Node> macroKernels) {
        return compile(load(jsonPath), macroKernels);
    }
}
