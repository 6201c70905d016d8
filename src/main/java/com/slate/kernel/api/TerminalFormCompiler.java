package com.slate.kernel.api;

import com.slate.kernel.node.Tensor;

import java.util.List;

/**
 * The form compiler that lowers one terminal tensor to generated subkernels.
 *
 * <p>
 * Implementations are invoked synchronously, once per terminal tensor of an
 * expression, and must name every generated function with the given prefix so
 * that subkernels of different terminals never collide.
 */
@FunctionalInterface
public interface TerminalFormCompiler {

    /**
     * Compiles the form behind {@code tensor}.
     *
     * @param tensor     The terminal tensor to lower.
     * @param prefix     Name prefix for every generated function, e.g.
     *                   {@code "subkernel0_"}.
     * @param parameters Form compiler parameters, forwarded unchanged from the
     *                   kernel builder.
     * @return One context kernel per integral type present in the form.
     * @throws FormCompilationException if the form cannot be lowered.
     */
    List<ContextKernel> compile(Tensor tensor, String prefix, CompilerParameters parameters);
}
