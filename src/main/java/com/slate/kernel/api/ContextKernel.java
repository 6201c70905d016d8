package com.slate.kernel.api;

import com.slate.kernel.node.Tensor;

import java.util.List;

/**
 * The form compiler's output for one terminal tensor and one original
 * integral type: all generated split kernels plus the information needed to
 * call them from the driver.
 *
 * @param tensor               The terminal tensor the kernels compute.
 * @param originalIntegralType Integral type as written in the form.
 * @param kernels              Generated split kernels, in form compiler order.
 */
public record ContextKernel(Tensor tensor, IntegralType originalIntegralType, List<SplitKernel> kernels) {

    public ContextKernel {
        if (tensor == null)
            throw new IllegalArgumentException("ContextKernel needs its terminal tensor");
        kernels = kernels == null ? List.of() : List.copyOf(kernels);
    }
}
