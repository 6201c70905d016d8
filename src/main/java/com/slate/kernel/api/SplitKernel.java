package com.slate.kernel.api;

import java.util.List;

/**
 * A subkernel for one block of a (possibly mixed) form.
 *
 * @param indices Block indices within the mixed tensor; empty for non-mixed forms.
 * @param kinfo   The generated kernel and its metadata.
 */
public record SplitKernel(List<Integer> indices, KernelInfo kinfo) {

    public SplitKernel {
        if (kinfo == null)
            throw new IllegalArgumentException("SplitKernel needs kernel info");
        indices = indices == null ? List.of() : List.copyOf(indices);
    }
}
