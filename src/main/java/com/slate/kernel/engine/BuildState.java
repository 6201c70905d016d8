package com.slate.kernel.engine;

/**
 * Lifecycle of a {@link KernelBuilder}.
 */
public enum BuildState {
    /** Requirements may still be recorded; nothing has been emitted. */
    CONSTRUCTED,
    /** Subkernels are rewritten and frozen; the kernel can be constructed. */
    FINALIZED
}
