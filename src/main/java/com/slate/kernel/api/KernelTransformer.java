package com.slate.kernel.api;

import com.slate.kernel.ast.Node;

/**
 * Rewrites a generated subkernel AST to the calling convention of the target
 * numerical library. Implementations must not mutate their input.
 */
@FunctionalInterface
public interface KernelTransformer {

    Node transform(Node kernel);
}
