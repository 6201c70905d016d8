package com.slate.kernel.node;

/** Elementwise negation. */
public final class Negative extends TensorOp {

    public Negative(TensorBase a) {
        super(require(a, "Negative").shape(), a);
    }
}
