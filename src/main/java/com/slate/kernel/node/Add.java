package com.slate.kernel.node;

import java.util.Arrays;

/** Elementwise sum of two tensors of equal shape. */
public final class Add extends TensorOp {

    public Add(TensorBase a, TensorBase b) {
        super(checkShape(a, b), a, b);
    }

    private static int[] checkShape(TensorBase a, TensorBase b) {
        require(a, "Add");
        require(b, "Add");
        if (!Arrays.equals(a.shape(), b.shape()))
            throw shapeError("Add", a, b);
        return a.shape();
    }
}
