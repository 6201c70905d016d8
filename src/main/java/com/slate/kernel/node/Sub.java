package com.slate.kernel.node;

import java.util.Arrays;

/** Elementwise difference of two tensors of equal shape. */
public final class Sub extends TensorOp {

    public Sub(TensorBase a, TensorBase b) {
        super(checkShape(a, b), a, b);
    }

    private static int[] checkShape(TensorBase a, TensorBase b) {
        require(a, "Sub");
        require(b, "Sub");
        if (!Arrays.equals(a.shape(), b.shape()))
            throw shapeError("Sub", a, b);
        return a.shape();
    }
}
