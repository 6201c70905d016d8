package com.slate.kernel.node;

/** Reverses the index order of its operand. */
public final class Transpose extends TensorOp {

    public Transpose(TensorBase a) {
        super(reversed(require(a, "Transpose").shape()), a);
    }

    private static int[] reversed(int[] shape) {
        int[] out = new int[shape.length];
        for (int i = 0; i < shape.length; i++)
            out[i] = shape[shape.length - 1 - i];
        return out;
    }
}
