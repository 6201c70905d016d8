package com.slate.kernel.node;

/**
 * Tensor contraction over the last index of the left operand and the first
 * index of the right one (matrix-matrix and matrix-vector products).
 */
public final class Mul extends TensorOp {

    public Mul(TensorBase a, TensorBase b) {
        super(productShape(a, b), a, b);
    }

    private static int[] productShape(TensorBase a, TensorBase b) {
        require(a, "Mul");
        require(b, "Mul");
        int[] sa = a.shape(), sb = b.shape();
        if (sa.length == 0 || sb.length == 0 || sa[sa.length - 1] != sb[0])
            throw shapeError("Mul", a, b);
        int[] out = new int[sa.length - 1 + sb.length - 1];
        System.arraycopy(sa, 0, out, 0, sa.length - 1);
        System.arraycopy(sb, 1, out, sa.length - 1, sb.length - 1);
        return out;
    }
}
