package com.slate.kernel.node;

import java.util.Arrays;

/** Inverse of a square rank-2 tensor. */
public final class Inverse extends TensorOp {

    public Inverse(TensorBase a) {
        super(checkSquare(a), a);
    }

    private static int[] checkSquare(TensorBase a) {
        int[] s = require(a, "Inverse").shape();
        if (s.length != 2 || s[0] != s[1])
            throw new IllegalArgumentException("Inverse needs a square matrix, got shape " + Arrays.toString(s));
        return s;
    }
}
