package com.slate.kernel.node;

import java.util.Arrays;
import java.util.List;

/**
 * Composite node combining one or more operand tensors.
 */
public abstract class TensorOp extends TensorBase {

    protected TensorOp(int[] shape, TensorBase... operands) {
        super(shape, List.of(operands));
    }

    @Override
    public final boolean isTerminal() {
        return false;
    }

    static TensorBase require(TensorBase operand, String op) {
        if (operand == null)
            throw new IllegalArgumentException(op + " needs a non-null operand");
        return operand;
    }

    static IllegalArgumentException shapeError(String op, TensorBase a, TensorBase b) {
        return new IllegalArgumentException("Incompatible shapes for " + op + ": "
                + Arrays.toString(a.shape()) + " and " + Arrays.toString(b.shape()));
    }
}
