package com.slate.kernel.node;

import com.slate.kernel.form.Coefficient;

import java.util.Arrays;
import java.util.List;

/**
 * Application of a tensor to an already assembled coefficient.
 *
 * <p>
 * The coefficient is not a DAG operand: the only operand edge is the tensor.
 * The driver must copy the acting coefficient into a local temporary before
 * the product can be formed, so every action is materialized regardless of
 * how often it is referenced.
 */
public final class Action extends TensorOp {
    private final Coefficient coefficient;

    public Action(TensorBase tensor, Coefficient coefficient) {
        super(actionShape(tensor, coefficient), tensor);
        this.coefficient = coefficient;
    }

    private static int[] actionShape(TensorBase tensor, Coefficient coefficient) {
        int[] s = require(tensor, "Action").shape();
        if (coefficient == null)
            throw new IllegalArgumentException("Action needs a coefficient");
        if (s.length == 0 || s[s.length - 1] != coefficient.space().dimension())
            throw new IllegalArgumentException("Cannot act tensor of shape " + Arrays.toString(s)
                    + " on coefficient " + coefficient.name() + " of dimension "
                    + coefficient.space().dimension());
        return Arrays.copyOf(s, s.length - 1);
    }

    public TensorBase tensor() {
        return operands().get(0);
    }

    public Coefficient coefficient() {
        return coefficient;
    }

    @Override
    protected List<Coefficient> ownCoefficients() {
        return List.of(coefficient);
    }
}
