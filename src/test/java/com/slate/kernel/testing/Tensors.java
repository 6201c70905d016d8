package com.slate.kernel.testing;

import com.slate.kernel.form.Coefficient;
import com.slate.kernel.form.Form;
import com.slate.kernel.form.FunctionSpace;
import com.slate.kernel.node.Tensor;

import java.util.ArrayList;
import java.util.List;

/**
 * Shortcuts for building terminal tensors in tests.
 */
public final class Tensors {
    public static final FunctionSpace P1 = FunctionSpace.of("P1", 3);
    public static final FunctionSpace P2 = FunctionSpace.of("P2", 6);

    private Tensors() {
        // Utility class
    }

    /** Rank-2 tensor on P1 x P1 without coefficients. */
    public static Tensor matrix(String name) {
        return tensor(name, List.of(P1, P1));
    }

    /** Rank-1 tensor on P1. */
    public static Tensor vector(String name) {
        return tensor(name, List.of(P1));
    }

    public static Tensor tensor(String name, List<FunctionSpace> arguments, Coefficient... coefficients) {
        return new Tensor(Form.cell(name, arguments, new ArrayList<>(List.of(coefficients))));
    }
}
