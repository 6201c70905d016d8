package com.slate.kernel.form;

import com.slate.kernel.api.IntegralType;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * A variational form: the source of one terminal tensor.
 *
 * <p>
 * The arguments fix the rank and shape of the local tensor (one dimension per
 * argument space). The coefficients are the external functions the integrand
 * depends on, kept in canonical (creation count) order. The integral types
 * record which kinds of integrals appear, so callers can tell when facet data
 * will be needed.
 */
public final class Form {
    private final String name;
    private final List<FunctionSpace> arguments;
    private final List<Coefficient> coefficients;
    private final Set<IntegralType> integralTypes;

    public Form(String name, List<FunctionSpace> arguments, List<Coefficient> coefficients,
            Set<IntegralType> integralTypes) {
        if (arguments.size() > 2)
            throw new IllegalArgumentException("Form " + name + " has rank " + arguments.size()
                    + "; only rank 0, 1 and 2 forms are supported");
        this.name = name;
        this.arguments = List.copyOf(arguments);
        List<Coefficient> sorted = new ArrayList<>(coefficients);
        sorted.sort(Coefficient.BY_COUNT);
        this.coefficients = List.copyOf(sorted);
        this.integralTypes = integralTypes.isEmpty()
                ? EnumSet.of(IntegralType.CELL)
                : EnumSet.copyOf(integralTypes);
    }

    /** A form with cell integrals only. */
    public static Form cell(String name, List<FunctionSpace> arguments, List<Coefficient> coefficients) {
        return new Form(name, arguments, coefficients, EnumSet.of(IntegralType.CELL));
    }

    public String name() {
        return name;
    }

    public int rank() {
        return arguments.size();
    }

    public List<FunctionSpace> arguments() {
        return arguments;
    }

    public List<Coefficient> coefficients() {
        return coefficients;
    }

    public Set<IntegralType> integralTypes() {
        return integralTypes;
    }

    /** Local tensor shape: one entry per argument, the argument space dimension. */
    public int[] shape() {
        int[] shape = new int[arguments.size()];
        for (int i = 0; i < shape.length; i++)
            shape[i] = arguments.get(i).dimension();
        return shape;
    }

    @Override
    public String toString() {
        return "Form(" + name + ")";
    }
}
