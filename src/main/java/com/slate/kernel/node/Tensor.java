package com.slate.kernel.node;

import com.slate.kernel.api.IntegralType;
import com.slate.kernel.form.Coefficient;
import com.slate.kernel.form.Form;

import java.util.List;
import java.util.Set;

/**
 * Terminal node: the local element tensor of a single form. Each terminal is
 * handed on its own to the form compiler.
 */
public final class Tensor extends TensorBase {
    private final Form form;

    public Tensor(Form form) {
        super(requireForm(form).shape(), List.of());
        this.form = form;
    }

    private static Form requireForm(Form form) {
        if (form == null)
            throw new IllegalArgumentException("Tensor needs a form");
        return form;
    }

    public Form form() {
        return form;
    }

    public Set<IntegralType> integralTypes() {
        return form.integralTypes();
    }

    @Override
    public boolean isTerminal() {
        return true;
    }

    @Override
    protected List<Coefficient> ownCoefficients() {
        return form.coefficients();
    }

    @Override
    public String label() {
        return "Tensor(" + form.name() + ")";
    }
}
