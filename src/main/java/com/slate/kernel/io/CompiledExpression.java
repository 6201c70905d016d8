package com.slate.kernel.io;

import com.slate.kernel.api.CompilerParameters;
import com.slate.kernel.form.Coefficient;
import com.slate.kernel.node.TensorBase;

import java.util.Map;

/**
 * An expression DAG built from a definition, with name lookups.
 *
 * @param name         Expression name from the definition.
 * @param root         The node named as root.
 * @param nodesByName  Every tensor and operator node, in definition order.
 * @param coefficients Every coefficient, in definition order.
 * @param parameters   Form compiler parameters given in the definition.
 */
public record CompiledExpression(String name, TensorBase root, Map<String, TensorBase> nodesByName,
        Map<String, Coefficient> coefficients, CompilerParameters parameters) {

    /**
     * Type-safe lookup of a node by name.
     *
     * @throws IllegalArgumentException if there is no such node.
     */
    @SuppressWarnings("unchecked")
    public <T extends TensorBase> T node(String nodeName) {
        TensorBase node = nodesByName.get(nodeName);
        if (node == null)
            throw new IllegalArgumentException("Unknown node: " + nodeName);
        return (T) node;
    }

    public Coefficient coefficient(String coefficientName) {
        Coefficient c = coefficients.get(coefficientName);
        if (c == null)
            throw new IllegalArgumentException("Unknown coefficient: " + coefficientName);
        return c;
    }
}
