package com.slate.kernel.form;

import java.util.List;

/**
 * A finite element function space as seen by a single cell.
 *
 * <p>
 * Only the information the kernel compiler needs is kept: the number of local
 * degrees of freedom, and whether the space is a mixed (product) space made of
 * component subspaces. A mixed space has exactly one local block per
 * component, and its dimension is the sum of the component dimensions.
 */
public final class FunctionSpace {
    private final String name;
    private final int dimension;
    private final List<FunctionSpace> components;

    private FunctionSpace(String name, int dimension, List<FunctionSpace> components) {
        this.name = name;
        this.dimension = dimension;
        this.components = components;
    }

    /**
     * Creates a non-mixed space.
     *
     * @param name      Human-readable name, used in diagnostics only.
     * @param dimension Number of local degrees of freedom on a cell.
     */
    public static FunctionSpace of(String name, int dimension) {
        if (dimension < 1)
            throw new IllegalArgumentException("Space " + name + " needs a positive dimension, got " + dimension);
        return new FunctionSpace(name, dimension, List.of());
    }

    /**
     * Creates a mixed space from its component spaces.
     * Components must themselves be non-mixed.
     */
    public static FunctionSpace mixed(String name, FunctionSpace... components) {
        return mixed(name, List.of(components));
    }

    public static FunctionSpace mixed(String name, List<FunctionSpace> components) {
        if (components.isEmpty())
            throw new IllegalArgumentException("Mixed space " + name + " needs at least one component");
        int dim = 0;
        for (FunctionSpace c : components) {
            if (c.isMixed())
                throw new IllegalArgumentException("Nested mixed space " + c.name() + " inside " + name);
            dim += c.dimension();
        }
        return new FunctionSpace(name, dim, List.copyOf(components));
    }

    public String name() {
        return name;
    }

    public int dimension() {
        return dimension;
    }

    public boolean isMixed() {
        return !components.isEmpty();
    }

    /**
     * Returns the component subspaces. A non-mixed space splits into itself.
     */
    public List<FunctionSpace> split() {
        return isMixed() ? components : List.of(this);
    }

    @Override
    public String toString() {
        return isMixed() ? name + components : name + "(" + dimension + ")";
    }
}
