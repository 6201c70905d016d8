package com.slate.kernel.api;

/**
 * Integral domain categories a form may contain.
 */
public enum IntegralType {
    CELL("cell"),
    EXTERIOR_FACET("exterior_facet"),
    INTERIOR_FACET("interior_facet"),
    // Extruded meshes only
    EXTERIOR_FACET_TOP("exterior_facet_top"),
    EXTERIOR_FACET_BOTTOM("exterior_facet_bottom"),
    INTERIOR_FACET_HORIZ("interior_facet_horiz");

    private final String value;

    IntegralType(String value) {
        this.value = value;
    }

    /** The canonical lower-case name, e.g. {@code "cell"}. */
    public String value() {
        return value;
    }

    public boolean isFacet() {
        return this != CELL;
    }

    public boolean isExtruded() {
        return this == EXTERIOR_FACET_TOP || this == EXTERIOR_FACET_BOTTOM || this == INTERIOR_FACET_HORIZ;
    }

    public static IntegralType fromString(String s) {
        for (IntegralType t : values()) {
            if (t.value.equalsIgnoreCase(s) || t.name().equalsIgnoreCase(s))
                return t;
        }
        throw new IllegalArgumentException("Unknown integral type: " + s);
    }

    @Override
    public String toString() {
        return value;
    }
}
