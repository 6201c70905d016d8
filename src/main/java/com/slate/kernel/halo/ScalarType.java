package com.slate.kernel.halo;

/**
 * Element types of distributed arrays, with the name of the matching
 * communication base type where one exists.
 */
public enum ScalarType {
    FLOAT64("MPI_DOUBLE"),
    FLOAT32("MPI_FLOAT"),
    INT32("MPI_INT"),
    INT64("MPI_LONG"),
    COMPLEX128("MPI_C_DOUBLE_COMPLEX"),
    FLOAT16(null);

    private final String baseType;

    ScalarType(String baseType) {
        this.baseType = baseType;
    }

    /** Communication base type name, or null when there is none. */
    public String baseType() {
        return baseType;
    }
}
