package com.slate.kernel.halo;

/**
 * Datatype descriptor used for one exchange: a base type, repeated
 * contiguously {@code blockSize} times per slot.
 */
public record ExchangeDatatype(ScalarType scalarType, int blockSize, String baseType) {

    public boolean isContiguous() {
        return blockSize > 1;
    }

    /** E.g. {@code MPI_DOUBLE} or {@code contiguous(3, MPI_DOUBLE)}. */
    public String describe() {
        return isContiguous() ? "contiguous(" + blockSize + ", " + baseType + ")" : baseType;
    }
}
