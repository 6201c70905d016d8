package com.slate.kernel.halo;

/**
 * Handle to a distributed array whose ghost entries a {@link Halo}
 * synchronises.
 */
public interface Dat {

    String name();

    ScalarType dtype();

    /** Number of values stored per data slot. */
    int cdim();
}
