package com.slate.kernel.halo;

/**
 * Precomputed communication graph between owned ("root") data slots and
 * their ghost ("leaf") copies on other processes.
 */
public interface StarForest {

    enum Type {
        BASIC,
        WINDOW,
        NEIGHBOR
    }

    Type type();

    /**
     * Starts moving values along the graph: roots to leaves, or leaves to
     * roots when {@code reverse} is set.
     */
    void exchangeBegin(Dat dat, ExchangeDatatype datatype, boolean reverse);

    void exchangeEnd(Dat dat, ExchangeDatatype datatype, boolean reverse);
}
