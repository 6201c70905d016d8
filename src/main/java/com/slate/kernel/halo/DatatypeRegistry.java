package com.slate.kernel.halo;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import lombok.extern.log4j.Log4j2;

/**
 * Process-wide cache of exchange datatypes, one per (element type, block size).
 *
 * <p>
 * Entries are built on first use and kept for the lifetime of the process;
 * the key space is small and fixed, so there is no eviction.
 */
@Log4j2
public final class DatatypeRegistry {
    private static final Map<Key, ExchangeDatatype> TYPES = new ConcurrentHashMap<>();

    private record Key(ScalarType scalarType, int blockSize) {
    }

    private DatatypeRegistry() {
        // Utility class
    }

    public static ExchangeDatatype get(Dat dat) {
        return get(dat.dtype(), dat.cdim());
    }

    /**
     * @throws UnsupportedOperationException if the element type has no
     *                                       communication base type.
     * @throws IllegalArgumentException      if the block size is not positive.
     */
    public static ExchangeDatatype get(ScalarType scalarType, int blockSize) {
        if (scalarType == null)
            throw new IllegalArgumentException("Exchange datatype needs an element type");
        if (blockSize < 1)
            throw new IllegalArgumentException("Block size must be positive, got " + blockSize);
        return TYPES.computeIfAbsent(new Key(scalarType, blockSize), DatatypeRegistry::create);
    }

    private static ExchangeDatatype create(Key key) {
        String base = key.scalarType().baseType();
        if (base == null)
            throw new UnsupportedOperationException("Unknown base type " + key.scalarType());
        var type = new ExchangeDatatype(key.scalarType(), key.blockSize(), base);
        log.debug("Created exchange datatype {}", type.describe());
        return type;
    }

    static int size() {
        return TYPES.size();
    }
}
