package com.slate.kernel.form;

import java.util.Comparator;
import java.util.concurrent.atomic.AtomicLong;

/**
 * An external, already assembled function that an expression depends on.
 *
 * <p>
 * Coefficients are compared by identity. Each one is stamped with a creation
 * count on construction; expressions list their coefficients sorted by this
 * count, which gives every participant that builds the same coefficients in
 * the same order the same canonical numbering.
 */
public final class Coefficient {
    private static final AtomicLong COUNTER = new AtomicLong();

    /** Orders coefficients by creation count. */
    public static final Comparator<Coefficient> BY_COUNT = Comparator.comparingLong(Coefficient::count);

    private final String name;
    private final FunctionSpace space;
    private final long count;

    public Coefficient(String name, FunctionSpace space) {
        if (space == null)
            throw new IllegalArgumentException("Coefficient " + name + " needs a function space");
        this.name = name;
        this.space = space;
        this.count = COUNTER.getAndIncrement();
    }

    public String name() {
        return name;
    }

    public FunctionSpace space() {
        return space;
    }

    public long count() {
        return count;
    }

    @Override
    public String toString() {
        return name + "#" + count;
    }
}
