package com.slate.kernel.halo;

import lombok.extern.log4j.Log4j2;

/**
 * Ghost data exchange for one data layout.
 *
 * <p>
 * Only two directions are supported: global-to-local with {@link InsertMode#WRITE}
 * (owners overwrite ghosts) and local-to-global with {@link InsertMode#INC}
 * (ghost contributions are added to owners). On a single process every
 * operation is a no-op. The exchange graph is built on first use and reused
 * for the lifetime of the halo.
 */
@Log4j2
public final class Halo {
    private final HaloLayout layout;

    private StarForest sf;
    private int[] localToGlobal;

    public Halo(HaloLayout layout) {
        if (layout == null)
            throw new IllegalArgumentException("Halo needs a data layout");
        this.layout = layout;
    }

    /**
     * The exchange graph, created once.
     *
     * @throws UnsupportedOperationException if the layout yields a non-basic
     *                                       graph; windowed graphs are known to
     *                                       misbehave with some MPI stacks.
     */
    public StarForest sf() {
        if (sf == null) {
            StarForest created = layout.createStarForest();
            if (created.type() != StarForest.Type.BASIC)
                throw new UnsupportedOperationException(
                        "Star forest type " + created.type() + " is not supported; use BASIC");
            sf = created;
            log.debug("Created exchange graph for {}", layout);
        }
        return sf;
    }

    public Communicator comm() {
        return layout.communicator();
    }

    /** Global index of every local data slot; a fresh copy on each call. */
    public int[] localToGlobalNumbering() {
        if (localToGlobal == null)
            localToGlobal = layout.localToGlobalNumbering();
        return localToGlobal.clone();
    }

    public void globalToLocalBegin(Dat dat, InsertMode mode) {
        requireMode(mode, InsertMode.WRITE, "global-to-local");
        if (isSerial())
            return;
        sf().exchangeBegin(dat, DatatypeRegistry.get(dat), false);
    }

    public void globalToLocalEnd(Dat dat, InsertMode mode) {
        requireMode(mode, InsertMode.WRITE, "global-to-local");
        if (isSerial())
            return;
        sf().exchangeEnd(dat, DatatypeRegistry.get(dat), false);
    }

    public void localToGlobalBegin(Dat dat, InsertMode mode) {
        requireMode(mode, InsertMode.INC, "local-to-global");
        if (isSerial())
            return;
        sf().exchangeBegin(dat, DatatypeRegistry.get(dat), true);
    }

    public void localToGlobalEnd(Dat dat, InsertMode mode) {
        requireMode(mode, InsertMode.INC, "local-to-global");
        if (isSerial())
            return;
        sf().exchangeEnd(dat, DatatypeRegistry.get(dat), true);
    }

    private boolean isSerial() {
        return comm().size() == 1;
    }

    private static void requireMode(InsertMode mode, InsertMode expected, String direction) {
        if (mode != expected)
            throw new UnsupportedOperationException("Only " + expected + " " + direction
                    + " exchanges are supported, got " + mode);
    }
}
