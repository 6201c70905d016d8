package com.slate.kernel.halo;

/**
 * A partitioned data layout: topology plus the number of values per mesh
 * entity, from which the exchange graph and global numbering derive.
 */
public interface HaloLayout {

    Communicator communicator();

    /**
     * Builds the exchange graph for this layout. Input and output of an
     * exchange share one buffer, so roots that reference the local process
     * are pruned from the returned graph.
     */
    StarForest createStarForest();

    /** Global index of every local data slot. */
    int[] localToGlobalNumbering();
}
