package com.slate.kernel.halo;

/**
 * How values arriving in a ghost exchange combine with the values already in
 * the destination slots.
 */
public enum InsertMode {
    READ,
    /** Overwrite destination values. */
    WRITE,
    RW,
    /** Accumulate into destination values. */
    INC,
    MIN,
    MAX
}
