package com.slate.kernel.halo;

/** The group of processes sharing a partitioned data layout. */
public interface Communicator {

    int size();

    int rank();
}
