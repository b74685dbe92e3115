package net.littleredcomputer.vmgraphs;

/** Stages of one graph generation run, in the order they are entered. */
public enum Phase {
    IDLE,
    LOADED,
    CLASSIFIED,
    PARTITIONED,
    /** Worker oracles are created and initialized, one at a time, on the coordinating thread. */
    INITIALIZING,
    RUNNING,
    MERGING,
    DONE,
    FAILED,
}
