package com.redline.chain;

/** Lifecycle of one element of a chain. */
public enum ChainState {
    /** Not run yet. */
    PENDING,
    /** Its synchronous portion or the stage it returned is in progress. */
    RUNNING,
    /** Its portion is done and it has neither advanced nor interrupted the chain yet. */
    SUSPENDED,
    /** It called {@code next()}. */
    COMPLETED,
    /** It interrupted the chain, or failed. */
    INTERRUPTED,
    /** The chain has finished and its continuations have run. */
    FINISHED
}
