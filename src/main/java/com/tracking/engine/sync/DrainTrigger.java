package com.tracking.engine.sync;

/**
 * What asked the sync pipeline to drain.
 */
public enum DrainTrigger {

    /** Records were inserted and auto-sync is on. */
    AUTO,

    /** The periodic sync timer fired. */
    SCHEDULED,

    /** The device regained (or changed) connectivity. */
    CONNECTIVITY,

    /** Explicit sync-now request. */
    MANUAL;

    /**
     * Triggers that may retry a parked batch.
     */
    public boolean unparks() {
        return this != AUTO;
    }
}
