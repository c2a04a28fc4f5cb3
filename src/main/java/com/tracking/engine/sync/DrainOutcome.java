package com.tracking.engine.sync;

/**
 * Immediate answer to a drain request. The upload itself runs asynchronously.
 */
public enum DrainOutcome {
    STARTED,
    DEFERRED,
    DISABLED,
    SKIPPED_OFFLINE,
    SKIPPED_CELLULAR,
    PARKED
}
