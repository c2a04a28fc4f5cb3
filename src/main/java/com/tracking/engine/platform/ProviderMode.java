package com.tracking.engine.platform;

/**
 * Power mode requested from the location provider.
 */
public enum ProviderMode {

    /** Continuous fixes honoring the minimum distance. */
    HIGH_ACCURACY,

    /** Significant-change or cell-level updates only. */
    LOW_POWER
}
