package com.tracking.engine.config;

/**
 * What the location filter does with a fix that fails a check.
 */
public enum FilterPolicy {

    /** Drop the fix and publish one FILTER_REJECTED error. */
    DISCARD,

    /** Drop the fix silently. */
    IGNORE,

    /** Keep the new timestamp but substitute the last accepted geometry. */
    ADJUST
}
