package com.tracking.engine.geofence;

/**
 * Per-region membership. DWELLING implies inside.
 */
public enum MembershipState {
    OUTSIDE,
    INSIDE,
    DWELLING;

    public boolean inside() {
        return this != OUTSIDE;
    }
}
