package com.tracking.engine.geofence;

import java.util.List;

/**
 * Difference between two consecutive monitored sets.
 *
 * @param added     regions newly registered with the platform
 * @param removed   regions unregistered from the platform
 * @param monitored the full monitored set after the change
 */
public record MonitoredSetChange(List<String> added, List<String> removed, List<String> monitored) {

    public MonitoredSetChange {
        added = List.copyOf(added);
        removed = List.copyOf(removed);
        monitored = List.copyOf(monitored);
    }
}
