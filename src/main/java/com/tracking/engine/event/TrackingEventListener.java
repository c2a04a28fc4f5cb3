package com.tracking.engine.event;

import com.tracking.engine.dto.GeofenceEvent;
import com.tracking.engine.dto.SessionSnapshot;
import com.tracking.engine.geofence.MonitoredSetChange;
import com.tracking.engine.platform.TransportType;

/**
 * Receiver of outbound tracking events. Every method defaults to a no-op so
 * listeners implement only what they need.
 *
 * Callbacks run on the publishing thread (usually the session thread) and
 * must return quickly.
 */
public interface TrackingEventListener {

    default void onLocation(LocationEvent event) {
    }

    default void onMotionChange(MotionChangeEvent event) {
    }

    default void onGeofence(GeofenceEvent event) {
    }

    default void onGeofencesChange(MonitoredSetChange change) {
    }

    default void onHttp(HttpEvent event) {
    }

    default void onActivityChange(ActivityChangeEvent event) {
    }

    default void onError(TrackingError error) {
    }

    default void onConnectivityChange(TransportType transport) {
    }

    default void onEnabledChange(boolean enabled) {
    }

    default void onHeartbeat(SessionSnapshot snapshot) {
    }
}
