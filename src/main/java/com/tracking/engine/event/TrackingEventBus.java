package com.tracking.engine.event;

import com.tracking.engine.dto.GeofenceEvent;
import com.tracking.engine.dto.SessionSnapshot;
import com.tracking.engine.geofence.MonitoredSetChange;
import com.tracking.engine.platform.TransportType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Fan-out of tracking events to subscribed listeners.
 *
 * Subscriptions are explicit: {@link #subscribe} returns a handle whose
 * {@link Subscription#close()} removes the listener. A failing listener is
 * logged and does not prevent delivery to the others.
 */
@Component
@Slf4j
public class TrackingEventBus {

    private final List<TrackingEventListener> listeners = new CopyOnWriteArrayList<>();

    public Subscription subscribe(TrackingEventListener listener) {
        listeners.add(listener);
        log.debug("Listener subscribed: {} ({} total)", listener.getClass().getSimpleName(), listeners.size());
        return () -> {
            if (listeners.remove(listener)) {
                log.debug("Listener unsubscribed: {}", listener.getClass().getSimpleName());
            }
        };
    }

    public int listenerCount() {
        return listeners.size();
    }

    public void publishLocation(LocationEvent event) {
        dispatch("location", l -> l.onLocation(event));
    }

    public void publishMotionChange(MotionChangeEvent event) {
        dispatch("motionchange", l -> l.onMotionChange(event));
    }

    public void publishGeofence(GeofenceEvent event) {
        dispatch("geofence", l -> l.onGeofence(event));
    }

    public void publishGeofencesChange(MonitoredSetChange change) {
        dispatch("geofenceschange", l -> l.onGeofencesChange(change));
    }

    public void publishHttp(HttpEvent event) {
        dispatch("http", l -> l.onHttp(event));
    }

    public void publishActivityChange(ActivityChangeEvent event) {
        dispatch("activitychange", l -> l.onActivityChange(event));
    }

    public void publishError(TrackingError error) {
        log.warn("Tracking error {}: {}", error.kind(), error.message());
        dispatch("error", l -> l.onError(error));
    }

    public void publishConnectivityChange(TransportType transport) {
        dispatch("connectivitychange", l -> l.onConnectivityChange(transport));
    }

    public void publishEnabledChange(boolean enabled) {
        dispatch("enabledchange", l -> l.onEnabledChange(enabled));
    }

    public void publishHeartbeat(SessionSnapshot snapshot) {
        dispatch("heartbeat", l -> l.onHeartbeat(snapshot));
    }

    private void dispatch(String eventName, Consumer<TrackingEventListener> delivery) {
        for (TrackingEventListener listener : listeners) {
            try {
                delivery.accept(listener);
            } catch (RuntimeException e) {
                log.error("Listener {} failed on {} event", listener.getClass().getSimpleName(), eventName, e);
            }
        }
    }

    /**
     * Handle returned by {@link #subscribe}. Closing it twice is harmless.
     */
    @FunctionalInterface
    public interface Subscription extends AutoCloseable {

        @Override
        void close();
    }
}
