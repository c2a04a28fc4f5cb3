package com.tracking.engine.event;

import com.tracking.engine.dto.GeofenceEvent;
import com.tracking.engine.dto.SessionSnapshot;
import com.tracking.engine.geofence.MonitoredSetChange;
import com.tracking.engine.platform.TransportType;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.MessagingException;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Map;

/**
 * Broadcasts every session event to its STOMP topic.
 *
 * Topics: /topic/location, /topic/motionchange, /topic/geofence,
 * /topic/geofenceschange, /topic/http, /topic/activitychange, /topic/error,
 * /topic/connectivitychange, /topic/enabledchange, /topic/heartbeat
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StompEventForwarder implements TrackingEventListener {

    static final String TOPIC_PREFIX = "/topic/";

    private final TrackingEventBus eventBus;
    private final SimpMessagingTemplate messagingTemplate;

    private TrackingEventBus.Subscription subscription;

    @PostConstruct
    void subscribe() {
        subscription = eventBus.subscribe(this);
    }

    @PreDestroy
    void unsubscribe() {
        if (subscription != null) {
            subscription.close();
        }
    }

    @Override
    public void onLocation(LocationEvent event) {
        send("location", event);
    }

    @Override
    public void onMotionChange(MotionChangeEvent event) {
        send("motionchange", event);
    }

    @Override
    public void onGeofence(GeofenceEvent event) {
        send("geofence", event);
    }

    @Override
    public void onGeofencesChange(MonitoredSetChange change) {
        send("geofenceschange", change);
    }

    @Override
    public void onHttp(HttpEvent event) {
        send("http", event);
    }

    @Override
    public void onActivityChange(ActivityChangeEvent event) {
        send("activitychange", event);
    }

    @Override
    public void onError(TrackingError error) {
        send("error", error);
    }

    @Override
    public void onConnectivityChange(TransportType transport) {
        send("connectivitychange", Map.of(
                "transport", transport,
                "connected", transport.connected(),
                "timestamp", Instant.now().toString()
        ));
    }

    @Override
    public void onEnabledChange(boolean enabled) {
        send("enabledchange", Map.of("enabled", enabled, "timestamp", Instant.now().toString()));
    }

    @Override
    public void onHeartbeat(SessionSnapshot snapshot) {
        send("heartbeat", snapshot);
    }

    private void send(String topic, Object payload) {
        try {
            messagingTemplate.convertAndSend(TOPIC_PREFIX + topic, payload);
        } catch (MessagingException e) {
            log.error("Failed to broadcast {} event: {}", topic, e.getMessage());
        }
    }
}
