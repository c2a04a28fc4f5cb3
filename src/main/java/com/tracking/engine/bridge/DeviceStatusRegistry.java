package com.tracking.engine.bridge;

import com.tracking.engine.platform.ConnectivityMonitor;
import com.tracking.engine.platform.PermissionChecker;
import com.tracking.engine.platform.TransportType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Last connectivity and authorization status reported by the device.
 *
 * Until the device reports otherwise, the transport is assumed to be WIFI and
 * location permission granted.
 */
@Component
@Slf4j
public class DeviceStatusRegistry implements ConnectivityMonitor, PermissionChecker {

    private final AtomicReference<TransportType> transport = new AtomicReference<>(TransportType.WIFI);
    private final AtomicBoolean locationPermitted = new AtomicBoolean(true);

    /**
     * @return the previous transport
     */
    public TransportType updateTransport(TransportType current) {
        TransportType previous = transport.getAndSet(current);
        if (previous != current) {
            log.info("Connectivity changed: {} -> {}", previous, current);
        }
        return previous;
    }

    public void updateAuthorization(boolean granted) {
        boolean previous = locationPermitted.getAndSet(granted);
        if (previous != granted) {
            log.info("Location authorization changed: {}", granted ? "granted" : "denied");
        }
    }

    @Override
    public TransportType currentTransport() {
        return transport.get();
    }

    @Override
    public boolean locationPermitted() {
        return locationPermitted.get();
    }
}
