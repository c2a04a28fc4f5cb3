package com.tracking.engine.geofence;

import com.tracking.engine.config.GeofenceConfig;
import com.tracking.engine.dto.GeofenceEvent;
import com.tracking.engine.dto.GeofenceRegion;
import com.tracking.engine.dto.LocationSample;
import com.tracking.engine.dto.NativeGeofenceEvent;
import com.tracking.engine.platform.NativeGeofenceService;
import com.tracking.engine.platform.TimerService;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Keeps the platform's geofence monitor pointed at the N registered regions
 * nearest to the device, and tracks membership of the monitored ones.
 *
 * Window update, on every accepted fix:
 * 1. Distance from the fix to every registered center
 * 2. Sort ascending, ties broken by registration order
 * 3. Target set = first min(N, registered) regions
 * 4. Unregister regions leaving the window, then register the newcomers
 * 5. One {@link MonitoredSetChange} if anything changed
 *
 * Membership, per monitored region:
 * OUTSIDE -> INSIDE (ENTER) -> DWELLING (DWELL, after the dwell delay) -> OUTSIDE (EXIT).
 * Containment is boundary inclusive. A region leaving the window is reset to
 * OUTSIDE without an event.
 *
 * In high-accuracy mode transitions are computed only from fixes and platform
 * events are logged. Otherwise platform events go through the same membership
 * machine, so an edge is reported once whichever source sees it first.
 *
 * Not thread-safe. Driven from the session thread.
 */
@Slf4j
public class GeofenceWindowManager {

    private final GeofenceConfig config;
    private final int capacity;
    private final NativeGeofenceService nativeService;
    private final TimerService timers;
    private final GeofenceListener listener;
    private final Clock clock;

    private final Map<String, Registration> registered = new LinkedHashMap<>();
    private final LinkedHashSet<String> monitored = new LinkedHashSet<>();
    private final Map<String, Membership> memberships = new HashMap<>();

    private long nextSequence;
    private LocationSample lastFix;

    public GeofenceWindowManager(GeofenceConfig config,
                                 int platformCapacity,
                                 NativeGeofenceService nativeService,
                                 TimerService timers,
                                 GeofenceListener listener,
                                 Clock clock) {
        this.config = config;
        this.capacity = config.effectiveCapacity(platformCapacity);
        this.nativeService = nativeService;
        this.timers = timers;
        this.listener = listener;
        this.clock = clock;
    }

    /**
     * Registers (or replaces) regions and refreshes the window once.
     */
    public void addAll(Collection<GeofenceRegion> regions) {
        Set<String> before = new LinkedHashSet<>(monitored);
        for (GeofenceRegion region : regions) {
            Registration previous = registered.remove(region.identifier());
            registered.put(region.identifier(), new Registration(region, nextSequence++));
            if (previous != null && monitored.contains(region.identifier())) {
                // geometry may have changed: re-register under the same id
                nativeService.unregister(region.identifier());
                nativeService.register(region);
                resetMembership(region.identifier());
                memberships.put(region.identifier(), new Membership());
            }
        }
        reconcile();
        notifyIfChanged(before);
    }

    public void add(GeofenceRegion region) {
        addAll(List.of(region));
    }

    /**
     * Removes a region. Returns false when it was not registered.
     */
    public boolean remove(String identifier) {
        if (!registered.containsKey(identifier)) {
            return false;
        }
        Set<String> before = new LinkedHashSet<>(monitored);
        dropRegion(identifier);
        reconcile();
        notifyIfChanged(before);
        return true;
    }

    /**
     * Removes every region and unregisters the whole monitored set.
     */
    public void removeAll() {
        Set<String> before = new LinkedHashSet<>(monitored);
        for (String identifier : new ArrayList<>(monitored)) {
            unmonitor(identifier);
        }
        registered.clear();
        notifyIfChanged(before);
    }

    /**
     * Unregisters the monitored set from the platform but keeps the registry,
     * so a later {@link #resume()} can rebuild the window.
     */
    public void suspend() {
        Set<String> before = new LinkedHashSet<>(monitored);
        for (String identifier : new ArrayList<>(monitored)) {
            unmonitor(identifier);
        }
        lastFix = null;
        notifyIfChanged(before);
    }

    public void resume() {
        Set<String> before = new LinkedHashSet<>(monitored);
        reconcile();
        notifyIfChanged(before);
    }

    /**
     * Moves the window around {@code fix} and evaluates membership transitions.
     */
    public void onFix(LocationSample fix) {
        lastFix = fix;
        Set<String> before = new LinkedHashSet<>(monitored);
        reconcile();

        List<String> knockedOut = new ArrayList<>();
        List<String> pending = new ArrayList<>(monitored);
        while (!pending.isEmpty()) {
            List<String> dropped = new ArrayList<>();
            for (String identifier : pending) {
                if (evaluate(registered.get(identifier).region(), fix)) {
                    dropped.add(identifier);
                }
            }
            if (dropped.isEmpty()) {
                break;
            }
            dropped.forEach(this::dropRegion);
            knockedOut.addAll(dropped);
            Set<String> kept = new LinkedHashSet<>(monitored);
            reconcile();
            // regions pulled into the freed slots see this fix too
            pending = monitored.stream().filter(id -> !kept.contains(id)).toList();
        }
        notifyIfChanged(before);
        knockedOut.forEach(listener::onRegionKnockedOut);
    }

    /**
     * Applies a platform geofence event, or only logs it in high-accuracy mode.
     */
    public void onNativeEvent(NativeGeofenceEvent event) {
        if (config.highAccuracy()) {
            log.info("Native {} for {} logged only, high-accuracy evaluation is authoritative",
                    event.action(), event.identifier());
            return;
        }
        Membership membership = memberships.get(event.identifier());
        Registration registration = registered.get(event.identifier());
        if (membership == null || registration == null) {
            log.debug("Native {} for unmonitored region {} ignored", event.action(), event.identifier());
            return;
        }
        GeofenceRegion region = registration.region();
        Instant at = event.timestamp() != null ? event.timestamp() : clock.instant();
        membership.evaluated = true;

        switch (event.action()) {
            case ENTER -> {
                if (membership.state == MembershipState.OUTSIDE) {
                    enter(region, membership, lastFix, at, true);
                }
            }
            case DWELL -> {
                if (membership.state == MembershipState.INSIDE) {
                    dwell(region, membership, lastFix, at);
                }
            }
            case EXIT -> {
                if (membership.state.inside()) {
                    exit(region, membership, lastFix, at);
                    if (config.knockOut()) {
                        Set<String> before = new LinkedHashSet<>(monitored);
                        dropRegion(region.identifier());
                        reconcile();
                        notifyIfChanged(before);
                        listener.onRegionKnockedOut(region.identifier());
                    }
                }
            }
        }
    }

    /**
     * @return true when the region must be knocked out after this evaluation
     */
    private boolean evaluate(GeofenceRegion region, LocationSample fix) {
        Membership membership = memberships.get(region.identifier());
        boolean inside = region.contains(fix);
        boolean firstEvaluation = !membership.evaluated;
        membership.evaluated = true;

        if (inside && membership.state == MembershipState.OUTSIDE) {
            boolean notify = !firstEvaluation || config.initialTriggerEntry();
            enter(region, membership, fix, fix.timestamp(), notify);
        } else if (inside && membership.state == MembershipState.INSIDE) {
            Duration insideFor = Duration.between(membership.insideSince, fix.timestamp());
            if (insideFor.compareTo(dwellDelay(region)) >= 0) {
                dwell(region, membership, fix, fix.timestamp());
            }
        } else if (!inside && membership.state.inside()) {
            exit(region, membership, fix, fix.timestamp());
            return config.knockOut();
        }
        return false;
    }

    private void enter(GeofenceRegion region, Membership membership, LocationSample fix, Instant at, boolean notify) {
        membership.state = MembershipState.INSIDE;
        membership.insideSince = at;
        if (notify && region.notifyOnEntry()) {
            emit(region, GeofenceAction.ENTER, fix, at);
        } else {
            log.debug("Entered {} silently", region.identifier());
        }
        String identifier = region.identifier();
        membership.dwellTimer = timers.schedule(dwellDelay(region), () -> onDwellTimer(identifier, membership));
    }

    private void onDwellTimer(String identifier, Membership membership) {
        membership.dwellTimer = null;
        Registration registration = registered.get(identifier);
        if (registration != null
                && memberships.get(identifier) == membership
                && membership.state == MembershipState.INSIDE) {
            dwell(registration.region(), membership, lastFix, clock.instant());
        }
    }

    private void dwell(GeofenceRegion region, Membership membership, LocationSample fix, Instant at) {
        cancelDwellTimer(membership);
        membership.state = MembershipState.DWELLING;
        if (region.notifyOnDwell()) {
            emit(region, GeofenceAction.DWELL, fix, at);
        }
    }

    private void exit(GeofenceRegion region, Membership membership, LocationSample fix, Instant at) {
        cancelDwellTimer(membership);
        membership.state = MembershipState.OUTSIDE;
        membership.insideSince = null;
        if (region.notifyOnExit()) {
            emit(region, GeofenceAction.EXIT, fix, at);
        }
    }

    private void emit(GeofenceRegion region, GeofenceAction action, LocationSample fix, Instant at) {
        GeofenceEvent event = new GeofenceEvent(region.identifier(), action, fix, region.extras(), at);
        log.info("Geofence {}", event.toLogString());
        listener.onGeofenceEvent(event);
    }

    private Duration dwellDelay(GeofenceRegion region) {
        return region.loiteringDelay() > 0
            ? Duration.ofMillis(region.loiteringDelay())
            : config.dwellDelay();
    }

    /**
     * Brings the monitored set in line with the target window. Unregisters first
     * so the platform never holds more than N regions.
     */
    private void reconcile() {
        List<String> target = targetWindow();

        for (String identifier : new ArrayList<>(monitored)) {
            if (!target.contains(identifier)) {
                unmonitor(identifier);
            }
        }
        for (String identifier : target) {
            if (monitored.add(identifier)) {
                nativeService.register(registered.get(identifier).region());
                memberships.put(identifier, new Membership());
            }
        }
    }

    private List<String> targetWindow() {
        if (lastFix == null) {
            // no position yet: keep what is monitored and fill up in registration order
            List<String> target = new ArrayList<>();
            for (String identifier : monitored) {
                if (registered.containsKey(identifier)) {
                    target.add(identifier);
                }
            }
            for (String identifier : registered.keySet()) {
                if (target.size() >= capacity) {
                    break;
                }
                if (!target.contains(identifier)) {
                    target.add(identifier);
                }
            }
            return target;
        }

        LocationSample fix = lastFix;
        return registered.values().stream()
            .sorted(Comparator
                .comparingDouble((Registration r) -> r.region().distanceFromCenter(fix))
                .thenComparingLong(Registration::sequence))
            .limit(capacity)
            .map(r -> r.region().identifier())
            .toList();
    }

    private void dropRegion(String identifier) {
        registered.remove(identifier);
        if (monitored.contains(identifier)) {
            unmonitor(identifier);
        }
    }

    private void unmonitor(String identifier) {
        monitored.remove(identifier);
        nativeService.unregister(identifier);
        resetMembership(identifier);
    }

    private void resetMembership(String identifier) {
        Membership membership = memberships.remove(identifier);
        if (membership != null) {
            cancelDwellTimer(membership);
        }
    }

    private void cancelDwellTimer(Membership membership) {
        if (membership.dwellTimer != null) {
            membership.dwellTimer.cancel();
            membership.dwellTimer = null;
        }
    }

    private void notifyIfChanged(Set<String> before) {
        List<String> added = monitored.stream().filter(id -> !before.contains(id)).toList();
        List<String> removed = before.stream().filter(id -> !monitored.contains(id)).toList();
        if (added.isEmpty() && removed.isEmpty()) {
            return;
        }
        MonitoredSetChange change = new MonitoredSetChange(added, removed, new ArrayList<>(monitored));
        log.info("Monitored geofences changed: +{} -{} (now {})", added.size(), removed.size(), monitored.size());
        listener.onMonitoredSetChanged(change);
    }

    /**
     * True when the provider should stay in high-accuracy mode for geofencing.
     */
    public boolean requiresHighAccuracy() {
        return config.highAccuracy() && !monitored.isEmpty();
    }

    public List<String> monitoredIdentifiers() {
        return List.copyOf(monitored);
    }

    public List<GeofenceRegion> registeredRegions() {
        return registered.values().stream().map(Registration::region).toList();
    }

    public MembershipState membership(String identifier) {
        Membership membership = memberships.get(identifier);
        return membership == null ? MembershipState.OUTSIDE : membership.state;
    }

    public int capacity() {
        return capacity;
    }

    private record Registration(GeofenceRegion region, long sequence) {
    }

    private static final class Membership {
        private MembershipState state = MembershipState.OUTSIDE;
        private Instant insideSince;
        private TimerService.TimerHandle dwellTimer;
        private boolean evaluated;
    }
}
