package com.tracking.engine.service;

import com.tracking.engine.config.TrackingConfig;
import com.tracking.engine.config.TrackingExecutors;
import com.tracking.engine.config.TrackingProperties;
import com.tracking.engine.dto.AccelerometerSample;
import com.tracking.engine.dto.ActivityTransitionEvent;
import com.tracking.engine.dto.GeofenceEvent;
import com.tracking.engine.dto.GeofenceRegion;
import com.tracking.engine.dto.LocationSample;
import com.tracking.engine.dto.NativeGeofenceEvent;
import com.tracking.engine.dto.ProviderErrorEvent;
import com.tracking.engine.dto.RecordQuery;
import com.tracking.engine.dto.RecordView;
import com.tracking.engine.dto.SessionSnapshot;
import com.tracking.engine.dto.SessionStatus;
import com.tracking.engine.dto.TrackingMode;
import com.tracking.engine.entity.TrackingRecord;
import com.tracking.engine.event.ActivityChangeEvent;
import com.tracking.engine.event.LocationEvent;
import com.tracking.engine.event.MotionChangeEvent;
import com.tracking.engine.event.TrackingError;
import com.tracking.engine.event.TrackingEventBus;
import com.tracking.engine.exception.PermissionDeniedException;
import com.tracking.engine.exception.StoreException;
import com.tracking.engine.exception.TrackingErrorKind;
import com.tracking.engine.exception.TrackingException;
import com.tracking.engine.filter.ElasticityCalculator;
import com.tracking.engine.filter.FilterResult;
import com.tracking.engine.filter.LocationFilter;
import com.tracking.engine.geofence.GeofenceListener;
import com.tracking.engine.geofence.GeofenceWindowManager;
import com.tracking.engine.geofence.MonitoredSetChange;
import com.tracking.engine.motion.ActivityType;
import com.tracking.engine.motion.MotionListener;
import com.tracking.engine.motion.MotionState;
import com.tracking.engine.motion.MotionStateMachine;
import com.tracking.engine.platform.LocationProvider;
import com.tracking.engine.platform.MotionSensors;
import com.tracking.engine.platform.NativeGeofenceService;
import com.tracking.engine.platform.PermissionChecker;
import com.tracking.engine.platform.ProviderMode;
import com.tracking.engine.platform.TimerService;
import com.tracking.engine.platform.TransportType;
import com.tracking.engine.schedule.ScheduleWindows;
import com.tracking.engine.sync.DrainOutcome;
import com.tracking.engine.sync.DrainTrigger;
import com.tracking.engine.sync.SyncPipeline;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * The tracking session: lifecycle, routing and timers.
 *
 * Lifecycle: IDLE -> READY (configure) -> TRACKING (start) -> IDLE (stop).
 * {@code start()} from IDLE reuses the last accepted configuration.
 *
 * Every state change runs on the single session executor, in arrival order:
 * API calls, device streams, and timer callbacks all enqueue there. One fix is
 * processed completely before the next one starts:
 *
 * 1. Location filter (accuracy, implied speed, odometer eligibility)
 * 2. Odometer and elasticity update
 * 3. Geofence window and membership transitions
 * 4. Persist (bounded wait on the store executor)
 * 5. Publish, then ask the sync pipeline for an automatic drain
 *
 * Filter, motion machine and geofence manager are created per session and
 * rebuilt on reconfigure. The motion machine only emits intents; this class
 * applies them to the provider and sensors.
 *
 * With schedule windows the session stays TRACKING while sources are switched
 * on and off at window boundaries.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TrackingSessionService {

    private final TrackingConfigValidator configValidator;
    private final RecordStoreService recordStore;
    private final RetentionService retentionService;
    private final SyncPipeline syncPipeline;
    private final GeofenceRegistryService geofenceRegistry;
    private final SessionStateStore sessionStateStore;
    private final TrackingEventBus events;
    private final LocationProvider locationProvider;
    private final MotionSensors motionSensors;
    private final NativeGeofenceService nativeGeofences;
    private final TimerService timerService;
    private final PermissionChecker permissionChecker;
    private final TrackingExecutors executors;
    private final TrackingProperties properties;
    private final Clock clock;

    // Session-confined state, touched only on the session executor
    private SessionStatus status = SessionStatus.IDLE;
    private TrackingConfig config;
    private TrackingMode trackingMode;
    private boolean enabled;
    private boolean schedulerEnabled;

    private TimerService sessionTimers;
    private LocationFilter locationFilter;
    private ElasticityCalculator elasticity;
    private MotionStateMachine motion;
    private GeofenceWindowManager geofenceManager;
    private ScheduleWindows scheduleWindows;

    private TimerService.TimerHandle autoStopTimer;
    private TimerService.TimerHandle scheduleTimer;
    private TimerService.TimerHandle syncTimer;
    private TimerService.TimerHandle heartbeatTimer;

    private double odometer;
    private LocationSample lastLocation;
    private ActivityType lastActivity;
    private double distanceFilter;
    private ProviderMode providerMode;
    private boolean providerRunning;

    // Last accepted config, readable from any thread
    private volatile TrackingConfig activeConfig;

    @PostConstruct
    void init() {
        sessionTimers = new SessionTimers(timerService, executors.session());
        submit("restore", () -> {
            sessionStateStore.load().ifPresent(state -> {
                odometer = state.odometer();
                log.info("Restored session state: odometer={}m, lastFix={}", state.odometer(), state.lastFixTime());
            });
            return null;
        });
    }

    // ------------------------------------------------------------------
    // Lifecycle
    // ------------------------------------------------------------------

    /**
     * Validates and applies a configuration. While TRACKING, the session
     * components are rebuilt with the new snapshot.
     *
     * @throws com.tracking.engine.exception.ConfigInvalidException immediately, on the caller's thread
     */
    public CompletableFuture<SessionSnapshot> configure(TrackingConfig newConfig) {
        TrackingConfig validated;
        try {
            validated = configValidator.validate(newConfig);
        } catch (TrackingException e) {
            events.publishError(TrackingError.from(e));
            throw e;
        }
        return submit("configure", () -> {
            applyConfig(validated);
            return buildSnapshot();
        });
    }

    public CompletableFuture<SessionSnapshot> start() {
        return submit("start", () -> {
            startSession(TrackingMode.LOCATION);
            return buildSnapshot();
        });
    }

    /**
     * Starts geofence-only tracking: fixes feed geofence evaluation but are not stored or published.
     */
    public CompletableFuture<SessionSnapshot> startGeofences() {
        return submit("startGeofences", () -> {
            startSession(TrackingMode.GEOFENCE);
            return buildSnapshot();
        });
    }

    public CompletableFuture<SessionSnapshot> stop() {
        return submit("stop", () -> {
            stopSession();
            return buildSnapshot();
        });
    }

    public CompletableFuture<SessionSnapshot> snapshot() {
        return submit("snapshot", this::buildSnapshot);
    }

    public CompletableFuture<SessionSnapshot> changePace(boolean moving) {
        return submit("changePace", () -> {
            if (status != SessionStatus.TRACKING || !enabled) {
                throw new IllegalStateException("Tracking is not active");
            }
            motion.changePace(moving);
            return buildSnapshot();
        });
    }

    public CompletableFuture<Double> odometer() {
        return submit("odometer", () -> odometer);
    }

    public CompletableFuture<Double> setOdometer(double value) {
        if (value < 0) {
            throw new IllegalArgumentException("Odometer cannot be negative");
        }
        return submit("setOdometer", () -> {
            odometer = value;
            persistState();
            log.info("Odometer set to {}m", value);
            return odometer;
        });
    }

    private void applyConfig(TrackingConfig newConfig) {
        config = newConfig;
        activeConfig = newConfig;
        syncPipeline.configure(newConfig.sync(), newConfig.retention());
        retentionService.activate(newConfig.retention());

        if (status == SessionStatus.TRACKING) {
            log.info("Reconfiguring active session");
            TrackingMode mode = trackingMode;
            teardownSession();
            status = SessionStatus.READY;
            startSession(mode);
        } else {
            status = SessionStatus.READY;
            log.info("Session configured, READY");
        }
    }

    private void startSession(TrackingMode mode) {
        if (config == null) {
            throw new IllegalStateException("Tracking is not configured");
        }
        if (status == SessionStatus.TRACKING && trackingMode == mode) {
            return;
        }
        // a refused mode switch leaves the running session untouched
        if (!permissionChecker.locationPermitted()) {
            PermissionDeniedException denied = new PermissionDeniedException("Location permission not granted");
            events.publishError(TrackingError.from(denied));
            throw denied;
        }
        if (status == SessionStatus.TRACKING) {
            teardownSession();
        }

        trackingMode = mode;
        status = SessionStatus.TRACKING;
        buildComponents();

        if (config.schedule().scheduled()) {
            schedulerEnabled = true;
            scheduleWindows = ScheduleWindows.parse(config.schedule().schedule());
            evaluateSchedule();
        } else {
            activateSources();
        }

        if (config.schedule().autoStopEnabled()) {
            int minutes = config.schedule().stopAfterElapsedMinutes();
            autoStopTimer = sessionTimers.schedule(Duration.ofMinutes(minutes), () -> {
                log.info("Stopping after {} elapsed minutes", minutes);
                stopSession();
            });
        }
        armSyncTimer();
        armHeartbeat();
        persistState();
        log.info("Tracking started in {} mode", mode);
    }

    private void stopSession() {
        if (status == SessionStatus.IDLE) {
            return;
        }
        if (status == SessionStatus.TRACKING) {
            teardownSession();
            log.info("Tracking stopped");
        }
        status = SessionStatus.IDLE;
        persistState();
    }

    private void buildComponents() {
        locationFilter = new LocationFilter(config.filter());
        elasticity = new ElasticityCalculator(config.elasticity());
        distanceFilter = elasticity.baseDistance();
        motion = new MotionStateMachine(config.motion(), sessionTimers, new MotionHandler());
        geofenceManager = new GeofenceWindowManager(
            config.geofence(),
            properties.getEngine().getPlatformGeofenceCapacity(),
            nativeGeofences,
            sessionTimers,
            new GeofenceHandler(),
            clock
        );
        List<GeofenceRegion> regions = awaitStore(
            CompletableFuture.supplyAsync(geofenceRegistry::findAll, executors.store()), "load geofences");
        if (regions != null && !regions.isEmpty()) {
            geofenceManager.addAll(regions);
        }
    }

    private void teardownSession() {
        cancel(autoStopTimer);
        cancel(scheduleTimer);
        cancel(syncTimer);
        cancel(heartbeatTimer);
        autoStopTimer = null;
        scheduleTimer = null;
        syncTimer = null;
        heartbeatTimer = null;

        if (enabled) {
            deactivateSources();
        }
        if (geofenceManager != null) {
            geofenceManager.suspend();
        }
        schedulerEnabled = false;
        scheduleWindows = null;
        motion = null;
        geofenceManager = null;
        locationFilter = null;
        elasticity = null;
    }

    private void activateSources() {
        enabled = true;
        events.publishEnabledChange(true);
        motion.start();
        geofenceManager.resume();
    }

    private void deactivateSources() {
        enabled = false;
        motion.stop();
        geofenceManager.suspend();
        if (providerRunning) {
            locationProvider.stop();
            providerRunning = false;
            providerMode = null;
        }
        events.publishEnabledChange(false);
    }

    private void evaluateSchedule() {
        if (status != SessionStatus.TRACKING || scheduleWindows == null) {
            return;
        }
        ZonedDateTime now = ZonedDateTime.now(clock);
        boolean active = scheduleWindows.isActive(now);
        if (active && !enabled) {
            log.info("Schedule window opened");
            activateSources();
        } else if (!active && enabled) {
            log.info("Schedule window closed");
            deactivateSources();
        }
        persistState();

        Optional<ZonedDateTime> next = scheduleWindows.nextBoundary(now);
        next.ifPresent(boundary ->
            scheduleTimer = sessionTimers.schedule(Duration.between(now, boundary), this::evaluateSchedule));
    }

    private void armSyncTimer() {
        if (!config.sync().scheduledDrainEnabled()) {
            return;
        }
        syncTimer = sessionTimers.schedule(config.sync().syncInterval(), () -> {
            syncPipeline.requestDrain(DrainTrigger.SCHEDULED);
            armSyncTimer();
        });
    }

    private void armHeartbeat() {
        if (!config.schedule().heartbeatEnabled()) {
            return;
        }
        heartbeatTimer = sessionTimers.schedule(config.schedule().heartbeatInterval(), () -> {
            events.publishHeartbeat(buildSnapshot());
            armHeartbeat();
        });
    }

    // ------------------------------------------------------------------
    // Device streams
    // ------------------------------------------------------------------

    public CompletableFuture<Void> onLocation(LocationSample sample) {
        return submit("location", () -> {
            processFix(sample);
            return null;
        });
    }

    public CompletableFuture<Void> onActivity(ActivityTransitionEvent event) {
        return submit("activity", () -> {
            if (isActive()) {
                motion.onActivityTransition(event);
            }
            return null;
        });
    }

    public CompletableFuture<Void> onAccelerometer(AccelerometerSample sample) {
        return submit("accelerometer", () -> {
            if (isActive()) {
                motion.onAccelerometerSample(sample);
            }
            return null;
        });
    }

    public CompletableFuture<Void> onNativeGeofence(NativeGeofenceEvent event) {
        return submit("nativeGeofence", () -> {
            if (isActive()) {
                geofenceManager.onNativeEvent(event);
            } else {
                log.debug("Native geofence event while inactive: {} {}", event.action(), event.identifier());
            }
            return null;
        });
    }

    public CompletableFuture<Void> onProviderError(ProviderErrorEvent event) {
        return submit("providerError", () -> {
            if (event.source() != ProviderErrorEvent.Source.LOCATION && motion != null) {
                motion.onSourceUnavailable(event.source(), event.detail());
            } else {
                events.publishError(TrackingError.of(TrackingErrorKind.PROVIDER_UNAVAILABLE,
                        event.source() + " unavailable: " + event.detail()));
            }
            return null;
        });
    }

    public CompletableFuture<Void> onConnectivityChange(TransportType previous, TransportType current) {
        return submit("connectivity", () -> {
            if (previous == current) {
                return null;
            }
            events.publishConnectivityChange(current);
            if (current.connected()) {
                syncPipeline.requestDrain(DrainTrigger.CONNECTIVITY);
            }
            return null;
        });
    }

    public CompletableFuture<Void> onAuthorizationChange(boolean granted) {
        return submit("authorization", () -> {
            if (!granted && status == SessionStatus.TRACKING) {
                events.publishError(TrackingError.of(TrackingErrorKind.PERMISSION_DENIED,
                        "Location permission revoked while tracking"));
            }
            return null;
        });
    }

    private boolean isActive() {
        return status == SessionStatus.TRACKING && enabled;
    }

    private void processFix(LocationSample sample) {
        if (!isActive()) {
            log.debug("Fix ignored, tracking not active: {}", sample.toLogString());
            return;
        }

        FilterResult result = locationFilter.process(sample);
        if (!result.accepted()) {
            if (result.publishError()) {
                events.publishError(TrackingError.of(TrackingErrorKind.FILTER_REJECTED, result.detail()));
            }
            return;
        }
        LocationSample fix = result.sample();

        if (motion.isMoving()) {
            odometer += result.odometerDelta();
        }
        lastLocation = fix;

        double effective = elasticity.effectiveDistance(fix.speedOrZero());
        if (effective != distanceFilter) {
            distanceFilter = effective;
            if (providerRunning) {
                locationProvider.setMinimumDistance(effective);
            }
        }

        geofenceManager.onFix(fix);

        if (trackingMode == TrackingMode.LOCATION) {
            recordLocation(fix);
        }
        persistState();
    }

    private void recordLocation(LocationSample fix) {
        String uuid = UUID.randomUUID().toString();
        String activity = lastActivity == null ? null : lastActivity.wireName();
        boolean moving = motion.isMoving();

        Optional<TrackingRecord> stored = awaitStore(
            recordStore.insertLocation(uuid, fix,
                new RecordStoreService.LocationContext(moving, odometer, activity, null),
                config.retention()),
            "store location " + uuid);

        Long recordId = stored == null ? null : stored.map(TrackingRecord::getId).orElse(null);
        events.publishLocation(new LocationEvent(
            recordId, uuid, fix, moving, odometer, activity, null, config.retention().extras()));
        if (recordId != null) {
            syncPipeline.onRecordsInserted();
        }
    }

    // ------------------------------------------------------------------
    // Geofences
    // ------------------------------------------------------------------

    /**
     * Stores the definitions and hands them to the running session, if any.
     */
    public CompletableFuture<List<GeofenceRegion>> addGeofences(List<GeofenceRegion> regions) {
        List<GeofenceRegion> saved = geofenceRegistry.saveAll(regions);
        return submit("addGeofences", () -> {
            if (geofenceManager != null) {
                geofenceManager.addAll(saved);
            }
            return saved;
        });
    }

    public CompletableFuture<Boolean> removeGeofence(String identifier) {
        boolean removed = geofenceRegistry.remove(identifier);
        return submit("removeGeofence", () -> {
            if (geofenceManager != null) {
                geofenceManager.remove(identifier);
            }
            return removed;
        });
    }

    public CompletableFuture<Long> removeAllGeofences() {
        long removed = geofenceRegistry.removeAll();
        return submit("removeAllGeofences", () -> {
            if (geofenceManager != null) {
                geofenceManager.removeAll();
            }
            return removed;
        });
    }

    public List<GeofenceRegion> listGeofences() {
        return geofenceRegistry.findAll();
    }

    public GeofenceRegion findGeofence(String identifier) {
        return geofenceRegistry.find(identifier);
    }

    // ------------------------------------------------------------------
    // Records, sync, retention
    // ------------------------------------------------------------------

    public Page<RecordView> queryRecords(RecordQuery query) {
        return recordStore.query(query, currentConfig().retention());
    }

    public long countRecords() {
        return recordStore.count();
    }

    public long destroyRecords() {
        return recordStore.destroyAll();
    }

    public DrainOutcome syncNow() {
        return syncPipeline.requestDrain(DrainTrigger.MANUAL);
    }

    /**
     * Runs both retention passes on the caller's thread.
     *
     * @return number of records deleted
     */
    public int pruneNow() {
        return retentionService.enforce(currentConfig().retention());
    }

    private TrackingConfig currentConfig() {
        TrackingConfig current = activeConfig;
        return current != null ? current : TrackingConfig.defaults();
    }

    // ------------------------------------------------------------------
    // Plumbing
    // ------------------------------------------------------------------

    /**
     * Waits for a session call with the configured query timeout and unwraps its failure.
     */
    public <T> T await(CompletableFuture<T> future) {
        Duration timeout = properties.getEngine().getQueryTimeout();
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw new TrackingException(TrackingErrorKind.TIMEOUT, "Session did not answer within " + timeout, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TrackingException(TrackingErrorKind.TIMEOUT, "Interrupted while waiting for the session", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException(e.getCause());
        }
    }

    private <T> CompletableFuture<T> submit(String name, Callable<T> action) {
        CompletableFuture<T> future = new CompletableFuture<>();
        try {
            executors.session().execute(() -> {
                try {
                    future.complete(action.call());
                } catch (TrackingException | IllegalStateException | IllegalArgumentException e) {
                    log.debug("Session task {} rejected: {}", name, e.getMessage());
                    future.completeExceptionally(e);
                } catch (Exception e) {
                    log.error("Session task {} failed", name, e);
                    future.completeExceptionally(e);
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("Session executor rejected {}: shutting down", name);
            future.completeExceptionally(e);
        }
        return future;
    }

    /**
     * Bounded wait on the store executor. Failures are published, not thrown:
     * a single failed write never aborts the session.
     *
     * @return the result, or null when the write failed or timed out
     */
    private <T> T awaitStore(CompletableFuture<T> future, String operation) {
        Duration timeout = properties.getEngine().getStoreTimeout();
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            events.publishError(TrackingError.of(TrackingErrorKind.TIMEOUT, operation + " timed out after " + timeout));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            events.publishError(TrackingError.of(TrackingErrorKind.TIMEOUT, operation + " interrupted"));
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            log.error("{} failed", operation, cause);
            if (cause instanceof TrackingException tracking) {
                events.publishError(TrackingError.from(tracking));
            } else {
                events.publishError(TrackingError.from(new StoreException(operation + " failed", cause)));
            }
        }
        return null;
    }

    private void persistState() {
        SessionState state = new SessionState(
            enabled,
            trackingMode,
            schedulerEnabled,
            odometer,
            motion != null && motion.isMoving(),
            lastLocation == null ? null : lastLocation.timestamp()
        );
        try {
            executors.store().execute(() -> {
                try {
                    sessionStateStore.save(state);
                } catch (RuntimeException e) {
                    log.error("Failed to persist session state", e);
                    events.publishError(TrackingError.from(new StoreException("Session state write failed", e)));
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("Session state not persisted: store executor shutting down");
        }
    }

    private SessionSnapshot buildSnapshot() {
        MotionState motionState = motion == null ? MotionState.STATIONARY : motion.state();
        return new SessionSnapshot(
            status,
            trackingMode,
            enabled,
            schedulerEnabled,
            motionState,
            motion != null && motion.isMoving(),
            odometer,
            lastLocation,
            lastLocation == null ? null : lastLocation.timestamp(),
            lastActivity == null ? null : lastActivity.wireName(),
            distanceFilter,
            geofenceManager == null ? List.of() : geofenceManager.monitoredIdentifiers(),
            geofenceManager == null ? 0 : geofenceManager.registeredRegions().size(),
            locationFilter == null ? 0 : locationFilter.totalRejections(),
            config
        );
    }

    private void applyProviderMode(ProviderMode requested) {
        ProviderMode effective = requested == ProviderMode.LOW_POWER
                && geofenceManager != null
                && geofenceManager.requiresHighAccuracy()
            ? ProviderMode.HIGH_ACCURACY
            : requested;
        if (providerRunning && effective == providerMode) {
            return;
        }
        locationProvider.start(effective, distanceFilter);
        providerMode = effective;
        providerRunning = true;
        log.debug("Location provider mode {} (distanceFilter {}m)", effective, distanceFilter);
    }

    private static void cancel(TimerService.TimerHandle handle) {
        if (handle != null) {
            handle.cancel();
        }
    }

    /**
     * Applies motion intents. Runs on the session executor.
     */
    private class MotionHandler implements MotionListener {

        @Override
        public void onMotionChange(boolean moving, ProviderMode requestedMode) {
            applyProviderMode(requestedMode);
            persistState();
            events.publishMotionChange(new MotionChangeEvent(moving, lastLocation));
        }

        @Override
        public void onAccelerometerIntent(boolean on) {
            if (on) {
                motionSensors.enableAccelerometer();
            } else {
                motionSensors.disableAccelerometer();
            }
        }

        @Override
        public void onActivityUpdatesIntent(boolean on) {
            if (on) {
                motionSensors.startActivityUpdates();
            } else {
                motionSensors.stopActivityUpdates();
            }
        }

        @Override
        public void onActivityChange(ActivityType activity, int confidence) {
            lastActivity = activity;
            events.publishActivityChange(new ActivityChangeEvent(activity, confidence));
        }

        @Override
        public void onSourceUnavailable(ProviderErrorEvent.Source source, String detail) {
            events.publishError(TrackingError.of(TrackingErrorKind.PROVIDER_UNAVAILABLE,
                    source + " unavailable: " + detail));
        }
    }

    /**
     * Persists and publishes geofence output. Runs on the session executor.
     */
    private class GeofenceHandler implements GeofenceListener {

        @Override
        public void onGeofenceEvent(GeofenceEvent event) {
            LocationSample anchor = event.location() != null ? event.location() : lastLocation;
            Optional<TrackingRecord> stored = awaitStore(
                recordStore.insertGeofence(UUID.randomUUID().toString(), event, anchor, config.retention()),
                "store geofence event " + event.identifier());
            events.publishGeofence(event);
            if (stored != null && stored.isPresent()) {
                syncPipeline.onRecordsInserted();
            }
        }

        @Override
        public void onMonitoredSetChanged(MonitoredSetChange change) {
            events.publishGeofencesChange(change);
            if (providerRunning && motion != null && !motion.isMoving()) {
                applyProviderMode(ProviderMode.LOW_POWER);
            }
        }

        @Override
        public void onRegionKnockedOut(String identifier) {
            try {
                executors.store().execute(() -> {
                    try {
                        geofenceRegistry.remove(identifier);
                    } catch (RuntimeException e) {
                        log.error("Failed to delete knocked-out geofence {}", identifier, e);
                        events.publishError(TrackingError.from(
                                new StoreException("Delete geofence " + identifier + " failed", e)));
                    }
                });
            } catch (RejectedExecutionException e) {
                log.warn("Knocked-out geofence {} not deleted: store executor shutting down", identifier);
            }
        }
    }
}
