package com.tracking.engine.sync;

import com.tracking.engine.config.RetentionConfig;
import com.tracking.engine.config.SyncConfig;
import com.tracking.engine.config.TrackingExecutors;
import com.tracking.engine.dto.RecordView;
import com.tracking.engine.event.HttpEvent;
import com.tracking.engine.event.TrackingError;
import com.tracking.engine.event.TrackingEventBus;
import com.tracking.engine.exception.SyncException;
import com.tracking.engine.exception.TrackingErrorKind;
import com.tracking.engine.platform.ConnectivityMonitor;
import com.tracking.engine.platform.NetworkTransport;
import com.tracking.engine.platform.TimerService;
import com.tracking.engine.platform.TransportType;
import com.tracking.engine.service.RecordStoreService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executor;

/**
 * Uploads unsynced records to the configured endpoint.
 *
 * Drain flow:
 * 1. Gates: sync enabled, device online, not cellular when
 *    {@code disableAutoSyncOnCellular} is set (manual drains ignore this gate)
 * 2. At most one batch in flight: a drain requested meanwhile is deferred and
 *    runs once the current one finishes
 * 3. Oldest unsynced records, up to the batch size, form one {@link SyncBatch}
 * 4. 2xx: records marked synced, next batch follows immediately
 * 5. 4xx: terminal, reported and parked
 * 6. 5xx, network failure, timeout: retried after
 *    {@code initialBackoff * 2^(attempt-1)} capped at {@code backoffCeiling},
 *    parked after {@code maxAttempts}
 *
 * A parked pipeline ignores automatic drains until a scheduled, connectivity
 * or manual drain comes in.
 */
@Service
@Slf4j
public class SyncPipeline {

    private final RecordStoreService recordStore;
    private final NetworkTransport transport;
    private final ConnectivityMonitor connectivity;
    private final TimerService timers;
    private final TrackingEventBus events;
    private final SyncPayloadBuilder payloadBuilder;
    private final Executor worker;

    private final Object lock = new Object();
    private boolean inFlight;
    private boolean parked;
    private DrainTrigger deferred;
    private DrainTrigger active;

    private volatile SyncConfig config = SyncConfig.defaults();
    private volatile RetentionConfig retention = RetentionConfig.defaults();

    @Autowired
    public SyncPipeline(RecordStoreService recordStore,
                        NetworkTransport transport,
                        ConnectivityMonitor connectivity,
                        TimerService timers,
                        TrackingEventBus events,
                        SyncPayloadBuilder payloadBuilder,
                        TrackingExecutors executors) {
        this(recordStore, transport, connectivity, timers, events, payloadBuilder, executors.sync());
    }

    SyncPipeline(RecordStoreService recordStore,
                 NetworkTransport transport,
                 ConnectivityMonitor connectivity,
                 TimerService timers,
                 TrackingEventBus events,
                 SyncPayloadBuilder payloadBuilder,
                 Executor worker) {
        this.recordStore = recordStore;
        this.transport = transport;
        this.connectivity = connectivity;
        this.timers = timers;
        this.events = events;
        this.payloadBuilder = payloadBuilder;
        this.worker = worker;
    }

    /**
     * Takes effect for the next batch. A batch already in flight finishes with its own settings.
     */
    public void configure(SyncConfig config, RetentionConfig retention) {
        this.config = config;
        this.retention = retention;
    }

    public DrainOutcome requestDrain(DrainTrigger trigger) {
        SyncConfig current = config;
        if (!current.enabled()) {
            return DrainOutcome.DISABLED;
        }

        DrainOutcome gate = checkTransport(current, trigger);
        if (gate != null) {
            log.debug("Drain ({}) skipped: {}", trigger, gate);
            return gate;
        }

        synchronized (lock) {
            if (inFlight) {
                if (deferred == null || trigger.unparks()) {
                    deferred = trigger;
                }
                log.debug("Drain ({}) deferred: batch in flight", trigger);
                return DrainOutcome.DEFERRED;
            }
            if (parked) {
                if (!trigger.unparks()) {
                    return DrainOutcome.PARKED;
                }
                log.info("Retrying parked sync ({})", trigger);
                parked = false;
            }
            inFlight = true;
            active = trigger;
        }

        log.debug("Drain started ({})", trigger);
        worker.execute(this::startNextBatch);
        return DrainOutcome.STARTED;
    }

    /**
     * Offline or cellular gate. Manual drains ignore the cellular gate.
     *
     * @return the skip outcome, or null when the transport allows an upload
     */
    private DrainOutcome checkTransport(SyncConfig current, DrainTrigger trigger) {
        TransportType transportType = connectivity.currentTransport();
        if (!transportType.connected()) {
            return DrainOutcome.SKIPPED_OFFLINE;
        }
        if (transportType == TransportType.CELLULAR
                && current.disableAutoSyncOnCellular()
                && trigger != DrainTrigger.MANUAL) {
            return DrainOutcome.SKIPPED_CELLULAR;
        }
        return null;
    }

    /**
     * Auto-sync hook, called after records were inserted.
     */
    public void onRecordsInserted() {
        SyncConfig current = config;
        if (!current.enabled() || !current.autoSync()) {
            return;
        }
        worker.execute(() -> {
            try {
                if (current.autoSyncThreshold() > 0 && recordStore.countUnsynced() < current.autoSyncThreshold()) {
                    return;
                }
                requestDrain(DrainTrigger.AUTO);
            } catch (RuntimeException e) {
                log.error("Auto-sync check failed", e);
            }
        });
    }

    private void startNextBatch() {
        SyncConfig current = config;
        SyncBatch batch;
        try {
            List<RecordView> records = recordStore.unsyncedBatch(current.effectiveBatchSize(), retention);
            if (records.isEmpty()) {
                log.debug("Nothing left to sync");
                finish();
                return;
            }
            batch = payloadBuilder.build(records, current);
        } catch (RuntimeException e) {
            log.error("Failed to select sync batch", e);
            events.publishError(TrackingError.of(TrackingErrorKind.STORE_ERROR, "Sync batch selection failed: " + e.getMessage()));
            finish();
            return;
        }
        attempt(batch, 1);
    }

    private void attempt(SyncBatch batch, int attempt) {
        SyncConfig current = config;
        NetworkTransport.TransportResponse response;
        try {
            response = transport.send(current.method(), current.url(), current.headers(), batch.body(), current.timeout());
        } catch (SyncException e) {
            events.publishHttp(new HttpEvent(false, 0, e.getMessage(), batch.size(), attempt));
            if (e.isRetryable()) {
                onRetryableFailure(batch, attempt, e.getKind(), e.getMessage());
            } else {
                onTerminalFailure(e.getMessage());
            }
            return;
        } catch (RuntimeException e) {
            log.error("Unexpected sync transport failure", e);
            events.publishHttp(new HttpEvent(false, 0, e.getMessage(), batch.size(), attempt));
            onRetryableFailure(batch, attempt, TrackingErrorKind.SYNC_RETRYABLE, e.getMessage());
            return;
        }

        if (response.successful()) {
            try {
                recordStore.markSynced(batch.recordIds());
            } catch (RuntimeException e) {
                log.error("Uploaded batch could not be marked synced", e);
                events.publishError(TrackingError.of(TrackingErrorKind.STORE_ERROR, "Mark synced failed: " + e.getMessage()));
                finish();
                return;
            }
            log.info("Synced {} records (HTTP {}, attempt {})", batch.size(), response.status(), attempt);
            events.publishHttp(new HttpEvent(true, response.status(), response.body(), batch.size(), attempt));
            worker.execute(this::startNextBatch);
            return;
        }

        events.publishHttp(new HttpEvent(false, response.status(), response.body(), batch.size(), attempt));
        if (response.clientError()) {
            onTerminalFailure("HTTP " + response.status() + " rejected " + batch.size() + " records");
        } else {
            onRetryableFailure(batch, attempt, TrackingErrorKind.SYNC_RETRYABLE, "HTTP " + response.status());
        }
    }

    private void onRetryableFailure(SyncBatch batch, int attempt, TrackingErrorKind kind, String message) {
        events.publishError(TrackingError.of(kind, "Sync attempt " + attempt + " failed: " + message));

        int maxAttempts = config.maxAttempts();
        if (attempt >= maxAttempts) {
            log.warn("Sync batch parked after {} attempts", attempt);
            events.publishError(TrackingError.of(TrackingErrorKind.SYNC_RETRYABLE,
                    "Sync parked after " + attempt + " attempts"));
            park();
            return;
        }

        Duration delay = config.backoffFor(attempt);
        log.info("Sync attempt {} failed ({}), retrying in {}", attempt, message, delay);
        timers.schedule(delay, () -> worker.execute(() -> retry(batch, attempt + 1)));
    }

    /**
     * Re-checks the transport before a retry. A closed gate releases the batch
     * unsent and without spending the attempt; the next connectivity drain
     * starts it over.
     */
    private void retry(SyncBatch batch, int attempt) {
        DrainTrigger trigger;
        synchronized (lock) {
            trigger = active;
        }
        DrainOutcome gate = checkTransport(config, trigger);
        if (gate != null) {
            log.info("Sync retry {} of {} records released: {}", attempt, batch.size(), gate);
            finish();
            return;
        }
        attempt(batch, attempt);
    }

    private void onTerminalFailure(String message) {
        log.warn("Sync rejected: {}", message);
        events.publishError(TrackingError.of(TrackingErrorKind.SYNC_TERMINAL, message));
        park();
    }

    private void park() {
        synchronized (lock) {
            parked = true;
            // drains requested during the failed attempts do not count as "next" triggers
            deferred = null;
        }
        finish();
    }

    private void finish() {
        DrainTrigger next;
        synchronized (lock) {
            inFlight = false;
            active = null;
            next = deferred;
            deferred = null;
        }
        if (next != null) {
            requestDrain(next);
        }
    }

    public boolean isInFlight() {
        synchronized (lock) {
            return inFlight;
        }
    }

    public boolean isParked() {
        synchronized (lock) {
            return parked;
        }
    }
}
