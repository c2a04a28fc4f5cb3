package com.tracking.engine.config;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Single-threaded executors of the engine.
 *
 * - session: every state mutation of the tracking session, in arrival order
 * - store:   record and session-state writes
 * - sync:    HTTP uploads
 *
 * Retention pruning runs on the separate {@code pruneExecutor} bean.
 */
@Component
@Slf4j
public class TrackingExecutors {

    private final ExecutorService session =
        Executors.newSingleThreadExecutor(new CustomizableThreadFactory("tracking-session-"));
    private final ExecutorService store =
        Executors.newSingleThreadExecutor(new CustomizableThreadFactory("tracking-store-"));
    private final ExecutorService sync =
        Executors.newSingleThreadExecutor(new CustomizableThreadFactory("tracking-sync-"));

    public ExecutorService session() {
        return session;
    }

    public ExecutorService store() {
        return store;
    }

    public ExecutorService sync() {
        return sync;
    }

    @PreDestroy
    public void shutdown() {
        for (ExecutorService executor : List.of(session, sync, store)) {
            executor.shutdown();
        }
        for (ExecutorService executor : List.of(session, sync, store)) {
            try {
                if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                    log.warn("Executor did not terminate in time, forcing shutdown");
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                executor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }
}
