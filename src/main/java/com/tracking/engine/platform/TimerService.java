package com.tracking.engine.platform;

import java.time.Duration;

/**
 * One-shot delayed callbacks.
 */
public interface TimerService {

    /**
     * Runs {@code task} once after {@code delay}.
     *
     * @return handle used to cancel the callback before it fires
     */
    TimerHandle schedule(Duration delay, Runnable task);

    /**
     * Cancellation handle. {@link #cancel()} is idempotent and a no-op after the task ran.
     */
    interface TimerHandle {

        void cancel();

        boolean isActive();
    }
}
