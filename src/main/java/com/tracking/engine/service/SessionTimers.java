package com.tracking.engine.service;

import com.tracking.engine.platform.TimerService;

import java.time.Duration;
import java.util.concurrent.Executor;

/**
 * Runs timer callbacks on the session executor instead of the timer thread.
 *
 * Cancellation is checked again on the session executor, so a callback that
 * was already queued when its handle got cancelled does not run.
 */
class SessionTimers implements TimerService {

    private final TimerService delegate;
    private final Executor sessionExecutor;

    SessionTimers(TimerService delegate, Executor sessionExecutor) {
        this.delegate = delegate;
        this.sessionExecutor = sessionExecutor;
    }

    @Override
    public TimerHandle schedule(Duration delay, Runnable task) {
        SessionTimerHandle handle = new SessionTimerHandle();
        handle.delegate = delegate.schedule(delay, () -> sessionExecutor.execute(() -> {
            if (!handle.cancelled) {
                handle.fired = true;
                task.run();
            }
        }));
        return handle;
    }

    private static final class SessionTimerHandle implements TimerHandle {

        private volatile TimerHandle delegate;
        private volatile boolean cancelled;
        private volatile boolean fired;

        @Override
        public void cancel() {
            cancelled = true;
            TimerHandle current = delegate;
            if (current != null) {
                current.cancel();
            }
        }

        @Override
        public boolean isActive() {
            return !cancelled && !fired;
        }
    }
}
