package com.tracking.engine.bridge;

import com.tracking.engine.platform.TimerService;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ScheduledFuture;

/**
 * {@link TimerService} on top of Spring's {@link TaskScheduler}.
 */
@Component
public class SchedulerTimerService implements TimerService {

    private final TaskScheduler taskScheduler;
    private final Clock clock;

    public SchedulerTimerService(@Qualifier("trackingTaskScheduler") TaskScheduler taskScheduler, Clock clock) {
        this.taskScheduler = taskScheduler;
        this.clock = clock;
    }

    @Override
    public TimerHandle schedule(Duration delay, Runnable task) {
        ScheduledFuture<?> future = taskScheduler.schedule(task, clock.instant().plus(delay));
        return new TimerHandle() {
            @Override
            public void cancel() {
                future.cancel(false);
            }

            @Override
            public boolean isActive() {
                return !future.isDone();
            }
        };
    }
}
