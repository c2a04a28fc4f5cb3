package com.tracking.engine.motion;

import com.tracking.engine.config.MotionConfig;
import com.tracking.engine.dto.AccelerometerSample;
import com.tracking.engine.dto.ActivityTransitionEvent;
import com.tracking.engine.dto.ProviderErrorEvent;
import com.tracking.engine.platform.ProviderMode;
import com.tracking.engine.platform.TimerService;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;

/**
 * Classifies the device as moving or stationary.
 *
 * Transitions:
 * - MOVING + STILL entered             -> arm stop timer, PENDING_STOP
 * - PENDING_STOP + stop timer elapsed  -> STATIONARY, accelerometer on
 * - PENDING_STOP + motion resumed      -> timer cancelled, MOVING retained (no event)
 * - STATIONARY + motion resumed        -> MOVING after {@code motionTriggerDelay}
 * - STATIONARY + accelerometer shake   -> accelerometer off, MOVING after {@code motionTriggerDelay}
 *
 * "Motion resumed" is a STILL exit or the entry of any moving activity.
 * A STILL entry while a MOVING declaration is pending cancels it.
 *
 * The machine never touches the device. Provider mode and sensor changes are
 * published through {@link MotionListener} as intents.
 *
 * Not thread-safe. Timers are expected to call back on the same thread that
 * drives the other methods.
 */
@Slf4j
public class MotionStateMachine {

    private final MotionConfig config;
    private final TimerService timers;
    private final MotionListener listener;

    private MotionState state = MotionState.STATIONARY;
    private ActivityType lastActivity;
    private boolean started;
    private boolean accelerometerOn;
    private boolean activityUpdatesOn;

    private TimerService.TimerHandle stopTimer;
    private TimerService.TimerHandle triggerTimer;

    public MotionStateMachine(MotionConfig config, TimerService timers, MotionListener listener) {
        this.config = config;
        this.timers = timers;
        this.listener = listener;
    }

    /**
     * Declares the configured initial state and starts the activity classifier.
     */
    public void start() {
        if (started) {
            return;
        }
        started = true;
        if (!config.disableMotionActivityUpdates()) {
            setActivityUpdates(true);
        }
        if (config.initiallyMoving()) {
            declareMoving();
        } else {
            declareStationary();
        }
        log.info("Motion detection started in state {}", state);
    }

    /**
     * Cancels every timer and turns the sensors off. Safe to call repeatedly.
     */
    public void stop() {
        cancelStopTimer();
        cancelTriggerTimer();
        setAccelerometer(false);
        setActivityUpdates(false);
        if (started) {
            log.info("Motion detection stopped in state {}", state);
        }
        started = false;
    }

    public void onActivityTransition(ActivityTransitionEvent event) {
        if (!started) {
            return;
        }
        ActivityType activity = event.activity();

        if (event.entering() && activity != lastActivity) {
            lastActivity = activity;
            listener.onActivityChange(activity, event.confidence() == null ? 100 : event.confidence());
        }

        if (activity == ActivityType.STILL && event.entering()) {
            onStillEntered();
        } else if ((activity == ActivityType.STILL && !event.entering())
                || (activity.isMoving() && event.entering())) {
            onMotionResumed();
        }
    }

    public void onAccelerometerSample(AccelerometerSample sample) {
        if (!started || state != MotionState.STATIONARY || !accelerometerOn) {
            return;
        }
        double magnitude = sample.magnitudeAboveGravity();
        if (magnitude > config.shakeThreshold()) {
            log.debug("Shake detected ({} m/s² above gravity)", String.format("%.2f", magnitude));
            setAccelerometer(false);
            requestMoving();
        }
    }

    /**
     * Manual override of the motion state.
     */
    public void changePace(boolean moving) {
        if (!started) {
            return;
        }
        cancelTriggerTimer();
        if (moving) {
            if (state == MotionState.PENDING_STOP) {
                cancelStopTimer();
                state = MotionState.MOVING;
            } else if (state == MotionState.STATIONARY) {
                declareMoving();
            }
        } else if (state != MotionState.STATIONARY) {
            cancelStopTimer();
            declareStationary();
        }
    }

    /**
     * A sensor went away. Reported, but the motion state is kept.
     */
    public void onSourceUnavailable(ProviderErrorEvent.Source source, String detail) {
        log.warn("Motion source {} unavailable: {}", source, detail);
        listener.onSourceUnavailable(source, detail);
    }

    private void onStillEntered() {
        switch (state) {
            case MOVING -> armStopTimer();
            case STATIONARY -> {
                if (triggerTimer != null) {
                    log.debug("STILL entered before motion trigger delay elapsed, staying STATIONARY");
                    cancelTriggerTimer();
                    setAccelerometer(true);
                }
            }
            case PENDING_STOP -> log.trace("STILL repeated while stop timer armed");
        }
    }

    private void onMotionResumed() {
        switch (state) {
            case PENDING_STOP -> {
                cancelStopTimer();
                state = MotionState.MOVING;
                log.debug("Motion resumed before stop timeout, MOVING retained");
            }
            case STATIONARY -> requestMoving();
            case MOVING -> log.trace("Motion resumed while already MOVING");
        }
    }

    private void armStopTimer() {
        Duration timeout = config.stopTimeout();
        if (timeout.isZero() || timeout.isNegative()) {
            declareStationary();
            return;
        }
        state = MotionState.PENDING_STOP;
        stopTimer = timers.schedule(timeout, this::onStopTimeout);
        log.debug("Stop timer armed for {}", timeout);
    }

    private void onStopTimeout() {
        stopTimer = null;
        if (state == MotionState.PENDING_STOP) {
            declareStationary();
        }
    }

    private void requestMoving() {
        if (triggerTimer != null) {
            return;
        }
        Duration delay = config.motionTriggerDelay();
        if (delay.isZero() || delay.isNegative()) {
            declareMoving();
            return;
        }
        triggerTimer = timers.schedule(delay, this::onTriggerDelayElapsed);
        log.debug("MOVING declaration delayed by {}", delay);
    }

    private void onTriggerDelayElapsed() {
        triggerTimer = null;
        if (started && state == MotionState.STATIONARY) {
            declareMoving();
        }
    }

    private void declareMoving() {
        cancelStopTimer();
        state = MotionState.MOVING;
        setAccelerometer(false);
        log.info("Motion change: MOVING");
        listener.onMotionChange(true, ProviderMode.HIGH_ACCURACY);
    }

    private void declareStationary() {
        state = MotionState.STATIONARY;
        log.info("Motion change: STATIONARY");
        listener.onMotionChange(false, ProviderMode.LOW_POWER);
        setAccelerometer(true);
    }

    private void cancelStopTimer() {
        if (stopTimer != null) {
            stopTimer.cancel();
            stopTimer = null;
        }
    }

    private void cancelTriggerTimer() {
        if (triggerTimer != null) {
            triggerTimer.cancel();
            triggerTimer = null;
        }
    }

    private void setAccelerometer(boolean on) {
        if (accelerometerOn == on) {
            return;
        }
        accelerometerOn = on;
        listener.onAccelerometerIntent(on);
    }

    private void setActivityUpdates(boolean on) {
        if (activityUpdatesOn == on) {
            return;
        }
        activityUpdatesOn = on;
        listener.onActivityUpdatesIntent(on);
    }

    public MotionState state() {
        return state;
    }

    public boolean isMoving() {
        return state.declaredMoving();
    }

    public ActivityType lastActivity() {
        return lastActivity;
    }

    public boolean stopTimerArmed() {
        return stopTimer != null;
    }

    public boolean accelerometerOn() {
        return accelerometerOn;
    }
}
