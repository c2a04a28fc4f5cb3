package com.tracking.engine.motion;

import com.tracking.engine.config.MotionConfig;
import com.tracking.engine.dto.AccelerometerSample;
import com.tracking.engine.dto.ActivityTransitionEvent;
import com.tracking.engine.dto.ProviderErrorEvent;
import com.tracking.engine.platform.ProviderMode;
import com.tracking.engine.support.ManualTimerService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class MotionStateMachineTest {

    private ManualTimerService timers;
    private RecordingListener listener;

    @BeforeEach
    void setUp() {
        timers = new ManualTimerService();
        listener = new RecordingListener();
    }

    private MotionStateMachine startMoving(MotionConfig config) {
        MotionStateMachine machine = new MotionStateMachine(
            config.toBuilder().initiallyMoving(true).build(), timers, listener);
        machine.start();
        listener.motionChanges.clear();
        return machine;
    }

    @Test
    void shouldDeclareInitialStateOnStart() {
        MotionStateMachine machine = new MotionStateMachine(MotionConfig.defaults(), timers, listener);

        machine.start();

        assertThat(machine.state()).isEqualTo(MotionState.STATIONARY);
        assertThat(listener.motionChanges).containsExactly(false);
        assertThat(listener.modes).containsExactly(ProviderMode.LOW_POWER);
        assertThat(listener.activityUpdates).containsExactly(true);
        assertThat(machine.accelerometerOn()).isTrue();
    }

    @Test
    void shouldNotStartActivityUpdatesWhenDisabled() {
        MotionStateMachine machine = new MotionStateMachine(
            MotionConfig.builder().disableMotionActivityUpdates(true).build(), timers, listener);

        machine.start();

        assertThat(listener.activityUpdates).isEmpty();
    }

    @Test
    void shouldDeclareStationaryExactlyAtStopTimeout() {
        MotionStateMachine machine = startMoving(MotionConfig.defaults());

        machine.onActivityTransition(ActivityTransitionEvent.enter(ActivityType.STILL));
        assertThat(machine.state()).isEqualTo(MotionState.PENDING_STOP);
        assertThat(machine.isMoving()).isTrue();

        timers.advance(Duration.ofMinutes(5).minusMillis(1));
        assertThat(machine.state()).isEqualTo(MotionState.PENDING_STOP);
        assertThat(listener.motionChanges).isEmpty();

        timers.advance(Duration.ofMillis(1));
        assertThat(machine.state()).isEqualTo(MotionState.STATIONARY);
        assertThat(listener.motionChanges).containsExactly(false);
        assertThat(timers.scheduledDelays()).containsExactly(Duration.ofMinutes(5));
    }

    @Test
    void shouldStayMovingWhenMotionResumesBeforeTimeout() {
        MotionStateMachine machine = startMoving(MotionConfig.defaults());

        machine.onActivityTransition(ActivityTransitionEvent.enter(ActivityType.STILL));
        timers.advance(Duration.ofMinutes(3));
        machine.onActivityTransition(ActivityTransitionEvent.enter(ActivityType.IN_VEHICLE));
        timers.advance(Duration.ofMinutes(10));

        assertThat(machine.state()).isEqualTo(MotionState.MOVING);
        assertThat(machine.stopTimerArmed()).isFalse();
        assertThat(listener.motionChanges).isEmpty();
    }

    @Test
    void shouldDeclareStationaryImmediatelyWithZeroStopTimeout() {
        MotionStateMachine machine = startMoving(MotionConfig.builder().stopTimeout(Duration.ZERO).build());

        machine.onActivityTransition(ActivityTransitionEvent.enter(ActivityType.STILL));

        assertThat(machine.state()).isEqualTo(MotionState.STATIONARY);
        assertThat(listener.motionChanges).containsExactly(false);
    }

    @Test
    void shouldDeclareMovingOnShake() {
        MotionStateMachine machine = new MotionStateMachine(MotionConfig.defaults(), timers, listener);
        machine.start();

        machine.onAccelerometerSample(new AccelerometerSample(0, 0, 10.0));
        assertThat(machine.state()).isEqualTo(MotionState.STATIONARY);

        machine.onAccelerometerSample(new AccelerometerSample(3.0, 4.0, 12.0));

        assertThat(machine.state()).isEqualTo(MotionState.MOVING);
        assertThat(listener.motionChanges).containsExactly(false, true);
        assertThat(listener.modes).endsWith(ProviderMode.HIGH_ACCURACY);
        assertThat(machine.accelerometerOn()).isFalse();
    }

    @Test
    void shouldDelayMovingDeclarationByTriggerDelay() {
        MotionStateMachine machine = new MotionStateMachine(
            MotionConfig.builder().motionTriggerDelay(Duration.ofSeconds(30)).build(), timers, listener);
        machine.start();

        machine.onActivityTransition(ActivityTransitionEvent.enter(ActivityType.WALKING));
        timers.advance(Duration.ofSeconds(29));
        assertThat(machine.state()).isEqualTo(MotionState.STATIONARY);

        timers.advance(Duration.ofSeconds(1));
        assertThat(machine.state()).isEqualTo(MotionState.MOVING);
    }

    @Test
    void shouldCancelPendingTriggerWhenStillReturns() {
        MotionStateMachine machine = new MotionStateMachine(
            MotionConfig.builder().motionTriggerDelay(Duration.ofSeconds(30)).build(), timers, listener);
        machine.start();

        machine.onActivityTransition(ActivityTransitionEvent.enter(ActivityType.WALKING));
        timers.advance(Duration.ofSeconds(10));
        machine.onActivityTransition(ActivityTransitionEvent.enter(ActivityType.STILL));
        timers.advance(Duration.ofMinutes(1));

        assertThat(machine.state()).isEqualTo(MotionState.STATIONARY);
        assertThat(listener.motionChanges).containsExactly(false);
    }

    @Test
    void shouldReportActivityChangesOnce() {
        MotionStateMachine machine = startMoving(MotionConfig.defaults());

        machine.onActivityTransition(ActivityTransitionEvent.enter(ActivityType.IN_VEHICLE));
        machine.onActivityTransition(ActivityTransitionEvent.enter(ActivityType.IN_VEHICLE));
        machine.onActivityTransition(ActivityTransitionEvent.exit(ActivityType.IN_VEHICLE));

        assertThat(listener.activities).containsExactly(ActivityType.IN_VEHICLE);
        assertThat(machine.lastActivity()).isEqualTo(ActivityType.IN_VEHICLE);
    }

    @Test
    void shouldForceStateWithChangePace() {
        MotionStateMachine machine = startMoving(MotionConfig.defaults());
        machine.onActivityTransition(ActivityTransitionEvent.enter(ActivityType.STILL));

        machine.changePace(false);
        assertThat(machine.state()).isEqualTo(MotionState.STATIONARY);
        assertThat(machine.stopTimerArmed()).isFalse();

        machine.changePace(true);
        assertThat(machine.state()).isEqualTo(MotionState.MOVING);
        assertThat(listener.motionChanges).containsExactly(false, true);
    }

    @Test
    void shouldKeepStateWhenSourceBecomesUnavailable() {
        MotionStateMachine machine = startMoving(MotionConfig.defaults());

        machine.onSourceUnavailable(ProviderErrorEvent.Source.ACTIVITY, "classifier offline");

        assertThat(machine.state()).isEqualTo(MotionState.MOVING);
        assertThat(listener.unavailable).containsExactly(ProviderErrorEvent.Source.ACTIVITY);
    }

    @Test
    void shouldCancelTimersOnStop() {
        MotionStateMachine machine = startMoving(MotionConfig.defaults());
        machine.onActivityTransition(ActivityTransitionEvent.enter(ActivityType.STILL));

        machine.stop();
        timers.advance(Duration.ofMinutes(10));

        assertThat(machine.state()).isEqualTo(MotionState.PENDING_STOP);
        assertThat(listener.motionChanges).isEmpty();
        assertThat(listener.activityUpdates).endsWith(false);
    }

    private static class RecordingListener implements MotionListener {

        final List<Boolean> motionChanges = new ArrayList<>();
        final List<ProviderMode> modes = new ArrayList<>();
        final List<Boolean> accelerometer = new ArrayList<>();
        final List<Boolean> activityUpdates = new ArrayList<>();
        final List<ActivityType> activities = new ArrayList<>();
        final List<ProviderErrorEvent.Source> unavailable = new ArrayList<>();

        @Override
        public void onMotionChange(boolean moving, ProviderMode requestedMode) {
            motionChanges.add(moving);
            modes.add(requestedMode);
        }

        @Override
        public void onAccelerometerIntent(boolean enabled) {
            accelerometer.add(enabled);
        }

        @Override
        public void onActivityUpdatesIntent(boolean enabled) {
            activityUpdates.add(enabled);
        }

        @Override
        public void onActivityChange(ActivityType activity, int confidence) {
            activities.add(activity);
        }

        @Override
        public void onSourceUnavailable(ProviderErrorEvent.Source source, String detail) {
            unavailable.add(source);
        }
    }
}
