package com.tracking.engine.motion;

import com.tracking.engine.dto.ProviderErrorEvent;
import com.tracking.engine.platform.ProviderMode;

/**
 * Intents and notifications produced by the {@link MotionStateMachine}.
 * The receiver decides how to apply them to the device.
 */
public interface MotionListener {

    /**
     * MOVING or STATIONARY was declared. Called exactly once per transition.
     *
     * @param moving        the declared state
     * @param requestedMode provider mode the declaration asks for
     */
    void onMotionChange(boolean moving, ProviderMode requestedMode);

    void onAccelerometerIntent(boolean enabled);

    void onActivityUpdatesIntent(boolean enabled);

    /**
     * The classifier reported a different activity than the previous one.
     */
    void onActivityChange(ActivityType activity, int confidence);

    void onSourceUnavailable(ProviderErrorEvent.Source source, String detail);
}
