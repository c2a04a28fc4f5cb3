package com.tracking.engine.event;

import com.tracking.engine.motion.ActivityType;

public record ActivityChangeEvent(ActivityType activity, int confidence) {
}
