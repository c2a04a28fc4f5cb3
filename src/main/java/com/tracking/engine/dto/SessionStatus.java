package com.tracking.engine.dto;

/**
 * Lifecycle of the tracking session: IDLE, then READY once configured, then
 * TRACKING once started. {@code stop()} returns to IDLE and keeps the last config.
 */
public enum SessionStatus {
    IDLE,
    READY,
    TRACKING
}
