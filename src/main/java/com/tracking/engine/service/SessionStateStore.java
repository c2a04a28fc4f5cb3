package com.tracking.engine.service;

import java.util.Optional;

/**
 * Storage port for the session-state blob.
 */
public interface SessionStateStore {

    Optional<SessionState> load();

    void save(SessionState state);
}
