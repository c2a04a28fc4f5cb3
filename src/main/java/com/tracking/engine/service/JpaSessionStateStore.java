package com.tracking.engine.service;

import com.tracking.engine.entity.SessionStateEntity;
import com.tracking.engine.repository.SessionStateRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Optional;

/**
 * Keeps the session state in a single row of {@code session_state}.
 */
@Component
@RequiredArgsConstructor
public class JpaSessionStateStore implements SessionStateStore {

    private final SessionStateRepository stateRepository;
    private final Clock clock;

    @Override
    public Optional<SessionState> load() {
        return stateRepository.findById(SessionStateEntity.SINGLETON_ID)
            .map(entity -> new SessionState(
                entity.isEnabled(),
                entity.getTrackingMode(),
                entity.isSchedulerEnabled(),
                entity.getOdometer(),
                entity.isMoving(),
                entity.getLastFixTime()
            ));
    }

    @Override
    public void save(SessionState state) {
        stateRepository.save(SessionStateEntity.builder()
            .id(SessionStateEntity.SINGLETON_ID)
            .enabled(state.enabled())
            .trackingMode(state.trackingMode())
            .schedulerEnabled(state.schedulerEnabled())
            .odometer(state.odometer())
            .moving(state.moving())
            .lastFixTime(state.lastFixTime())
            .updatedAt(clock.instant())
            .build());
    }
}
