package com.tracking.engine.repository;

import com.tracking.engine.entity.SessionStateEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface SessionStateRepository extends JpaRepository<SessionStateEntity, Long> {
}
