package com.tracking.engine.repository;

import com.tracking.engine.entity.GeofenceDefinition;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

@Repository
public interface GeofenceDefinitionRepository extends JpaRepository<GeofenceDefinition, Long> {

    Optional<GeofenceDefinition> findByIdentifier(String identifier);

    /**
     * All definitions in registration order.
     */
    List<GeofenceDefinition> findAllByOrderByIdAsc();

    @Modifying
    @Transactional
    long deleteByIdentifier(String identifier);
}
