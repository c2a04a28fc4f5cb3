package com.tracking.engine.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tracking.engine.config.CacheConfig;
import com.tracking.engine.dto.GeofenceRegion;
import com.tracking.engine.entity.GeofenceDefinition;
import com.tracking.engine.exception.StoreException;
import com.tracking.engine.repository.GeofenceDefinitionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;

/**
 * Persistent geofence definitions.
 *
 * The table holds every registered region, however many the platform can
 * monitor. Single-region lookups are cached; any write evicts.
 * Re-adding an identifier replaces the definition and moves it to the end of
 * the registration order.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GeofenceRegistryService {

    private static final TypeReference<Map<String, Object>> EXTRAS_TYPE = new TypeReference<>() {
    };
    private static final TypeReference<List<List<Double>>> VERTICES_TYPE = new TypeReference<>() {
    };

    private final GeofenceDefinitionRepository definitionRepository;
    private final ObjectMapper objectMapper;

    @Transactional
    @CacheEvict(cacheNames = CacheConfig.GEOFENCE_CACHE, allEntries = true)
    public List<GeofenceRegion> saveAll(List<GeofenceRegion> regions) {
        for (GeofenceRegion region : regions) {
            definitionRepository.findByIdentifier(region.identifier()).ifPresent(existing -> {
                definitionRepository.delete(existing);
                definitionRepository.flush();
            });
            definitionRepository.save(toEntity(region));
        }
        log.info("Saved {} geofence definitions", regions.size());
        return regions;
    }

    @Cacheable(cacheNames = CacheConfig.GEOFENCE_CACHE, key = "#identifier", unless = "#result == null")
    @Transactional(readOnly = true)
    public GeofenceRegion find(String identifier) {
        log.debug("Geofence cache miss: {}", identifier);
        return definitionRepository.findByIdentifier(identifier)
            .map(this::toRegion)
            .orElse(null);
    }

    /**
     * All definitions in registration order.
     */
    @Transactional(readOnly = true)
    public List<GeofenceRegion> findAll() {
        return definitionRepository.findAllByOrderByIdAsc().stream()
            .map(this::toRegion)
            .toList();
    }

    @Transactional
    @CacheEvict(cacheNames = CacheConfig.GEOFENCE_CACHE, key = "#identifier")
    public boolean remove(String identifier) {
        long removed = definitionRepository.deleteByIdentifier(identifier);
        if (removed > 0) {
            log.info("Removed geofence definition {}", identifier);
        }
        return removed > 0;
    }

    @Transactional
    @CacheEvict(cacheNames = CacheConfig.GEOFENCE_CACHE, allEntries = true)
    public long removeAll() {
        long count = definitionRepository.count();
        definitionRepository.deleteAllInBatch();
        log.info("Removed all {} geofence definitions", count);
        return count;
    }

    private GeofenceDefinition toEntity(GeofenceRegion region) {
        try {
            return GeofenceDefinition.builder()
                .identifier(region.identifier())
                .latitude(region.latitude())
                .longitude(region.longitude())
                .radius(region.radius())
                .notifyOnEntry(region.notifyOnEntry())
                .notifyOnExit(region.notifyOnExit())
                .notifyOnDwell(region.notifyOnDwell())
                .loiteringDelay(region.loiteringDelay())
                .extras(region.extras().isEmpty() ? null : objectMapper.writeValueAsString(region.extras()))
                .vertices(region.polygonal() ? objectMapper.writeValueAsString(region.vertices()) : null)
                .build();
        } catch (JsonProcessingException e) {
            throw new StoreException("Cannot serialize geofence " + region.identifier(), e);
        }
    }

    private GeofenceRegion toRegion(GeofenceDefinition definition) {
        try {
            return GeofenceRegion.builder()
                .identifier(definition.getIdentifier())
                .latitude(definition.getLatitude())
                .longitude(definition.getLongitude())
                .radius(definition.getRadius())
                .notifyOnEntry(definition.getNotifyOnEntry())
                .notifyOnExit(definition.getNotifyOnExit())
                .notifyOnDwell(definition.getNotifyOnDwell())
                .loiteringDelay(definition.getLoiteringDelay())
                .extras(definition.getExtras() == null ? null : objectMapper.readValue(definition.getExtras(), EXTRAS_TYPE))
                .vertices(definition.getVertices() == null ? null : objectMapper.readValue(definition.getVertices(), VERTICES_TYPE))
                .build();
        } catch (JsonProcessingException e) {
            throw new StoreException("Corrupt geofence definition " + definition.getIdentifier(), e);
        }
    }
}
