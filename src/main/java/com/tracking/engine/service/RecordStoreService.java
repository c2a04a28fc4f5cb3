package com.tracking.engine.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tracking.engine.config.RetentionConfig;
import com.tracking.engine.config.TrackingExecutors;
import com.tracking.engine.dto.GeofenceEvent;
import com.tracking.engine.dto.LocationSample;
import com.tracking.engine.dto.RecordQuery;
import com.tracking.engine.dto.RecordView;
import com.tracking.engine.entity.RecordKind;
import com.tracking.engine.entity.TrackingRecord;
import com.tracking.engine.exception.StoreException;
import com.tracking.engine.repository.TrackingRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Append-only store of location and geofence records.
 *
 * Insert flow (on the store executor):
 * 1. Persist mode gate: skipped kinds resolve to an empty result
 * 2. Body built as JSON, configured extras merged under {@code extras}
 * 3. Row written, database identity assigns the next id
 * 4. Retention requested asynchronously, the insert does not wait for it
 *
 * Templates are applied when records are read ({@link #query}, sync batches),
 * stored rows are never rewritten.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RecordStoreService {

    private final TrackingRecordRepository recordRepository;
    private final RetentionService retentionService;
    private final RecordTemplateRenderer templateRenderer;
    private final ObjectMapper objectMapper;
    private final TrackingExecutors executors;
    private final Clock clock;

    /**
     * Location context stored alongside a fix.
     *
     * @param moving   declared motion state
     * @param odometer meters after this fix
     * @param activity last classified activity, optional
     * @param event    event tag such as "motionchange", optional
     */
    public record LocationContext(boolean moving, double odometer, String activity, String event) {
    }

    public CompletableFuture<Optional<TrackingRecord>> insertLocation(String uuid,
                                                                      LocationSample sample,
                                                                      LocationContext context,
                                                                      RetentionConfig retention) {
        if (!retention.persistMode().persists(RecordKind.LOCATION)) {
            return CompletableFuture.completedFuture(Optional.empty());
        }
        return CompletableFuture.supplyAsync(() -> {
            ObjectNode body = baseBody(uuid, sample);
            body.put("is_moving", context.moving());
            body.put("odometer", context.odometer());
            body.put("activity", context.activity());
            body.put("event", context.event());
            body.set("extras", objectMapper.valueToTree(retention.extras()));
            return Optional.of(write(RecordKind.LOCATION, uuid, sample, sample.timestamp(), body, retention));
        }, executors.store());
    }

    public CompletableFuture<Optional<TrackingRecord>> insertGeofence(String uuid,
                                                                      GeofenceEvent event,
                                                                      LocationSample anchor,
                                                                      RetentionConfig retention) {
        if (!retention.persistMode().persists(RecordKind.GEOFENCE) || anchor == null) {
            return CompletableFuture.completedFuture(Optional.empty());
        }
        return CompletableFuture.supplyAsync(() -> {
            ObjectNode body = baseBody(uuid, anchor);
            ObjectNode geofence = body.putObject("geofence");
            geofence.put("identifier", event.identifier());
            geofence.put("action", event.action().name());
            geofence.set("extras", objectMapper.valueToTree(event.extras()));
            body.put("timestamp", event.timestamp().toString());
            body.set("extras", objectMapper.valueToTree(retention.extras()));
            return Optional.of(write(RecordKind.GEOFENCE, uuid, anchor, event.timestamp(), body, retention));
        }, executors.store());
    }

    private ObjectNode baseBody(String uuid, LocationSample sample) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("uuid", uuid);
        body.put("timestamp", sample.timestamp().toString());
        body.put("latitude", sample.latitude());
        body.put("longitude", sample.longitude());
        body.put("accuracy", sample.accuracy());
        body.put("altitude", sample.altitude());
        body.put("speed", sample.speed());
        body.put("heading", sample.heading());
        body.put("provider", sample.provider());
        return body;
    }

    private TrackingRecord write(RecordKind kind, String uuid, LocationSample sample, Instant recordedAt,
                                 ObjectNode body, RetentionConfig retention) {
        try {
            TrackingRecord record = TrackingRecord.builder()
                .uuid(uuid)
                .kind(kind)
                .latitude(sample.latitude())
                .longitude(sample.longitude())
                .accuracy(sample.accuracy())
                .recordedAt(recordedAt)
                .createdAt(clock.instant())
                .synced(false)
                .payload(objectMapper.writeValueAsString(body))
                .build();
            TrackingRecord saved = recordRepository.save(record);
            log.debug("Stored {} record id={} uuid={}", kind, saved.getId(), uuid);

            if (retention.ageLimitEnabled() || retention.countLimitEnabled()) {
                retentionService.enforceAsync(retention);
            }
            return saved;
        } catch (JsonProcessingException e) {
            throw new StoreException("Cannot serialize record body " + uuid, e);
        } catch (RuntimeException e) {
            throw new StoreException("Failed to store " + kind + " record " + uuid + ": " + e.getMessage(), e);
        }
    }

    /**
     * Paged lookup with optional time range, sync status and kind filters.
     */
    public Page<RecordView> query(RecordQuery query, RetentionConfig retention) {
        Sort sort = query.ascending() ? Sort.by("id").ascending() : Sort.by("id").descending();
        PageRequest pageRequest = PageRequest.of(query.page(), query.size(), sort);
        return recordRepository.findAll(specificationFor(query), pageRequest)
            .map(record -> toView(record, retention));
    }

    private Specification<TrackingRecord> specificationFor(RecordQuery query) {
        List<Specification<TrackingRecord>> filters = new ArrayList<>();
        if (query.from() != null) {
            filters.add((root, q, cb) -> cb.greaterThanOrEqualTo(root.get("recordedAt"), query.from()));
        }
        if (query.to() != null) {
            filters.add((root, q, cb) -> cb.lessThan(root.get("recordedAt"), query.to()));
        }
        if (query.synced() != null) {
            filters.add((root, q, cb) -> cb.equal(root.get("synced"), query.synced()));
        }
        if (query.kind() != null) {
            filters.add((root, q, cb) -> cb.equal(root.get("kind"), query.kind()));
        }
        return Specification.allOf(filters);
    }

    /**
     * Oldest unsynced records, rendered for upload.
     */
    public List<RecordView> unsyncedBatch(int limit, RetentionConfig retention) {
        return recordRepository.findBySyncedFalseOrderByIdAsc(PageRequest.of(0, limit)).stream()
            .map(record -> toView(record, retention))
            .toList();
    }

    public int markSynced(Collection<Long> ids) {
        if (ids.isEmpty()) {
            return 0;
        }
        int updated = recordRepository.markSynced(ids);
        log.debug("Marked {} records as synced", updated);
        return updated;
    }

    public long countUnsynced() {
        return recordRepository.countBySyncedFalse();
    }

    public long count() {
        return recordRepository.count();
    }

    /**
     * Deletes every record.
     *
     * @return number of records removed
     */
    public long destroyAll() {
        long count = recordRepository.count();
        recordRepository.deleteAllInBatch();
        log.info("Destroyed {} records", count);
        return count;
    }

    public RecordView toView(TrackingRecord record, RetentionConfig retention) {
        JsonNode body = readBody(record);
        String template = record.getKind() == RecordKind.LOCATION
            ? retention.locationTemplate()
            : retention.geofenceTemplate();
        if (template != null && !template.isBlank()) {
            body = templateRenderer.render(template, body);
        }
        return new RecordView(
            record.getId(),
            record.getUuid(),
            record.getKind(),
            record.getRecordedAt(),
            record.getCreatedAt(),
            record.isSynced(),
            body
        );
    }

    private JsonNode readBody(TrackingRecord record) {
        try {
            return objectMapper.readTree(record.getPayload());
        } catch (JsonProcessingException e) {
            log.error("Corrupt payload in record {}", record.getId(), e);
            return objectMapper.valueToTree(Map.of("uuid", record.getUuid()));
        }
    }
}
