package com.tracking.engine.service;

import com.tracking.engine.config.PersistMode;
import com.tracking.engine.config.RetentionConfig;
import com.tracking.engine.dto.GeofenceEvent;
import com.tracking.engine.dto.LocationSample;
import com.tracking.engine.dto.RecordQuery;
import com.tracking.engine.dto.RecordView;
import com.tracking.engine.entity.RecordKind;
import com.tracking.engine.entity.TrackingRecord;
import com.tracking.engine.geofence.GeofenceAction;
import com.tracking.engine.support.IntegrationTestSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.domain.Page;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class RecordStoreServiceTest extends IntegrationTestSupport {

    private static final RecordStoreService.LocationContext CONTEXT =
        new RecordStoreService.LocationContext(true, 42.5, "walking", null);

    @Autowired
    private RecordStoreService recordStore;

    @BeforeEach
    void setUp() {
        recordStore.destroyAll();
    }

    private LocationSample fix(Instant time) {
        return LocationSample.builder()
            .latitude(37.78)
            .longitude(-122.415)
            .accuracy(5.0)
            .speed(1.5)
            .timestamp(time)
            .build();
    }

    private Optional<TrackingRecord> insert(String uuid, Instant time, RetentionConfig retention) throws Exception {
        return recordStore.insertLocation(uuid, fix(time), CONTEXT, retention).get(5, TimeUnit.SECONDS);
    }

    @Test
    void shouldStoreLocationWithContextAndExtras() throws Exception {
        RetentionConfig retention = RetentionConfig.builder().extras(Map.of("route", "R-7")).build();

        Optional<TrackingRecord> stored = insert("uuid-1", clock.instant(), retention);

        assertThat(stored).isPresent();
        RecordView view = recordStore.toView(stored.get(), retention);
        assertThat(view.kind()).isEqualTo(RecordKind.LOCATION);
        assertThat(view.synced()).isFalse();
        assertThat(view.body().get("uuid").asText()).isEqualTo("uuid-1");
        assertThat(view.body().get("odometer").asDouble()).isEqualTo(42.5);
        assertThat(view.body().get("is_moving").asBoolean()).isTrue();
        assertThat(view.body().get("activity").asText()).isEqualTo("walking");
        assertThat(view.body().get("extras").get("route").asText()).isEqualTo("R-7");
    }

    @Test
    void shouldSkipKindsExcludedByPersistMode() throws Exception {
        RetentionConfig geofenceOnly = RetentionConfig.builder().persistMode(PersistMode.GEOFENCE).build();

        Optional<TrackingRecord> location = insert("uuid-1", clock.instant(), geofenceOnly);
        Optional<TrackingRecord> geofence = recordStore.insertGeofence("uuid-2",
                new GeofenceEvent("HOME", GeofenceAction.ENTER, null, Map.of(), clock.instant()),
                fix(clock.instant()), geofenceOnly)
            .get(5, TimeUnit.SECONDS);

        assertThat(location).isEmpty();
        assertThat(geofence).isPresent();
        assertThat(recordStore.count()).isEqualTo(1);
        RecordView view = recordStore.toView(geofence.get(), geofenceOnly);
        assertThat(view.body().get("geofence").get("identifier").asText()).isEqualTo("HOME");
        assertThat(view.body().get("geofence").get("action").asText()).isEqualTo("ENTER");
    }

    @Test
    void shouldAssignIncreasingIds() throws Exception {
        long first = insert("a", clock.instant(), RetentionConfig.defaults()).orElseThrow().getId();
        long second = insert("b", clock.instant(), RetentionConfig.defaults()).orElseThrow().getId();

        assertThat(second).isGreaterThan(first);
    }

    @Test
    void shouldFilterQueryByTimeAndSyncStatus() throws Exception {
        Instant t0 = clock.instant();
        long first = insert("a", t0, RetentionConfig.defaults()).orElseThrow().getId();
        insert("b", t0.plus(Duration.ofMinutes(10)), RetentionConfig.defaults());
        insert("c", t0.plus(Duration.ofMinutes(20)), RetentionConfig.defaults());
        recordStore.markSynced(List.of(first));

        Page<RecordView> unsynced = recordStore.query(
            new RecordQuery(null, null, false, null, 0, 10, true), RetentionConfig.defaults());
        Page<RecordView> window = recordStore.query(
            new RecordQuery(t0, t0.plus(Duration.ofMinutes(20)), null, RecordKind.LOCATION, 0, 10, false),
            RetentionConfig.defaults());

        assertThat(unsynced.getContent()).extracting(RecordView::uuid).containsExactly("b", "c");
        assertThat(window.getContent()).extracting(RecordView::uuid).containsExactly("b", "a");
        assertThat(recordStore.countUnsynced()).isEqualTo(2);
    }

    @Test
    void shouldReturnOldestUnsyncedFirst() throws Exception {
        for (String uuid : List.of("a", "b", "c", "d")) {
            insert(uuid, clock.instant(), RetentionConfig.defaults());
        }

        List<RecordView> batch = recordStore.unsyncedBatch(2, RetentionConfig.defaults());

        assertThat(batch).extracting(RecordView::uuid).containsExactly("a", "b");
    }

    @Test
    void shouldRenderTemplateAtReadTimeWithoutChangingStoredBody() throws Exception {
        RetentionConfig templated = RetentionConfig.builder()
            .locationTemplate("{\"lat\":<%= latitude %>,\"id\":\"<%= uuid %>\",\"missing\":<%= nope.deeper %>}")
            .build();
        insert("uuid-1", clock.instant(), RetentionConfig.defaults());

        RecordView rendered = recordStore.query(RecordQuery.firstPage(10), templated).getContent().get(0);
        RecordView raw = recordStore.query(RecordQuery.firstPage(10), RetentionConfig.defaults()).getContent().get(0);

        assertThat(rendered.body().get("lat").asDouble()).isEqualTo(37.78);
        assertThat(rendered.body().get("id").asText()).isEqualTo("uuid-1");
        assertThat(rendered.body().get("missing").isNull()).isTrue();
        assertThat(raw.body().has("lat")).isFalse();
        assertThat(raw.body().get("latitude").asDouble()).isEqualTo(37.78);
    }

    @Test
    void shouldDestroyAllRecords() throws Exception {
        insert("a", clock.instant(), RetentionConfig.defaults());
        insert("b", clock.instant(), RetentionConfig.defaults());

        assertThat(recordStore.destroyAll()).isEqualTo(2);
        assertThat(recordStore.count()).isZero();
    }
}
