package com.tracking.engine.service;

import com.tracking.engine.config.RetentionConfig;
import com.tracking.engine.dto.LocationSample;
import com.tracking.engine.dto.RecordQuery;
import com.tracking.engine.dto.RecordView;
import com.tracking.engine.support.IntegrationTestSupport;
import com.tracking.engine.support.TrackingTestConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class RetentionServiceTest extends IntegrationTestSupport {

    private static final RecordStoreService.LocationContext CONTEXT =
        new RecordStoreService.LocationContext(false, 0, null, null);

    @Autowired
    private RecordStoreService recordStore;

    @Autowired
    private RetentionService retentionService;

    @BeforeEach
    void setUp() {
        clock.set(TrackingTestConfig.START);
        recordStore.destroyAll();
    }

    @AfterEach
    void tearDown() {
        clock.set(TrackingTestConfig.START);
    }

    private void insert(String uuid, RetentionConfig retention) throws Exception {
        LocationSample sample = LocationSample.builder()
            .latitude(37.78)
            .longitude(-122.415)
            .accuracy(5.0)
            .timestamp(clock.instant())
            .build();
        recordStore.insertLocation(uuid, sample, CONTEXT, retention).get(5, TimeUnit.SECONDS);
    }

    @Test
    void shouldKeepNewestRecordsWhenCountLimitExceeded() throws Exception {
        for (int i = 0; i < 150; i++) {
            insert("rec-" + i, RetentionConfig.defaults());
        }

        int deleted = retentionService.enforce(RetentionConfig.builder().maxRecordsToPersist(100).build());

        assertThat(deleted).isEqualTo(50);
        assertThat(recordStore.count()).isEqualTo(100);
        RecordView oldest = recordStore.query(RecordQuery.firstPage(1), RetentionConfig.defaults()).getContent().get(0);
        assertThat(oldest.uuid()).isEqualTo("rec-50");
    }

    @Test
    void shouldDropRecordsOlderThanAgeLimit() throws Exception {
        for (int day = 0; day < 10; day++) {
            insert("day-" + day, RetentionConfig.defaults());
            if (day < 9) {
                clock.advance(Duration.ofDays(1));
            }
        }
        clock.advance(Duration.ofHours(1));

        int deleted = retentionService.enforce(RetentionConfig.builder().maxDaysToPersist(7).build());

        assertThat(deleted).isEqualTo(3);
        assertThat(recordStore.count()).isEqualTo(7);
    }

    @Test
    void shouldApplyAgeThenCount() throws Exception {
        for (int day = 0; day < 10; day++) {
            insert("day-" + day, RetentionConfig.defaults());
            clock.advance(Duration.ofDays(1));
        }

        int deleted = retentionService.enforce(RetentionConfig.builder()
            .maxDaysToPersist(7)
            .maxRecordsToPersist(5)
            .build());

        assertThat(deleted).isEqualTo(5);
        assertThat(recordStore.count()).isEqualTo(5);
    }

    @Test
    void shouldPruneInBackgroundAfterInsert() throws Exception {
        RetentionConfig limited = RetentionConfig.builder().maxRecordsToPersist(5).build();

        for (int i = 0; i < 8; i++) {
            insert("rec-" + i, limited);
        }

        await().atMost(5, TimeUnit.SECONDS).until(() -> recordStore.count() == 5);
    }

    @Test
    void shouldDeleteNothingWithoutLimits() throws Exception {
        insert("a", RetentionConfig.defaults());

        assertThat(retentionService.enforce(RetentionConfig.defaults())).isZero();
        assertThat(recordStore.count()).isEqualTo(1);
    }
}
