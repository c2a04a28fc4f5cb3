package com.tracking.engine.schedule;

import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScheduleWindowsTest {

    // 2024-01-01 is a Monday
    private static ZonedDateTime at(int day, int hour, int minute) {
        return ZonedDateTime.of(2024, 1, day, hour, minute, 0, 0, ZoneOffset.UTC);
    }

    @Test
    void shouldParseDayRangesAndLists() {
        ScheduleWindows windows = ScheduleWindows.parse(List.of("1-5 09:00-17:00", "6,7 10:00-12:30"));

        assertThat(windows.windows()).hasSize(2);
        assertThat(windows.windows().get(0).days()).hasSize(5).doesNotContain(DayOfWeek.SATURDAY);
        assertThat(windows.windows().get(1).days()).containsExactlyInAnyOrder(DayOfWeek.SATURDAY, DayOfWeek.SUNDAY);
    }

    @Test
    void shouldBeActiveInsideHalfOpenWindow() {
        ScheduleWindows windows = ScheduleWindows.parse(List.of("1-5 09:00-17:00"));

        assertThat(windows.isActive(at(1, 8, 59))).isFalse();
        assertThat(windows.isActive(at(1, 9, 0))).isTrue();
        assertThat(windows.isActive(at(1, 16, 59))).isTrue();
        assertThat(windows.isActive(at(1, 17, 0))).isFalse();
        // Saturday
        assertThat(windows.isActive(at(6, 10, 0))).isFalse();
    }

    @Test
    void shouldFindNextBoundary() {
        ScheduleWindows windows = ScheduleWindows.parse(List.of("1-5 09:00-17:00"));

        assertThat(windows.nextBoundary(at(1, 8, 0))).contains(at(1, 9, 0));
        assertThat(windows.nextBoundary(at(1, 9, 0))).contains(at(1, 17, 0));
        // Friday evening -> Monday morning
        assertThat(windows.nextBoundary(at(5, 18, 0))).contains(at(8, 9, 0));
    }

    @Test
    void shouldRejectMalformedEntries() {
        assertThatThrownBy(() -> ScheduleWindows.parse(List.of("1-5 17:00-09:00")))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("end must be after start");
        assertThatThrownBy(() -> ScheduleWindows.parse(List.of("0-5 09:00-17:00")))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ScheduleWindows.parse(List.of("mon 09:00-17:00")))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ScheduleWindows.parse(List.of("1-5 9am-5pm")))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
