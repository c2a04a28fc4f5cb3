package com.tracking.engine.schedule;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Weekly tracking windows parsed from schedule entries.
 *
 * Entry format: {@code "<days> <HH:mm>-<HH:mm>"} where days is an ISO weekday
 * (1 = Monday, 7 = Sunday), a range {@code 1-5} or a comma list {@code 1,3,5-7}.
 * A window covers {@code [start, end)} on each listed day.
 *
 * Examples:
 * - {@code "1-5 09:00-17:00"}  weekdays, office hours
 * - {@code "6,7 10:00-14:00"}  weekends, late morning
 */
public final class ScheduleWindows {

    private final List<Window> windows;

    private ScheduleWindows(List<Window> windows) {
        this.windows = List.copyOf(windows);
    }

    /**
     * Parses all entries.
     *
     * @throws IllegalArgumentException naming the first malformed entry
     */
    public static ScheduleWindows parse(List<String> entries) {
        List<Window> parsed = new ArrayList<>();
        for (String entry : entries) {
            parsed.add(parseEntry(entry));
        }
        return new ScheduleWindows(parsed);
    }

    public boolean isEmpty() {
        return windows.isEmpty();
    }

    public List<Window> windows() {
        return Collections.unmodifiableList(windows);
    }

    /**
     * True when {@code now} falls inside any window.
     */
    public boolean isActive(ZonedDateTime now) {
        return windows.stream().anyMatch(window -> window.contains(now));
    }

    /**
     * The next instant strictly after {@code now} at which some window opens or closes.
     */
    public Optional<ZonedDateTime> nextBoundary(ZonedDateTime now) {
        ZonedDateTime best = null;
        for (int offset = 0; offset <= 7; offset++) {
            LocalDate date = now.toLocalDate().plusDays(offset);
            for (Window window : windows) {
                if (!window.days().contains(date.getDayOfWeek())) {
                    continue;
                }
                for (LocalTime edge : List.of(window.start(), window.end())) {
                    ZonedDateTime candidate = date.atTime(edge).atZone(now.getZone());
                    if (candidate.isAfter(now) && (best == null || candidate.isBefore(best))) {
                        best = candidate;
                    }
                }
            }
            if (best != null) {
                return Optional.of(best);
            }
        }
        return Optional.empty();
    }

    private static Window parseEntry(String entry) {
        if (entry == null || entry.isBlank()) {
            throw new IllegalArgumentException("Empty schedule entry");
        }
        String[] parts = entry.trim().split("\\s+");
        if (parts.length != 2) {
            throw new IllegalArgumentException("Schedule entry must be '<days> <HH:mm>-<HH:mm>': " + entry);
        }
        Set<DayOfWeek> days = parseDays(parts[0], entry);
        String[] times = parts[1].split("-");
        if (times.length != 2) {
            throw new IllegalArgumentException("Time range must be '<HH:mm>-<HH:mm>': " + entry);
        }
        try {
            LocalTime start = LocalTime.parse(times[0]);
            LocalTime end = LocalTime.parse(times[1]);
            if (!end.isAfter(start)) {
                throw new IllegalArgumentException("Window end must be after start: " + entry);
            }
            return new Window(days, start, end);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid time in schedule entry: " + entry, e);
        }
    }

    private static Set<DayOfWeek> parseDays(String dayList, String entry) {
        Set<DayOfWeek> days = EnumSet.noneOf(DayOfWeek.class);
        for (String token : dayList.split(",")) {
            String[] range = token.split("-");
            try {
                int from = Integer.parseInt(range[0].trim());
                int to = range.length > 1 ? Integer.parseInt(range[1].trim()) : from;
                if (range.length > 2 || from < 1 || to > 7 || from > to) {
                    throw new IllegalArgumentException("Invalid day range '" + token + "' in: " + entry);
                }
                for (int day = from; day <= to; day++) {
                    days.add(DayOfWeek.of(day));
                }
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid day '" + token + "' in: " + entry, e);
            }
        }
        return days;
    }

    /**
     * One weekly window, {@code [start, end)} on each listed day.
     */
    public record Window(Set<DayOfWeek> days, LocalTime start, LocalTime end) {

        public boolean contains(ZonedDateTime time) {
            LocalTime local = time.toLocalTime();
            return days.contains(time.getDayOfWeek())
                && !local.isBefore(start)
                && local.isBefore(end);
        }
    }
}
