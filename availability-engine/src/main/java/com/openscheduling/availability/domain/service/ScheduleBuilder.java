package com.openscheduling.availability.domain.service;

import com.openscheduling.availability.domain.model.BreakPeriod;
import com.openscheduling.availability.domain.model.BusinessHoursRule;
import com.openscheduling.availability.domain.model.ExistingBooking;
import com.openscheduling.availability.domain.model.SchedulingPolicy;
import com.openscheduling.availability.domain.model.TimeInterval;
import com.openscheduling.availability.domain.port.AppointmentStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Builds the free intervals of each resource over a range.
 *
 * Flow:
 * 1. Cut the range into per-day open windows from the business hours (closed days and
 *    break periods removed)
 * 2. Read the active bookings of all requested resources in one store call
 * 3. Subtract each resource's coalesced bookings from every open window
 *
 * Store failures propagate; a resource is never silently dropped from the result.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ScheduleBuilder {

    private final BusinessHoursCatalog businessHoursCatalog;
    private final AppointmentStore appointmentStore;
    private final SchedulingPolicy schedulingPolicy;

    /**
     * @param resourceIds   resources to build schedules for, in the order the result should keep
     * @param bufferMinutes clearance required on both sides of every booking
     * @return free intervals per resource, chronologically ordered
     */
    public Map<String, List<TimeInterval>> buildFreeSchedules(TimeInterval range,
                                                              List<String> resourceIds,
                                                              int bufferMinutes) {
        Map<String, List<TimeInterval>> schedules = new LinkedHashMap<>();
        List<TimeInterval> openWindows = openWindows(range);
        if (openWindows.isEmpty() || resourceIds.isEmpty()) {
            resourceIds.forEach(resourceId -> schedules.put(resourceId, List.of()));
            return schedules;
        }

        Duration buffer = Duration.ofMinutes(bufferMinutes);
        List<ExistingBooking> bookings = appointmentStore.listBookings(range.expand(buffer), Set.copyOf(resourceIds));
        Map<String, List<TimeInterval>> busyByResource = groupBusyIntervals(bookings, buffer);

        for (String resourceId : resourceIds) {
            List<TimeInterval> busy = coalesce(busyByResource.getOrDefault(resourceId, List.of()));
            List<TimeInterval> free = new ArrayList<>();
            for (TimeInterval window : openWindows) {
                free.addAll(subtract(window, busy));
            }
            schedules.put(resourceId, free);
        }
        log.debug("Built free schedules for {} resources over {} ({} bookings, buffer {} min)",
                resourceIds.size(), range, bookings.size(), bufferMinutes);
        return schedules;
    }

    /**
     * Business-open parts of {@code range}, one or more per open day, breaks excluded.
     */
    public List<TimeInterval> openWindows(TimeInterval range) {
        ZoneId zone = schedulingPolicy.getZoneId();
        LocalDate day = range.start().atZone(zone).toLocalDate();
        LocalDate lastDay = range.end().atZone(zone).toLocalDate();
        List<TimeInterval> windows = new ArrayList<>();

        while (!day.isAfter(lastDay)) {
            Optional<BusinessHoursRule> rule = businessHoursCatalog.hoursFor(BusinessHoursRule.dayIndex(day.getDayOfWeek()));
            if (rule.isPresent() && rule.get().open()) {
                LocalDate current = day;
                dayWindow(current, rule.get(), zone)
                        .flatMap(window -> window.intersection(range))
                        .ifPresent(window -> windows.addAll(subtract(window, breakIntervals(current, rule.get(), zone))));
            }
            day = day.plusDays(1);
        }
        return windows;
    }

    /**
     * Parts of {@code window} not covered by {@code busy}. {@code busy} must be sorted and coalesced.
     */
    static List<TimeInterval> subtract(TimeInterval window, List<TimeInterval> busy) {
        List<TimeInterval> free = new ArrayList<>();
        Instant cursor = window.start();
        for (TimeInterval booked : busy) {
            if (!booked.end().isAfter(cursor)) {
                continue;
            }
            if (!booked.start().isBefore(window.end())) {
                break;
            }
            if (booked.start().isAfter(cursor)) {
                free.add(new TimeInterval(cursor, booked.start()));
            }
            cursor = booked.end();
            if (!cursor.isBefore(window.end())) {
                return free;
            }
        }
        if (cursor.isBefore(window.end())) {
            free.add(new TimeInterval(cursor, window.end()));
        }
        return free;
    }

    /**
     * Sorts intervals and merges the ones that overlap or touch, so that two overlapping
     * bookings never leave a gap between them.
     */
    static List<TimeInterval> coalesce(Collection<TimeInterval> intervals) {
        List<TimeInterval> sorted = intervals.stream().sorted().toList();
        List<TimeInterval> merged = new ArrayList<>();
        for (TimeInterval next : sorted) {
            if (!merged.isEmpty()) {
                TimeInterval last = merged.get(merged.size() - 1);
                if (!next.start().isAfter(last.end())) {
                    if (next.end().isAfter(last.end())) {
                        merged.set(merged.size() - 1, new TimeInterval(last.start(), next.end()));
                    }
                    continue;
                }
            }
            merged.add(next);
        }
        return merged;
    }

    private Map<String, List<TimeInterval>> groupBusyIntervals(List<ExistingBooking> bookings, Duration buffer) {
        Map<String, List<TimeInterval>> busy = new HashMap<>();
        for (ExistingBooking booking : bookings) {
            if (!booking.isActive() || booking.resourceId() == null) {
                continue;
            }
            busy.computeIfAbsent(booking.resourceId(), id -> new ArrayList<>())
                    .add(booking.interval().expand(buffer));
        }
        return busy;
    }

    private Optional<TimeInterval> dayWindow(LocalDate day, BusinessHoursRule rule, ZoneId zone) {
        return toInterval(day, rule.openTime(), rule.closeTime(), zone);
    }

    private List<TimeInterval> breakIntervals(LocalDate day, BusinessHoursRule rule, ZoneId zone) {
        List<TimeInterval> breaks = new ArrayList<>();
        for (BreakPeriod period : rule.breaks()) {
            toInterval(day, period.startTime(), period.endTime(), zone).ifPresent(breaks::add);
        }
        return coalesce(breaks);
    }

    // A DST gap can collapse a local window to nothing.
    private static Optional<TimeInterval> toInterval(LocalDate day, LocalTime from, LocalTime to, ZoneId zone) {
        Instant start = day.atTime(from).atZone(zone).toInstant();
        Instant end = day.atTime(to).atZone(zone).toInstant();
        return start.isBefore(end) ? Optional.of(new TimeInterval(start, end)) : Optional.empty();
    }
}
