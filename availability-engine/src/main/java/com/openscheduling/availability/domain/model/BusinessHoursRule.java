package com.openscheduling.availability.domain.model;

import com.openscheduling.common.exception.InvalidArgumentException;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Opening hours for one day of the week. Days are numbered 0 (Sunday) to 6 (Saturday).
 * Open and close times are wall-clock times in the business time zone.
 */
public record BusinessHoursRule(
        int dayOfWeek,
        LocalTime openTime,
        LocalTime closeTime,
        boolean open,
        List<BreakPeriod> breaks
) {

    public BusinessHoursRule {
        checkDayOfWeek(dayOfWeek);
        breaks = breaks == null ? List.of() : List.copyOf(breaks);
        if (open) {
            if (openTime == null || closeTime == null) {
                throw new InvalidArgumentException("Open day " + dayOfWeek + " needs open and close times");
            }
            if (!openTime.isBefore(closeTime)) {
                throw new InvalidArgumentException(
                        String.format("Open time must be before close time for day %d", dayOfWeek));
            }
        }
    }

    public static BusinessHoursRule open(int dayOfWeek, LocalTime openTime, LocalTime closeTime) {
        return new BusinessHoursRule(dayOfWeek, openTime, closeTime, true, List.of());
    }

    public static BusinessHoursRule closed(int dayOfWeek) {
        return new BusinessHoursRule(dayOfWeek, null, null, false, List.of());
    }

    public BusinessHoursRule withBreak(LocalTime start, LocalTime end) {
        List<BreakPeriod> extended = new ArrayList<>(breaks);
        extended.add(new BreakPeriod(start, end));
        return new BusinessHoursRule(dayOfWeek, openTime, closeTime, open, extended);
    }

    /**
     * Maps {@link DayOfWeek} (Monday = 1 .. Sunday = 7) onto the 0 (Sunday) .. 6 numbering.
     */
    public static int dayIndex(DayOfWeek day) {
        return day.getValue() % 7;
    }

    public static void checkDayOfWeek(int dayOfWeek) {
        if (dayOfWeek < 0 || dayOfWeek > 6) {
            throw new InvalidArgumentException("Day of week must be between 0 and 6, got " + dayOfWeek);
        }
    }
}
