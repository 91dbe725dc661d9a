package com.openscheduling.availability.support;

import com.openscheduling.availability.domain.model.BusinessHoursRule;
import com.openscheduling.availability.domain.model.TimeInterval;

import java.time.Instant;
import java.time.LocalTime;
import java.util.List;

public final class Fixtures {
    private Fixtures() {
    }

    /** Monday 2024-01-15, business zone UTC. */
    public static final String MONDAY = "2024-01-15";

    public static Instant at(String date, String time) {
        return Instant.parse(date + "T" + time + ":00Z");
    }

    public static Instant monday(String time) {
        return at(MONDAY, time);
    }

    public static TimeInterval interval(String from, String to) {
        return new TimeInterval(monday(from), monday(to));
    }

    /** Mon 09:00-17:00 only. */
    public static List<BusinessHoursRule> mondayNineToFive() {
        return List.of(BusinessHoursRule.open(1, LocalTime.of(9, 0), LocalTime.of(17, 0)));
    }

    /** Mon-Fri 09:00-17:00, weekend closed. */
    public static List<BusinessHoursRule> weekdaysNineToFive() {
        return List.of(
                BusinessHoursRule.closed(0),
                BusinessHoursRule.open(1, LocalTime.of(9, 0), LocalTime.of(17, 0)),
                BusinessHoursRule.open(2, LocalTime.of(9, 0), LocalTime.of(17, 0)),
                BusinessHoursRule.open(3, LocalTime.of(9, 0), LocalTime.of(17, 0)),
                BusinessHoursRule.open(4, LocalTime.of(9, 0), LocalTime.of(17, 0)),
                BusinessHoursRule.open(5, LocalTime.of(9, 0), LocalTime.of(17, 0)),
                BusinessHoursRule.closed(6));
    }
}
