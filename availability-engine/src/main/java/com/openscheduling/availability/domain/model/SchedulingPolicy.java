package com.openscheduling.availability.domain.model;

import com.openscheduling.common.util.Constants;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * Configurable scheduling defaults and limits.
 */
@Value
@Builder
public class SchedulingPolicy {

    /** Time zone business hours are expressed in. */
    @Builder.Default
    ZoneId zoneId = ZoneOffset.UTC;

    @Builder.Default
    int minDurationMinutes = 15;

    @Builder.Default
    int maxDurationMinutes = 480;

    @Builder.Default
    int defaultDurationMinutes = 60;

    @Builder.Default
    int defaultBufferMinutes = 15;

    @Builder.Default
    int defaultMaxResults = Constants.DEFAULT_MAX_RESULTS;

    /** Minimum notice between now and an appointment start. Zero only rejects past starts. */
    @Builder.Default
    Duration minLeadTime = Duration.ZERO;

    /** How far ahead appointments may be booked; {@code null} means no limit. */
    Duration maxAdvance;

    public static SchedulingPolicy defaults() {
        return SchedulingPolicy.builder().build();
    }
}
