package com.openscheduling.availability.domain.model;

import com.openscheduling.common.exception.InvalidArgumentException;

import java.time.LocalTime;

/**
 * A recurring closed period inside a business day, e.g. a lunch break.
 */
public record BreakPeriod(LocalTime startTime, LocalTime endTime) {

    public BreakPeriod {
        if (startTime == null || endTime == null || !startTime.isBefore(endTime)) {
            throw new InvalidArgumentException(
                    String.format("Break %s-%s must start before it ends", startTime, endTime));
        }
    }
}
