package com.openscheduling.availability.domain.model;

import lombok.Builder;

import java.time.Instant;
import java.util.Set;

/**
 * Availability search over {@code [rangeStart, rangeEnd)}.
 *
 * @param resourceIds   resources to search; {@code null} means every schedulable resource
 * @param maxResults    global cap on returned slots; {@code null} falls back to the policy default
 * @param bufferMinutes clearance kept around existing bookings and between generated slots
 */
@Builder(toBuilder = true)
public record AvailabilitySearchRequest(
        Instant rangeStart,
        Instant rangeEnd,
        Set<String> resourceIds,
        int durationMinutes,
        Integer maxResults,
        String locationId,
        int bufferMinutes
) {

    public AvailabilitySearchRequest {
        resourceIds = resourceIds == null ? null : Set.copyOf(resourceIds);
    }
}
