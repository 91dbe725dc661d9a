package com.openscheduling.availability.domain.model;

import java.util.List;

/**
 * A bookable interval and the resources free for all of it, ordered by id.
 */
public record AvailableSlot(
        TimeInterval interval,
        List<String> eligibleResourceIds,
        String locationId
) {

    public AvailableSlot {
        eligibleResourceIds = List.copyOf(eligibleResourceIds);
    }
}
