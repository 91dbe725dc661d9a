package com.openscheduling.availability.domain.model;

import java.time.Duration;

/**
 * An alternative slot ranked by its distance from the requested time (rank 1 is the closest).
 */
public record SuggestedSlot(
        AvailableSlot slot,
        Duration distanceFromPreferred,
        int rank
) {
}
