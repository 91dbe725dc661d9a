package com.openscheduling.availability.domain.model;

import lombok.Builder;

/**
 * Tuning for alternative-time suggestions.
 *
 * @param withinDays     how many days after the preferred start to look
 * @param maxSuggestions how many suggestions to return at most
 * @param bufferMinutes  clearance around existing bookings; {@code null} uses no buffer
 */
@Builder
public record AlternativeTimeOptions(
        int withinDays,
        int maxSuggestions,
        Integer bufferMinutes
) {

    public static AlternativeTimeOptions defaults() {
        return new AlternativeTimeOptions(7, 5, null);
    }
}
