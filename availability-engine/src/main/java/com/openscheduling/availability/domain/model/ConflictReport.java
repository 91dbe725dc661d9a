package com.openscheduling.availability.domain.model;

import java.util.List;

/**
 * Existing bookings overlapping a proposed interval.
 */
public record ConflictReport(TimeInterval proposed, List<Conflict> conflicts) {

    public ConflictReport {
        conflicts = List.copyOf(conflicts);
    }

    public boolean isEmpty() {
        return conflicts.isEmpty();
    }

    public List<String> bookingIds() {
        return conflicts.stream()
                .map(conflict -> conflict.booking().id())
                .toList();
    }

    /**
     * @param overlap the part of the proposed interval the booking occupies
     */
    public record Conflict(ExistingBooking booking, TimeInterval overlap) {
    }
}
