package com.openscheduling.availability.domain.model;

/**
 * Read projection of a stored booking.
 *
 * @param resourceId the booked resource, or {@code null} when the booking is not assigned to one
 */
public record ExistingBooking(
        String id,
        TimeInterval interval,
        String resourceId,
        BookingStatus status
) {

    public boolean isActive() {
        return status == null || status.blocksCalendar();
    }

    public boolean belongsTo(String resource) {
        return resource != null && resource.equals(resourceId);
    }
}
