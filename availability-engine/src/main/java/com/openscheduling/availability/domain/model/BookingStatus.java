package com.openscheduling.availability.domain.model;

public enum BookingStatus {
    SCHEDULED,
    CONFIRMED,
    COMPLETED,
    NO_SHOW,
    CANCELLED;

    /**
     * Cancelled bookings never occupy calendar time.
     */
    public boolean blocksCalendar() {
        return this != CANCELLED;
    }
}
