package com.openscheduling.common.exception;

import lombok.Getter;

import java.util.List;

/**
 * Raised by the booking write path when the conflict re-check finds bookings
 * overlapping the interval being written. Never raised by read-only queries.
 */
@Getter
public class BookingConflictException extends BusinessException {

    public static final String ERROR_CODE = "BOOKING_CONFLICT";

    private final List<String> conflictingBookingIds;

    public BookingConflictException(String message, List<String> conflictingBookingIds) {
        super(message, ERROR_CODE);
        this.conflictingBookingIds = List.copyOf(conflictingBookingIds);
    }
}
