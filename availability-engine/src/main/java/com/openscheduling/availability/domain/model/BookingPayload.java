package com.openscheduling.availability.domain.model;

/**
 * Descriptive data stored with a new booking. None of it takes part in availability.
 */
public record BookingPayload(
        String customerId,
        String serviceType,
        String notes
) {
}
