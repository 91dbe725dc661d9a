package com.openscheduling.appointment.domain.strategy;

import com.openscheduling.availability.domain.model.BookingPayload;
import com.openscheduling.availability.domain.model.TimeInterval;

/**
 * Strategy interface for writing bookings with different concurrency control mechanisms.
 *
 * Implementations (bean names):
 * - distributed: Redisson lock per resource around a conflict-checking transaction
 * - serializable: SERIALIZABLE transaction retried on serialization failure
 *
 * Whatever the mechanism, two writers can never both commit overlapping active bookings
 * for the same resource; the loser gets a BookingConflictException.
 */
public interface BookingWriteStrategy {

    /**
     * @param resourceId resource to book, or {@code null} for an unassigned booking
     * @return id of the new booking
     */
    String create(TimeInterval interval, String resourceId, BookingPayload payload);

    void reschedule(String bookingId, TimeInterval newInterval);

    /**
     * @return strategy type (DISTRIBUTED_LOCK, SERIALIZABLE)
     */
    String getStrategyType();
}
