package com.openscheduling.availability.domain.port;

import com.openscheduling.availability.domain.model.BookingPayload;
import com.openscheduling.availability.domain.model.ExistingBooking;
import com.openscheduling.availability.domain.model.TimeInterval;

import java.util.List;
import java.util.Set;

/**
 * Durable booking storage, implemented by the persistence layer.
 *
 * Read failures surface as {@link com.openscheduling.common.exception.StoreUnavailableException}.
 * Writes must re-run the overlap check against the latest committed state inside the same
 * atomic unit that writes, and fail with
 * {@link com.openscheduling.common.exception.BookingConflictException} when it finds one.
 * Two committed bookings for the same resource never overlap.
 */
public interface AppointmentStore {

    /**
     * Non-cancelled bookings overlapping {@code range}.
     *
     * @param resourceIds restricts the result to these resources; {@code null} returns bookings of every resource
     */
    List<ExistingBooking> listBookings(TimeInterval range, Set<String> resourceIds);

    /**
     * @return the new booking id
     */
    String createBooking(TimeInterval interval, String resourceId, BookingPayload payload);

    /**
     * Moves a booking, ignoring the booking itself during the conflict re-check.
     */
    void updateBookingTime(String bookingId, TimeInterval newInterval);

    void cancelBooking(String bookingId);
}
