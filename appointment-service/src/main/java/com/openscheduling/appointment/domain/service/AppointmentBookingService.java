package com.openscheduling.appointment.domain.service;

import com.openscheduling.appointment.config.SchedulingProperties;
import com.openscheduling.appointment.exception.SchedulingRulesViolatedException;
import com.openscheduling.availability.domain.model.AlternativeTimeOptions;
import com.openscheduling.availability.domain.model.AvailabilitySearchRequest;
import com.openscheduling.availability.domain.model.AvailableSlot;
import com.openscheduling.availability.domain.model.BookingPayload;
import com.openscheduling.availability.domain.model.SchedulingPolicy;
import com.openscheduling.availability.domain.model.SuggestedSlot;
import com.openscheduling.availability.domain.model.TimeInterval;
import com.openscheduling.availability.domain.model.ValidationResult;
import com.openscheduling.availability.domain.port.AppointmentStore;
import com.openscheduling.availability.domain.service.AvailabilityCoordinator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;

/**
 * Booking workflow on top of the availability engine.
 *
 * Flow:
 * 1. Validate the proposed time against business hours, duration limits and lead time
 * 2. Write through the {@link AppointmentStore}, whose write path re-checks conflicts
 *    atomically and raises BookingConflictException if the time was taken meanwhile
 *
 * Availability seen by earlier searches is never trusted; only step 2 decides.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AppointmentBookingService {

    private final AvailabilityCoordinator availabilityCoordinator;
    private final AppointmentStore appointmentStore;
    private final SchedulingPolicy schedulingPolicy;
    private final SchedulingProperties schedulingProperties;

    /**
     * Slot search bounded by {@code scheduling.search-timeout}.
     */
    public List<AvailableSlot> findAvailableSlots(AvailabilitySearchRequest request) {
        return availabilityCoordinator.search(request, schedulingProperties.searchTimeout());
    }

    /**
     * @param durationMinutes appointment length, or {@code null} for the policy default
     * @param resourceId      resource to book, or {@code null} for an unassigned appointment
     * @return id of the new appointment
     */
    public String book(Instant start, Integer durationMinutes, String resourceId, BookingPayload payload) {
        int duration = durationOrDefault(durationMinutes);
        requireValid(start, duration);

        String bookingId = appointmentStore.createBooking(TimeInterval.ofMinutes(start, duration), resourceId, payload);
        log.info("Booked appointment {} at {} for {} min on resource {}", bookingId, start, duration, resourceId);
        return bookingId;
    }

    public void reschedule(String bookingId, Instant newStart, Integer durationMinutes) {
        int duration = durationOrDefault(durationMinutes);
        requireValid(newStart, duration);

        appointmentStore.updateBookingTime(bookingId, TimeInterval.ofMinutes(newStart, duration));
        log.info("Rescheduled appointment {} to {} for {} min", bookingId, newStart, duration);
    }

    public void cancel(String bookingId) {
        appointmentStore.cancelBooking(bookingId);
    }

    /**
     * Free times near a requested start, for a caller whose booking attempt failed.
     * Existing bookings are padded with the policy's default buffer.
     */
    public List<SuggestedSlot> alternativesFor(Instant preferredStart, Integer durationMinutes, String resourceId) {
        AlternativeTimeOptions defaults = AlternativeTimeOptions.defaults();
        AlternativeTimeOptions options = AlternativeTimeOptions.builder()
                .withinDays(defaults.withinDays())
                .maxSuggestions(defaults.maxSuggestions())
                .bufferMinutes(schedulingPolicy.getDefaultBufferMinutes())
                .build();
        return availabilityCoordinator.suggestAlternatives(
                preferredStart, durationOrDefault(durationMinutes), resourceId, options);
    }

    private void requireValid(Instant start, int durationMinutes) {
        // conflicts are left to the store's write-time check
        ValidationResult result = availabilityCoordinator.validateSchedulingRules(start, durationMinutes, null);
        if (!result.valid()) {
            log.debug("Rejected appointment at {} for {} min: {}", start, durationMinutes, result.reasonCodes());
            throw new SchedulingRulesViolatedException(result.reasons());
        }
    }

    private int durationOrDefault(Integer durationMinutes) {
        return durationMinutes != null ? durationMinutes : schedulingPolicy.getDefaultDurationMinutes();
    }
}
