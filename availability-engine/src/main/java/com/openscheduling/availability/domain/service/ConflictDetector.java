package com.openscheduling.availability.domain.service;

import com.openscheduling.availability.domain.model.ConflictReport;
import com.openscheduling.availability.domain.model.ExistingBooking;
import com.openscheduling.availability.domain.model.TimeInterval;
import com.openscheduling.availability.domain.port.AppointmentStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Set;

/**
 * Finds existing bookings that overlap a proposed interval.
 *
 * Overlap is always the half-open test of {@link TimeInterval#overlaps}. Cancelled bookings
 * never conflict. When a resource is given only that resource's bookings are considered;
 * without one, every booking is.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConflictDetector {

    private final AppointmentStore appointmentStore;

    /**
     * Reads the bookings around {@code interval} from the store and reports the overlapping ones.
     *
     * @param resourceId       resource to check, or {@code null} for all bookings
     * @param excludeBookingId booking to ignore, e.g. the one being moved
     */
    public ConflictReport detect(TimeInterval interval, String resourceId, String excludeBookingId) {
        Set<String> scope = resourceId == null ? null : Set.of(resourceId);
        List<ExistingBooking> candidates = appointmentStore.listBookings(interval, scope);
        ConflictReport report = findConflicts(interval, resourceId, excludeBookingId, candidates);
        if (!report.isEmpty()) {
            log.debug("Interval {} for resource {} conflicts with bookings {}",
                    interval, resourceId, report.bookingIds());
        }
        return report;
    }

    /**
     * Evaluates the conflict rule over bookings the caller already loaded. Booking write paths
     * call this inside their transaction against freshly read rows.
     */
    public static ConflictReport findConflicts(TimeInterval interval,
                                        String resourceId,
                                        String excludeBookingId,
                                        Collection<ExistingBooking> candidates) {
        List<ConflictReport.Conflict> conflicts = candidates.stream()
                .filter(ExistingBooking::isActive)
                .filter(booking -> resourceId == null || booking.belongsTo(resourceId))
                .filter(booking -> excludeBookingId == null || !excludeBookingId.equals(booking.id()))
                .filter(booking -> booking.interval().overlaps(interval))
                .sorted(Comparator.comparing((ExistingBooking booking) -> booking.interval())
                        .thenComparing(ExistingBooking::id))
                .map(booking -> new ConflictReport.Conflict(
                        booking, booking.interval().intersection(interval).orElseThrow()))
                .toList();
        return new ConflictReport(interval, conflicts);
    }
}
