package com.openscheduling.appointment.domain.store;

import com.openscheduling.appointment.domain.model.Appointment;
import com.openscheduling.appointment.domain.model.SchedulableResource;
import com.openscheduling.appointment.domain.repository.AppointmentRepository;
import com.openscheduling.appointment.domain.repository.SchedulableResourceRepository;
import com.openscheduling.appointment.domain.strategy.BookingWriteStrategy;
import com.openscheduling.appointment.domain.strategy.ConflictCheckingWriter;
import com.openscheduling.availability.domain.model.BookingPayload;
import com.openscheduling.availability.domain.model.ExistingBooking;
import com.openscheduling.availability.domain.model.TimeInterval;
import com.openscheduling.availability.domain.port.AppointmentStore;
import com.openscheduling.availability.domain.port.ResourceDirectory;
import com.openscheduling.common.exception.StoreUnavailableException;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

/**
 * {@link AppointmentStore} and {@link ResourceDirectory} over PostgreSQL.
 *
 * Reads go straight to the repositories. Writes go through the configured
 * {@link BookingWriteStrategy}, selected by bean name from Spring's map injection:
 * {@code appointments.booking.strategy: distributed | serializable}.
 * Database failures surface as {@link StoreUnavailableException}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JpaAppointmentStore implements AppointmentStore, ResourceDirectory {

    private static final String DEFAULT_STRATEGY = "distributed";

    private final Map<String, BookingWriteStrategy> writeStrategies;
    private final ConflictCheckingWriter writer;
    private final AppointmentRepository appointmentRepository;
    private final SchedulableResourceRepository resourceRepository;

    @Value("${appointments.booking.strategy:distributed}")
    private String strategyType;

    @PostConstruct
    public void init() {
        BookingWriteStrategy strategy = getWriteStrategy();
        log.info("Initialized JpaAppointmentStore with booking strategy: {}", strategy.getStrategyType());
    }

    @Override
    @Transactional(readOnly = true)
    public List<ExistingBooking> listBookings(TimeInterval range, Set<String> resourceIds) {
        List<Appointment> appointments = translate("list bookings", () -> resourceIds == null
                ? appointmentRepository.findActiveOverlapping(range.start(), range.end())
                : appointmentRepository.findActiveOverlappingForResources(range.start(), range.end(), resourceIds));
        return appointments.stream()
                .map(Appointment::toExistingBooking)
                .toList();
    }

    @Override
    public String createBooking(TimeInterval interval, String resourceId, BookingPayload payload) {
        return translate("create booking", () -> getWriteStrategy().create(interval, resourceId, payload));
    }

    @Override
    public void updateBookingTime(String bookingId, TimeInterval newInterval) {
        translate("update booking", () -> {
            getWriteStrategy().reschedule(bookingId, newInterval);
            return null;
        });
    }

    @Override
    public void cancelBooking(String bookingId) {
        translate("cancel booking", () -> {
            writer.cancel(bookingId);
            return null;
        });
    }

    @Override
    @Transactional(readOnly = true)
    public List<String> listResourceIds() {
        return translate("list resources", () -> resourceRepository.findByActiveTrueOrderByIdAsc().stream()
                .map(SchedulableResource::getId)
                .toList());
    }

    /**
     * Looks the configured strategy up by bean name (case-insensitive), falling back to
     * "distributed" when the name is unknown.
     */
    private BookingWriteStrategy getWriteStrategy() {
        String strategyKey = strategyType.toLowerCase();
        BookingWriteStrategy strategy = writeStrategies.get(strategyKey);

        if (strategy == null) {
            log.warn("Unknown booking strategy: {}. Available strategies: {}. Defaulting to {}",
                    strategyType, writeStrategies.keySet(), DEFAULT_STRATEGY);
            strategy = writeStrategies.get(DEFAULT_STRATEGY);

            if (strategy == null) {
                throw new IllegalStateException(
                        DEFAULT_STRATEGY + " strategy not found. Available strategies: " + writeStrategies.keySet());
            }
        }
        return strategy;
    }

    private static <T> T translate(String operation, Supplier<T> call) {
        try {
            return call.get();
        } catch (DataAccessException e) {
            log.warn("Appointment store failed to {}: {}", operation, e.getMessage());
            throw new StoreUnavailableException("Appointment store unavailable: could not " + operation, e);
        }
    }
}
