package com.openscheduling.appointment.domain.strategy;

import com.openscheduling.appointment.domain.model.Appointment;
import com.openscheduling.appointment.domain.repository.AppointmentRepository;
import com.openscheduling.appointment.domain.repository.SchedulableResourceRepository;
import com.openscheduling.availability.domain.model.BookingPayload;
import com.openscheduling.availability.domain.model.BookingStatus;
import com.openscheduling.availability.domain.model.ConflictReport;
import com.openscheduling.availability.domain.model.ExistingBooking;
import com.openscheduling.availability.domain.model.TimeInterval;
import com.openscheduling.availability.domain.service.ConflictDetector;
import com.openscheduling.common.exception.BookingConflictException;
import com.openscheduling.common.exception.BusinessException;
import com.openscheduling.common.exception.ResourceNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Transactional write path shared by the booking strategies.
 *
 * Every write re-reads the overlapping active bookings inside its own transaction and
 * applies the conflict rule before inserting or moving a row. Strategies decide what
 * surrounds the transaction: a distributed lock, or SERIALIZABLE isolation plus retry.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConflictCheckingWriter {

    private final AppointmentRepository appointmentRepository;
    private final SchedulableResourceRepository resourceRepository;

    @Transactional
    public String create(TimeInterval interval, String resourceId, BookingPayload payload) {
        return doCreate(interval, resourceId, payload);
    }

    @Transactional(isolation = Isolation.SERIALIZABLE)
    public String createSerializable(TimeInterval interval, String resourceId, BookingPayload payload) {
        return doCreate(interval, resourceId, payload);
    }

    @Transactional
    public void reschedule(String bookingId, TimeInterval newInterval) {
        doReschedule(bookingId, newInterval);
    }

    @Transactional(isolation = Isolation.SERIALIZABLE)
    public void rescheduleSerializable(String bookingId, TimeInterval newInterval) {
        doReschedule(bookingId, newInterval);
    }

    @Transactional
    public void cancel(String bookingId) {
        Appointment appointment = load(bookingId);
        if (appointment.getStatus() == BookingStatus.CANCELLED) {
            log.debug("Appointment {} already cancelled", bookingId);
            return;
        }
        appointment.setStatus(BookingStatus.CANCELLED);
        appointmentRepository.save(appointment);
        log.info("Cancelled appointment {} on resource {}", bookingId, appointment.getResourceId());
    }

    /**
     * Resource the booking is held on, or {@code null} when it is unassigned.
     */
    @Transactional(readOnly = true)
    public String resourceOf(String bookingId) {
        return load(bookingId).getResourceId();
    }

    private String doCreate(TimeInterval interval, String resourceId, BookingPayload payload) {
        if (resourceId != null && !resourceRepository.existsById(resourceId)) {
            throw new ResourceNotFoundException("Resource", resourceId);
        }
        rejectConflicts(interval, resourceId, null);

        Appointment appointment = Appointment.builder()
                .resourceId(resourceId)
                .startTime(interval.start())
                .endTime(interval.end())
                .status(BookingStatus.SCHEDULED)
                .customerId(payload != null ? payload.customerId() : null)
                .serviceType(payload != null ? payload.serviceType() : null)
                .notes(payload != null ? payload.notes() : null)
                .build();
        Appointment saved = appointmentRepository.saveAndFlush(appointment);
        log.info("Created appointment {} on resource {} for {}", saved.getId(), resourceId, interval);
        return String.valueOf(saved.getId());
    }

    private void doReschedule(String bookingId, TimeInterval newInterval) {
        Appointment appointment = load(bookingId);
        if (appointment.getStatus() == BookingStatus.CANCELLED) {
            throw new BusinessException("Appointment " + bookingId + " is cancelled", "BOOKING_CANCELLED");
        }
        rejectConflicts(newInterval, appointment.getResourceId(), bookingId);

        TimeInterval previous = appointment.interval();
        appointment.moveTo(newInterval);
        appointmentRepository.saveAndFlush(appointment);
        log.info("Moved appointment {} from {} to {}", bookingId, previous, newInterval);
    }

    private void rejectConflicts(TimeInterval interval, String resourceId, String excludeBookingId) {
        List<Appointment> overlapping = resourceId == null
                ? appointmentRepository.findActiveOverlapping(interval.start(), interval.end())
                : appointmentRepository.findActiveOverlappingForResources(interval.start(), interval.end(), Set.of(resourceId));
        List<ExistingBooking> candidates = overlapping.stream()
                .map(Appointment::toExistingBooking)
                .toList();

        ConflictReport report = ConflictDetector.findConflicts(interval, resourceId, excludeBookingId, candidates);
        if (!report.isEmpty()) {
            log.warn("Rejected write of {} on resource {}: conflicts with {}", interval, resourceId, report.bookingIds());
            throw new BookingConflictException(
                    String.format("Time %s is no longer available on resource %s", interval, resourceId),
                    report.bookingIds());
        }
    }

    private Appointment load(String bookingId) {
        return parseId(bookingId)
                .flatMap(appointmentRepository::findById)
                .orElseThrow(() -> new ResourceNotFoundException("Appointment", bookingId));
    }

    private static Optional<Long> parseId(String bookingId) {
        try {
            return Optional.of(Long.parseLong(bookingId));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }
}
