package com.openscheduling.appointment.domain.repository;

import com.openscheduling.appointment.domain.model.Appointment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

/**
 * Repository for {@link Appointment}. Overlap queries use the half-open test
 * {@code start < rangeEnd AND end > rangeStart} and skip cancelled appointments.
 */
public interface AppointmentRepository extends JpaRepository<Appointment, Long> {

    @Query("""
           SELECT a FROM Appointment a
           WHERE a.status <> com.openscheduling.availability.domain.model.BookingStatus.CANCELLED
             AND a.startTime < :rangeEnd
             AND a.endTime > :rangeStart
           ORDER BY a.startTime, a.id
           """)
    List<Appointment> findActiveOverlapping(@Param("rangeStart") Instant rangeStart,
                                            @Param("rangeEnd") Instant rangeEnd);

    @Query("""
           SELECT a FROM Appointment a
           WHERE a.status <> com.openscheduling.availability.domain.model.BookingStatus.CANCELLED
             AND a.resourceId IN :resourceIds
             AND a.startTime < :rangeEnd
             AND a.endTime > :rangeStart
           ORDER BY a.startTime, a.id
           """)
    List<Appointment> findActiveOverlappingForResources(@Param("rangeStart") Instant rangeStart,
                                                        @Param("rangeEnd") Instant rangeEnd,
                                                        @Param("resourceIds") Collection<String> resourceIds);
}
