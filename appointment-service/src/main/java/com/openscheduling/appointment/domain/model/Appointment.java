package com.openscheduling.appointment.domain.model;

import com.openscheduling.availability.domain.model.BookingStatus;
import com.openscheduling.availability.domain.model.ExistingBooking;
import com.openscheduling.availability.domain.model.TimeInterval;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

/**
 * A booked appointment occupying {@code [startTime, endTime)} on a resource.
 * {@code resourceId} is null for appointments not assigned to a resource.
 */
@Entity
@Table(name = "appointments", indexes = {
        @Index(name = "idx_appointments_resource_time", columnList = "resource_id, start_time, end_time"),
        @Index(name = "idx_appointments_status", columnList = "status")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Appointment {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "resource_id", length = 64)
    private String resourceId;

    @Column(name = "start_time", nullable = false)
    private Instant startTime;

    @Column(name = "end_time", nullable = false)
    private Instant endTime;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private BookingStatus status;

    @Column(name = "customer_id", length = 64)
    private String customerId;

    @Column(name = "service_type", length = 100)
    private String serviceType;

    @Column(name = "notes", length = 1000)
    private String notes;

    @Version
    private Long version;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
        updatedAt = createdAt;
        if (status == null) {
            status = BookingStatus.SCHEDULED;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    public TimeInterval interval() {
        return new TimeInterval(startTime, endTime);
    }

    public void moveTo(TimeInterval interval) {
        this.startTime = interval.start();
        this.endTime = interval.end();
    }

    public ExistingBooking toExistingBooking() {
        return new ExistingBooking(String.valueOf(id), interval(), resourceId, status);
    }
}
