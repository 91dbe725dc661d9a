package com.openscheduling.appointment.domain.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * A person or room appointments can be booked on. Inactive resources are left out of searches.
 */
@Entity
@Table(name = "schedulable_resources")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SchedulableResource {
    @Id
    @Column(name = "resource_id", length = 64)
    private String id;

    @Column(name = "display_name", nullable = false)
    private String displayName;

    @Builder.Default
    @Column(name = "active", nullable = false)
    private boolean active = true;
}
