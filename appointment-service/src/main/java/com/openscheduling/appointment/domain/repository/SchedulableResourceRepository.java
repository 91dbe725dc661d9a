package com.openscheduling.appointment.domain.repository;

import com.openscheduling.appointment.domain.model.SchedulableResource;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface SchedulableResourceRepository extends JpaRepository<SchedulableResource, String> {
    List<SchedulableResource> findByActiveTrueOrderByIdAsc();
}
