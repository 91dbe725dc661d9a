package com.openscheduling.appointment.domain.repository;

import com.openscheduling.appointment.domain.model.BusinessHoursEntry;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface BusinessHoursRepository extends JpaRepository<BusinessHoursEntry, Integer> {
    List<BusinessHoursEntry> findAllByOrderByDayOfWeekAsc();
}
