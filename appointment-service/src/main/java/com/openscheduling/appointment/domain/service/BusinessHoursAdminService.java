package com.openscheduling.appointment.domain.service;

import com.openscheduling.appointment.config.SchedulingProperties;
import com.openscheduling.appointment.domain.model.BusinessHoursEntry;
import com.openscheduling.appointment.domain.repository.BusinessHoursRepository;
import com.openscheduling.availability.domain.model.BusinessHoursRule;
import com.openscheduling.availability.domain.service.BusinessHoursCatalog;
import com.openscheduling.common.exception.StoreUnavailableException;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads and replaces the weekly business hours.
 *
 * Stored hours win over the configured defaults. A replacement is validated before anything
 * is written and the in-memory catalog only switches after the new rows are committed.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BusinessHoursAdminService {

    private final BusinessHoursRepository businessHoursRepository;
    private final BusinessHoursCatalog businessHoursCatalog;
    private final SchedulingProperties schedulingProperties;

    @PostConstruct
    public void loadBusinessHours() {
        List<BusinessHoursRule> stored;
        try {
            stored = businessHoursRepository.findAllByOrderByDayOfWeekAsc().stream()
                    .map(BusinessHoursEntry::toRule)
                    .toList();
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Could not load business hours", e);
        }

        if (stored.isEmpty()) {
            log.info("No stored business hours, using configured defaults");
            businessHoursCatalog.replaceAll(schedulingProperties.defaultRules());
        } else {
            businessHoursCatalog.replaceAll(stored);
        }
    }

    @Transactional
    public void replaceBusinessHours(List<BusinessHoursRule> rules) {
        BusinessHoursCatalog.validate(rules);

        Map<Integer, BusinessHoursEntry> previous = new HashMap<>();
        businessHoursRepository.findAll().forEach(entry -> previous.put(entry.getDayOfWeek(), entry));
        for (BusinessHoursRule rule : rules) {
            BusinessHoursEntry entry = previous.remove(rule.dayOfWeek());
            if (entry == null) {
                businessHoursRepository.save(BusinessHoursEntry.fromRule(rule));
            } else {
                entry.apply(rule);
                businessHoursRepository.save(entry);
            }
        }
        businessHoursRepository.deleteAll(List.copyOf(previous.values()));
        log.info("Stored business hours for days {}", rules.stream().map(BusinessHoursRule::dayOfWeek).sorted().toList());

        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    businessHoursCatalog.replaceAll(rules);
                }
            });
        } else {
            businessHoursCatalog.replaceAll(rules);
        }
    }

    public List<BusinessHoursRule> currentBusinessHours() {
        return businessHoursCatalog.allRules();
    }
}
