package com.openscheduling.availability.domain.service;

import com.openscheduling.availability.domain.model.BusinessHoursRule;
import com.openscheduling.common.exception.InvalidArgumentException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Weekly opening hours shared by every query.
 *
 * The active table is an immutable snapshot behind an {@link AtomicReference}; {@link #replaceAll}
 * builds a new snapshot and swaps it in, so readers see either the old or the new week, never a mix.
 * Days without a rule are closed.
 */
@Slf4j
@Component
public class BusinessHoursCatalog {

    private final AtomicReference<Snapshot> current = new AtomicReference<>(Snapshot.EMPTY);

    public BusinessHoursCatalog() {
    }

    public BusinessHoursCatalog(Collection<BusinessHoursRule> rules) {
        replaceAll(rules);
    }

    public Optional<BusinessHoursRule> hoursFor(int dayOfWeek) {
        BusinessHoursRule.checkDayOfWeek(dayOfWeek);
        return Optional.ofNullable(current.get().rules[dayOfWeek]);
    }

    public boolean isOpen(int dayOfWeek) {
        return hoursFor(dayOfWeek).map(BusinessHoursRule::open).orElse(false);
    }

    /**
     * @return the active rules ordered by day of week
     */
    public List<BusinessHoursRule> allRules() {
        return current.get().asList();
    }

    /**
     * Atomically replaces the whole weekly table. The new table is validated first; on
     * failure the active table is left untouched.
     */
    public void replaceAll(Collection<BusinessHoursRule> rules) {
        Snapshot next = Snapshot.of(rules);
        current.set(next);
        log.info("Business hours replaced: {} day rules, open on days {}", next.asList().size(), next.openDays());
    }

    /**
     * Checks that {@code rules} form a consistent week without installing them.
     */
    public static void validate(Collection<BusinessHoursRule> rules) {
        Snapshot.of(rules);
    }

    private static final class Snapshot {
        static final Snapshot EMPTY = new Snapshot(new BusinessHoursRule[7]);

        private final BusinessHoursRule[] rules;

        private Snapshot(BusinessHoursRule[] rules) {
            this.rules = rules;
        }

        static Snapshot of(Collection<BusinessHoursRule> rules) {
            if (rules == null) {
                throw new InvalidArgumentException("Business hours must not be null");
            }
            BusinessHoursRule[] table = new BusinessHoursRule[7];
            for (BusinessHoursRule rule : rules) {
                if (table[rule.dayOfWeek()] != null) {
                    throw new InvalidArgumentException("Duplicate business hours for day " + rule.dayOfWeek());
                }
                table[rule.dayOfWeek()] = rule;
            }
            return new Snapshot(table);
        }

        List<BusinessHoursRule> asList() {
            return Arrays.stream(rules)
                    .filter(Objects::nonNull)
                    .toList();
        }

        List<Integer> openDays() {
            return asList().stream()
                    .filter(BusinessHoursRule::open)
                    .map(BusinessHoursRule::dayOfWeek)
                    .toList();
        }
    }
}
