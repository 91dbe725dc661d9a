package com.openscheduling.appointment.config;

import com.openscheduling.availability.domain.model.BusinessHoursRule;
import com.openscheduling.availability.domain.model.SchedulingPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.List;

/**
 * Scheduling policy and default weekly hours, bound from {@code scheduling.*}.
 *
 * Times of day are written as {@code HH:mm}. The default hours are used until
 * business hours have been stored in the database.
 */
@ConfigurationProperties(prefix = "scheduling")
public record SchedulingProperties(
        @DefaultValue("UTC") String zoneId,
        @DefaultValue("15") int minDurationMinutes,
        @DefaultValue("480") int maxDurationMinutes,
        @DefaultValue("60") int defaultDurationMinutes,
        @DefaultValue("15") int defaultBufferMinutes,
        @DefaultValue("50") int defaultMaxResults,
        @DefaultValue("0s") Duration minLeadTime,
        Duration maxAdvance,
        @DefaultValue("5s") Duration searchTimeout,
        List<DayHours> businessHours
) {

    public SchedulingProperties {
        businessHours = businessHours == null ? List.of() : List.copyOf(businessHours);
    }

    public SchedulingPolicy toPolicy() {
        return SchedulingPolicy.builder()
                .zoneId(ZoneId.of(zoneId))
                .minDurationMinutes(minDurationMinutes)
                .maxDurationMinutes(maxDurationMinutes)
                .defaultDurationMinutes(defaultDurationMinutes)
                .defaultBufferMinutes(defaultBufferMinutes)
                .defaultMaxResults(defaultMaxResults)
                .minLeadTime(minLeadTime)
                .maxAdvance(maxAdvance)
                .build();
    }

    public List<BusinessHoursRule> defaultRules() {
        return businessHours.stream()
                .map(DayHours::toRule)
                .toList();
    }

    /**
     * @param day 0 (Sunday) to 6 (Saturday)
     */
    public record DayHours(int day, boolean open, String openTime, String closeTime, List<BreakHours> breaks) {

        BusinessHoursRule toRule() {
            if (!open) {
                return BusinessHoursRule.closed(day);
            }
            BusinessHoursRule rule = BusinessHoursRule.open(day, LocalTime.parse(openTime), LocalTime.parse(closeTime));
            if (breaks != null) {
                for (BreakHours pause : breaks) {
                    rule = rule.withBreak(LocalTime.parse(pause.start()), LocalTime.parse(pause.end()));
                }
            }
            return rule;
        }
    }

    public record BreakHours(String start, String end) {
    }
}
