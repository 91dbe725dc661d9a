package com.openscheduling.appointment.domain.model;

import com.openscheduling.availability.domain.model.BreakPeriod;
import com.openscheduling.availability.domain.model.BusinessHoursRule;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Stored opening hours of one day of the week (0 = Sunday).
 */
@Entity
@Table(name = "business_hours")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BusinessHoursEntry {
    @Id
    @Column(name = "day_of_week")
    private Integer dayOfWeek;

    @Column(name = "is_open", nullable = false)
    private boolean open;

    @Column(name = "open_time")
    private LocalTime openTime;

    @Column(name = "close_time")
    private LocalTime closeTime;

    @Builder.Default
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "business_hours_breaks", joinColumns = @JoinColumn(name = "day_of_week"))
    private List<BreakWindow> breaks = new ArrayList<>();

    public static BusinessHoursEntry fromRule(BusinessHoursRule rule) {
        BusinessHoursEntry entry = BusinessHoursEntry.builder()
                .dayOfWeek(rule.dayOfWeek())
                .build();
        entry.apply(rule);
        return entry;
    }

    /**
     * Overwrites this day's hours and breaks with {@code rule}.
     */
    public void apply(BusinessHoursRule rule) {
        open = rule.open();
        openTime = rule.openTime();
        closeTime = rule.closeTime();
        breaks.clear();
        for (BreakPeriod period : rule.breaks()) {
            breaks.add(new BreakWindow(period.startTime(), period.endTime()));
        }
    }

    public BusinessHoursRule toRule() {
        List<BreakPeriod> periods = breaks.stream()
                .map(window -> new BreakPeriod(window.getStartTime(), window.getEndTime()))
                .toList();
        return new BusinessHoursRule(dayOfWeek, openTime, closeTime, open, periods);
    }

    @Embeddable
    @Getter
    @NoArgsConstructor
    @AllArgsConstructor
    public static class BreakWindow {
        @Column(name = "start_time", nullable = false)
        private LocalTime startTime;

        @Column(name = "end_time", nullable = false)
        private LocalTime endTime;
    }
}
