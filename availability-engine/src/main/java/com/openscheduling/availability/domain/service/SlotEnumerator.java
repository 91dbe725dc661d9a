package com.openscheduling.availability.domain.service;

import com.openscheduling.availability.domain.model.AvailableSlot;
import com.openscheduling.availability.domain.model.TimeInterval;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Slices free intervals into bookable slots of an exact duration.
 *
 * Each free interval is walked from its start; a slot is emitted while it still fits, then the
 * window advances by the duration (plus the buffer in buffer-aware mode). Slots for the same
 * interval on several resources are merged into one slot listing every eligible resource.
 * Results are ordered by start, then end, and truncated silently at {@code maxResults}.
 */
@Slf4j
@Component
public class SlotEnumerator {

    public List<AvailableSlot> enumerate(Map<String, List<TimeInterval>> freeByResource,
                                         int durationMinutes,
                                         int bufferMinutes,
                                         int maxResults,
                                         String locationId) {
        Duration duration = Duration.ofMinutes(durationMinutes);
        Duration step = duration.plusMinutes(bufferMinutes);
        TreeMap<TimeInterval, SortedSet<String>> merged = new TreeMap<>();

        freeByResource.forEach((resourceId, freeIntervals) -> {
            // A resource's slots past its own first maxResults can never reach the global top maxResults.
            int emitted = 0;
            for (TimeInterval free : freeIntervals) {
                Instant slotStart = free.start();
                while (emitted < maxResults && !slotStart.plus(duration).isAfter(free.end())) {
                    TimeInterval slot = new TimeInterval(slotStart, slotStart.plus(duration));
                    merged.computeIfAbsent(slot, key -> new TreeSet<>()).add(resourceId);
                    emitted++;
                    slotStart = slotStart.plus(step);
                }
                if (emitted >= maxResults) {
                    break;
                }
            }
        });

        List<AvailableSlot> slots = new ArrayList<>(Math.min(merged.size(), maxResults));
        for (Map.Entry<TimeInterval, SortedSet<String>> entry : merged.entrySet()) {
            if (slots.size() >= maxResults) {
                log.debug("Slot enumeration truncated at {} of {} candidate intervals", maxResults, merged.size());
                break;
            }
            slots.add(new AvailableSlot(entry.getKey(), List.copyOf(entry.getValue()), locationId));
        }
        return slots;
    }
}
