package com.openscheduling.availability.domain.service;

import com.openscheduling.availability.domain.model.AlternativeTimeOptions;
import com.openscheduling.availability.domain.model.AvailabilitySearchRequest;
import com.openscheduling.availability.domain.model.AvailableSlot;
import com.openscheduling.availability.domain.model.BreakPeriod;
import com.openscheduling.availability.domain.model.BusinessHoursRule;
import com.openscheduling.availability.domain.model.ConflictReport;
import com.openscheduling.availability.domain.model.SchedulingPolicy;
import com.openscheduling.availability.domain.model.SuggestedSlot;
import com.openscheduling.availability.domain.model.TimeInterval;
import com.openscheduling.availability.domain.model.ValidationReason;
import com.openscheduling.availability.domain.model.ValidationResult;
import com.openscheduling.availability.domain.port.ResourceDirectory;
import com.openscheduling.common.exception.BusinessException;
import com.openscheduling.common.exception.InvalidArgumentException;
import com.openscheduling.common.exception.StoreUnavailableException;
import com.openscheduling.common.util.Constants;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Entry point for availability queries: slot search, slot checks, rule validation,
 * alternative suggestions and next-available scans.
 *
 * Every operation is read-only. Results are snapshots of the store at query time and do not
 * reserve anything; the booking write path re-checks conflicts when it commits.
 * Malformed input fails with {@link InvalidArgumentException} before the store is touched,
 * store failures surface as {@link StoreUnavailableException}.
 */
@Slf4j
@Service
public class AvailabilityCoordinator {

    private static final String SEARCH_INTERRUPTED = "SEARCH_INTERRUPTED";

    private final ScheduleBuilder scheduleBuilder;
    private final SlotEnumerator slotEnumerator;
    private final ConflictDetector conflictDetector;
    private final BusinessHoursCatalog businessHoursCatalog;
    private final ResourceDirectory resourceDirectory;
    private final SchedulingPolicy schedulingPolicy;
    private final Clock clock;
    private final Executor searchExecutor;

    public AvailabilityCoordinator(ScheduleBuilder scheduleBuilder,
                                   SlotEnumerator slotEnumerator,
                                   ConflictDetector conflictDetector,
                                   BusinessHoursCatalog businessHoursCatalog,
                                   ResourceDirectory resourceDirectory,
                                   SchedulingPolicy schedulingPolicy,
                                   Clock clock,
                                   @Qualifier("availabilitySearchExecutor") Executor searchExecutor) {
        this.scheduleBuilder = scheduleBuilder;
        this.slotEnumerator = slotEnumerator;
        this.conflictDetector = conflictDetector;
        this.businessHoursCatalog = businessHoursCatalog;
        this.resourceDirectory = resourceDirectory;
        this.schedulingPolicy = schedulingPolicy;
        this.clock = clock;
        this.searchExecutor = searchExecutor;
    }

    /**
     * Searches bookable slots. Identical input against an unchanged store yields identical,
     * identically ordered output.
     */
    public List<AvailableSlot> search(AvailabilitySearchRequest request) {
        validateRequest(request);
        List<String> resourceIds = resolveResources(request.resourceIds());
        if (resourceIds.isEmpty()) {
            log.debug("No schedulable resources, search over [{}, {}) returns nothing",
                    request.rangeStart(), request.rangeEnd());
            return List.of();
        }

        int maxResults = request.maxResults() != null ? request.maxResults() : schedulingPolicy.getDefaultMaxResults();
        TimeInterval range = new TimeInterval(request.rangeStart(), request.rangeEnd());
        Map<String, List<TimeInterval>> free = scheduleBuilder.buildFreeSchedules(
                range, resourceIds, request.bufferMinutes());
        List<AvailableSlot> slots = slotEnumerator.enumerate(
                free, request.durationMinutes(), request.bufferMinutes(), maxResults, request.locationId());

        log.debug("Availability search over {} for {} resources, {} min: {} slots",
                range, resourceIds.size(), request.durationMinutes(), slots.size());
        return slots;
    }

    /**
     * Same as {@link #search(AvailabilitySearchRequest)}, bounded by {@code timeout}. A search that
     * does not finish in time is interrupted and reported as {@link StoreUnavailableException}.
     */
    public List<AvailableSlot> search(AvailabilitySearchRequest request, Duration timeout) {
        validateRequest(request);
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new InvalidArgumentException("Search timeout must be positive");
        }
        FutureTask<List<AvailableSlot>> task = new FutureTask<>(() -> search(request));
        try {
            searchExecutor.execute(task);
        } catch (RejectedExecutionException e) {
            log.warn("Availability search over [{}, {}) rejected by the search executor",
                    request.rangeStart(), request.rangeEnd());
            throw new StoreUnavailableException("Availability search capacity exhausted", e);
        }
        try {
            return task.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            task.cancel(true);
            log.warn("Availability search over [{}, {}) timed out after {}",
                    request.rangeStart(), request.rangeEnd(), timeout);
            throw new StoreUnavailableException("Availability search timed out after " + timeout, e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException("Availability search failed", e.getCause());
        } catch (InterruptedException e) {
            task.cancel(true);
            Thread.currentThread().interrupt();
            throw new BusinessException("Availability search interrupted", e, SEARCH_INTERRUPTED);
        }
    }

    /**
     * @param resourceId       resource to check, or {@code null} to check against every booking
     * @param excludeBookingId booking to ignore, e.g. when moving it
     */
    public boolean isSlotFree(TimeInterval interval, String resourceId, String excludeBookingId) {
        requireInterval(interval);
        return conflictDetector.detect(interval, resourceId, excludeBookingId).isEmpty();
    }

    /**
     * Detailed form of {@link #isSlotFree}: the overlapping bookings and the overlapped part of each.
     */
    public ConflictReport checkConflicts(TimeInterval interval, String resourceId, String excludeBookingId) {
        requireInterval(interval);
        return conflictDetector.detect(interval, resourceId, excludeBookingId);
    }

    /**
     * Checks a proposed appointment against every scheduling rule and reports all violations at once.
     * The conflict rule is only checked when a resource is given.
     */
    public ValidationResult validateSchedulingRules(Instant start, int durationMinutes, String resourceId) {
        if (start == null) {
            throw new InvalidArgumentException("Start time must not be null");
        }
        requirePositiveDuration(durationMinutes);

        List<ValidationReason> reasons = new ArrayList<>();
        if (durationMinutes < schedulingPolicy.getMinDurationMinutes()) {
            reasons.add(ValidationReason.DURATION_BELOW_MINIMUM);
        }
        if (durationMinutes > schedulingPolicy.getMaxDurationMinutes()) {
            reasons.add(ValidationReason.DURATION_ABOVE_MAXIMUM);
        }

        TimeInterval proposed = TimeInterval.ofMinutes(start, durationMinutes);
        businessHoursViolation(proposed).ifPresent(reasons::add);

        Instant now = clock.instant();
        if (start.isBefore(now)) {
            reasons.add(ValidationReason.IN_PAST);
        } else if (start.isBefore(now.plus(schedulingPolicy.getMinLeadTime()))) {
            reasons.add(ValidationReason.INSUFFICIENT_LEAD_TIME);
        }
        Duration maxAdvance = schedulingPolicy.getMaxAdvance();
        if (maxAdvance != null && start.isAfter(now.plus(maxAdvance))) {
            reasons.add(ValidationReason.TOO_FAR_IN_ADVANCE);
        }

        if (resourceId != null && !conflictDetector.detect(proposed, resourceId, null).isEmpty()) {
            reasons.add(ValidationReason.CONFLICTS_WITH_EXISTING_BOOKING);
        }

        ValidationResult result = ValidationResult.of(reasons);
        if (!result.valid()) {
            log.debug("Appointment {} for resource {} violates {}", proposed, resourceId, result.reasonCodes());
        }
        return result;
    }

    /**
     * Suggests slots in {@code [preferredStart, preferredStart + withinDays)} closest to the
     * preferred start, ties broken chronologically. Returns an empty list when nothing is free;
     * widening the window is up to the caller.
     */
    public List<SuggestedSlot> suggestAlternatives(Instant preferredStart,
                                                   int durationMinutes,
                                                   String resourceId,
                                                   AlternativeTimeOptions options) {
        if (preferredStart == null) {
            throw new InvalidArgumentException("Preferred start must not be null");
        }
        requirePositiveDuration(durationMinutes);
        AlternativeTimeOptions effective = options != null ? options : AlternativeTimeOptions.defaults();
        if (effective.withinDays() < 0) {
            throw new InvalidArgumentException("withinDays must not be negative");
        }
        if (effective.maxSuggestions() <= 0) {
            throw new InvalidArgumentException("maxSuggestions must be positive");
        }
        if (effective.withinDays() == 0) {
            return List.of();
        }

        int buffer = effective.bufferMinutes() != null ? effective.bufferMinutes() : 0;
        AvailabilitySearchRequest request = AvailabilitySearchRequest.builder()
                .rangeStart(preferredStart)
                .rangeEnd(preferredStart.plus(Duration.ofDays(effective.withinDays())))
                .resourceIds(resourceId == null ? null : Set.of(resourceId))
                .durationMinutes(durationMinutes)
                .maxResults(effective.maxSuggestions())
                .bufferMinutes(buffer)
                .build();

        List<AvailableSlot> ranked = search(request).stream()
                .sorted(Comparator.comparing((AvailableSlot slot) -> distance(preferredStart, slot))
                        .thenComparing(AvailableSlot::interval))
                .limit(effective.maxSuggestions())
                .toList();

        List<SuggestedSlot> suggestions = new ArrayList<>(ranked.size());
        for (int i = 0; i < ranked.size(); i++) {
            AvailableSlot slot = ranked.get(i);
            suggestions.add(new SuggestedSlot(slot, distance(preferredStart, slot), i + 1));
        }
        log.debug("Suggested {} alternatives around {} for resource {}", suggestions.size(), preferredStart, resourceId);
        return suggestions;
    }

    /**
     * {@link #findNextAvailable(Instant, int, Collection, int)} over the default horizon of
     * {@value Constants#DEFAULT_MAX_DAYS_TO_CHECK} days.
     */
    public Optional<SuggestedSlot> findNextAvailable(Instant fromDate, int durationMinutes, Collection<String> resourceIds) {
        return findNextAvailable(fromDate, durationMinutes, resourceIds, Constants.DEFAULT_MAX_DAYS_TO_CHECK);
    }

    /**
     * Scans forward one business day at a time for the earliest free slot. The scan is bounded by
     * {@code maxDaysToCheck}; zero returns empty without reading the store. The current thread's
     * interrupt flag is checked before every day.
     *
     * @param resourceIds resources to consider, or {@code null} for every schedulable resource
     */
    public Optional<SuggestedSlot> findNextAvailable(Instant fromDate,
                                                     int durationMinutes,
                                                     Collection<String> resourceIds,
                                                     int maxDaysToCheck) {
        if (fromDate == null) {
            throw new InvalidArgumentException("Start date must not be null");
        }
        requirePositiveDuration(durationMinutes);
        if (maxDaysToCheck < 0) {
            throw new InvalidArgumentException("maxDaysToCheck must not be negative");
        }
        Set<String> resources = resourceIds == null ? null : Set.copyOf(resourceIds);
        requireNonEmpty(resources);

        ZoneId zone = schedulingPolicy.getZoneId();
        Instant dayStart = fromDate;
        for (int day = 0; day < maxDaysToCheck; day++) {
            if (Thread.currentThread().isInterrupted()) {
                throw new BusinessException("Next-available scan interrupted after " + day + " days", SEARCH_INTERRUPTED);
            }
            Instant dayEnd = dayStart.atZone(zone).toLocalDate().plusDays(1).atStartOfDay(zone).toInstant();
            List<AvailableSlot> slots = search(AvailabilitySearchRequest.builder()
                    .rangeStart(dayStart)
                    .rangeEnd(dayEnd)
                    .resourceIds(resources)
                    .durationMinutes(durationMinutes)
                    .maxResults(1)
                    .build());
            if (!slots.isEmpty()) {
                AvailableSlot first = slots.get(0);
                log.debug("Next available slot from {} found after {} days: {}", fromDate, day, first.interval());
                return Optional.of(new SuggestedSlot(first, distance(fromDate, first), 1));
            }
            dayStart = dayEnd;
        }
        log.debug("No slot of {} min found within {} days from {}", durationMinutes, maxDaysToCheck, fromDate);
        return Optional.empty();
    }

    /**
     * Each resource's own slots on {@code date}, keyed by resource id in the given order.
     */
    public Map<String, List<AvailableSlot>> availabilityByResource(LocalDate date,
                                                                   List<String> resourceIds,
                                                                   int durationMinutes) {
        if (date == null) {
            throw new InvalidArgumentException("Date must not be null");
        }
        requirePositiveDuration(durationMinutes);
        if (resourceIds == null || resourceIds.isEmpty()) {
            throw new InvalidArgumentException("At least one resource id is required");
        }

        ZoneId zone = schedulingPolicy.getZoneId();
        TimeInterval day = new TimeInterval(
                date.atStartOfDay(zone).toInstant(), date.plusDays(1).atStartOfDay(zone).toInstant());
        List<String> ordered = resourceIds.stream().distinct().toList();
        Map<String, List<TimeInterval>> free = scheduleBuilder.buildFreeSchedules(day, ordered, 0);

        Map<String, List<AvailableSlot>> byResource = new LinkedHashMap<>();
        for (String resourceId : ordered) {
            byResource.put(resourceId, slotEnumerator.enumerate(
                    Map.of(resourceId, free.get(resourceId)),
                    durationMinutes, 0, schedulingPolicy.getDefaultMaxResults(), null));
        }
        return byResource;
    }

    private Optional<ValidationReason> businessHoursViolation(TimeInterval proposed) {
        ZoneId zone = schedulingPolicy.getZoneId();
        ZonedDateTime localStart = proposed.start().atZone(zone);
        Optional<BusinessHoursRule> rule = businessHoursCatalog.hoursFor(
                BusinessHoursRule.dayIndex(localStart.getDayOfWeek()));
        if (rule.isEmpty() || !rule.get().open()) {
            return Optional.of(ValidationReason.CLOSED_DAY);
        }

        LocalDate date = localStart.toLocalDate();
        Instant open = date.atTime(rule.get().openTime()).atZone(zone).toInstant();
        Instant close = date.atTime(rule.get().closeTime()).atZone(zone).toInstant();
        if (proposed.start().isBefore(open) || proposed.end().isAfter(close)) {
            return Optional.of(ValidationReason.OUTSIDE_BUSINESS_HOURS);
        }
        for (BreakPeriod period : rule.get().breaks()) {
            Instant breakStart = date.atTime(period.startTime()).atZone(zone).toInstant();
            Instant breakEnd = date.atTime(period.endTime()).atZone(zone).toInstant();
            if (breakStart.isBefore(breakEnd) && proposed.overlaps(new TimeInterval(breakStart, breakEnd))) {
                return Optional.of(ValidationReason.OVERLAPS_BREAK);
            }
        }
        return Optional.empty();
    }

    private List<String> resolveResources(Set<String> requested) {
        if (requested != null) {
            return requested.stream().sorted().toList();
        }
        return resourceDirectory.listResourceIds().stream().sorted().toList();
    }

    private void validateRequest(AvailabilitySearchRequest request) {
        if (request == null) {
            throw new InvalidArgumentException("Search request must not be null");
        }
        if (request.rangeStart() == null || request.rangeEnd() == null) {
            throw new InvalidArgumentException("Search range bounds must not be null");
        }
        if (!request.rangeStart().isBefore(request.rangeEnd())) {
            throw new InvalidArgumentException(String.format(
                    "Search range start %s must be before end %s", request.rangeStart(), request.rangeEnd()));
        }
        requirePositiveDuration(request.durationMinutes());
        if (request.maxResults() != null && request.maxResults() <= 0) {
            throw new InvalidArgumentException("maxResults must be positive");
        }
        if (request.bufferMinutes() < 0) {
            throw new InvalidArgumentException("bufferMinutes must not be negative");
        }
        requireNonEmpty(request.resourceIds());
    }

    private static void requireNonEmpty(Set<String> resourceIds) {
        if (resourceIds != null && resourceIds.isEmpty()) {
            throw new InvalidArgumentException("resourceIds must be omitted or non-empty");
        }
    }

    private static void requirePositiveDuration(int durationMinutes) {
        if (durationMinutes <= 0) {
            throw new InvalidArgumentException("Duration must be positive, got " + durationMinutes);
        }
    }

    private static void requireInterval(TimeInterval interval) {
        if (interval == null) {
            throw new InvalidArgumentException("Interval must not be null");
        }
    }

    private static Duration distance(Instant from, AvailableSlot slot) {
        return Duration.between(from, slot.interval().start()).abs();
    }
}
