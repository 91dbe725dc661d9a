package com.openscheduling.availability.domain.model;

/**
 * Scheduling rules a proposed appointment can violate.
 */
public enum ValidationReason {
    DURATION_BELOW_MINIMUM("duration_below_minimum"),
    DURATION_ABOVE_MAXIMUM("duration_above_maximum"),
    CLOSED_DAY("closed_day"),
    OUTSIDE_BUSINESS_HOURS("outside_business_hours"),
    OVERLAPS_BREAK("overlaps_break"),
    IN_PAST("in_past"),
    INSUFFICIENT_LEAD_TIME("insufficient_lead_time"),
    TOO_FAR_IN_ADVANCE("too_far_in_advance"),
    CONFLICTS_WITH_EXISTING_BOOKING("conflicts_with_existing_booking");

    private final String code;

    ValidationReason(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
