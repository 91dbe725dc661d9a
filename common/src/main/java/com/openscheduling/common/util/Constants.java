package com.openscheduling.common.util;

/**
 * Common constants used across all modules.
 */
public final class Constants {
    private Constants() {
        // Utility class
    }

    public static final String LOCK_PREFIX = "lock:calendar:";
    /** Lock scope for bookings written without a resource. */
    public static final String UNASSIGNED_SCOPE = "unassigned";

    public static final int DEFAULT_MAX_RESULTS = 50;
    public static final int DEFAULT_MAX_DAYS_TO_CHECK = 30;
}
