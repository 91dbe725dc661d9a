package com.openscheduling.common.exception;

/**
 * Thrown for malformed requests: inverted ranges, non-positive durations,
 * unknown days of week. Always raised before any store access.
 */
public class InvalidArgumentException extends BusinessException {

    public static final String ERROR_CODE = "INVALID_ARGUMENT";

    public InvalidArgumentException(String message) {
        super(message, ERROR_CODE);
    }
}
