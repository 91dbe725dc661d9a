package com.openscheduling.common.exception;

import lombok.Getter;

/**
 * Business exception for domain-specific errors.
 * Used when scheduling rules are violated or a booking cannot be written.
 */
@Getter
public class BusinessException extends RuntimeException {
    private final String errorCode;

    public BusinessException(String message, String errorCode) {
        super(message);
        this.errorCode = errorCode;
    }

    public BusinessException(String message, Throwable cause, String errorCode) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
