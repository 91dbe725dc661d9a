package com.openscheduling.common.exception;

/**
 * Thrown when the appointment store cannot be read (timeout, connection loss).
 * Propagated unchanged to the caller; the engine never retries on its own.
 */
public class StoreUnavailableException extends RuntimeException {

    public StoreUnavailableException(String message) {
        super(message);
    }

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
