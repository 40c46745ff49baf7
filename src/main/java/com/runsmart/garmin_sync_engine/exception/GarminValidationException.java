package com.runsmart.garmin_sync_engine.exception;

/**
 * Malformed inbound payload: a webhook body or queue message that cannot be processed as sent.
 */
public class GarminValidationException extends RuntimeException {

    public GarminValidationException(String message) {
        super(message);
    }

    public GarminValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
