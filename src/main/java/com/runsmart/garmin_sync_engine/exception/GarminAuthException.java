package com.runsmart.garmin_sync_engine.exception;

/**
 * Credentials are missing, expired, undecryptable or were rejected by Garmin. The user has to
 * reconnect; callers never retry this.
 */
public class GarminAuthException extends RuntimeException {

    public GarminAuthException(String message) {
        super(message);
    }

    public GarminAuthException(String message, Throwable cause) {
        super(message, cause);
    }
}
