package com.runsmart.garmin_sync_engine.exception;

public class GarminStorageException extends RuntimeException {

    public GarminStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
