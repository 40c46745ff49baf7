package com.runsmart.garmin_sync_engine.util;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * Result of a best-effort side effect. Failures are captured instead of thrown so the caller
 * can log them and carry on.
 */
public final class Outcome<T> {

    private final T value;
    private final Exception error;

    private Outcome(T value, Exception error) {
        this.value = value;
        this.error = error;
    }

    public static <T> Outcome<T> success(T value) {
        return new Outcome<>(value, null);
    }

    public static <T> Outcome<T> failure(Exception error) {
        return new Outcome<>(null, error);
    }

    public static <T> Outcome<T> attempt(Supplier<T> action) {
        try {
            return success(action.get());
        } catch (Exception e) {
            return failure(e);
        }
    }

    public static Outcome<Void> run(Runnable action) {
        try {
            action.run();
            return success(null);
        } catch (Exception e) {
            return failure(e);
        }
    }

    public boolean isSuccess() {
        return error == null;
    }

    public Optional<T> value() {
        return Optional.ofNullable(value);
    }

    public Optional<Exception> error() {
        return Optional.ofNullable(error);
    }

    public String errorMessage() {
        return error == null ? null : String.valueOf(error.getMessage());
    }
}
