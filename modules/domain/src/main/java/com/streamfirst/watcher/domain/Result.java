package com.streamfirst.watcher.domain;

import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.Value;

import java.util.Optional;

/**
 * Generic result type that represents either success with data or failure with error.
 * Lets a failure travel as a value next to its siblings instead of unwinding the caller.
 * 
 * @param <T> the type of data returned on success
 */
@Value
@EqualsAndHashCode(exclude = "cause")
public class Result<T> {
    
    boolean success;
    @Getter(AccessLevel.NONE)
    T data;
    String errorMessage;
    @Getter(AccessLevel.NONE)
    Throwable cause;

    private Result(boolean success, T data, String errorMessage, Throwable cause) {
        this.success = success;
        this.data = data;
        this.errorMessage = errorMessage;
        this.cause = cause;
    }

    /**
     * Creates a successful result with data.
     */
    public static <T> Result<T> success(@NonNull T data) {
        return new Result<>(true, data, null, null);
    }

    /**
     * Creates a failure result from the exception that caused it.
     */
    public static <T> Result<T> failure(@NonNull String errorMessage, @NonNull Throwable cause) {
        return new Result<>(false, null, errorMessage, cause);
    }

    /**
     * Returns the data if successful, or throws an exception if failed.
     */
    public T orElseThrow() {
        if (success) {
            return data;
        }
        throw new IllegalStateException(errorMessage, cause);
    }

    /**
     * Gets the error message if failed, empty otherwise.
     */
    public Optional<String> getErrorMessage() {
        return success ? Optional.empty() : Optional.ofNullable(errorMessage);
    }

    @Override
    public String toString() {
        if (success) {
            return "Result.success(" + data + ")";
        } else {
            return "Result.failure(" + errorMessage + ", cause=" + cause.getClass().getSimpleName() + ")";
        }
    }
}
