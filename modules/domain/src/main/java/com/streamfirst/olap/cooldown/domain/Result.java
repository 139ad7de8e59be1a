package com.streamfirst.olap.cooldown.domain;

import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.Value;

import java.util.Optional;
import java.util.function.Function;

/**
 * Outcome of a cooldown-engine operation: either success with data or failure with
 * a message and a {@link CooldownError} code. Expected protocol failures travel as
 * values of this type instead of exceptions, so schedulers can decide on retries.
 *
 * @param <T> the type of data returned on success
 */
@Value
@EqualsAndHashCode
public class Result<T> {

    boolean success;
    T data;
    String errorMessage;
    CooldownError errorCode;

    private Result(boolean success, T data, String errorMessage, CooldownError errorCode) {
        this.success = success;
        this.data = data;
        this.errorMessage = errorMessage;
        this.errorCode = errorCode;
    }

    /**
     * Creates a successful result with data.
     */
    public static <T> Result<T> success(@NonNull T data) {
        return new Result<>(true, data, null, null);
    }

    /**
     * Creates a successful result without data.
     */
    public static Result<Void> success() {
        return new Result<>(true, null, null, null);
    }

    /**
     * Creates a failure result with error message and code.
     */
    public static <T> Result<T> failure(@NonNull String errorMessage, @NonNull CooldownError errorCode) {
        return new Result<>(false, null, errorMessage, errorCode);
    }

    /**
     * Returns the data if successful, or throws an exception if failed.
     */
    public T orElseThrow() {
        if (success) {
            return data;
        }
        throw new IllegalStateException(errorMessage + " (code: " + errorCode + ")");
    }

    /**
     * Returns the data if successful, or the provided default value if failed.
     */
    public T orElse(T defaultValue) {
        return success ? data : defaultValue;
    }

    /**
     * Maps the data to another type if successful, preserves failure if failed.
     */
    public <U> Result<U> map(Function<T, U> mapper) {
        if (success) {
            return Result.success(mapper.apply(data));
        }
        return Result.failure(errorMessage, errorCode);
    }

    /**
     * Flat maps the data to another Result if successful, preserves failure if failed.
     */
    public <U> Result<U> flatMap(Function<T, Result<U>> mapper) {
        if (success) {
            return mapper.apply(data);
        }
        return Result.failure(errorMessage, errorCode);
    }

    /**
     * Re-types a failure, for handing it up through a method with another result type.
     */
    public <U> Result<U> propagate() {
        if (success) {
            throw new IllegalStateException("Cannot propagate a successful result");
        }
        return Result.failure(errorMessage, errorCode);
    }

    public boolean isSuccess() {
        return success;
    }

    public boolean isFailure() {
        return !success;
    }

    /**
     * Returns true if this is a failure carrying the given code.
     */
    public boolean hasError(CooldownError code) {
        return !success && errorCode == code;
    }

    /**
     * Gets the data if successful, empty otherwise.
     */
    public Optional<T> getData() {
        return success ? Optional.ofNullable(data) : Optional.empty();
    }

    public Optional<String> getErrorMessage() {
        return success ? Optional.empty() : Optional.ofNullable(errorMessage);
    }

    public Optional<CooldownError> getErrorCode() {
        return Optional.ofNullable(errorCode);
    }

    @Override
    public String toString() {
        if (success) {
            return "Result.success(" + data + ")";
        } else {
            return "Result.failure(" + errorMessage + ", code=" + errorCode + ")";
        }
    }
}
