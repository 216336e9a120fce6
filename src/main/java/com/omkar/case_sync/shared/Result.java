package com.omkar.case_sync.shared;

import lombok.EqualsAndHashCode;
import lombok.NonNull;

import java.util.function.Function;

/**
 * Either a successful value or a structured {@link ErrorDetail}.
 * Every Intempus call, every CRUD operation and the reconciliation pass
 * report their outcome through this type instead of throwing.
 *
 * @param <T> the type of data returned on success
 */
@EqualsAndHashCode
public final class Result<T> {

    private final boolean success;
    private final T data;
    private final ErrorDetail error;

    private Result(boolean success, T data, ErrorDetail error) {
        this.success = success;
        this.data = data;
        this.error = error;
    }

    public static <T> Result<T> success(T data) {
        return new Result<>(true, data, null);
    }

    public static Result<Void> success() {
        return new Result<>(true, null, null);
    }

    public static <T> Result<T> failure(@NonNull ErrorDetail error) {
        return new Result<>(false, null, error);
    }

    public boolean isSuccess() {
        return success;
    }

    public boolean isFailure() {
        return !success;
    }

    /**
     * Returns the data of a successful result.
     *
     * @throws IllegalStateException if this is a failure
     */
    public T get() {
        if (!success) {
            throw new IllegalStateException("Result is a failure: " + error.getTitle());
        }
        return data;
    }

    /**
     * @throws IllegalStateException if this is a success
     */
    public ErrorDetail getError() {
        if (success) {
            throw new IllegalStateException("Result is a success");
        }
        return error;
    }

    public <U> Result<U> flatMap(Function<T, Result<U>> mapper) {
        return success ? mapper.apply(data) : Result.failure(error);
    }

    @Override
    public String toString() {
        if (success) {
            return "Result.success(" + data + ")";
        }
        return "Result.failure(" + error.getStatusCode() + " " + error.getTitle() + ": " + error.getDetail() + ")";
    }
}
