package io.valuation.core;

import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Outcome of a unit of work that is allowed to fail without aborting its siblings.
 * Exactly one of value / error is present.
 */
public final class Result<T> {
    private final T value;
    private final Exception error;

    private Result(T value, Exception error) {
        this.value = value;
        this.error = error;
    }

    public static <T> Result<T> ok(T value) {
        return new Result<>(Objects.requireNonNull(value, "value"), null);
    }

    public static <T> Result<T> failed(Exception error) {
        return new Result<>(null, Objects.requireNonNull(error, "error"));
    }

    public boolean isOk() { return error == null; }

    public T value() {
        if (error != null) throw new NoSuchElementException("failed result has no value: " + error.getMessage());
        return value;
    }

    public Optional<Exception> error() { return Optional.ofNullable(error); }

    /** Error message for reporting; falls back to the exception type when the message is blank. */
    public String errorMessage() {
        if (error == null) return "";
        String m = error.getMessage();
        return (m == null || m.isBlank()) ? error.getClass().getSimpleName() : m;
    }

    public <R> Result<R> map(Function<? super T, ? extends R> fn) {
        if (error != null) return failed(error);
        return ok(fn.apply(value));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Result<?> that)) return false;
        return Objects.equals(value, that.value) && Objects.equals(error, that.error);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, error);
    }

    @Override
    public String toString() {
        return error == null ? "Ok{" + value + '}' : "Failed{" + errorMessage() + '}';
    }
}
