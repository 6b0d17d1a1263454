package gitcontext.core.repository;

import java.util.Objects;
import java.util.Optional;

import gitcontext.exceptions.GitException;

/**
 * The settled outcome of one memoized computation: a value, nothing, or the
 * failure that stopped it.
 */
public final class Result<T> {
    private static final Result<?> ABSENT = new Result<>(null, null);

    private final T value;
    private final GitException error;

    private Result(T value, GitException error) {
        this.value = value;
        this.error = error;
    }

    public static <T> Result<T> ok(T value) {
        return new Result<>(Objects.requireNonNull(value, "value"), null);
    }

    @SuppressWarnings("unchecked")
    public static <T> Result<T> absent() {
        return (Result<T>) ABSENT;
    }

    public static <T> Result<T> error(GitException error) {
        return new Result<>(null, Objects.requireNonNull(error, "error"));
    }

    /**
     * Runs a computation and captures its outcome.
     */
    public static <T> Result<T> of(Computation<T> computation) {
        try {
            T value = computation.compute();
            return value != null ? ok(value) : absent();
        } catch (GitException e) {
            return error(e);
        }
    }

    /**
     * Feeds a present value into the next computation. Absence and failure
     * pass through unchanged.
     */
    public <R> Result<R> then(Step<T, R> step) {
        if (isOk()) {
            return of(() -> step.apply(value));
        }
        @SuppressWarnings("unchecked")
        Result<R> passed = (Result<R>) this;
        return passed;
    }

    public boolean isOk() {
        return value != null;
    }

    public boolean isAbsent() {
        return value == null && error == null;
    }

    public boolean isError() {
        return error != null;
    }

    public Optional<T> toOptional() {
        return Optional.ofNullable(value);
    }

    public T orElse(T other) {
        return value != null ? value : other;
    }

    public GitException getError() {
        return error;
    }

    @Override
    public String toString() {
        if (isOk()) {
            return "Ok(" + value + ")";
        }
        return isError() ? "Error(" + error.getKind() + ": " + error.getMessage() + ")" : "Absent";
    }

    @FunctionalInterface
    public interface Computation<T> {
        T compute() throws GitException;
    }

    @FunctionalInterface
    public interface Step<T, R> {
        R apply(T input) throws GitException;
    }
}
