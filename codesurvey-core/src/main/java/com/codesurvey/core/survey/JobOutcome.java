package com.codesurvey.core.survey;

/**
 * Result of a finished {@link Job}, handed to its callback on the coordinating thread.
 *
 * @param job finished job
 * @param value result, {@code null} on failure
 * @param failure exception raised by the computation, {@code null} on success
 * @param <T> result type
 */
public record JobOutcome<T>(Job<T> job, T value, Throwable failure) {

    static <T> JobOutcome<T> success(Job<T> job, T value) {
        return new JobOutcome<>(job, value, null);
    }

    static <T> JobOutcome<T> failure(Job<T> job, Throwable failure) {
        return new JobOutcome<>(job, null, failure);
    }

    public boolean isFailure() {
        return failure != null;
    }
}
