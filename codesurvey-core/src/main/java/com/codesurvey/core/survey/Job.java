package com.codesurvey.core.survey;

import com.codesurvey.core.source.Repo;

import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * A unit of work admitted to the {@link JobScheduler}.
 *
 * @param kind repository preparation or unit analysis
 * @param owner name of the source or analyzer that produced the work
 * @param subject label of the repository (or unit) the work is about
 * @param repo repository a unit analysis belongs to, {@code null} for repository jobs
 * @param features feature names the work will resolve
 * @param work ready value or deferred computation
 * @param callback invoked on the coordinating thread with the outcome
 * @param <T> result type
 */
public record Job<T>(
    JobKind kind,
    String owner,
    String subject,
    Repo repo,
    List<String> features,
    Work<T> work,
    Consumer<JobOutcome<T>> callback
) {
    public Job {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(work, "work must not be null");
        Objects.requireNonNull(callback, "callback must not be null");
        features = features == null ? List.of() : List.copyOf(features);
    }

    @Override
    public String toString() {
        return kind + " job " + subject + " (" + owner + ")";
    }
}
