package com.codesurvey.core.survey;

import com.codesurvey.core.exception.SurveyInterruptedException;
import com.codesurvey.core.source.Repo;
import org.slf4j.Logger;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs deferred jobs on a bounded worker pool and routes their outcomes back to the
 * coordinating thread.
 *
 * <p>Not thread-safe: {@link #admit(Job)}, {@link #awaitAndDispatch(CancellationToken)} and
 * every callback run on the single coordinating thread. Only the deferred computations run
 * on workers. At most {@code maxPending} deferred jobs are pending at any time.
 *
 * <p>A repository produced by a job whose callback will never run, because the job was
 * cancelled while or after its worker produced it, is cleaned up by the scheduler.
 */
public final class JobScheduler implements AutoCloseable {

    static final long POLL_INTERVAL_MILLIS = 100;

    private final Logger log;
    private final int maxPending;
    private final ExecutorService executor;
    private final CompletionService<Object> completionService;
    private final Map<Future<Object>, Submission> pending = new LinkedHashMap<>();

    /**
     * @param maxPending maximum number of pending deferred jobs, also the worker count
     * @param log run-scoped logger
     */
    public JobScheduler(int maxPending, Logger log) {
        if (maxPending < 1) {
            throw new IllegalArgumentException("maxPending must be at least 1: " + maxPending);
        }
        this.log = log;
        this.maxPending = maxPending;
        this.executor = Executors.newFixedThreadPool(maxPending, new WorkerThreadFactory());
        this.completionService = new ExecutorCompletionService<>(executor);
    }

    /**
     * @return true if another deferred job may be admitted
     */
    public boolean hasCapacity() {
        return pending.size() < maxPending;
    }

    public int pendingCount() {
        return pending.size();
    }

    public int pendingCount(JobKind kind) {
        return (int) pending.values().stream().filter(submission -> submission.job.kind() == kind).count();
    }

    /**
     * @return true if a pending job of the given kind has the given subject
     */
    public boolean hasPendingSubject(JobKind kind, String subject) {
        return pending.values().stream()
            .anyMatch(submission -> submission.job.kind() == kind && subject.equals(submission.job.subject()));
    }

    /**
     * @return true if a unit analysis job of the repository is pending
     */
    public boolean hasPendingJobs(Repo repo) {
        return pending.values().stream().anyMatch(submission -> submission.job.repo() == repo);
    }

    /**
     * Admits a unit of work. A ready value is passed to the callback immediately without
     * using a worker; a deferred computation is submitted to the pool.
     *
     * @param job job to admit
     * @param <T> result type
     * @throws IllegalStateException if the job is deferred and no capacity is left
     */
    public <T> void admit(Job<T> job) {
        if (job.work() instanceof Work.Ready<T> ready) {
            job.callback().accept(JobOutcome.success(job, ready.value()));
            return;
        }
        if (!hasCapacity()) {
            throw new IllegalStateException("Cannot admit " + job + ": " + maxPending + " jobs already pending");
        }
        Work.Deferred<T> deferred = (Work.Deferred<T>) job.work();
        Submission submission = new Submission(job);
        Future<Object> future = completionService.submit(() -> submission.deliver(deferred.computation().call()));
        pending.put(future, submission);
        log.debug("Submitted {}", job);
    }

    /**
     * Blocks until at least one pending job has finished, then invokes the callbacks of every
     * finished job. Each job's record is removed before its callback runs.
     *
     * @param token checked while waiting
     * @return number of callbacks invoked
     * @throws SurveyInterruptedException if the token is cancelled or the thread is interrupted
     */
    public int awaitAndDispatch(CancellationToken token) {
        if (pending.isEmpty()) {
            return 0;
        }
        try {
            Future<Object> done = null;
            while (done == null) {
                token.throwIfCancelled();
                done = completionService.poll(POLL_INTERVAL_MILLIS, TimeUnit.MILLISECONDS);
            }
            int dispatched = 0;
            while (done != null) {
                if (dispatch(done)) {
                    dispatched++;
                }
                done = completionService.poll();
            }
            return dispatched;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SurveyInterruptedException("Interrupted while waiting for jobs", e);
        }
    }

    private boolean dispatch(Future<Object> future) throws InterruptedException {
        Submission submission = pending.remove(future);
        if (submission == null) {
            return false;
        }
        complete(submission.job, future);
        return true;
    }

    @SuppressWarnings("unchecked")
    private <T> void complete(Job<T> job, Future<Object> future) throws InterruptedException {
        JobOutcome<T> outcome;
        try {
            outcome = JobOutcome.success(job, (T) future.get());
        } catch (ExecutionException e) {
            outcome = JobOutcome.failure(job, e.getCause() != null ? e.getCause() : e);
        } catch (CancellationException e) {
            log.debug("Dropping cancelled {}", job);
            return;
        }
        job.callback().accept(outcome);
    }

    /**
     * Cancels every pending job, interrupting workers that are running them. Their callbacks
     * are never invoked. Repositories already produced by cancelled jobs are cleaned up here;
     * those produced later are cleaned up by the worker.
     *
     * @return the cancelled jobs
     */
    public List<Job<?>> cancelPending() {
        List<Job<?>> cancelled = new ArrayList<>();
        pending.forEach((future, submission) -> {
            cancelled.add(submission.job);
            if (submission.abandon()) {
                future.cancel(true);
            } else {
                releaseDelivered(submission, future);
            }
        });
        pending.clear();
        if (!cancelled.isEmpty()) {
            log.info("Cancelled {} pending jobs", cancelled.size());
        }
        return cancelled;
    }

    private void releaseDelivered(Submission submission, Future<Object> future) {
        try {
            release(submission.job, future.get());
        } catch (ExecutionException | CancellationException e) {
            log.debug("No result to release for {}: {}", submission.job, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while releasing the result of {}", submission.job);
        }
    }

    private void release(Job<?> job, Object value) {
        if (value instanceof Repo repo) {
            log.info("Cleaning up repo {} of cancelled {}", repo, job);
            try {
                repo.cleanup();
            } catch (RuntimeException e) {
                log.warn("Failed to clean up repo {}: {}", repo, e.getMessage(), e);
            }
        }
    }

    /**
     * Stops the worker pool without waiting for running computations.
     */
    public void shutdownNow() {
        executor.shutdownNow();
    }

    @Override
    public void close() {
        cancelPending();
        shutdownNow();
    }

    private enum HandOff { OPEN, DELIVERED, ABANDONED }

    /**
     * A submitted job plus the hand-off between its worker and {@link #cancelPending()}.
     * Exactly one of them wins the transition out of {@code OPEN}.
     */
    private final class Submission {
        private final Job<?> job;
        private final AtomicReference<HandOff> state = new AtomicReference<>(HandOff.OPEN);

        Submission(Job<?> job) {
            this.job = job;
        }

        /** Runs on the worker once the computation has returned. */
        Object deliver(Object value) {
            if (!state.compareAndSet(HandOff.OPEN, HandOff.DELIVERED)) {
                release(job, value);
            }
            return value;
        }

        /**
         * @return true if the result was not delivered yet and will be released by the worker
         */
        boolean abandon() {
            return state.compareAndSet(HandOff.OPEN, HandOff.ABANDONED);
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private static final AtomicInteger POOL_COUNT = new AtomicInteger();

        private final int poolNumber = POOL_COUNT.incrementAndGet();
        private final AtomicInteger threadCount = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable,
                "codesurvey-" + poolNumber + "-worker-" + threadCount.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
