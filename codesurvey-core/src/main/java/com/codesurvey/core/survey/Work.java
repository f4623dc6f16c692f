package com.codesurvey.core.survey;

import java.util.Objects;
import java.util.concurrent.Callable;

/**
 * Payload of a {@link Job}: a value that is already available or a computation to run
 * on a worker thread.
 *
 * @param <T> result type
 */
public sealed interface Work<T> permits Work.Ready, Work.Deferred {

    static <T> Work<T> ready(T value) {
        return new Ready<>(value);
    }

    static <T> Work<T> deferred(Callable<T> computation) {
        return new Deferred<>(computation);
    }

    record Ready<T>(T value) implements Work<T> {
        public Ready {
            Objects.requireNonNull(value, "value must not be null");
        }
    }

    /**
     * @param computation runs on a worker, using only its captured inputs
     */
    record Deferred<T>(Callable<T> computation) implements Work<T> {
        public Deferred {
            Objects.requireNonNull(computation, "computation must not be null");
        }
    }
}
