package com.codesurvey.core.store;

/**
 * Opens {@link CompletionStore} sessions over the same durable records.
 *
 * <p>A survey opens one store per run and one per result query.
 */
@FunctionalInterface
public interface CompletionStoreFactory extends AutoCloseable {

    CompletionStore open();

    /**
     * Releases resources shared by all sessions. Stores opened afterwards may see no records.
     */
    @Override
    default void close() {
    }
}
