package com.questrail.poolheat.api;

/**
 * Handle returned by subscribe calls. Unsubscribing is idempotent.
 */
@FunctionalInterface
public interface Subscription extends AutoCloseable
{
    void unsubscribe();

    @Override
    default void close() {
        unsubscribe();
    }
}
