package com.omniva.dbnotify.messaging.listener;

/**
 * Handle returned by every subscribe call. Unsubscribing is idempotent.
 */
@FunctionalInterface
public interface Subscription extends AutoCloseable {

    void unsubscribe();

    @Override
    default void close() {
        unsubscribe();
    }
}
