package com.omniva.dbnotify.messaging.listener;

/**
 * Receives decode failures, connection errors, reconnection exhaustion and
 * change handler failures. Exceptions thrown here are swallowed.
 */
@FunctionalInterface
public interface ErrorHandler {

    void onError(Throwable error);
}
