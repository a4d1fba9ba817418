package com.omniva.dbnotify.engine.fault;

/**
 * Error thrown when the listener cannot be configured or started at all
 */
public class DbNotifyFatalError extends Error {
    public DbNotifyFatalError(String message, Throwable cause) {
        super(message, cause);
    }

    public DbNotifyFatalError(String message) {
        super(message);
    }
}
