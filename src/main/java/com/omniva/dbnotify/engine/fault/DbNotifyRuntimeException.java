package com.omniva.dbnotify.engine.fault;

/**
 * Base runtime exception for all DB Notify related errors
 */
public class DbNotifyRuntimeException extends RuntimeException {
    public DbNotifyRuntimeException(String message) {
        super(message);
    }

    public DbNotifyRuntimeException(String message, Throwable cause) {
        super(message, cause);
    }
}
