package com.omniva.dbnotify.engine.fault;

/**
 * Transient failure of the dedicated notification connection.
 * Reported through the error channel; the listener recovers on its own.
 */
public class ListenerConnectionException extends DbNotifyRuntimeException {
    public ListenerConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
