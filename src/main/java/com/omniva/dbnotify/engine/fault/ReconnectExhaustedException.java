package com.omniva.dbnotify.engine.fault;

import lombok.Getter;

/**
 * Terminal error: the listener stopped trying to reconnect.
 */
@Getter
public class ReconnectExhaustedException extends DbNotifyRuntimeException {
    private final int attempts;

    public ReconnectExhaustedException(int attempts) {
        super("Giving up after " + attempts + " reconnection attempts");
        this.attempts = attempts;
    }
}
