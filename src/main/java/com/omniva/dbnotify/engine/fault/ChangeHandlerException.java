package com.omniva.dbnotify.engine.fault;

import com.omniva.dbnotify.messaging.listener.SubscriptionKey;
import com.omniva.dbnotify.messaging.model.ChangeEvent;
import lombok.Getter;

/**
 * Wraps an exception thrown by a change handler. The original exception is the cause.
 */
@Getter
public class ChangeHandlerException extends DbNotifyRuntimeException {
    private final transient ChangeEvent event;
    private final transient SubscriptionKey key;

    public ChangeHandlerException(SubscriptionKey key, ChangeEvent event, Throwable cause) {
        super(String.format("Change handler for '%s' failed on %s %s.%s(%s): %s",
                key.value(), event.getOperation(), event.getSchema(), event.getTable(), event.getId(),
                cause.getMessage()), cause);
        this.event = event;
        this.key = key;
    }
}
