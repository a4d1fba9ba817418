package com.omniva.dbnotify.messaging.listener;

import com.omniva.dbnotify.messaging.model.ChangeEvent;

/**
 * Receives change events. Runs on a handler pool thread, never on the
 * connection's poll thread. Exceptions are routed to the error handlers.
 * <p>
 * Spring beans implementing this interface and annotated with
 * {@link TableChangeListener} are subscribed automatically.
 */
@FunctionalInterface
public interface ChangeHandler {

    void onChange(ChangeEvent event) throws Exception;

    /**
     * Name used in logs
     */
    default String getHandlerName() {
        return this.getClass().getSimpleName();
    }
}
