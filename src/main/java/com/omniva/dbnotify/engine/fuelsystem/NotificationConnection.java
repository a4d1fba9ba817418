package com.omniva.dbnotify.engine.fuelsystem;

import com.omniva.dbnotify.messaging.model.ChannelNotification;

import java.sql.SQLException;
import java.util.List;

/**
 * A dedicated, never pooled, connection subscribed to notification channels.
 * <p>
 * An {@link SQLException} from {@link #poll(int)} is the connection's error
 * event; {@link #isClosed()} turning true without one is its end event.
 */
public interface NotificationConnection extends AutoCloseable {

    /**
     * Subscribe to a channel. Subscribing twice on the same connection is harmless.
     */
    void listen(String channel) throws SQLException;

    void unlisten(String channel) throws SQLException;

    /**
     * Wait up to {@code timeoutMillis} for notifications.
     *
     * @return received notifications, empty on timeout
     */
    List<ChannelNotification> poll(int timeoutMillis) throws SQLException;

    boolean isClosed();

    @Override
    void close() throws SQLException;
}
