package com.omniva.dbnotify.engine.fuelsystem;

import com.omniva.dbnotify.messaging.model.ChannelNotification;
import org.postgresql.PGConnection;
import org.postgresql.PGNotification;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

/**
 * PostgreSQL LISTEN/NOTIFY over a single JDBC connection.
 * Channel names must already be validated identifiers, they are quoted, not bound.
 */
public class PgNotificationConnection implements NotificationConnection {

    private final Connection connection;
    private final PGConnection pgConnection;

    public PgNotificationConnection(Connection connection) throws SQLException {
        this.connection = connection;
        this.pgConnection = connection.unwrap(PGConnection.class);
    }

    @Override
    public void listen(String channel) throws SQLException {
        execute("LISTEN " + quote(channel));
    }

    @Override
    public void unlisten(String channel) throws SQLException {
        execute("UNLISTEN " + quote(channel));
    }

    @Override
    public List<ChannelNotification> poll(int timeoutMillis) throws SQLException {
        PGNotification[] notifications = pgConnection.getNotifications(timeoutMillis);
        if (notifications == null || notifications.length == 0) {
            return List.of();
        }
        List<ChannelNotification> result = new ArrayList<>(notifications.length);
        for (PGNotification notification : notifications) {
            result.add(new ChannelNotification(
                    notification.getName(), notification.getParameter(), notification.getPID()));
        }
        return result;
    }

    @Override
    public boolean isClosed() {
        try {
            return connection.isClosed();
        } catch (SQLException e) {
            return true;
        }
    }

    @Override
    public void close() throws SQLException {
        connection.close();
    }

    private void execute(String sql) throws SQLException {
        try (Statement statement = connection.createStatement()) {
            statement.execute(sql);
        }
    }

    private static String quote(String channel) {
        return "\"" + channel.replace("\"", "\"\"") + "\"";
    }

    @Override
    public String toString() {
        return "PgNotificationConnection[" + connection + "]";
    }
}
