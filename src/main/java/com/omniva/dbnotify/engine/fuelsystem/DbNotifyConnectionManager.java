package com.omniva.dbnotify.engine.fuelsystem;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;

/**
 * Creates dedicated notification connections and tears them down safely.
 * <p>
 * The data source must not be a pool: LISTEN is session state and the
 * connection is held for the listener's lifetime.
 */
public class DbNotifyConnectionManager implements NotificationConnectionFactory {

    private static final Logger log = LoggerFactory.getLogger(DbNotifyConnectionManager.class);

    private final DataSource dataSource;

    public DbNotifyConnectionManager(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    /**
     * Creates and configures a new connection for the listener.
     */
    @Override
    public NotificationConnection open() throws SQLException {
        Connection connection = dataSource.getConnection();
        try {
            // LISTEN only takes effect once its transaction commits
            connection.setAutoCommit(true);
            return new PgNotificationConnection(connection);
        } catch (SQLException e) {
            safeClose(connection);
            throw e;
        }
    }

    /**
     * Safely unsubscribes; the connection may already be broken.
     */
    public static void safeUnlisten(NotificationConnection connection, String channel) {
        if (connection != null) {
            try {
                connection.unlisten(channel);
            } catch (SQLException e) {
                log.debug("Error running UNLISTEN {} (connection may be broken): {}", channel, e.getMessage());
            }
        }
    }

    /**
     * Safely closes a notification connection.
     */
    public static void safeClose(NotificationConnection connection) {
        if (connection != null) {
            try {
                connection.close();
            } catch (SQLException e) {
                log.debug("Error closing notification connection: {}", e.getMessage());
            }
        }
    }

    private static void safeClose(Connection connection) {
        try {
            connection.close();
        } catch (SQLException closeError) {
            log.warn("Error closing connection: {}", closeError.getMessage());
        }
    }
}
