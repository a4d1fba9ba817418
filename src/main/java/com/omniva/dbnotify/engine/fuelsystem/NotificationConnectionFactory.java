package com.omniva.dbnotify.engine.fuelsystem;

import java.sql.SQLException;

/**
 * Opens a fresh dedicated notification connection on every call.
 */
@FunctionalInterface
public interface NotificationConnectionFactory {

    NotificationConnection open() throws SQLException;
}
