package com.omniva.dbnotify.transaction;

import org.springframework.jdbc.core.RowMapper;

import java.sql.SQLException;
import java.util.List;

/**
 * A client already bound to an open transaction. Statements are always
 * parameterized; values are never interpolated into the SQL text.
 */
public interface TransactionHandle extends DbClient {

    void execute(String sql, Object... params) throws SQLException;

    int update(String sql, Object... params) throws SQLException;

    <T> List<T> query(String sql, RowMapper<T> rowMapper, Object... params) throws SQLException;

    /**
     * Cancel the statement currently running on this handle and refuse any further ones.
     * Called when the owning transaction lost a race against its cancellation signal.
     */
    default void abortInFlight() {
    }
}
