package com.omniva.dbnotify.transaction.jdbc;

import com.omniva.dbnotify.transaction.TransactionAbortedException;
import com.omniva.dbnotify.transaction.TransactionHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.PreparedStatementCallback;
import org.springframework.jdbc.core.RowMapper;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * JDBC statements bound to one open transaction.
 * <p>
 * The running statement is tracked so {@link #abortInFlight()} can cancel it
 * from another thread.
 */
public class JdbcTransactionHandle implements TransactionHandle {

    private static final Logger log = LoggerFactory.getLogger(JdbcTransactionHandle.class);

    private final Connection connection;
    private final AtomicReference<PreparedStatement> currentStatement = new AtomicReference<>();
    private final AtomicBoolean aborted = new AtomicBoolean(false);

    public JdbcTransactionHandle(Connection connection) {
        this.connection = connection;
    }

    @Override
    public void execute(String sql, Object... params) throws SQLException {
        withStatement(sql, params, PreparedStatement::execute);
    }

    @Override
    public int update(String sql, Object... params) throws SQLException {
        return withStatement(sql, params, PreparedStatement::executeUpdate);
    }

    @Override
    public <T> List<T> query(String sql, RowMapper<T> rowMapper, Object... params) throws SQLException {
        return withStatement(sql, params, statement -> {
            List<T> rows = new ArrayList<>();
            try (ResultSet rs = statement.executeQuery()) {
                int rowNum = 0;
                while (rs.next()) {
                    rows.add(rowMapper.mapRow(rs, rowNum++));
                }
            }
            return rows;
        });
    }

    @Override
    public void abortInFlight() {
        if (aborted.compareAndSet(false, true)) {
            safeCancelStatement(currentStatement.get());
        }
    }

    public boolean isAborted() {
        return aborted.get();
    }

    private <R> R withStatement(String sql, Object[] params, PreparedStatementCallback<R> action) throws SQLException {
        checkNotAborted();

        try (PreparedStatement statement = connection.prepareStatement(sql)) {
            bind(statement, params);
            currentStatement.set(statement);
            try {
                checkNotAborted();
                return action.doInPreparedStatement(statement);
            } catch (SQLException e) {
                if (aborted.get()) {
                    throw new TransactionAbortedException(null, e);
                }
                throw e;
            } finally {
                currentStatement.set(null);
            }
        }
    }

    private static void bind(PreparedStatement statement, Object[] params) throws SQLException {
        if (params == null) {
            return;
        }
        for (int i = 0; i < params.length; i++) {
            statement.setObject(i + 1, params[i]);
        }
    }

    private void checkNotAborted() {
        if (aborted.get()) {
            throw new TransactionAbortedException(null);
        }
    }

    /**
     * Called by the engine once the transaction has ended.
     */
    void release() {
        PreparedStatement leftover = currentStatement.getAndSet(null);
        if (leftover != null) {
            safeCancelStatement(leftover);
        }
    }

    /**
     * Safely cancels a statement
     */
    private static void safeCancelStatement(PreparedStatement statement) {
        if (statement != null) {
            try {
                statement.cancel();
            } catch (SQLException e) {
                log.warn("Error cancelling transaction statement: {}", e.getMessage());
            }
        }
    }
}
