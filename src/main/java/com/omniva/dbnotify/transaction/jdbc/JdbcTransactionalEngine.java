package com.omniva.dbnotify.transaction.jdbc;

import com.omniva.dbnotify.transaction.TransactionCallback;
import com.omniva.dbnotify.transaction.TransactionalEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;

/**
 * {@link TransactionalEngine} over a pooled {@link DataSource}.
 * One connection per transaction, returned to the pool afterwards.
 */
public class JdbcTransactionalEngine implements TransactionalEngine {

    private static final Logger log = LoggerFactory.getLogger(JdbcTransactionalEngine.class);

    private final DataSource dataSource;

    public JdbcTransactionalEngine(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
    }

    @Override
    public <T> T inTransaction(TransactionCallback<T> callback) throws Exception {
        Connection connection = dataSource.getConnection();
        boolean previousAutoCommit = true;
        JdbcTransactionHandle handle = new JdbcTransactionHandle(connection);

        try {
            previousAutoCommit = connection.getAutoCommit();
            connection.setAutoCommit(false);

            T result = callback.doInTransaction(handle);
            connection.commit();
            return result;
        } catch (Exception | Error e) {
            safeRollback(connection);
            throw e;
        } finally {
            handle.release();
            restoreAutoCommit(connection, previousAutoCommit);
            safeClose(connection);
        }
    }

    /**
     * Safely rolls back a transaction.
     */
    static void safeRollback(Connection connection) {
        try {
            connection.rollback();
        } catch (SQLException rollbackError) {
            log.warn("Error rolling back transaction: {}", rollbackError.getMessage());
        }
    }

    private static void restoreAutoCommit(Connection connection, boolean autoCommit) {
        try {
            if (!connection.isClosed()) {
                connection.setAutoCommit(autoCommit);
            }
        } catch (SQLException e) {
            log.warn("Error restoring autocommit: {}", e.getMessage());
        }
    }

    private static void safeClose(Connection connection) {
        try {
            if (!connection.isClosed()) {
                connection.close();
            }
        } catch (SQLException closeError) {
            log.warn("Error closing transaction connection: {}", closeError.getMessage());
        }
    }
}
