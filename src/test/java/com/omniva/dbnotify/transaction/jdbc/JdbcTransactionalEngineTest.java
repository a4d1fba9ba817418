package com.omniva.dbnotify.transaction.jdbc;

import com.omniva.dbnotify.transaction.TransactionAbortedException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("JdbcTransactionalEngine Tests")
class JdbcTransactionalEngineTest {

    @Mock
    private DataSource dataSource;

    @Mock
    private Connection connection;

    @Mock
    private PreparedStatement statement;

    @Mock
    private ResultSet resultSet;

    private JdbcTransactionalEngine engine;

    @BeforeEach
    void setUp() {
        engine = new JdbcTransactionalEngine(dataSource);
    }

    @Test
    @DisplayName("Commits when the callback returns")
    void commitsOnSuccess() throws Exception {
        when(dataSource.getConnection()).thenReturn(connection);
        when(connection.getAutoCommit()).thenReturn(true);
        when(connection.prepareStatement(anyString())).thenReturn(statement);
        when(statement.executeUpdate()).thenReturn(1);

        String result = engine.inTransaction(tx -> {
            tx.update("UPDATE account SET name = ? WHERE id = ?", "n", 7);
            return "ok";
        });

        assertThat(result).isEqualTo("ok");
        InOrder order = inOrder(connection, statement);
        order.verify(connection).setAutoCommit(false);
        order.verify(statement).setObject(1, "n");
        order.verify(statement).setObject(2, 7);
        order.verify(statement).executeUpdate();
        order.verify(connection).commit();
        order.verify(connection).setAutoCommit(true);
        order.verify(connection).close();
        verify(connection, never()).rollback();
        verify(statement).close();
    }

    @Test
    @DisplayName("Rolls back and rethrows when the callback fails")
    void rollsBackOnFailure() throws Exception {
        when(dataSource.getConnection()).thenReturn(connection);
        when(connection.getAutoCommit()).thenReturn(true);
        IllegalStateException boom = new IllegalStateException("boom");

        assertThatThrownBy(() -> engine.inTransaction(tx -> {
            throw boom;
        })).isSameAs(boom);

        verify(connection).rollback();
        verify(connection, never()).commit();
        verify(connection).close();
    }

    @Test
    @DisplayName("Rollback failure does not mask the original error")
    void rollbackFailureIsLogged() throws Exception {
        when(dataSource.getConnection()).thenReturn(connection);
        when(connection.getAutoCommit()).thenReturn(true);
        doThrow(new SQLException("connection gone")).when(connection).rollback();
        SQLException original = new SQLException("deadlock detected", "40P01");

        assertThatThrownBy(() -> engine.inTransaction(tx -> {
            throw original;
        })).isSameAs(original);

        verify(connection).close();
    }

    @Test
    @DisplayName("Query maps each row")
    void queryMapsRows() throws Exception {
        when(dataSource.getConnection()).thenReturn(connection);
        when(connection.getAutoCommit()).thenReturn(true);
        when(connection.prepareStatement(anyString())).thenReturn(statement);
        when(statement.executeQuery()).thenReturn(resultSet);
        when(resultSet.next()).thenReturn(true, true, false);
        when(resultSet.getString(1)).thenReturn("a", "b");

        List<String> rows = engine.inTransaction(tx ->
                tx.query("SELECT name FROM account", (rs, rowNum) -> rs.getString(1)));

        assertThat(rows).containsExactly("a", "b");
        verify(resultSet).close();
    }

    @Test
    @DisplayName("abortInFlight cancels the running statement and refuses later ones")
    void abortInFlightCancelsStatement() throws Exception {
        when(connection.prepareStatement(anyString())).thenReturn(statement);
        JdbcTransactionHandle handle = new JdbcTransactionHandle(connection);
        when(statement.execute()).thenAnswer(invocation -> {
            handle.abortInFlight();
            throw new SQLException("canceling statement due to user request", "57014");
        });

        assertThatThrownBy(() -> handle.execute("SELECT pg_sleep(10)"))
                .isInstanceOf(TransactionAbortedException.class)
                .hasCauseInstanceOf(SQLException.class);
        verify(statement).cancel();

        assertThatThrownBy(() -> handle.update("UPDATE account SET name = ?", "x"))
                .isInstanceOf(TransactionAbortedException.class);
        verify(connection, times(1)).prepareStatement(anyString());
        assertThat(handle.isAborted()).isTrue();
    }

    @Test
    @DisplayName("Plain SQL errors pass through untouched")
    void sqlErrorPassesThrough() throws Exception {
        when(connection.prepareStatement(anyString())).thenReturn(statement);
        SQLException violation = new SQLException("duplicate key", "23505");
        when(statement.execute()).thenThrow(violation);
        JdbcTransactionHandle handle = new JdbcTransactionHandle(connection);

        assertThatThrownBy(() -> handle.execute("INSERT INTO account(id) VALUES (?)", 1)).isSameAs(violation);
        assertThat(handle.isAborted()).isFalse();
    }
}
