package com.omniva.dbnotify.engine.fuelsystem;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.postgresql.PGConnection;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DbNotifyConnectionManagerTest {

    @Mock
    private DataSource dataSource;

    @Mock
    private Connection connection;

    @Mock
    private PGConnection pgConnection;

    @Test
    void opensAutoCommitConnection() throws SQLException {
        when(dataSource.getConnection()).thenReturn(connection);
        when(connection.unwrap(PGConnection.class)).thenReturn(pgConnection);

        NotificationConnection opened = new DbNotifyConnectionManager(dataSource).open();

        assertThat(opened).isInstanceOf(PgNotificationConnection.class);
        verify(connection).setAutoCommit(true);
    }

    @Test
    void closesConnectionThatIsNotPostgres() throws SQLException {
        when(dataSource.getConnection()).thenReturn(connection);
        when(connection.unwrap(PGConnection.class)).thenThrow(new SQLException("not a wrapper for PGConnection"));

        assertThatThrownBy(() -> new DbNotifyConnectionManager(dataSource).open()).isInstanceOf(SQLException.class);
        verify(connection).close();
    }

    @Test
    void safeTeardownIgnoresErrors() throws SQLException {
        NotificationConnection broken = mock(NotificationConnection.class);
        doThrow(new SQLException("connection is broken")).when(broken).unlisten("table_change");
        doThrow(new SQLException("already closed")).when(broken).close();

        assertThatCode(() -> {
            DbNotifyConnectionManager.safeUnlisten(broken, "table_change");
            DbNotifyConnectionManager.safeClose(broken);
            DbNotifyConnectionManager.safeClose(null);
        }).doesNotThrowAnyException();
        verify(broken).close();
    }
}
