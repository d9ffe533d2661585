package com.banking.scd.store;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("JdbcTransaction Tests")
class JdbcTransactionTest {

    @Mock
    private DataSource dataSource;

    @Mock
    private Connection connection;

    @BeforeEach
    void setUp() throws SQLException {
        when(dataSource.getConnection()).thenReturn(connection);
        when(connection.getAutoCommit()).thenReturn(true);
    }

    @Test
    @DisplayName("Should commit and restore auto-commit")
    void commits() throws SQLException {
        try (JdbcTransaction tx = JdbcTransaction.begin(dataSource)) {
            assertEquals("done", tx.execute("step", c -> "done"));
            tx.commit();
            assertTrue(tx.isSuccess());
        }

        InOrder order = inOrder(connection);
        order.verify(connection).setAutoCommit(false);
        order.verify(connection).commit();
        order.verify(connection).setAutoCommit(true);
        order.verify(connection).close();
        verify(connection, never()).rollback();
    }

    @Test
    @DisplayName("Should roll back when closed without commit")
    void rollsBackWithoutCommit() throws SQLException {
        try (JdbcTransaction tx = JdbcTransaction.begin(dataSource)) {
            tx.execute("step", c -> null);
        }

        verify(connection).rollback();
        verify(connection, never()).commit();
        verify(connection).close();
    }

    @Test
    @DisplayName("Should roll back when a step fails")
    void rollsBackOnFailure() throws SQLException {
        SQLException failure = new SQLException("boom");

        SQLException thrown = assertThrows(SQLException.class, () -> {
            try (JdbcTransaction tx = JdbcTransaction.begin(dataSource)) {
                tx.execute("failing step", c -> {
                    throw failure;
                });
                tx.commit();
            }
        });

        assertSame(failure, thrown);
        verify(connection).rollback();
        verify(connection).close();
    }

    @Test
    @DisplayName("Should refuse steps after close")
    void closedTransaction() throws SQLException {
        JdbcTransaction tx = JdbcTransaction.begin(dataSource);
        tx.close();
        tx.close();

        assertThrows(IllegalStateException.class, () -> tx.execute("late", c -> null));
        assertThrows(IllegalStateException.class, tx::commit);
        verify(connection, times(1)).close();
    }
}
