package com.banking.scd.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;

/**
 * A JDBC transaction scoped to a try-with-resources block.
 * Every step runs on one connection with auto-commit off; unless {@link #commit()}
 * succeeds before close, the work is rolled back.
 *
 * <p>Usage:</p>
 * <pre>
 * try (JdbcTransaction tx = JdbcTransaction.begin(dataSource)) {
 *     tx.execute("close version", c -> closeVersion(c, ...));
 *     tx.execute("insert version", c -> insertVersion(c, ...));
 *     tx.commit();
 * }
 * // If commit() was not reached, everything is rolled back
 * </pre>
 */
public class JdbcTransaction implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(JdbcTransaction.class);

    private final Connection connection;
    private final boolean previousAutoCommit;
    private boolean success = false;
    private boolean closed = false;

    private JdbcTransaction(Connection connection) throws SQLException {
        this.connection = connection;
        this.previousAutoCommit = connection.getAutoCommit();
        connection.setAutoCommit(false);
    }

    /**
     * Opens a connection and starts a transaction on it.
     */
    public static JdbcTransaction begin(DataSource dataSource) throws SQLException {
        Connection connection = dataSource.getConnection();
        try {
            return new JdbcTransaction(connection);
        } catch (SQLException e) {
            connection.close();
            throw e;
        }
    }

    /**
     * Runs one step of the transaction.
     *
     * @param description human-readable description of the step
     * @param step        the work to run on the transaction's connection
     */
    public <T> T execute(String description, SqlStep<T> step) throws SQLException {
        if (closed) {
            throw new IllegalStateException("Transaction is already closed");
        }
        log.debug("Executing transaction step: {}", description);
        return step.run(connection);
    }

    /**
     * Commits the transaction. After a successful commit, close() does not roll back.
     */
    public void commit() throws SQLException {
        if (closed) {
            throw new IllegalStateException("Transaction is already closed");
        }
        connection.commit();
        success = true;
    }

    /**
     * Returns whether the transaction was committed.
     */
    public boolean isSuccess() {
        return success;
    }

    @Override
    public void close() throws SQLException {
        if (closed) {
            return;
        }
        closed = true;
        try {
            if (!success) {
                log.debug("Transaction closed without commit - rolling back");
                connection.rollback();
            }
            connection.setAutoCommit(previousAutoCommit);
        } finally {
            connection.close();
        }
    }

    /**
     * One unit of work inside a transaction.
     */
    @FunctionalInterface
    public interface SqlStep<T> {
        T run(Connection connection) throws SQLException;
    }
}
