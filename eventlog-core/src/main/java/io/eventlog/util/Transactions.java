package io.eventlog.util;

import io.eventlog.StoreUnavailableException;
import io.eventlog.spi.ConnectionProvider;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Connection and transaction scoping shared by the repository, tracker, worker and admin facade.
 *
 * <p>{@link SQLException}s are rethrown as {@link StoreUnavailableException}; runtime
 * exceptions roll the transaction back and propagate unchanged.
 */
public final class Transactions {

    /**
     * Unit of work executed against an open connection.
     *
     * @param <T> result type
     */
    @FunctionalInterface
    public interface SqlWork<T> {
        T execute(Connection conn) throws SQLException;
    }

    private Transactions() {
    }

    /**
     * Runs {@code work} in a new transaction, committing on success and rolling back on failure.
     *
     * @param connectionProvider source of the connection
     * @param action             description used in the error message (e.g. "append events")
     * @param work               the unit of work
     * @return the work's result
     * @throws StoreUnavailableException if the connection or a statement fails
     */
    public static <T> T inTransaction(ConnectionProvider connectionProvider, String action, SqlWork<T> work) {
        try (Connection conn = connectionProvider.getConnection()) {
            conn.setAutoCommit(false);
            try {
                T result = work.execute(conn);
                conn.commit();
                return result;
            } catch (SQLException | RuntimeException e) {
                rollback(conn, e);
                throw e;
            }
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to " + action, e);
        }
    }

    /**
     * Runs read-only {@code work} on an auto-commit connection.
     *
     * @param connectionProvider source of the connection
     * @param action             description used in the error message (e.g. "load events")
     * @param work               the unit of work
     * @return the work's result
     * @throws StoreUnavailableException if the connection or a statement fails
     */
    public static <T> T withConnection(ConnectionProvider connectionProvider, String action, SqlWork<T> work) {
        try (Connection conn = connectionProvider.getConnection()) {
            conn.setAutoCommit(true);
            return work.execute(conn);
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to " + action, e);
        }
    }

    private static void rollback(Connection conn, Exception cause) {
        try {
            conn.rollback();
        } catch (SQLException e) {
            cause.addSuppressed(e);
        }
    }
}
