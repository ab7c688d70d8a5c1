package io.eventlog.jdbc.dialect;

import io.eventlog.jdbc.spi.Dialect;

import java.sql.SQLException;

/**
 * Base dialect with standard SQL implementations.
 *
 * <p>Subclasses can override methods to provide database-specific SQL.
 */
public abstract class AbstractDialect implements Dialect {

    @Override
    public String jsonParameter() {
        return "?";
    }

    /**
     * Locks the aggregate's rows in a derived table and takes the maximum in the outer query.
     */
    @Override
    public String lockedVersionSql(String table) {
        return "SELECT COALESCE(MAX(locked.event_version), 0) FROM" +
                " (SELECT event_version FROM " + table + " WHERE aggregate_id=? FOR UPDATE) locked";
    }

    @Override
    public boolean isWriteConflict(SQLException e) {
        for (SQLException current = e; current != null; current = current.getNextException()) {
            String state = current.getSQLState();
            // 23: integrity constraint violation, 40: transaction rollback (serialization, deadlock)
            if (state != null && (state.startsWith("23") || state.startsWith("40"))) {
                return true;
            }
        }
        return false;
    }
}
