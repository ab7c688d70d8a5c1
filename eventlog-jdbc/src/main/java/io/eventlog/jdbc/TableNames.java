package io.eventlog.jdbc;

import java.util.Objects;

/**
 * Default table names and shared table name validation for the JDBC stores.
 */
public final class TableNames {
    public static final String EVENTS = "events";
    public static final String SNAPSHOTS = "snapshots";
    public static final String PROJECTION_FAILURES = "projection_failures";
    public static final String PROJECTION_CHECKPOINTS = "projection_checkpoints";
    public static final String PROJECTION_HEALTH = "projection_health_metrics";

    private static final String TABLE_NAME_PATTERN = "[a-zA-Z_][a-zA-Z0-9_]*";

    private TableNames() {
    }

    public static String validate(String tableName) {
        Objects.requireNonNull(tableName, "tableName");
        if (!tableName.matches(TABLE_NAME_PATTERN)) {
            throw new IllegalArgumentException("Invalid table name: " + tableName);
        }
        return tableName;
    }
}
