package io.eventlog.spi;

import io.eventlog.DomainEvent;

import java.sql.Connection;
import java.util.List;
import java.util.Optional;

/**
 * Append-only, per-aggregate ordered storage of domain events.
 *
 * <p>All methods operate on a caller-supplied connection; the caller owns the transaction.
 *
 * @see io.eventlog.jdbc.JdbcEventLogStore
 */
public interface EventLogStore {

    /**
     * Appends events to an aggregate's stream under an optimistic version check.
     *
     * <p>Must run inside a transaction. Implementations lock the aggregate's existing rows,
     * compare the highest locked version with {@code expectedVersion}, and on a match insert
     * the events with versions {@code expectedVersion + 1 ...} and store-assigned global
     * sequences. On a mismatch nothing is written.
     *
     * @param conn            the JDBC connection (transaction managed by the caller)
     * @param aggregateId     the aggregate to append to
     * @param events          events to append, in order
     * @param expectedVersion the version the events were produced against
     * @return the appended events, or a version conflict
     */
    AppendResult append(Connection conn, String aggregateId, List<DomainEvent> events, long expectedVersion);

    /**
     * Loads an aggregate's events with {@code version > fromVersion}, ordered by version.
     *
     * @param conn        the JDBC connection
     * @param aggregateId the aggregate
     * @param fromVersion exclusive lower bound ({@code 0} for the whole stream)
     * @return ordered events (possibly empty)
     */
    List<DomainEvent> load(Connection conn, String aggregateId, long fromVersion);

    /**
     * Loads events across all aggregates with {@code sequence >= fromSequence}, in global order.
     *
     * @param conn         the JDBC connection
     * @param fromSequence inclusive lower bound
     * @param limit        maximum number of events
     * @return ordered events (possibly empty)
     */
    List<DomainEvent> loadAll(Connection conn, long fromSequence, int limit);

    /**
     * Finds a single event by its id.
     *
     * @param conn    the JDBC connection
     * @param eventId the event id
     * @return the event, or empty if not found
     */
    Optional<DomainEvent> findEvent(Connection conn, String eventId);

    /**
     * Returns the highest assigned global sequence, or {@code 0} if the log is empty.
     */
    long latestSequence(Connection conn);

    /**
     * Returns the current version of an aggregate, or {@code 0} if it has no events.
     */
    long currentVersion(Connection conn, String aggregateId);
}
