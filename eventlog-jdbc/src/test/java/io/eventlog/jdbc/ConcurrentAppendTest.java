package io.eventlog.jdbc;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.eventlog.DomainEvent;
import io.eventlog.jdbc.dialect.H2Dialect;
import io.eventlog.spi.AppendResult;
import io.eventlog.util.Transactions;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ConcurrentAppendTest {
    private static final int WRITERS = 10;

    private HikariDataSource dataSource;
    private DataSourceConnectionProvider connections;
    private JdbcEventLogStore store;

    @BeforeEach
    void setUp() throws Exception {
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl("jdbc:h2:mem:concurrent_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1;LOCK_TIMEOUT=10000");
        config.setMaximumPoolSize(WRITERS);
        config.setPoolName("eventlog-concurrency-pool");
        dataSource = new HikariDataSource(config);
        TestDatabase.createSchema(dataSource, "/schema/h2.sql");
        connections = new DataSourceConnectionProvider(dataSource);
        store = new JdbcEventLogStore(new H2Dialect(), new JacksonJsonCodec());
    }

    @AfterEach
    void tearDown() {
        if (dataSource != null && !dataSource.isClosed()) {
            dataSource.close();
        }
    }

    private static DomainEvent event(String aggregateId, long version, String writer) {
        return DomainEvent.builder("FundsDeposited")
                .aggregateId(aggregateId)
                .aggregateType("Account")
                .version(version)
                .payload(Map.of("writer", writer))
                .build();
    }

    @Test
    void exactlyOneWriterWinsTheNextVersion() throws Exception {
        List<DomainEvent> history = new ArrayList<>();
        for (int v = 1; v <= 4; v++) {
            history.add(event("acc-1", v, "seed"));
        }
        Transactions.inTransaction(connections, "seed", conn -> store.append(conn, "acc-1", history, 0));

        ExecutorService pool = Executors.newFixedThreadPool(WRITERS);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<AppendResult>> results = new ArrayList<>();
        for (int i = 0; i < WRITERS; i++) {
            String writer = "writer-" + i;
            results.add(pool.submit(() -> {
                start.await();
                return Transactions.inTransaction(connections, "append",
                        conn -> store.append(conn, "acc-1", List.of(event("acc-1", 5, writer)), 4));
            }));
        }
        start.countDown();

        int appended = 0;
        int conflicts = 0;
        for (Future<AppendResult> result : results) {
            AppendResult outcome = result.get(30, TimeUnit.SECONDS);
            if (outcome instanceof AppendResult.Appended) {
                appended++;
            } else {
                conflicts++;
            }
        }
        pool.shutdown();

        assertEquals(1, appended);
        assertEquals(WRITERS - 1, conflicts);
        try (Connection conn = dataSource.getConnection()) {
            List<DomainEvent> stored = store.load(conn, "acc-1", 0);
            assertEquals(5, stored.size());
            assertEquals(List.of(1L, 2L, 3L, 4L, 5L), stored.stream().map(DomainEvent::version).toList());
        }
    }

    @Test
    void concurrentCreatorsOfNewAggregateProduceOneStream() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(4);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<AppendResult>> results = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            String writer = "creator-" + i;
            results.add(pool.submit(() -> {
                start.await();
                return Transactions.inTransaction(connections, "append",
                        conn -> store.append(conn, "acc-new", List.of(event("acc-new", 1, writer)), 0));
            }));
        }
        start.countDown();

        long appended = 0;
        for (Future<AppendResult> result : results) {
            if (result.get(30, TimeUnit.SECONDS) instanceof AppendResult.Appended) {
                appended++;
            }
        }
        pool.shutdown();

        assertEquals(1, appended);
        try (Connection conn = dataSource.getConnection()) {
            assertEquals(1, store.currentVersion(conn, "acc-new"));
        }
    }

    @Test
    void appendHoldsLocksOnEveryRowOfTheAggregate() throws Exception {
        JdbcDataSource shortLocks = new JdbcDataSource();
        shortLocks.setURL("jdbc:h2:mem:locks_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1;LOCK_TIMEOUT=200");
        TestDatabase.createSchema(shortLocks, "/schema/h2.sql");
        DataSourceConnectionProvider provider = new DataSourceConnectionProvider(shortLocks);
        Transactions.inTransaction(provider, "seed", conn -> store.append(conn, "acc-1",
                List.of(event("acc-1", 1, "seed"), event("acc-1", 2, "seed"), event("acc-1", 3, "seed")), 0));

        try (Connection writer = shortLocks.getConnection(); Connection other = shortLocks.getConnection()) {
            writer.setAutoCommit(false);
            other.setAutoCommit(false);
            assertInstanceOf(AppendResult.Appended.class,
                    store.append(writer, "acc-1", List.of(event("acc-1", 4, "writer")), 3));

            try (PreparedStatement ps = other.prepareStatement(
                    "SELECT event_version FROM events WHERE aggregate_id=? AND event_version=1 FOR UPDATE")) {
                ps.setString(1, "acc-1");
                assertThrows(SQLException.class, ps::executeQuery);
            }
            other.rollback();
            writer.rollback();
        }
    }
}
