package io.eventlog.jdbc;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.eventlog.ConcurrencyException;
import io.eventlog.EventLog;
import io.eventlog.admin.ProjectionAdmin;
import io.eventlog.admin.ReplayReport;
import io.eventlog.admin.ResolutionStrategy;
import io.eventlog.admin.ResolveResult;
import io.eventlog.jdbc.dialect.H2Dialect;
import io.eventlog.model.HealthStatus;
import io.eventlog.model.ProjectionFailure;
import io.eventlog.model.ResolutionMethod;
import io.eventlog.model.Snapshot;
import io.eventlog.projection.DefaultProjectionRegistry;
import io.eventlog.repository.AggregateRepository;
import io.eventlog.repository.SaveResult;
import io.eventlog.util.Transactions;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end behaviour of an {@link EventLog} wired to H2 through the JDBC stores.
 */
class EventLogAcceptanceTest {
    private HikariDataSource dataSource;
    private DataSourceConnectionProvider connections;
    private JdbcSnapshotStore snapshotStore;
    private BalanceProjection balances;
    private EventLog eventLog;
    private AggregateRepository<Account> accounts;
    private ProjectionAdmin admin;

    @BeforeEach
    void setUp() throws Exception {
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(TestDatabase.h2Url());
        config.setMaximumPoolSize(5);
        config.setPoolName("eventlog-test-pool");
        dataSource = new HikariDataSource(config);
        TestDatabase.createSchema(dataSource, "/schema/h2.sql");

        H2Dialect dialect = new H2Dialect();
        JacksonJsonCodec codec = new JacksonJsonCodec();
        connections = new DataSourceConnectionProvider(dataSource);
        snapshotStore = new JdbcSnapshotStore(dialect, codec);
        balances = new BalanceProjection(dataSource);
        eventLog = EventLog.builder()
                .connectionProvider(connections)
                .eventLogStore(new JdbcEventLogStore(dialect, codec))
                .snapshotStore(snapshotStore)
                .projectionStore(new JdbcProjectionStore(dialect))
                .projections(new DefaultProjectionRegistry().register(balances))
                .sleeper(delayMs -> { })
                .publishAsync(false)
                .retrySchedule(List.of(Duration.ZERO))
                .build();
        accounts = eventLog.repository(Account::new);
        admin = eventLog.admin();
    }

    @AfterEach
    void tearDown() {
        eventLog.close();
        dataSource.close();
    }

    @Test
    void savedEventsAreProjected() throws Exception {
        Account account = Account.open("acc-1", "ana");
        account.deposit(100);
        account.withdraw(30);

        SaveResult.Saved saved = accounts.save(account).orThrow();

        assertEquals(3, saved.version());
        assertEquals(3, saved.events().size());
        assertEquals(Optional.of(70), balances.balance("acc-1"));
        assertEquals(3, admin.checkpoint("account_balances").orElseThrow().lastEventSequence());
        assertEquals(HealthStatus.HEALTHY, admin.health("account_balances").healthStatus());
    }

    @Test
    void reloadedAggregateMatchesSavedOne() {
        Account account = Account.open("acc-1", "ana");
        account.deposit(100);
        accounts.save(account).orThrow();

        Account loaded = accounts.get("acc-1");

        assertEquals("ana", loaded.owner());
        assertEquals(100, loaded.balance());
        assertEquals(2, loaded.version());
        assertTrue(loaded.pendingEvents().isEmpty());
    }

    @Test
    void staleCopyIsRejected() {
        accounts.save(Account.open("acc-1", "ana")).orThrow();
        Account first = accounts.get("acc-1");
        Account second = accounts.get("acc-1");

        first.deposit(10);
        second.deposit(20);
        accounts.save(first).orThrow();
        SaveResult result = accounts.save(second);

        SaveResult.Conflict conflict = assertInstanceOf(SaveResult.Conflict.class, result);
        assertEquals(3, conflict.attempts());
        assertEquals(2, conflict.conflict().actualVersion());
        assertThrows(ConcurrencyException.class, result::orThrow);
        assertEquals(10, accounts.get("acc-1").balance());
    }

    @Test
    void snapshotIsWrittenAtThresholdAndUsedOnLoad() {
        Account account = Account.open("acc-1", "ana");
        for (int i = 0; i < 11; i++) {
            account.deposit(5);
        }
        accounts.save(account).orThrow();

        Snapshot snapshot = Transactions.withConnection(connections, "load snapshot",
                conn -> snapshotStore.load(conn, "acc-1")).orElseThrow();
        assertEquals(12, snapshot.version());
        assertEquals(55, ((Number) snapshot.state().get("balance")).intValue());

        Account loaded = accounts.get("acc-1");
        loaded.withdraw(15);
        accounts.save(loaded).orThrow();

        Account reloaded = accounts.get("acc-1");
        assertEquals(40, reloaded.balance());
        assertEquals(13, reloaded.version());
    }

    @Test
    void projectionOutageIsRecordedAndRetried() throws Exception {
        balances.failing(true);
        accounts.save(Account.open("acc-1", "ana")).orThrow();

        List<ProjectionFailure> failures = admin.failures("account_balances", false, 10);
        assertEquals(1, failures.size());
        assertEquals("AccountOpened", failures.get(0).eventType());
        assertTrue(failures.get(0).errorMessage().startsWith("SQLException"));
        assertEquals(HealthStatus.DEGRADED, admin.health("account_balances").healthStatus());
        assertTrue(balances.balance("acc-1").isEmpty());

        balances.failing(false);
        assertEquals(1, eventLog.worker().poll());

        assertEquals(Optional.of(0), balances.balance("acc-1"));
        ProjectionFailure resolved = admin.failure(failures.get(0).id()).orElseThrow();
        assertEquals(ResolutionMethod.AUTO_RETRY, resolved.resolutionMethod());
        assertEquals(HealthStatus.HEALTHY, admin.health("account_balances").healthStatus());
        assertEquals(0, admin.health("account_balances").lagEvents());
    }

    @Test
    void manualSkipAndRetry() {
        balances.failing(true);
        accounts.save(Account.open("acc-1", "ana")).orThrow();
        String failureId = admin.failures("account_balances", false, 1).get(0).id();

        ResolveResult stillDown = admin.resolve(failureId, ResolutionStrategy.RETRY);
        assertInstanceOf(ResolveResult.RetryFailed.class, stillDown);

        balances.failing(false);
        assertEquals(new ResolveResult.Resolved(failureId, ResolutionMethod.MANUAL_RETRY),
                admin.resolve(failureId, ResolutionStrategy.RETRY));
        assertInstanceOf(ResolveResult.AlreadyResolved.class, admin.resolve(failureId, ResolutionStrategy.SKIP));
    }

    @Test
    void resetAndReplayRebuildsReadModel() throws Exception {
        Account first = Account.open("acc-1", "ana");
        first.deposit(100);
        Account second = Account.open("acc-2", "ben");
        second.deposit(40);
        second.withdraw(15);
        accounts.save(first).orThrow();
        accounts.save(second).orThrow();

        admin.reset("account_balances");
        assertTrue(balances.balance("acc-1").isEmpty());
        assertTrue(admin.checkpoint("account_balances").isEmpty());
        assertEquals(5, admin.health("account_balances").lagEvents());

        ReplayReport report = admin.replay("account_balances", null, null, false);

        assertEquals(5, report.eventsReplayed());
        assertEquals(ReplayReport.Status.COMPLETED, report.status());
        assertEquals(Optional.of(100), balances.balance("acc-1"));
        assertEquals(Optional.of(25), balances.balance("acc-2"));
        assertEquals(0, admin.health("account_balances").lagEvents());

        ReplayReport again = admin.replay("account_balances", 1L, null, false);
        assertEquals(5, again.eventsReplayed());
        assertEquals(Optional.of(25), balances.balance("acc-2"));
    }

    @Test
    void systemHealthReflectsStoredBookkeeping() {
        balances.failing(true);
        accounts.save(Account.open("acc-1", "ana")).orThrow();

        var system = admin.systemHealth();

        assertEquals(HealthStatus.DEGRADED, system.overallStatus());
        assertEquals(1, system.totalActiveFailures());
        assertEquals(1, system.latestSequence());
    }
}
