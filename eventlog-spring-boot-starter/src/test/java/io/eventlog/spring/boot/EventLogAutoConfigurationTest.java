package io.eventlog.spring.boot;

import io.eventlog.DomainEvent;
import io.eventlog.EventLog;
import io.eventlog.admin.ProjectionAdmin;
import io.eventlog.aggregate.Aggregate;
import io.eventlog.jdbc.DataSourceConnectionProvider;
import io.eventlog.jdbc.JacksonJsonCodec;
import io.eventlog.jdbc.JdbcEventLogStore;
import io.eventlog.jdbc.JdbcProjectionStore;
import io.eventlog.jdbc.JdbcSnapshotStore;
import io.eventlog.jdbc.dialect.H2Dialect;
import io.eventlog.jdbc.spi.Dialect;
import io.eventlog.model.HealthStatus;
import io.eventlog.projection.DefaultProjectionRegistry;
import io.eventlog.projection.EventTypeProjection;
import io.eventlog.repository.AggregateRepository;
import io.eventlog.repository.SaveResult;
import io.eventlog.spi.ConnectionProvider;
import io.eventlog.spi.EventLogStore;
import io.eventlog.spi.JsonCodec;
import io.eventlog.spi.ProjectionStore;
import io.eventlog.spi.SnapshotStore;
import io.eventlog.tracking.ProjectionFailureTracker;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.sql.init.SqlInitializationAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

import static org.junit.jupiter.api.Assertions.*;

class EventLogAutoConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(
                    DataSourceAutoConfiguration.class,
                    SqlInitializationAutoConfiguration.class,
                    EventLogAutoConfiguration.class))
            .withPropertyValues(
                    "spring.datasource.url=jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1",
                    "spring.datasource.driver-class-name=org.h2.Driver",
                    "spring.sql.init.schema-locations=classpath:schema/h2.sql",
                    "eventlog.worker.enabled=false");

    @Test
    void createsAllBeans() {
        runner.withUserConfiguration(ProjectionConfig.class).run(ctx -> {
            assertTrue(ctx.containsBean("eventLogDialect"));
            assertTrue(ctx.containsBean("eventLogJsonCodec"));
            assertTrue(ctx.containsBean("connectionProvider"));
            assertTrue(ctx.containsBean("eventLogStore"));
            assertTrue(ctx.containsBean("snapshotStore"));
            assertTrue(ctx.containsBean("projectionStore"));
            assertTrue(ctx.containsBean("projectionRegistry"));
            assertTrue(ctx.containsBean("projectionBeanRegistrar"));
            assertTrue(ctx.containsBean("eventLog"));
            assertTrue(ctx.containsBean("projectionFailureTracker"));
            assertTrue(ctx.containsBean("projectionAdmin"));

            assertInstanceOf(H2Dialect.class, ctx.getBean(Dialect.class));
            assertInstanceOf(JacksonJsonCodec.class, ctx.getBean(JsonCodec.class));
            assertInstanceOf(DataSourceConnectionProvider.class, ctx.getBean(ConnectionProvider.class));
            assertInstanceOf(JdbcEventLogStore.class, ctx.getBean(EventLogStore.class));
            assertInstanceOf(JdbcSnapshotStore.class, ctx.getBean(SnapshotStore.class));
            assertInstanceOf(JdbcProjectionStore.class, ctx.getBean(ProjectionStore.class));

            EventLog eventLog = ctx.getBean(EventLog.class);
            assertSame(eventLog.tracker(), ctx.getBean(ProjectionFailureTracker.class));
            assertSame(eventLog.admin(), ctx.getBean(ProjectionAdmin.class));
            assertFalse(eventLog.worker().isRunning());
        });
    }

    @Test
    void registersProjectionBeans() {
        runner.withUserConfiguration(ProjectionConfig.class).run(ctx -> {
            var registry = ctx.getBean(DefaultProjectionRegistry.class);
            assertTrue(registry.find("note_titles").isPresent());
            assertEquals(1, registry.all().size());
        });
    }

    @Test
    void duplicateProjectionNamesFailStartup() {
        runner.withUserConfiguration(ProjectionConfig.class, DuplicateProjectionConfig.class).run(ctx -> {
            assertNotNull(ctx.getStartupFailure());
        });
    }

    @Test
    void savesAndProjectsThroughTheWiredEventLog() {
        runner.withUserConfiguration(ProjectionConfig.class)
                .withPropertyValues("eventlog.publisher.async=false")
                .run(ctx -> {
                    EventLog eventLog = ctx.getBean(EventLog.class);
                    AggregateRepository<Note> notes = eventLog.repository(Note::new);

                    Note note = new Note("note-1");
                    note.write("Groceries");
                    SaveResult result = notes.save(note);
                    assertInstanceOf(SaveResult.Saved.class, result);

                    Optional<Note> loaded = notes.find("note-1");
                    assertTrue(loaded.isPresent());
                    assertEquals("Groceries", loaded.get().title);
                    assertEquals(1, loaded.get().version());

                    NoteTitlesProjection projection = ctx.getBean(NoteTitlesProjection.class);
                    assertEquals("Groceries", projection.titles.get("note-1"));

                    var health = ctx.getBean(ProjectionAdmin.class).health("note_titles");
                    assertEquals(HealthStatus.HEALTHY, health.healthStatus());
                    assertEquals(1, health.metric().totalEventsProcessed());
                    assertEquals(0, health.lagEvents());
                });
    }

    @Test
    void startsWorkerWhenEnabled() {
        runner.withUserConfiguration(ProjectionConfig.class)
                .withPropertyValues("eventlog.worker.enabled=true", "eventlog.worker.interval-ms=60000")
                .run(ctx -> assertTrue(ctx.getBean(EventLog.class).worker().isRunning()));
    }

    @Test
    void customTableNames() {
        runner.withPropertyValues("eventlog.tables.events=ev_log_custom")
                .withUserConfiguration(ProjectionConfig.class).run(ctx -> {
                    assertNotNull(ctx.getBean(EventLogStore.class));
                });
    }

    @Test
    void invalidTableNameFailsStartup() {
        runner.withPropertyValues("eventlog.tables.events=events; DROP TABLE x")
                .run(ctx -> assertNotNull(ctx.getStartupFailure()));
    }

    @Test
    void notLoadedWithoutDataSource() {
        new ApplicationContextRunner()
                .withConfiguration(AutoConfigurations.of(EventLogAutoConfiguration.class))
                .run(ctx -> assertFalse(ctx.containsBean("eventLog")));
    }

    @Test
    void respectsConditionalOnMissingBean() {
        runner.withUserConfiguration(CustomDialectConfig.class).run(ctx -> {
            assertEquals("myDialect", ctx.getBeanNamesForType(Dialect.class)[0]);
            assertEquals(1, ctx.getBeanNamesForType(Dialect.class).length);
        });
    }

    // ── Test configurations ──────────────────────────────────────

    static class Note extends Aggregate {
        String title;

        Note(String id) {
            super(id);
        }

        void write(String title) {
            raise("NoteWritten", Map.of("title", title));
        }

        @Override
        public String aggregateType() {
            return "Note";
        }

        @Override
        protected void when(DomainEvent event) {
            if ("NoteWritten".equals(event.eventType())) {
                title = (String) event.payload().get("title");
            }
        }

        @Override
        public Map<String, Object> serializeState() {
            return title == null ? Map.of() : Map.of("title", title);
        }

        @Override
        public void restoreState(Map<String, Object> state) {
            title = (String) state.get("title");
        }
    }

    static class NoteTitlesProjection extends EventTypeProjection {
        final Map<String, String> titles = new ConcurrentHashMap<>();

        NoteTitlesProjection() {
            super("note_titles");
            on("NoteWritten", e -> titles.put(e.aggregateId(), (String) e.payload().get("title")));
        }

        @Override
        public void reset() {
            titles.clear();
        }
    }

    @Configuration
    static class ProjectionConfig {
        @Bean
        NoteTitlesProjection noteTitlesProjection() {
            return new NoteTitlesProjection();
        }
    }

    @Configuration
    static class DuplicateProjectionConfig {
        @Bean
        NoteTitlesProjection anotherNoteTitlesProjection() {
            return new NoteTitlesProjection();
        }
    }

    @Configuration
    static class CustomDialectConfig {
        @Bean
        Dialect myDialect() {
            return new H2Dialect();
        }
    }
}
