package notestore.domain.harness;

import io.smallrye.config.PropertiesConfigSource;
import io.smallrye.config.SmallRyeConfigBuilder;
import io.smallrye.config.inject.ConfigExtension;
import jakarta.annotation.Priority;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Alternative;
import jakarta.inject.Inject;
import notestore.domain.exceptionhandling.LoggingExceptionHandler;
import notestore.domain.exceptions.QueryFailure;
import notestore.domain.harness.scenarios.CreateReadScenario;
import notestore.domain.harness.scenarios.SearchScenario;
import notestore.domain.harness.scenarios.SpecialCharacterSearchScenario;
import notestore.domain.harness.scenarios.StatsScenario;
import notestore.domain.json.JsonDeserializerJackson;
import notestore.domain.logger.Loggers;
import notestore.domain.note.BackendType;
import notestore.domain.note.Note;
import notestore.domain.note.NoteId;
import notestore.domain.note.NoteStats;
import notestore.domain.note.NoteUpdate;
import notestore.domain.persist.InMemoryNoteStore;
import notestore.domain.persist.NoteStore;
import notestore.domain.persist.NoteStoreLookup;
import notestore.domain.persist.RelationalNoteStore;
import notestore.domain.persist.RemoteNoteStore;
import notestore.domain.persist.config.RelationalConfig;
import notestore.domain.persist.config.RemoteConfig;
import notestore.domain.response.RemoteResponseValidation;
import notestore.domain.time.MonotonicNoteClock;
import notestore.domain.validate.ValidateNoteFields;
import org.eclipse.microprofile.config.Config;
import org.eclipse.microprofile.config.spi.ConfigProviderResolver;
import org.jboss.weld.junit5.auto.AddBeanClasses;
import org.jboss.weld.junit5.auto.AddExtensions;
import org.jboss.weld.junit5.auto.EnableAutoWeld;
import org.jspecify.annotations.Nullable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * A backend that misbehaves in some scenarios fails only those scenarios. The rest of its scenarios, its benchmark
 * and the backends after it still run.
 */
@EnableAutoWeld
@AddExtensions(ConfigExtension.class)
@AddBeanClasses(NotesHarness.class)
@AddBeanClasses(HarnessConfig.class)
@AddBeanClasses(NoteStoreBenchmark.class)
@AddBeanClasses(TextReportFormatter.class)
@AddBeanClasses(CreateReadScenario.class)
@AddBeanClasses(SearchScenario.class)
@AddBeanClasses(SpecialCharacterSearchScenario.class)
@AddBeanClasses(StatsScenario.class)
@AddBeanClasses(NotesHarnessIsolationTest.BackendNameScenario.class)
@AddBeanClasses(NotesHarnessIsolationTest.FaultyRelationalLookup.class)
@AddBeanClasses(InMemoryNoteStore.class)
@AddBeanClasses(RelationalNoteStore.class)
@AddBeanClasses(RelationalConfig.class)
@AddBeanClasses(RemoteNoteStore.class)
@AddBeanClasses(RemoteConfig.class)
@AddBeanClasses(RemoteResponseValidation.class)
@AddBeanClasses(JsonDeserializerJackson.class)
@AddBeanClasses(MonotonicNoteClock.class)
@AddBeanClasses(ValidateNoteFields.class)
@AddBeanClasses(LoggingExceptionHandler.class)
@AddBeanClasses(Loggers.class)
public class NotesHarnessIsolationTest {

    private static final String REJECTED_QUERY = "[a-z]+";

    @Inject
    NotesHarness notesHarness;

    @Inject
    TextReportFormatter textReportFormatter;

    /**
     * Observes something every backend reports differently, so only the in-memory store matches the reference.
     */
    @ApplicationScoped
    public static class BackendNameScenario implements Scenario {
        @Override
        public String getName() {
            return "backend-name";
        }

        @Override
        public int getOrder() {
            return 1000;
        }

        @Override
        public List<String> run(final NoteStore noteStore) {
            return List.of("backend=" + noteStore.getBackendType());
        }
    }

    /**
     * Hands out a relational store whose engine rejects one search query.
     */
    @Alternative
    @Priority(1)
    @ApplicationScoped
    public static class FaultyRelationalLookup extends NoteStoreLookup {
        @Override
        public NoteStore getNoteStore(final BackendType backendType) {
            final NoteStore noteStore = super.getNoteStore(backendType);
            return backendType == BackendType.RELATIONAL ? new RejectingNoteStore(noteStore) : noteStore;
        }
    }

    private static class RejectingNoteStore implements NoteStore {
        private final NoteStore delegate;

        RejectingNoteStore(final NoteStore delegate) {
            this.delegate = delegate;
        }

        @Override
        public BackendType getBackendType() {
            return delegate.getBackendType();
        }

        @Override
        public NoteId parseId(final String raw) {
            return delegate.parseId(raw);
        }

        @Override
        public NoteId add(final String title, final String content, @Nullable final Instant dueAt) {
            return delegate.add(title, content, dueAt);
        }

        @Override
        public Optional<Note> get(final NoteId id) {
            return delegate.get(id);
        }

        @Override
        public boolean delete(final NoteId id) {
            return delegate.delete(id);
        }

        @Override
        public boolean update(final NoteId id, final NoteUpdate update) {
            return delegate.update(id, update);
        }

        @Override
        public List<Note> search(final String query, final int limit) {
            if (REJECTED_QUERY.equals(query)) {
                throw new QueryFailure("The engine rejected the query " + query);
            }
            return delegate.search(query, limit);
        }

        @Override
        public List<Note> recent(final int limit) {
            return delegate.recent(limit);
        }

        @Override
        public List<Note> upcomingReminders(final int hours) {
            return delegate.upcomingReminders(hours);
        }

        @Override
        public NoteStats stats() {
            return delegate.stats();
        }

        @Override
        public void clear() {
            delegate.clear();
        }
    }

    @BeforeEach
    void updateConfig() {
        final var configSource = new PropertiesConfigSource(Map.of(
                "notes.harness.backends", "relational,in-memory",
                "notes.harness.benchmark.size", "10",
                "notes.relational.url", "jdbc:h2:mem:isolation;DB_CLOSE_DELAY=-1"), "TestConfig", Integer.MAX_VALUE);
        final Config newConfig = new SmallRyeConfigBuilder()
                .withSources(configSource)
                .build();

        final var configProviderResolver = ConfigProviderResolver.instance();
        final var oldConfig = configProviderResolver.getConfig();

        configProviderResolver.releaseConfig(oldConfig);
        configProviderResolver.registerConfig(
                newConfig,
                Thread.currentThread().getContextClassLoader()
        );
    }

    @Test
    public void testFailuresStayInTheirScenario() {
        final HarnessReport report = notesHarness.run();

        assertEquals(List.of("create-read", "search", "special-characters", "stats", "backend-name"), report.scenarios());

        final BackendReport relational = report.getBackend(BackendType.RELATIONAL).orElseThrow();
        assertNull(relational.initFailure());
        assertEquals(5, relational.scenarios().size());

        final ScenarioResult rejected = relational.getScenario("special-characters").orElseThrow();
        assertFalse(rejected.passed());
        assertTrue(rejected.failure().contains("The engine rejected the query " + REJECTED_QUERY));

        final ScenarioResult differs = relational.getScenario("backend-name").orElseThrow();
        assertFalse(differs.passed());
        assertTrue(differs.failure().contains("reference observed [backend=in-memory]"));
        assertEquals(List.of("backend=relational"), differs.observations());

        assertTrue(relational.getScenario("create-read").orElseThrow().passed());
        assertTrue(relational.getScenario("search").orElseThrow().passed());
        assertTrue(relational.getScenario("stats").orElseThrow().passed());

        assertNotNull(relational.benchmark());
        assertNull(relational.benchmarkFailure());
        assertEquals(10, relational.benchmark().getPhase(NoteStoreBenchmark.LOOKUP).orElseThrow().operations());

        assertTrue(report.getBackend(BackendType.IN_MEMORY).orElseThrow().passed());
        assertFalse(report.passed());

        final String text = textReportFormatter.format(report);
        assertTrue(text.contains("relational special-characters"));
        assertTrue(text.contains("relational backend-name"));
    }
}
