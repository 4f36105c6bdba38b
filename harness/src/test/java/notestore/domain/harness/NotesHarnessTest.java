package notestore.domain.harness;

import io.smallrye.config.PropertiesConfigSource;
import io.smallrye.config.SmallRyeConfigBuilder;
import io.smallrye.config.inject.ConfigExtension;
import jakarta.inject.Inject;
import notestore.domain.exceptionhandling.LoggingExceptionHandler;
import notestore.domain.harness.scenarios.CreateReadScenario;
import notestore.domain.harness.scenarios.DeleteScenario;
import notestore.domain.harness.scenarios.InvalidInputScenario;
import notestore.domain.harness.scenarios.RecentOrderScenario;
import notestore.domain.harness.scenarios.ReminderWindowScenario;
import notestore.domain.harness.scenarios.RepeatedReadScenario;
import notestore.domain.harness.scenarios.SearchScenario;
import notestore.domain.harness.scenarios.SpecialCharacterSearchScenario;
import notestore.domain.harness.scenarios.StatsScenario;
import notestore.domain.harness.scenarios.UpdateScenario;
import notestore.domain.json.JsonDeserializerJackson;
import notestore.domain.logger.Loggers;
import notestore.domain.note.BackendType;
import notestore.domain.persist.InMemoryNoteStore;
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
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

@EnableAutoWeld
@AddExtensions(ConfigExtension.class)
@AddBeanClasses(NotesHarness.class)
@AddBeanClasses(HarnessConfig.class)
@AddBeanClasses(NoteStoreBenchmark.class)
@AddBeanClasses(TextReportFormatter.class)
@AddBeanClasses(CreateReadScenario.class)
@AddBeanClasses(UpdateScenario.class)
@AddBeanClasses(DeleteScenario.class)
@AddBeanClasses(InvalidInputScenario.class)
@AddBeanClasses(SearchScenario.class)
@AddBeanClasses(SpecialCharacterSearchScenario.class)
@AddBeanClasses(RecentOrderScenario.class)
@AddBeanClasses(ReminderWindowScenario.class)
@AddBeanClasses(StatsScenario.class)
@AddBeanClasses(RepeatedReadScenario.class)
@AddBeanClasses(NoteStoreLookup.class)
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
public class NotesHarnessTest {

    @Inject
    NotesHarness notesHarness;

    @Inject
    TextReportFormatter textReportFormatter;

    private void updateConfig(final Map<String, String> properties) {
        final var configSource = new PropertiesConfigSource(properties, "TestConfig", Integer.MAX_VALUE);
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
    public void testConformingBackendsPass() {
        updateConfig(Map.of(
                "notes.harness.backends", "in-memory, relational",
                "notes.harness.benchmark.size", "20",
                "notes.relational.url", "jdbc:h2:mem:harness;DB_CLOSE_DELAY=-1"));

        final HarnessReport report = notesHarness.run();

        assertEquals(10, report.scenarios().size());
        assertEquals("create-read", report.scenarios().get(0));
        assertEquals(List.of(BackendType.IN_MEMORY, BackendType.RELATIONAL),
                report.backends().stream().map(BackendReport::backend).toList());

        for (final BackendReport backend : report.backends()) {
            assertTrue(backend.passed(), () -> textReportFormatter.format(report));
            assertEquals(10, backend.scenarios().size());
            assertNotNull(backend.benchmark());
            assertEquals(20, backend.benchmark().getPhase(NoteStoreBenchmark.INSERT).orElseThrow().operations());
        }

        assertTrue(report.passed());
    }

    @Test
    public void testUnavailableBackendDoesNotStopTheRun() {
        updateConfig(Map.of(
                "notes.harness.backends", "remote-proxy,in-memory",
                "notes.harness.benchmark.size", "5",
                "notes.remote.url", "http://localhost:1",
                "notes.remote.timeout-seconds", "1"));

        final HarnessReport report = notesHarness.run();

        final BackendReport remote = report.getBackend(BackendType.REMOTE_PROXY).orElseThrow();
        assertFalse(remote.passed());
        assertNotNull(remote.initFailure());
        assertTrue(remote.scenarios().isEmpty());
        assertNull(remote.benchmark());

        assertTrue(report.getBackend(BackendType.IN_MEMORY).orElseThrow().passed());
        assertFalse(report.passed());

        final String text = textReportFormatter.format(report);
        assertTrue(text.contains("remote-proxy unavailable"));
        assertTrue(text.contains("FAIL"));
    }
}
