package notestore.application.web;

import io.smallrye.config.PropertiesConfigSource;
import io.smallrye.config.SmallRyeConfigBuilder;
import io.smallrye.config.inject.ConfigExtension;
import jakarta.inject.Inject;
import jakarta.ws.rs.core.Response;
import notestore.domain.exceptionhandling.LoggingExceptionHandler;
import notestore.domain.json.JsonDeserializer;
import notestore.domain.json.JsonDeserializerJackson;
import notestore.domain.logger.Loggers;
import notestore.domain.persist.InMemoryNoteStore;
import notestore.domain.persist.NoteStoreLookup;
import notestore.domain.persist.NoteStoreProducer;
import notestore.domain.persist.RelationalNoteStore;
import notestore.domain.persist.config.RelationalConfig;
import notestore.domain.response.RemoteResponseValidation;
import notestore.domain.time.MonotonicNoteClock;
import notestore.domain.validate.ValidateNoteFields;
import notestore.infrastructure.remote.api.RemoteCount;
import notestore.infrastructure.remote.api.RemoteHealth;
import notestore.infrastructure.remote.api.RemoteStats;
import org.eclipse.microprofile.config.Config;
import org.eclipse.microprofile.config.spi.ConfigProviderResolver;
import org.jboss.weld.junit5.auto.AddBeanClasses;
import org.jboss.weld.junit5.auto.AddExtensions;
import org.jboss.weld.junit5.auto.EnableAutoWeld;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

@EnableAutoWeld
@AddExtensions(ConfigExtension.class)
@AddBeanClasses(MonitorResource.class)
@AddBeanClasses(NotesResource.class)
@AddBeanClasses(NoteStoreResponses.class)
@AddBeanClasses(NoteStoreProducer.class)
@AddBeanClasses(NoteStoreLookup.class)
@AddBeanClasses(InMemoryNoteStore.class)
@AddBeanClasses(RelationalNoteStore.class)
@AddBeanClasses(RelationalConfig.class)
@AddBeanClasses(RemoteResponseValidation.class)
@AddBeanClasses(JsonDeserializerJackson.class)
@AddBeanClasses(MonotonicNoteClock.class)
@AddBeanClasses(ValidateNoteFields.class)
@AddBeanClasses(LoggingExceptionHandler.class)
@AddBeanClasses(Loggers.class)
public class MonitorResourceTest {

    @Inject
    MonitorResource monitorResource;

    @Inject
    NotesResource notesResource;

    @Inject
    JsonDeserializer jsonDeserializer;

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
    public void testHealthyStore() {
        updateConfig(Map.of("notes.backend", "in-memory"));
        notesResource.add("{\"title\":\"One\",\"content\":\"1\",\"due_at\":\"2099-01-01T00:00:00Z\"}");
        notesResource.add("{\"title\":\"Two\",\"content\":\"2\"}");

        final Response health = monitorResource.health();
        assertEquals(200, health.getStatus());
        final RemoteHealth body = jsonDeserializer.deserialize((String) health.getEntity(), RemoteHealth.class);
        assertTrue(body.ok());
        assertEquals("in-memory", body.backend());

        final RemoteCount count = jsonDeserializer.deserialize((String) monitorResource.count().getEntity(), RemoteCount.class);
        assertEquals(2L, count.records());

        final RemoteStats stats = jsonDeserializer.deserialize((String) monitorResource.stats().getEntity(), RemoteStats.class);
        assertEquals(2, stats.totalNotes());
        assertEquals(1, stats.notesWithReminders());
        assertEquals(1, stats.notesWithoutReminders());
        assertEquals(2, stats.recentNotes());
    }

    @Test
    public void testReportsTheActiveBackendName() {
        updateConfig(Map.of("notes.backend", " In-Memory "));

        final RemoteHealth health = jsonDeserializer.deserialize((String) monitorResource.health().getEntity(), RemoteHealth.class);
        assertEquals("in-memory", health.backend());

        final RemoteCount count = jsonDeserializer.deserialize((String) monitorResource.count().getEntity(), RemoteCount.class);
        assertEquals("in-memory", count.backend());
    }

    @Test
    public void testUnreachableStore() {
        updateConfig(Map.of(
                "notes.backend", "relational",
                "notes.relational.url", "jdbc:h2:tcp://localhost:1/notes"));

        final Response health = monitorResource.health();
        assertEquals(503, health.getStatus());
        final RemoteHealth body = jsonDeserializer.deserialize((String) health.getEntity(), RemoteHealth.class);
        assertFalse(body.ok());
        assertEquals("relational", body.backend());

        final Response count = monitorResource.count();
        assertEquals(200, count.getStatus());
        assertTrue(((String) count.getEntity()).contains("\"records\":null"));
        assertNull(jsonDeserializer.deserialize((String) count.getEntity(), RemoteCount.class).records());

        assertEquals(503, monitorResource.stats().getStatus());
    }
}
