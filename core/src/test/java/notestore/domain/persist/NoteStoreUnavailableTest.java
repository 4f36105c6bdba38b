package notestore.domain.persist;

import io.smallrye.config.PropertiesConfigSource;
import io.smallrye.config.SmallRyeConfigBuilder;
import io.smallrye.config.inject.ConfigExtension;
import jakarta.inject.Inject;
import notestore.domain.exceptionhandling.LoggingExceptionHandler;
import notestore.domain.exceptions.BackendUnavailable;
import notestore.domain.json.JsonDeserializerJackson;
import notestore.domain.logger.Loggers;
import notestore.domain.persist.config.RelationalConfig;
import notestore.domain.persist.config.RemoteConfig;
import notestore.domain.response.RemoteResponseValidation;
import notestore.domain.time.MonotonicNoteClock;
import notestore.domain.validate.ValidateNoteFields;
import org.apache.commons.lang3.exception.ExceptionUtils;
import org.eclipse.microprofile.config.Config;
import org.eclipse.microprofile.config.spi.ConfigProviderResolver;
import org.jboss.weld.junit5.auto.AddBeanClasses;
import org.jboss.weld.junit5.auto.AddExtensions;
import org.jboss.weld.junit5.auto.EnableAutoWeld;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * A store that can not reach its engine must fail when it is constructed, not on some later call. The container may
 * wrap the exception thrown from the post construct callback, so the cause chain is searched.
 */
@EnableAutoWeld
@AddExtensions(ConfigExtension.class)
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
public class NoteStoreUnavailableTest {

    @Inject
    RelationalNoteStore relationalNoteStore;

    @Inject
    RemoteNoteStore remoteNoteStore;

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
    public void testRelationalConnectionRefused() {
        updateConfig(Map.of("notes.relational.url", "jdbc:h2:tcp://localhost:1/notes"));

        final RuntimeException ex = assertThrows(RuntimeException.class, () -> relationalNoteStore.recent(1));
        assertTrue(ExceptionUtils.indexOfType(ex, BackendUnavailable.class) >= 0);
    }

    @Test
    public void testRemoteConnectionRefused() {
        updateConfig(Map.of(
                "notes.remote.url", "http://localhost:1",
                "notes.remote.timeout-seconds", "2"));

        final RuntimeException ex = assertThrows(RuntimeException.class, () -> remoteNoteStore.recent(1));
        assertTrue(ExceptionUtils.indexOfType(ex, BackendUnavailable.class) >= 0);
    }
}
