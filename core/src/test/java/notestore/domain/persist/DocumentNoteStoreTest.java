package notestore.domain.persist;

import io.smallrye.config.inject.ConfigExtension;
import jakarta.inject.Inject;
import notestore.domain.exceptionhandling.LoggingExceptionHandler;
import notestore.domain.exceptions.InvalidIdentifier;
import notestore.domain.logger.Loggers;
import notestore.domain.persist.config.DocumentConfig;
import notestore.domain.time.MonotonicNoteClock;
import notestore.domain.validate.ValidateNoteFields;
import org.jboss.weld.junit5.auto.AddBeanClasses;
import org.jboss.weld.junit5.auto.AddExtensions;
import org.jboss.weld.junit5.auto.EnableAutoWeld;
import org.junit.jupiter.api.Test;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

@Testcontainers(disabledWithoutDocker = true)
@EnableAutoWeld
@AddExtensions(ConfigExtension.class)
@AddBeanClasses(DocumentNoteStore.class)
@AddBeanClasses(DocumentConfig.class)
@AddBeanClasses(MonotonicNoteClock.class)
@AddBeanClasses(ValidateNoteFields.class)
@AddBeanClasses(LoggingExceptionHandler.class)
@AddBeanClasses(Loggers.class)
public class DocumentNoteStoreTest extends NoteStoreContractTest {

    @Container
    public static final GenericContainer<?> MONGO = new GenericContainer<>("mongo:7.0")
            .withExposedPorts(27017);

    @Inject
    DocumentNoteStore documentNoteStore;

    @Override
    protected NoteStore store() {
        return documentNoteStore;
    }

    @Override
    protected Map<String, String> configuration() {
        return Map.of(
                "notes.document.uri", "mongodb://" + MONGO.getHost() + ":" + MONGO.getMappedPort(27017),
                "notes.document.database", "notes_test");
    }

    @Test
    public void testIdsAreObjectIds() {
        final String value = documentNoteStore.add("A", "B", null).value();

        assertEquals(24, value.length());
        assertEquals(value, documentNoteStore.parseId(value.toUpperCase()).value());
        assertThrows(InvalidIdentifier.class, () -> documentNoteStore.parseId("0123456789abcdef"));
    }
}
