package notestore.domain.json;

import io.smallrye.config.inject.ConfigExtension;
import jakarta.inject.Inject;
import notestore.domain.exceptions.DeserializationFailed;
import notestore.domain.logger.Loggers;
import notestore.infrastructure.remote.api.RemoteNote;
import notestore.infrastructure.remote.api.RemoteNoteRequest;
import org.jboss.weld.junit5.auto.AddBeanClasses;
import org.jboss.weld.junit5.auto.AddExtensions;
import org.jboss.weld.junit5.auto.EnableAutoWeld;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@EnableAutoWeld
@AddExtensions(ConfigExtension.class)
@AddBeanClasses(JsonDeserializerJackson.class)
@AddBeanClasses(Loggers.class)
public class JsonDeserializerJacksonTest {

    @Inject
    JsonDeserializerJackson jsonDeserializer;

    @Test
    public void testTimesAreIsoStrings() {
        final String json = jsonDeserializer.serialize(
                new RemoteNoteRequest("Title", "Content", Instant.parse("2030-05-06T07:08:09.123Z")));

        assertTrue(json.contains("\"due_at\":\"2030-05-06T07:08:09.123Z\""));
        assertEquals(Instant.parse("2030-05-06T07:08:09.123Z"),
                jsonDeserializer.deserialize(json, RemoteNoteRequest.class).dueAt());
    }

    @Test
    public void testInvalidJsonIsDeserializationFailed() {
        final DeserializationFailed ex = assertThrows(DeserializationFailed.class,
                () -> jsonDeserializer.deserialize("{not json", RemoteNoteRequest.class));
        assertNotNull(ex.getCause());

        assertThrows(DeserializationFailed.class,
                () -> jsonDeserializer.deserializeCollection("{\"id\":\"1\"}", RemoteNote.class));
    }

    @Test
    public void testCollection() {
        final List<RemoteNote> notes = jsonDeserializer.deserializeCollection(
                "[{\"id\":\"7\",\"title\":\"T\",\"content\":\"C\",\"created_at\":\"2024-01-01T00:00:00Z\",\"extra\":1}]",
                RemoteNote.class);

        assertEquals(1, notes.size());
        assertEquals("7", notes.get(0).id());
    }
}
