package notestore.domain.persist;

import io.smallrye.config.inject.ConfigExtension;
import jakarta.inject.Inject;
import notestore.domain.exceptionhandling.LoggingExceptionHandler;
import notestore.domain.logger.Loggers;
import notestore.domain.note.NoteId;
import notestore.domain.time.MonotonicNoteClock;
import notestore.domain.validate.ValidateNoteFields;
import org.jboss.weld.junit5.auto.AddBeanClasses;
import org.jboss.weld.junit5.auto.AddExtensions;
import org.jboss.weld.junit5.auto.EnableAutoWeld;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.assertEquals;

@EnableAutoWeld
@AddExtensions(ConfigExtension.class)
@AddBeanClasses(InMemoryNoteStore.class)
@AddBeanClasses(MonotonicNoteClock.class)
@AddBeanClasses(ValidateNoteFields.class)
@AddBeanClasses(LoggingExceptionHandler.class)
@AddBeanClasses(Loggers.class)
public class InMemoryNoteStoreTest extends NoteStoreContractTest {

    @Inject
    InMemoryNoteStore inMemoryNoteStore;

    @Override
    protected NoteStore store() {
        return inMemoryNoteStore;
    }

    @Override
    protected Map<String, String> configuration() {
        return Map.of();
    }

    @Test
    public void testConcurrentAdds() throws Exception {
        final ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            final List<Future<NoteId>> futures = IntStream.range(0, 200)
                    .mapToObj(i -> executor.submit(() -> inMemoryNoteStore.add("Note " + i, "Body " + i, null)))
                    .toList();

            for (final Future<NoteId> future : futures) {
                future.get();
            }
        } finally {
            executor.shutdown();
        }

        assertEquals(200, inMemoryNoteStore.stats().total());
        assertEquals(200, inMemoryNoteStore.recent(1000).stream().map(note -> note.createdAt()).distinct().count());
    }
}
