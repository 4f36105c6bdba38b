package notestore.domain.harness;

import com.google.common.base.Stopwatch;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import notestore.domain.note.NoteId;
import notestore.domain.persist.NoteStore;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Times bulk inserts, lookups by id and a fixed set of searches against a note store.
 */
@ApplicationScoped
public class NoteStoreBenchmark {
    public static final String INSERT = "insert";
    public static final String LOOKUP = "lookup";
    public static final String SEARCH = "search";

    private static final List<String> QUERIES = List.of("benchmark", "note 1", "BODY", "no such text", "%");

    @Inject
    private Logger logger;

    public BenchmarkResult run(final NoteStore noteStore, final int size) {
        checkArgument(size > 0, "The benchmark size must be positive");

        final List<NoteId> ids = new ArrayList<>(size);

        final Stopwatch insert = Stopwatch.createStarted();
        for (int i = 0; i < size; ++i) {
            ids.add(noteStore.add("Benchmark note " + i, "Body of benchmark note " + i, null));
        }
        insert.stop();

        final Stopwatch lookup = Stopwatch.createStarted();
        for (final NoteId id : ids) {
            if (noteStore.get(id).isEmpty()) {
                throw new ScenarioFailed("The benchmark note " + id + " was not found");
            }
        }
        lookup.stop();

        final Stopwatch search = Stopwatch.createStarted();
        for (final String query : QUERIES) {
            noteStore.search(query, 10);
        }
        search.stop();

        logger.info("Benchmarked " + noteStore.getBackendType() + " with " + size + " notes: insert " + insert
                + ", lookup " + lookup + ", search " + search);

        return new BenchmarkResult(size, List.of(
                new BenchmarkPhase(INSERT, size, insert.elapsed()),
                new BenchmarkPhase(LOOKUP, size, lookup.elapsed()),
                new BenchmarkPhase(SEARCH, QUERIES.size(), search.elapsed())));
    }
}
