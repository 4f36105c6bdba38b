package notestore.domain.harness.scenarios;

import jakarta.enterprise.context.ApplicationScoped;
import notestore.domain.harness.Scenario;
import notestore.domain.note.NoteId;
import notestore.domain.note.NoteStats;
import notestore.domain.persist.NoteStore;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static notestore.domain.harness.Expectations.equal;

@ApplicationScoped
public class StatsScenario implements Scenario {
    @Override
    public String getName() {
        return "stats";
    }

    @Override
    public int getOrder() {
        return 90;
    }

    @Override
    public List<String> run(final NoteStore noteStore) {
        final NoteStats empty = equal(new NoteStats(0, 0, 0, 0), noteStore.stats(), "stats of an empty store");

        noteStore.add("One", "first", Instant.now().plus(Duration.ofDays(2)));
        noteStore.add("Two", "second", null);
        final NoteId third = noteStore.add("Three", "third", null);
        final NoteStats full = equal(new NoteStats(3, 1, 2, 3), noteStore.stats(), "stats of three notes");

        noteStore.delete(third);
        final NoteStats afterDelete = equal(new NoteStats(2, 1, 1, 2), noteStore.stats(), "stats after a delete");

        return List.of("empty=" + empty, "full=" + full, "after-delete=" + afterDelete);
    }
}
