package notestore.domain.harness.scenarios;

import jakarta.enterprise.context.ApplicationScoped;
import notestore.domain.harness.Scenario;
import notestore.domain.note.Note;
import notestore.domain.note.NoteId;
import notestore.domain.persist.NoteStore;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static notestore.domain.harness.Expectations.equal;

/**
 * Reads have no side effects. Repeating them without a write in between gives the same answer.
 */
@ApplicationScoped
public class RepeatedReadScenario implements Scenario {
    @Override
    public String getName() {
        return "repeated-read";
    }

    @Override
    public int getOrder() {
        return 100;
    }

    @Override
    public List<String> run(final NoteStore noteStore) {
        final NoteId id = noteStore.add("Stable", "Read me twice", Instant.now().plus(Duration.ofMinutes(5)));
        noteStore.add("Also stable", "Read me too", null);

        final Optional<Note> first = noteStore.get(id);
        equal(first, noteStore.get(id), "second get");
        equal(first, noteStore.get(id), "third get");
        equal(noteStore.search("stable", 10), noteStore.search("stable", 10), "repeated search");
        equal(noteStore.recent(10), noteStore.recent(10), "repeated recent");
        equal(noteStore.upcomingReminders(1), noteStore.upcomingReminders(1), "repeated reminders");
        equal(noteStore.stats(), noteStore.stats(), "repeated stats");

        return List.of(
                "present=" + first.isPresent(),
                "search=" + noteStore.search("stable", 10).size(),
                "reminders=" + noteStore.upcomingReminders(1).size());
    }
}
