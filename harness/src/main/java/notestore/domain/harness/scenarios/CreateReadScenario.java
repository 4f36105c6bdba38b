package notestore.domain.harness.scenarios;

import jakarta.enterprise.context.ApplicationScoped;
import notestore.domain.harness.Scenario;
import notestore.domain.harness.ScenarioFailed;
import notestore.domain.note.Note;
import notestore.domain.note.NoteId;
import notestore.domain.persist.NoteStore;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;

import static notestore.domain.harness.Expectations.check;
import static notestore.domain.harness.Expectations.equal;

/**
 * A note reads back exactly as it was added, with or without a reminder.
 */
@ApplicationScoped
public class CreateReadScenario implements Scenario {
    @Override
    public String getName() {
        return "create-read";
    }

    @Override
    public int getOrder() {
        return 10;
    }

    @Override
    public List<String> run(final NoteStore noteStore) {
        final Instant before = Instant.now().minusSeconds(1);
        final Instant dueAt = Instant.now().plus(Duration.ofHours(1)).truncatedTo(ChronoUnit.MILLIS);

        final NoteId withReminder = noteStore.add("Groceries", "Milk, eggs and bread", dueAt);
        final NoteId withoutReminder = noteStore.add("Ideas", "Write a novel", null);
        final Instant after = Instant.now().plusSeconds(1);

        check(!withReminder.equals(withoutReminder), "Two notes were given the same id " + withReminder);

        final Note first = noteStore.get(withReminder)
                .orElseThrow(() -> new ScenarioFailed("The added note " + withReminder + " was not found"));
        final Note second = noteStore.get(withoutReminder)
                .orElseThrow(() -> new ScenarioFailed("The added note " + withoutReminder + " was not found"));

        equal(withReminder, first.id(), "id");
        equal("Groceries", first.title(), "title");
        equal("Milk, eggs and bread", first.content(), "content");
        equal(dueAt, first.dueAt(), "due time");
        equal(null, second.dueAt(), "due time of a note without a reminder");
        check(first.createdAt().isAfter(before) && first.createdAt().isBefore(after),
                "The creation time " + first.createdAt() + " is not the time the note was added");

        return List.of(
                "title=" + first.title(),
                "content=" + first.content(),
                "reminder=" + first.hasReminder(),
                "title=" + second.title(),
                "reminder=" + second.hasReminder());
    }
}
