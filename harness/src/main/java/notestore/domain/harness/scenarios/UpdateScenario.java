package notestore.domain.harness.scenarios;

import jakarta.enterprise.context.ApplicationScoped;
import notestore.domain.harness.Scenario;
import notestore.domain.harness.ScenarioFailed;
import notestore.domain.note.Note;
import notestore.domain.note.NoteId;
import notestore.domain.note.NoteUpdate;
import notestore.domain.persist.NoteStore;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

import static notestore.domain.harness.Expectations.equal;

/**
 * Updates change only the supplied fields and report notes that do not exist.
 */
@ApplicationScoped
public class UpdateScenario implements Scenario {
    @Override
    public String getName() {
        return "update";
    }

    @Override
    public int getOrder() {
        return 20;
    }

    @Override
    public List<String> run(final NoteStore noteStore) {
        final List<String> observations = new ArrayList<>();

        final NoteId id = noteStore.add("Draft", "First version", null);
        final Note original = read(noteStore, id);

        observations.add("title-only=" + noteStore.update(id, NoteUpdate.title("Final")));
        final Note renamed = read(noteStore, id);
        equal("Final", renamed.title(), "updated title");
        equal("First version", renamed.content(), "content left out of the update");
        equal(original.createdAt(), renamed.createdAt(), "creation time after an update");

        final Instant dueAt = Instant.now().plus(Duration.ofDays(1)).truncatedTo(ChronoUnit.MILLIS);
        observations.add("all-fields=" + noteStore.update(id, new NoteUpdate("Done", "Second version", dueAt)));
        final Note changed = read(noteStore, id);
        equal("Done", changed.title(), "updated title");
        equal("Second version", changed.content(), "updated content");
        equal(dueAt, changed.dueAt(), "updated due time");
        equal(id, changed.id(), "id after an update");

        observations.add("empty=" + noteStore.update(id, NoteUpdate.empty()));
        equal(changed, read(noteStore, id), "note after an empty update");

        final NoteId deleted = noteStore.add("Temporary", "Soon gone", null);
        noteStore.delete(deleted);
        observations.add("missing=" + equal(false, noteStore.update(deleted, NoteUpdate.title("Ghost")),
                "update of a deleted note"));
        equal(true, noteStore.get(deleted).isEmpty(), "a deleted note reappeared after an update");

        observations.add("title=" + changed.title());
        observations.add("content=" + changed.content());
        return observations;
    }

    private Note read(final NoteStore noteStore, final NoteId id) {
        return noteStore.get(id)
                .orElseThrow(() -> new ScenarioFailed("The note " + id + " was not found"));
    }
}
