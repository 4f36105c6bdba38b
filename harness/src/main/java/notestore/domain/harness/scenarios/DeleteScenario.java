package notestore.domain.harness.scenarios;

import jakarta.enterprise.context.ApplicationScoped;
import notestore.domain.harness.Scenario;
import notestore.domain.note.NoteId;
import notestore.domain.persist.NoteStore;

import java.util.List;

import static notestore.domain.harness.Expectations.equal;

/**
 * Deleting twice is not an error. The second delete reports that nothing was removed.
 */
@ApplicationScoped
public class DeleteScenario implements Scenario {
    @Override
    public String getName() {
        return "delete-idempotence";
    }

    @Override
    public int getOrder() {
        return 30;
    }

    @Override
    public List<String> run(final NoteStore noteStore) {
        final NoteId keep = noteStore.add("Keep", "Still here", null);
        final NoteId id = noteStore.add("Remove", "Short lived", null);

        final boolean first = equal(true, noteStore.delete(id), "first delete");
        final boolean present = noteStore.get(id).isPresent();
        equal(false, present, "note present after delete");
        final boolean second = equal(false, noteStore.delete(id), "second delete");
        equal(true, noteStore.get(keep).isPresent(), "other note present after delete");

        return List.of(
                "first=" + first,
                "present=" + present,
                "second=" + second,
                "total=" + noteStore.stats().total());
    }
}
