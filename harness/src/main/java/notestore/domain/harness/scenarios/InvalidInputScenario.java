package notestore.domain.harness.scenarios;

import jakarta.enterprise.context.ApplicationScoped;
import notestore.domain.exceptions.InvalidIdentifier;
import notestore.domain.exceptions.ValidationFailed;
import notestore.domain.harness.Scenario;
import notestore.domain.note.BackendType;
import notestore.domain.note.NoteId;
import notestore.domain.note.NoteUpdate;
import notestore.domain.persist.NoteStore;

import java.util.Arrays;
import java.util.List;

import static notestore.domain.harness.Expectations.equal;
import static notestore.domain.harness.Expectations.raises;

/**
 * Bad arguments and bad ids are rejected with the same exception on every backend, and leave the store untouched.
 */
@ApplicationScoped
public class InvalidInputScenario implements Scenario {
    @Override
    public String getName() {
        return "invalid-input";
    }

    @Override
    public int getOrder() {
        return 40;
    }

    @Override
    public List<String> run(final NoteStore noteStore) {
        final NoteId id = noteStore.add("Valid", "A valid note", null);
        final NoteId foreign = new NoteId(foreignBackend(noteStore.getBackendType()), id.value());

        final List<String> observations = List.of(
                raises(ValidationFailed.class, () -> noteStore.add("", "content", null), "blank-title"),
                raises(ValidationFailed.class, () -> noteStore.add("title", " \t", null), "blank-content"),
                raises(ValidationFailed.class, () -> noteStore.update(id, NoteUpdate.title(" ")), "blank-update"),
                raises(ValidationFailed.class, () -> noteStore.search(" ", 10), "blank-query"),
                raises(ValidationFailed.class, () -> noteStore.recent(0), "zero-limit"),
                raises(ValidationFailed.class, () -> noteStore.search("valid", -1), "negative-limit"),
                raises(ValidationFailed.class, () -> noteStore.upcomingReminders(-1), "negative-hours"),
                raises(InvalidIdentifier.class, () -> noteStore.parseId("not a valid id"), "malformed-id"),
                raises(InvalidIdentifier.class, () -> noteStore.parseId(""), "empty-id"),
                raises(InvalidIdentifier.class, () -> noteStore.get(foreign), "foreign-id"));

        equal(1L, noteStore.stats().total(), "notes after rejected calls");
        equal("Valid", noteStore.get(id).map(note -> note.title()).orElse(null), "title after rejected update");
        return observations;
    }

    private BackendType foreignBackend(final BackendType backendType) {
        return Arrays.stream(BackendType.values())
                .filter(type -> type != backendType)
                .findFirst()
                .orElseThrow();
    }
}
