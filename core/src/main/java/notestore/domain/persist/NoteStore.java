package notestore.domain.persist;

import notestore.domain.note.BackendType;
import notestore.domain.note.Note;
import notestore.domain.note.NoteId;
import notestore.domain.note.NoteStats;
import notestore.domain.note.NoteUpdate;
import org.jspecify.annotations.Nullable;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Stores notes in a persistence engine. Every implementation must behave identically at the level of this contract,
 * whatever engine sits behind it.
 * <p>
 * Implementations are shared by all callers for the lifetime of the process and must tolerate concurrent calls.
 * Each call is atomic for the single note it touches; nothing spanning several notes is.
 * <p>
 * Errors are reported with the exceptions in {@link notestore.domain.exceptions}: {@code ValidationFailed} for bad
 * input, {@code InvalidIdentifier} for a malformed or foreign id, {@code QueryFailure} when the engine rejects a
 * request and {@code BackendUnavailable} when the engine can not be reached. A well-formed id that matches nothing is
 * not an error.
 */
public interface NoteStore {
    /**
     * @return The backend this store is implemented with
     */
    BackendType getBackendType();

    /**
     * Convert a raw identifier, like one typed by a user or taken from a URL, into an id for this store.
     *
     * @param raw The raw identifier
     * @return The typed id
     * @throws notestore.domain.exceptions.InvalidIdentifier if the value is not a valid key for this backend
     */
    NoteId parseId(String raw);

    /**
     * Add a note. The store assigns the id and the creation time.
     *
     * @param title   The title, must not be blank
     * @param content The body, must not be blank
     * @param dueAt   The reminder time, or null for no reminder
     * @return The id of the new note
     */
    NoteId add(String title, String content, @Nullable Instant dueAt);

    /**
     * Get a note.
     *
     * @param id The note id
     * @return The note exactly as it was last added or updated, or empty if there is no such note
     */
    Optional<Note> get(NoteId id);

    /**
     * Delete a note. Deleting a note that does not exist is not an error.
     *
     * @param id The note id
     * @return true if a note was removed, false if there was no such note
     */
    boolean delete(NoteId id);

    /**
     * Change the supplied fields of a note. The id and creation time never change.
     *
     * @param id     The note id
     * @param update The fields to change
     * @return true if the note was updated, false if the update was empty or there was no such note
     */
    boolean update(NoteId id, NoteUpdate update);

    /**
     * Find notes whose title or content contains the query, ignoring case.
     *
     * @param query The literal text to look for
     * @param limit The maximum number of notes to return
     * @return The matching notes, newest first
     */
    List<Note> search(String query, int limit);

    /**
     * @param limit The maximum number of notes to return
     * @return The most recently created notes, newest first
     */
    List<Note> recent(int limit);

    /**
     * @param hours The size of the window, starting now
     * @return The notes due between now and now plus the window, inclusive, soonest first
     */
    List<Note> upcomingReminders(int hours);

    /**
     * @return The note counts at the time of the call
     */
    NoteStats stats();

    /**
     * Remove every note. This exists so the conformance harness and tests can start from a known state.
     */
    void clear();
}
