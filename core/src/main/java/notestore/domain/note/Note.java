package notestore.domain.note;

import org.jspecify.annotations.Nullable;

import java.time.Instant;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A short text record, optionally carrying a due time for a reminder.
 *
 * @param id        The handle assigned by the backend when the note was added
 * @param title     The title, never blank
 * @param content   The body, never blank
 * @param dueAt     The reminder time, or null if the note has no reminder
 * @param createdAt The time the note was added, never modified
 */
public record Note(NoteId id, String title, String content, @Nullable Instant dueAt, Instant createdAt) {
    public Note {
        checkNotNull(id);
        checkNotNull(title);
        checkNotNull(content);
        checkNotNull(createdAt);
    }

    public boolean hasReminder() {
        return dueAt != null;
    }
}
