package notestore.domain.note;

import org.jspecify.annotations.Nullable;

import java.time.Instant;

/**
 * The fields to change on an existing note. Null fields are left as they are.
 */
public record NoteUpdate(@Nullable String title, @Nullable String content, @Nullable Instant dueAt) {
    public static NoteUpdate empty() {
        return new NoteUpdate(null, null, null);
    }

    public static NoteUpdate title(final String title) {
        return new NoteUpdate(title, null, null);
    }

    public static NoteUpdate content(final String content) {
        return new NoteUpdate(null, content, null);
    }

    public static NoteUpdate dueAt(final Instant dueAt) {
        return new NoteUpdate(null, null, dueAt);
    }

    public boolean isEmpty() {
        return title == null && content == null && dueAt == null;
    }
}
