package notestore.domain.validate;

import notestore.domain.note.NoteUpdate;
import org.jspecify.annotations.Nullable;

import java.time.Instant;

/**
 * Checks the arguments passed to a note store and normalizes them to the form every backend stores.
 * Failures are reported as {@link notestore.domain.exceptions.ValidationFailed}.
 */
public interface ValidateNote {
    /**
     * @param value The text to check
     * @param field The name of the field, used in the error message
     * @return The value, unchanged
     */
    String throwIfBlank(@Nullable String value, String field);

    /**
     * @return The time truncated to the millisecond precision every backend can store, or null if it was null
     */
    @Nullable Instant normalize(@Nullable Instant time);

    /**
     * Check the supplied fields of an update and normalize its due time.
     */
    NoteUpdate validateUpdate(NoteUpdate update);

    String validateQuery(@Nullable String query);

    int validateLimit(int limit);

    int validateHours(int hours);
}
