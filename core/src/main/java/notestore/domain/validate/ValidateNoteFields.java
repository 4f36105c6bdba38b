package notestore.domain.validate;

import jakarta.enterprise.context.ApplicationScoped;
import notestore.domain.exceptions.ValidationFailed;
import notestore.domain.note.NoteUpdate;
import org.apache.commons.lang3.StringUtils;
import org.jspecify.annotations.Nullable;

import java.time.Instant;
import java.time.temporal.ChronoUnit;

import static com.google.common.base.Preconditions.checkNotNull;

@ApplicationScoped
public class ValidateNoteFields implements ValidateNote {

    @Override
    public String throwIfBlank(@Nullable final String value, final String field) {
        if (StringUtils.isBlank(value)) {
            throw new ValidationFailed("The note " + field + " must not be empty");
        }
        return value;
    }

    @Override
    public @Nullable Instant normalize(@Nullable final Instant time) {
        return time == null ? null : time.truncatedTo(ChronoUnit.MILLIS);
    }

    @Override
    public NoteUpdate validateUpdate(final NoteUpdate update) {
        checkNotNull(update);

        if (update.title() != null) {
            throwIfBlank(update.title(), "title");
        }

        if (update.content() != null) {
            throwIfBlank(update.content(), "content");
        }

        return new NoteUpdate(update.title(), update.content(), normalize(update.dueAt()));
    }

    @Override
    public String validateQuery(@Nullable final String query) {
        if (StringUtils.isBlank(query)) {
            throw new ValidationFailed("The search query must not be empty");
        }
        return query;
    }

    @Override
    public int validateLimit(final int limit) {
        if (limit < 1) {
            throw new ValidationFailed("The limit must be at least 1, but was " + limit);
        }
        return limit;
    }

    @Override
    public int validateHours(final int hours) {
        if (hours < 0) {
            throw new ValidationFailed("The reminder window must not be negative, but was " + hours);
        }
        return hours;
    }
}
