package notestore.domain.note;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * An opaque note handle. The value is only meaningful to the backend that issued it, so the backend travels with it
 * and an id from one backend can never be used against another.
 *
 * @param backend The backend that issued the id
 * @param value   The backend specific key, e.g. an auto increment integer, a UUID or an ObjectId
 */
public record NoteId(BackendType backend, String value) {
    public NoteId {
        checkNotNull(backend);
        checkNotNull(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
