package notestore.domain.persist;

import io.vavr.control.Try;
import notestore.domain.exceptions.InvalidIdentifier;
import notestore.domain.note.BackendType;
import notestore.domain.note.NoteId;

import java.util.Locale;
import java.util.UUID;
import java.util.regex.Pattern;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Checks that an id belongs to a backend and has the key format that backend issues.
 */
public final class NoteIds {
    private static final Pattern CANONICAL_UUID =
            Pattern.compile("^[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}$");

    private NoteIds() {
    }

    public static NoteId requireBackend(final NoteId id, final BackendType backend) {
        checkNotNull(id);

        if (id.backend() != backend) {
            throw new InvalidIdentifier("The id " + id + " was issued by the " + id.backend()
                    + " backend and can not be used with the " + backend + " backend");
        }

        return id;
    }

    /**
     * UUID.fromString accepts some non canonical forms, like missing leading zeros, so the format is checked first.
     */
    public static UUID parseUuid(final NoteId id) {
        final String value = id.value().toLowerCase(Locale.ROOT);

        if (!CANONICAL_UUID.matcher(value).matches()) {
            throw new InvalidIdentifier("The id \"" + id.value() + "\" is not a UUID");
        }

        return Try.of(() -> UUID.fromString(value))
                .getOrElseThrow(ex -> new InvalidIdentifier("The id \"" + id.value() + "\" is not a UUID", ex));
    }

    public static long parsePositiveLong(final NoteId id) {
        final long value = Try.of(() -> Long.parseLong(id.value()))
                .getOrElseThrow(ex -> new InvalidIdentifier("The id \"" + id.value() + "\" is not an integer", ex));

        if (value <= 0) {
            throw new InvalidIdentifier("The id \"" + id.value() + "\" must be a positive integer");
        }

        return value;
    }
}
