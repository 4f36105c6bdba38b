package notestore.domain.exceptions;

/**
 * Represents a note identifier that is malformed for the backend it was passed to, or that belongs to another backend.
 * This is distinct from a well-formed identifier that matches no note, which is reported as an empty result.
 */
public class InvalidIdentifier extends RuntimeException implements InternalException {
    public InvalidIdentifier() {
        super();
    }

    public InvalidIdentifier(final String message) {
        super(message);
    }

    public InvalidIdentifier(final String message, final Throwable cause) {
        super(message, cause);
    }

    public InvalidIdentifier(final Throwable cause) {
        super(cause);
    }
}
