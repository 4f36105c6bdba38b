package notestore.domain.exceptions;

/**
 * Represents a note or request that failed validation, like a blank title or a negative limit.
 */
public class ValidationFailed extends RuntimeException implements InternalException {
    public ValidationFailed() {
        super();
    }

    public ValidationFailed(final String message) {
        super(message);
    }

    public ValidationFailed(final String message, final Throwable cause) {
        super(message, cause);
    }

    public ValidationFailed(final Throwable cause) {
        super(cause);
    }
}
