package notestore.domain.exceptions;

/**
 * Represents a storage engine that could not be reached or initialized. Raised during adapter construction this
 * aborts startup; raised later it means the engine went away between calls.
 */
public class BackendUnavailable extends RuntimeException implements ExternalException {
    public BackendUnavailable() {
        super();
    }

    public BackendUnavailable(final String message) {
        super(message);
    }

    public BackendUnavailable(final String message, final Throwable cause) {
        super(message, cause);
    }

    public BackendUnavailable(final Throwable cause) {
        super(cause);
    }
}
