package notestore.domain.exceptions;

/**
 * Represents a backend name in the configuration that does not match any known backend.
 */
public class InvalidBackend extends RuntimeException implements InternalException {
    public InvalidBackend() {
        super();
    }

    public InvalidBackend(final String message) {
        super(message);
    }

    public InvalidBackend(final String message, final Throwable cause) {
        super(message, cause);
    }

    public InvalidBackend(final Throwable cause) {
        super(cause);
    }
}
