package notestore.domain.exceptions;

/**
 * Represents a request that reached the storage engine but failed there. This is like a 500 response code in HTTP.
 */
public class QueryFailure extends RuntimeException implements ExternalException {
    public QueryFailure() {
        super();
    }

    public QueryFailure(final String message) {
        super(message);
    }

    public QueryFailure(final String message, final Throwable cause) {
        super(message, cause);
    }

    public QueryFailure(final Throwable cause) {
        super(cause);
    }
}
