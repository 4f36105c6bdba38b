package notestore.infrastructure.remote.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.jspecify.annotations.Nullable;

/**
 * The body of a 4xx or 5xx response.
 *
 * @param error   A machine readable code, like {@link #INVALID_IDENTIFIER}
 * @param message A human readable description
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RemoteError(String error, @Nullable String message) {
    public static final String INVALID_IDENTIFIER = "invalid-identifier";
    public static final String VALIDATION_FAILED = "validation-failed";
    public static final String NOT_FOUND = "not-found";
    public static final String QUERY_FAILURE = "query-failure";
    public static final String BACKEND_UNAVAILABLE = "backend-unavailable";
}
