package notestore.domain.response;

import io.vavr.control.Try;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.core.Response;
import notestore.domain.exceptions.InvalidIdentifier;
import notestore.domain.exceptions.QueryFailure;
import notestore.domain.exceptions.ValidationFailed;
import notestore.domain.json.JsonDeserializer;
import notestore.infrastructure.remote.api.RemoteError;
import org.apache.commons.lang3.StringUtils;

/**
 * Maps the status of a notes API response onto the note store exceptions. A 400 is the caller's fault and is
 * reported as an invalid id or invalid input, depending on the error code in the body. Anything else outside the 2xx
 * range is a failure of the remote store.
 */
@ApplicationScoped
public class RemoteResponseValidation implements ResponseValidation {
    @Inject
    private JsonDeserializer jsonDeserializer;

    @Override
    public Response validate(final Response response, final String target) {
        if (response.getStatusInfo().getFamily() == Response.Status.Family.SUCCESSFUL) {
            return response;
        }

        final String body = Try.of(() -> response.readEntity(String.class)).getOrElse("");

        if (response.getStatus() == 400) {
            final RemoteError error = Try.of(() -> jsonDeserializer.deserialize(body, RemoteError.class))
                    .getOrNull();
            final String message = error == null || StringUtils.isBlank(error.message())
                    ? "The request to " + target + " was rejected"
                    : error.message();

            if (error != null && RemoteError.INVALID_IDENTIFIER.equals(error.error())) {
                throw new InvalidIdentifier(message);
            }

            throw new ValidationFailed(message);
        }

        throw new QueryFailure("Expected a 2xx status code from " + target + ", but got "
                + response.getStatus() + " " + StringUtils.abbreviate(body, 200));
    }
}
