package notestore.application.web;

import io.vavr.control.Try;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import notestore.domain.exceptionhandling.ExceptionHandler;
import notestore.domain.exceptions.BackendUnavailable;
import notestore.domain.exceptions.DeserializationFailed;
import notestore.domain.exceptions.InvalidIdentifier;
import notestore.domain.exceptions.QueryFailure;
import notestore.domain.exceptions.ValidationFailed;
import notestore.domain.json.JsonDeserializer;
import notestore.infrastructure.remote.api.RemoteError;
import org.apache.commons.lang3.exception.ExceptionUtils;

import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Builds JSON responses and maps note store exceptions onto the status codes of the notes API.
 */
@ApplicationScoped
public class NoteStoreResponses {
    @Inject
    private JsonDeserializer jsonDeserializer;

    @Inject
    private ExceptionHandler exceptionHandler;

    @Inject
    private Logger logger;

    public Response json(final int status, final Object body) {
        return Response.status(status)
                .type(MediaType.APPLICATION_JSON_TYPE)
                .entity(jsonDeserializer.serialize(body))
                .build();
    }

    public Response notFound(final String what) {
        return json(404, new RemoteError(RemoteError.NOT_FOUND, what + " was not found"));
    }

    /**
     * Runs a note store call. Caller errors become a 400, an unreachable engine a 503 and a failed query a 500.
     * Anything else is left to the container.
     */
    public Response respond(final String operation, final Supplier<Response> call) {
        return Try.of(call::get)
                .recover(InvalidIdentifier.class, ex -> json(400,
                        new RemoteError(RemoteError.INVALID_IDENTIFIER, ex.getMessage())))
                .recover(ValidationFailed.class, ex -> json(400,
                        new RemoteError(RemoteError.VALIDATION_FAILED, ex.getMessage())))
                .recover(DeserializationFailed.class, ex -> json(400,
                        new RemoteError(RemoteError.VALIDATION_FAILED, "The request body is not a valid note")))
                .recover(BackendUnavailable.class, ex -> serverError(503, RemoteError.BACKEND_UNAVAILABLE, operation, ex))
                .recover(QueryFailure.class, ex -> serverError(500, RemoteError.QUERY_FAILURE, operation, ex))
                // The container wraps exceptions thrown while it constructs the store
                .recoverWith(RuntimeException.class, ex -> ExceptionUtils.throwableOfType(ex, BackendUnavailable.class) == null
                        ? Try.failure(ex)
                        : Try.success(serverError(503, RemoteError.BACKEND_UNAVAILABLE, operation, ex)))
                .get();
    }

    private Response serverError(final int status, final String error, final String operation, final Exception ex) {
        logger.warning("Failed to " + operation + ": " + exceptionHandler.getExceptionMessage(ex));
        return json(status, new RemoteError(error, ex.getMessage()));
    }
}
