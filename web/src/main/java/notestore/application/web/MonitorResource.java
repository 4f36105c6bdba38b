package notestore.application.web;

import io.vavr.control.Try;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import notestore.domain.exceptionhandling.ExceptionHandler;
import notestore.domain.injection.Preferred;
import notestore.domain.persist.NoteStore;
import notestore.infrastructure.remote.api.RemoteCount;
import notestore.infrastructure.remote.api.RemoteHealth;
import notestore.infrastructure.remote.api.RemoteStats;
import org.apache.commons.lang3.StringUtils;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.util.Locale;
import java.util.logging.Logger;

@Path("/")
public class MonitorResource {

    @Inject
    @Preferred
    private NoteStore noteStore;

    @Inject
    @ConfigProperty(name = "notes.backend", defaultValue = "relational")
    private String backend;

    @Inject
    private NoteStoreResponses responses;

    @Inject
    private ExceptionHandler exceptionHandler;

    @Inject
    private Logger logger;

    /**
     * The store is healthy if it can count its notes.
     */
    @GET
    @Path("health")
    @Produces(MediaType.APPLICATION_JSON)
    public Response health() {
        final boolean ok = Try.of(noteStore::stats)
                .onFailure(ex -> logger.warning("Health check failed: " + exceptionHandler.getExceptionMessage(ex)))
                .isSuccess();
        return responses.json(ok ? 200 : 503, new RemoteHealth(ok, activeBackend()));
    }

    /**
     * The number of notes. A store that can not be asked reports a null count rather than an error.
     */
    @GET
    @Path("count")
    @Produces(MediaType.APPLICATION_JSON)
    public Response count() {
        final Long records = Try.of(() -> noteStore.stats().total())
                .onFailure(ex -> logger.warning("Failed to count the notes: " + exceptionHandler.getExceptionMessage(ex)))
                .getOrNull();
        return responses.json(200, new RemoteCount(records, activeBackend()));
    }

    /**
     * The name of the backend in use. A store that could not be started falls back to the configured name.
     */
    private String activeBackend() {
        return Try.of(() -> noteStore.getBackendType().getConfigName())
                .getOrElse(() -> StringUtils.trimToEmpty(backend).toLowerCase(Locale.ROOT));
    }

    @GET
    @Path("stats")
    @Produces(MediaType.APPLICATION_JSON)
    public Response stats() {
        return responses.respond("get the note stats", () -> responses.json(200, RemoteStats.fromStats(noteStore.stats())));
    }
}
