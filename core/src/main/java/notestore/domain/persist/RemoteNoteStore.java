package notestore.domain.persist;

import io.vavr.API;
import io.vavr.control.Try;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.ProcessingException;
import jakarta.ws.rs.client.Client;
import jakarta.ws.rs.client.ClientBuilder;
import jakarta.ws.rs.client.Entity;
import jakarta.ws.rs.client.WebTarget;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import notestore.domain.exceptionhandling.ExceptionHandler;
import notestore.domain.exceptions.BackendUnavailable;
import notestore.domain.exceptions.DeserializationFailed;
import notestore.domain.exceptions.ExternalException;
import notestore.domain.exceptions.InternalException;
import notestore.domain.exceptions.InvalidIdentifier;
import notestore.domain.exceptions.QueryFailure;
import notestore.domain.json.JsonDeserializer;
import notestore.domain.note.BackendType;
import notestore.domain.note.Note;
import notestore.domain.note.NoteId;
import notestore.domain.note.NoteStats;
import notestore.domain.note.NoteUpdate;
import notestore.domain.persist.config.RemoteConfig;
import notestore.domain.response.ResponseValidation;
import notestore.domain.validate.ValidateNote;
import notestore.infrastructure.remote.api.RemoteNote;
import notestore.infrastructure.remote.api.RemoteNoteCreated;
import notestore.infrastructure.remote.api.RemoteNoteRequest;
import notestore.infrastructure.remote.api.RemoteStats;
import org.apache.commons.lang3.StringUtils;
import org.jboss.resteasy.client.jaxrs.ResteasyClientBuilder;
import org.jspecify.annotations.Nullable;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.logging.Logger;
import java.util.regex.Pattern;

import static com.google.common.base.Predicates.instanceOf;

/**
 * Forwards every call to another process serving the notes HTTP API. Ids are whatever the remote store issues, so
 * the only local check is that an id can be placed in a URL path.
 */
@ApplicationScoped
public class RemoteNoteStore implements NoteStore {
    private static final Pattern REMOTE_ID = Pattern.compile("^[^/?#{}\\s]+$");
    private static final int NOT_FOUND = 404;

    @Inject
    private RemoteConfig config;

    @Inject
    private JsonDeserializer jsonDeserializer;

    @Inject
    private ResponseValidation responseValidation;

    @Inject
    private ValidateNote validateNote;

    @Inject
    private ExceptionHandler exceptionHandler;

    @Inject
    private Logger logger;

    private Client client;

    @PostConstruct
    public void postConstruct() {
        logger.info("Initializing the remote note store at " + config.getUrl());

        final ResteasyClientBuilder clientBuilder = (ResteasyClientBuilder) ClientBuilder.newBuilder();
        clientBuilder.connectionPoolSize(config.getPoolSize());
        clientBuilder.maxPooledPerRoute(config.getPoolSize());
        clientBuilder.connectTimeout(config.getTimeoutSeconds(), TimeUnit.SECONDS);
        clientBuilder.readTimeout(config.getTimeoutSeconds(), TimeUnit.SECONDS);
        client = clientBuilder.build();

        Try.of(() -> call("check the health of the remote store",
                        target -> target.path("health").request(MediaType.APPLICATION_JSON_TYPE).get(),
                        response -> responseValidation.validate(response, config.getUrl() + "/health").getStatus()))
                .onSuccess(status -> logger.info("Initialized the remote note store"))
                .onFailure(ex -> preDestroy())
                .mapFailure(API.Case(API.$(), ex -> new BackendUnavailable(
                        "The remote note store at " + config.getUrl() + " is not healthy", ex)))
                .get();
    }

    @PreDestroy
    public void preDestroy() {
        if (client != null) {
            client.close();
            client = null;
        }
    }

    @Override
    public BackendType getBackendType() {
        return BackendType.REMOTE_PROXY;
    }

    @Override
    public NoteId parseId(final String raw) {
        return new NoteId(BackendType.REMOTE_PROXY, toKey(new NoteId(BackendType.REMOTE_PROXY, StringUtils.trimToEmpty(raw))));
    }

    @Override
    public NoteId add(final String title, final String content, @Nullable final Instant dueAt) {
        validateNote.throwIfBlank(title, "title");
        validateNote.throwIfBlank(content, "content");

        final String body = jsonDeserializer.serialize(new RemoteNoteRequest(title, content, validateNote.normalize(dueAt)));

        final RemoteNoteCreated created = call("add a note",
                target -> target.path("notes")
                        .request(MediaType.APPLICATION_JSON_TYPE)
                        .post(Entity.entity(body, MediaType.APPLICATION_JSON_TYPE)),
                response -> readEntity(response, "/notes", RemoteNoteCreated.class));

        if (created == null || StringUtils.isBlank(created.id())) {
            throw new QueryFailure("The remote note store did not return the id of the new note");
        }

        final NoteId id = new NoteId(BackendType.REMOTE_PROXY, created.id());
        logger.info("Added note " + id);
        return id;
    }

    @Override
    public Optional<Note> get(final NoteId id) {
        final String key = toKey(id);
        logger.fine("Getting note " + id);

        return call("get a note",
                target -> noteTarget(target, key).request(MediaType.APPLICATION_JSON_TYPE).get(),
                response -> response.getStatus() == NOT_FOUND
                        ? Optional.<Note>empty()
                        : Optional.of(readEntity(response, "/notes/" + key, RemoteNote.class)
                        .toNote(BackendType.REMOTE_PROXY)));
    }

    @Override
    public boolean delete(final NoteId id) {
        final String key = toKey(id);

        final boolean deleted = call("delete a note",
                target -> noteTarget(target, key).request(MediaType.APPLICATION_JSON_TYPE).delete(),
                response -> found(response, "/notes/" + key));

        logger.info("Deleted note " + id + ": " + deleted);
        return deleted;
    }

    @Override
    public boolean update(final NoteId id, final NoteUpdate update) {
        final String key = toKey(id);
        final NoteUpdate validated = validateNote.validateUpdate(update);

        if (validated.isEmpty()) {
            return false;
        }

        final String body = jsonDeserializer.serialize(
                new RemoteNoteRequest(validated.title(), validated.content(), validated.dueAt()));

        final boolean updated = call("update a note",
                target -> noteTarget(target, key)
                        .request(MediaType.APPLICATION_JSON_TYPE)
                        .put(Entity.entity(body, MediaType.APPLICATION_JSON_TYPE)),
                response -> found(response, "/notes/" + key));

        logger.info("Updated note " + id + ": " + updated);
        return updated;
    }

    @Override
    public List<Note> search(final String query, final int limit) {
        validateNote.validateQuery(query);
        validateNote.validateLimit(limit);

        // The query is bound as a template value so that braces and percent signs are encoded rather than parsed
        return call("search notes",
                target -> target.path("notes/search")
                        .queryParam("q", "{q}")
                        .resolveTemplate("q", query)
                        .queryParam("limit", limit)
                        .request(MediaType.APPLICATION_JSON_TYPE)
                        .get(),
                response -> readNotes(response, "/notes/search"));
    }

    @Override
    public List<Note> recent(final int limit) {
        validateNote.validateLimit(limit);

        return call("list recent notes",
                target -> target.path("notes")
                        .queryParam("limit", limit)
                        .request(MediaType.APPLICATION_JSON_TYPE)
                        .get(),
                response -> readNotes(response, "/notes"));
    }

    @Override
    public List<Note> upcomingReminders(final int hours) {
        validateNote.validateHours(hours);

        return call("list reminders",
                target -> target.path("notes/reminders")
                        .queryParam("hours", hours)
                        .request(MediaType.APPLICATION_JSON_TYPE)
                        .get(),
                response -> readNotes(response, "/notes/reminders"));
    }

    @Override
    public NoteStats stats() {
        return call("count notes",
                target -> target.path("stats").request(MediaType.APPLICATION_JSON_TYPE).get(),
                response -> readEntity(response, "/stats", RemoteStats.class).toStats());
    }

    @Override
    public void clear() {
        call("clear notes",
                target -> target.path("notes").request(MediaType.APPLICATION_JSON_TYPE).delete(),
                response -> responseValidation.validate(response, config.getUrl() + "/notes").getStatus());
        logger.info("Cleared the remote note store");
    }

    /**
     * Sends a request and hands the response to the handler, closing the response afterwards. Transport failures,
     * like a refused connection or a timeout, mean the remote store is unavailable.
     */
    private <T> T call(final String operation,
                       final Function<WebTarget, Response> request,
                       final Function<Response, T> handler) {
        return Try.withResources(() -> request.apply(client.target(config.getUrl())))
                .of(handler::apply)
                .onFailure(ex -> logger.warning(exceptionHandler.getExceptionMessage(ex)))
                .mapFailure(
                        API.Case(API.$(instanceOf(DeserializationFailed.class)),
                                ex -> new QueryFailure("The remote note store returned an unreadable response", ex)),
                        API.Case(API.$(instanceOf(InternalException.class)), ex -> ex),
                        API.Case(API.$(instanceOf(ExternalException.class)), ex -> ex),
                        API.Case(API.$(instanceOf(ProcessingException.class)),
                                ex -> new BackendUnavailable("Failed to reach the remote note store to " + operation, ex)),
                        API.Case(API.$(), ex -> new QueryFailure("Failed to " + operation, ex)))
                .get();
    }

    private WebTarget noteTarget(final WebTarget target, final String key) {
        return target.path("notes/{id}").resolveTemplate("id", key);
    }

    private boolean found(final Response response, final String path) {
        if (response.getStatus() == NOT_FOUND) {
            return false;
        }

        responseValidation.validate(response, config.getUrl() + path);
        return true;
    }

    private <T> T readEntity(final Response response, final String path, final Class<T> clazz) {
        responseValidation.validate(response, config.getUrl() + path);
        return jsonDeserializer.deserialize(response.readEntity(String.class), clazz);
    }

    private List<Note> readNotes(final Response response, final String path) {
        responseValidation.validate(response, config.getUrl() + path);
        return jsonDeserializer.deserializeCollection(response.readEntity(String.class), RemoteNote.class)
                .stream()
                .map(note -> note.toNote(BackendType.REMOTE_PROXY))
                .toList();
    }

    private String toKey(final NoteId id) {
        NoteIds.requireBackend(id, BackendType.REMOTE_PROXY);

        if (!REMOTE_ID.matcher(id.value()).matches()) {
            throw new InvalidIdentifier("The id \"" + id.value() + "\" can not be used in a URL path");
        }

        return id.value();
    }
}
