package notestore.application.web;

import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.PUT;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import notestore.domain.exceptions.ValidationFailed;
import notestore.domain.injection.Preferred;
import notestore.domain.json.JsonDeserializer;
import notestore.domain.note.Note;
import notestore.domain.note.NoteId;
import notestore.domain.note.NoteUpdate;
import notestore.domain.persist.NoteStore;
import notestore.infrastructure.remote.api.RemoteNote;
import notestore.infrastructure.remote.api.RemoteNoteCreated;
import notestore.infrastructure.remote.api.RemoteNoteRequest;

import java.util.List;
import java.util.Objects;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * The notes HTTP API, served over the configured note store. This is the API {@code RemoteNoteStore} talks to.
 */
@Path("/notes")
public class NotesResource {

    @Inject
    @Preferred
    private NoteStore noteStore;

    @Inject
    private JsonDeserializer jsonDeserializer;

    @Inject
    private NoteStoreResponses responses;

    @GET
    @Produces(MediaType.APPLICATION_JSON)
    public Response recent(@QueryParam("limit") @DefaultValue("10") final int limit) {
        return responses.respond("list recent notes", () -> notes(noteStore.recent(limit)));
    }

    @POST
    @Consumes(MediaType.APPLICATION_JSON)
    @Produces(MediaType.APPLICATION_JSON)
    public Response add(final String body) {
        return responses.respond("add a note", () -> {
            final RemoteNoteRequest request = readRequest(body);
            final NoteId id = noteStore.add(request.title(), request.content(), request.dueAt());
            return responses.json(201, new RemoteNoteCreated(id.value()));
        });
    }

    @DELETE
    public Response clear() {
        return responses.respond("clear the notes", () -> {
            noteStore.clear();
            return Response.noContent().build();
        });
    }

    @GET
    @Path("search")
    @Produces(MediaType.APPLICATION_JSON)
    public Response search(@QueryParam("q") final String query,
                           @QueryParam("limit") @DefaultValue("10") final int limit) {
        return responses.respond("search the notes", () -> notes(noteStore.search(query, limit)));
    }

    @GET
    @Path("reminders")
    @Produces(MediaType.APPLICATION_JSON)
    public Response reminders(@QueryParam("hours") @DefaultValue("24") final int hours) {
        return responses.respond("list upcoming reminders", () -> notes(noteStore.upcomingReminders(hours)));
    }

    @GET
    @Path("{id}")
    @Produces(MediaType.APPLICATION_JSON)
    public Response get(@PathParam("id") final String id) {
        return responses.respond("get note " + id, () -> noteStore.get(noteStore.parseId(id))
                .map(note -> responses.json(200, RemoteNote.fromNote(note)))
                .orElseGet(() -> responses.notFound("Note " + id)));
    }

    @PUT
    @Path("{id}")
    @Consumes(MediaType.APPLICATION_JSON)
    @Produces(MediaType.APPLICATION_JSON)
    public Response update(@PathParam("id") final String id, final String body) {
        return responses.respond("update note " + id, () -> {
            final NoteId noteId = noteStore.parseId(id);
            final RemoteNoteRequest request = readRequest(body);
            final NoteUpdate update = new NoteUpdate(request.title(), request.content(), request.dueAt());
            return noteStore.update(noteId, update)
                    ? Response.noContent().build()
                    : responses.notFound("Note " + id);
        });
    }

    @DELETE
    @Path("{id}")
    @Produces(MediaType.APPLICATION_JSON)
    public Response delete(@PathParam("id") final String id) {
        return responses.respond("delete note " + id, () -> noteStore.delete(noteStore.parseId(id))
                ? Response.noContent().build()
                : responses.notFound("Note " + id));
    }

    private RemoteNoteRequest readRequest(final String body) {
        final RemoteNoteRequest request = jsonDeserializer.deserialize(Objects.requireNonNullElse(body, ""),
                RemoteNoteRequest.class);
        if (request == null) {
            throw new ValidationFailed("The request body must be a note");
        }
        return request;
    }

    private Response notes(final List<Note> notes) {
        checkNotNull(notes);
        return responses.json(200, notes.stream().map(RemoteNote::fromNote).toList());
    }
}
