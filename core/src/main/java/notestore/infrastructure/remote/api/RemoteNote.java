package notestore.infrastructure.remote.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import notestore.domain.note.BackendType;
import notestore.domain.note.Note;
import notestore.domain.note.NoteId;
import org.jspecify.annotations.Nullable;

import java.time.Instant;

/**
 * A note as it travels over the notes HTTP API.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RemoteNote(
        String id,
        String title,
        String content,
        @JsonProperty("due_at") @Nullable Instant dueAt,
        @JsonProperty("created_at") Instant createdAt) {

    public static RemoteNote fromNote(final Note note) {
        return new RemoteNote(note.id().value(), note.title(), note.content(), note.dueAt(), note.createdAt());
    }

    public Note toNote(final BackendType backend) {
        return new Note(new NoteId(backend, id), title, content, dueAt, createdAt);
    }
}
