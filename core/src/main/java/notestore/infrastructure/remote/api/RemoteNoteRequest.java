package notestore.infrastructure.remote.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jspecify.annotations.Nullable;

import java.time.Instant;

/**
 * The body of a create or update request. An update only sends the fields it changes.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RemoteNoteRequest(
        @Nullable String title,
        @Nullable String content,
        @JsonProperty("due_at") @Nullable Instant dueAt) {
}
