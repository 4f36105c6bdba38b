package notestore.infrastructure.remote.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import org.jspecify.annotations.Nullable;

/**
 * @param records The number of notes, or null if the backend could not be asked
 * @param backend The configured backend
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.ALWAYS)
public record RemoteCount(@Nullable Long records, String backend) {
}
