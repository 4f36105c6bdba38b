package notestore.infrastructure.remote.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record RemoteHealth(boolean ok, String backend) {
}
