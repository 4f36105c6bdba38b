package notestore.domain.response;

import jakarta.ws.rs.core.Response;

public interface ResponseValidation {
    /**
     * @param response The response to check
     * @param target   The URL that was called, used in error messages
     * @return The response, if it has a 2xx status code
     */
    Response validate(Response response, String target);
}
