package notestore.application.web;

import jakarta.ws.rs.ApplicationPath;
import jakarta.ws.rs.core.Application;

/**
 * Serves the notes API from the root of the context, where {@code RemoteNoteStore} expects it.
 */
@ApplicationPath("/")
public class RestApplication extends Application {
}
