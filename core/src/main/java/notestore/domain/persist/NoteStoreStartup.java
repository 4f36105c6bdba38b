package notestore.domain.persist;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.enterprise.event.Startup;
import notestore.domain.injection.Preferred;

import java.util.logging.Logger;

/**
 * Connects the selected note store as soon as the container starts, so that a bad backend name or an unreachable
 * engine stops the process before it serves anything.
 */
@ApplicationScoped
public class NoteStoreStartup {
    public void onStartup(@Observes final Startup startup,
                          @Preferred final NoteStore noteStore,
                          final Logger logger) {
        logger.info("Note store " + noteStore.getBackendType() + " is ready");
    }
}
