package notestore.domain.persist;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import notestore.domain.injection.Preferred;
import notestore.domain.note.BackendType;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.util.logging.Logger;

/**
 * Produces the NoteStore named by the notes.backend setting.
 */
@ApplicationScoped
public class NoteStoreProducer {

    @Inject
    @ConfigProperty(name = "notes.backend", defaultValue = "relational")
    private String backend;

    @Inject
    private NoteStoreLookup noteStoreLookup;

    @Inject
    private Logger logger;

    @Produces
    @Preferred
    @ApplicationScoped
    public NoteStore produceNoteStore() {
        final BackendType backendType = BackendType.fromConfig(backend);
        logger.info("Using the " + backendType + " note store");
        return noteStoreLookup.getNoteStore(backendType);
    }
}
