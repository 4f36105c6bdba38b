package notestore.domain.persist.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;

@ApplicationScoped
public class DocumentConfig {
    @Inject
    @ConfigProperty(name = "notes.document.uri", defaultValue = "mongodb://localhost:27017")
    private String uri;

    @Inject
    @ConfigProperty(name = "notes.document.database", defaultValue = "notes_db")
    private String database;

    @Inject
    @ConfigProperty(name = "notes.document.collection", defaultValue = "notes")
    private String collection;

    @Inject
    @ConfigProperty(name = "notes.document.timeout-seconds", defaultValue = "10")
    private int timeoutSeconds;

    public String getUri() {
        return uri;
    }

    public String getDatabase() {
        return database;
    }

    public String getCollection() {
        return collection;
    }

    public int getTimeoutSeconds() {
        return timeoutSeconds;
    }
}
