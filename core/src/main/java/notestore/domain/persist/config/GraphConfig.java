package notestore.domain.persist.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.util.Optional;

@ApplicationScoped
public class GraphConfig {
    @Inject
    @ConfigProperty(name = "notes.graph.uri", defaultValue = "bolt://localhost:7687")
    private String uri;

    @Inject
    @ConfigProperty(name = "notes.graph.user", defaultValue = "neo4j")
    private String user;

    @Inject
    @ConfigProperty(name = "notes.graph.password")
    private Optional<String> password;

    /**
     * Empty means the server's default database.
     */
    @Inject
    @ConfigProperty(name = "notes.graph.database")
    private Optional<String> database;

    public String getUri() {
        return uri;
    }

    public String getUser() {
        return user;
    }

    public Optional<String> getPassword() {
        return password;
    }

    public Optional<String> getDatabase() {
        return database;
    }
}
