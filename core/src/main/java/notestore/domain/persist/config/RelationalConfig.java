package notestore.domain.persist.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.util.Optional;

/**
 * Connection settings for the relational backend. Any JDBC URL with a driver on the classpath works; H2 and
 * PostgreSQL are shipped.
 */
@ApplicationScoped
public class RelationalConfig {
    @Inject
    @ConfigProperty(name = "notes.relational.url", defaultValue = "jdbc:h2:file:./notes")
    private String url;

    @Inject
    @ConfigProperty(name = "notes.relational.user")
    private Optional<String> user;

    @Inject
    @ConfigProperty(name = "notes.relational.password")
    private Optional<String> password;

    public String getUrl() {
        return url;
    }

    public Optional<String> getUser() {
        return user;
    }

    public Optional<String> getPassword() {
        return password;
    }
}
