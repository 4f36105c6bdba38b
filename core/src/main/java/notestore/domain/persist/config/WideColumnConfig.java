package notestore.domain.persist.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

@ApplicationScoped
public class WideColumnConfig {
    /**
     * A comma separated list of hosts.
     */
    @Inject
    @ConfigProperty(name = "notes.widecolumn.contact-points", defaultValue = "localhost")
    private String contactPoints;

    @Inject
    @ConfigProperty(name = "notes.widecolumn.port", defaultValue = "9042")
    private int port;

    @Inject
    @ConfigProperty(name = "notes.widecolumn.datacenter", defaultValue = "datacenter1")
    private String datacenter;

    @Inject
    @ConfigProperty(name = "notes.widecolumn.keyspace", defaultValue = "notes_keyspace")
    private String keyspace;

    @Inject
    @ConfigProperty(name = "notes.widecolumn.user")
    private Optional<String> user;

    @Inject
    @ConfigProperty(name = "notes.widecolumn.password")
    private Optional<String> password;

    public List<String> getContactPoints() {
        return Arrays.stream(contactPoints.split(","))
                .map(String::trim)
                .filter(host -> !host.isEmpty())
                .toList();
    }

    public int getPort() {
        return port;
    }

    public String getDatacenter() {
        return datacenter;
    }

    public String getKeyspace() {
        return keyspace;
    }

    public Optional<String> getUser() {
        return user;
    }

    public Optional<String> getPassword() {
        return password;
    }
}
