package notestore.domain.persist.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.apache.commons.lang3.StringUtils;
import org.eclipse.microprofile.config.inject.ConfigProperty;

@ApplicationScoped
public class RemoteConfig {
    @Inject
    @ConfigProperty(name = "notes.remote.url", defaultValue = "http://localhost:8080")
    private String url;

    @Inject
    @ConfigProperty(name = "notes.remote.timeout-seconds", defaultValue = "10")
    private int timeoutSeconds;

    @Inject
    @ConfigProperty(name = "notes.remote.pool-size", defaultValue = "20")
    private int poolSize;

    public String getUrl() {
        return StringUtils.removeEnd(url, "/");
    }

    public int getTimeoutSeconds() {
        return timeoutSeconds;
    }

    public int getPoolSize() {
        return poolSize;
    }
}
