package notestore.domain.harness;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import notestore.domain.note.BackendType;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.util.Arrays;
import java.util.List;

/**
 * Exposes the harness configuration.
 */
@ApplicationScoped
public class HarnessConfig {
    @Inject
    @ConfigProperty(name = "notes.harness.backends",
            defaultValue = "in-memory,relational,document,graph,wide-column,remote-proxy")
    private String backends;

    @Inject
    @ConfigProperty(name = "notes.harness.benchmark.size", defaultValue = "200")
    private int benchmarkSize;

    /**
     * @return The backends to exercise, in the order they were listed, without duplicates
     * @throws notestore.domain.exceptions.InvalidBackend if a name matches no backend
     */
    public List<BackendType> getBackends() {
        return Arrays.stream(backends.split(","))
                .filter(name -> !name.isBlank())
                .map(BackendType::fromConfig)
                .distinct()
                .toList();
    }

    public int getBenchmarkSize() {
        return benchmarkSize;
    }
}
