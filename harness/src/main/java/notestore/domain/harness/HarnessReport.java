package notestore.domain.harness;

import notestore.domain.note.BackendType;

import java.util.List;
import java.util.Optional;

/**
 * @param scenarios The scenario names in the order they were run
 * @param backends  One report for each backend that was exercised
 */
public record HarnessReport(List<String> scenarios, List<BackendReport> backends) {
    public boolean passed() {
        return backends.stream().allMatch(BackendReport::passed);
    }

    public Optional<BackendReport> getBackend(final BackendType backendType) {
        return backends.stream().filter(report -> report.backend() == backendType).findFirst();
    }
}
