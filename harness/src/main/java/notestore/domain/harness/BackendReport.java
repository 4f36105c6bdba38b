package notestore.domain.harness;

import notestore.domain.note.BackendType;
import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.Optional;

/**
 * Everything the harness found out about one backend.
 *
 * @param backend          The backend
 * @param initFailure      Why the backend could not be started, or null if it started
 * @param scenarios        The scenario results, empty if the backend did not start
 * @param benchmark        The benchmark timings, or null if the benchmark did not complete
 * @param benchmarkFailure Why the benchmark did not complete, or null
 */
public record BackendReport(BackendType backend,
                            @Nullable String initFailure,
                            List<ScenarioResult> scenarios,
                            @Nullable BenchmarkResult benchmark,
                            @Nullable String benchmarkFailure) {

    public static BackendReport unavailable(final BackendType backend, final String initFailure) {
        return new BackendReport(backend, initFailure, List.of(), null, null);
    }

    public boolean passed() {
        return initFailure == null
                && benchmarkFailure == null
                && scenarios.stream().allMatch(ScenarioResult::passed);
    }

    public Optional<ScenarioResult> getScenario(final String name) {
        return scenarios.stream().filter(result -> result.scenario().equals(name)).findFirst();
    }
}
