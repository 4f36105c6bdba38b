package notestore.domain.harness;

import java.util.List;
import java.util.Optional;

public record BenchmarkResult(int size, List<BenchmarkPhase> phases) {
    public Optional<BenchmarkPhase> getPhase(final String name) {
        return phases.stream().filter(phase -> phase.name().equals(name)).findFirst();
    }
}
