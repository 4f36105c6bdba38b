package notestore.domain.harness;

import java.time.Duration;

/**
 * Timing for one phase of the benchmark.
 *
 * @param name       The phase, e.g. insert
 * @param operations The number of note store calls made
 * @param elapsed    The wall clock time the calls took
 */
public record BenchmarkPhase(String name, int operations, Duration elapsed) {
    public double operationsPerSecond() {
        final long nanos = Math.max(elapsed.toNanos(), 1);
        return operations * 1_000_000_000d / nanos;
    }
}
