package notestore.domain.harness;

import notestore.domain.note.BackendType;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertTrue;

public class TextReportFormatterTest {
    @Test
    public void testFormat() {
        final BenchmarkResult benchmark = new BenchmarkResult(10, List.of(
                new BenchmarkPhase(NoteStoreBenchmark.INSERT, 10, Duration.ofMillis(500)),
                new BenchmarkPhase(NoteStoreBenchmark.LOOKUP, 10, Duration.ofMillis(100)),
                new BenchmarkPhase(NoteStoreBenchmark.SEARCH, 5, Duration.ofMillis(50))));

        final HarnessReport report = new HarnessReport(
                List.of("create-read", "stats"),
                List.of(
                        new BackendReport(BackendType.IN_MEMORY, null, List.of(
                                ScenarioResult.passed("create-read", List.of("title=a")),
                                ScenarioResult.passed("stats", List.of())), benchmark, null),
                        new BackendReport(BackendType.GRAPH, null, List.of(
                                ScenarioResult.passed("create-read", List.of("title=a")),
                                ScenarioResult.failed("stats", "stats of three notes: expected 3\nmore detail")), null,
                                "Connection lost"),
                        BackendReport.unavailable(BackendType.DOCUMENT, "Timed out")));

        final String text = new TextReportFormatter().format(report);

        assertTrue(text.contains("in-memory"));
        assertTrue(text.contains("20.0"));
        assertTrue(text.contains("100.0"));
        assertTrue(text.contains("graph stats: stats of three notes: expected 3"));
        assertTrue(!text.contains("more detail"));
        assertTrue(text.contains("graph benchmark: Connection lost"));
        assertTrue(text.contains("document unavailable: Timed out"));
        assertTrue(text.contains("n/a"));
    }
}
