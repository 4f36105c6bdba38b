package notestore.domain.harness;

import jakarta.enterprise.context.ApplicationScoped;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * A plain text table with a row for each scenario and benchmark phase and a column for each backend, followed by
 * the details of every failure.
 */
@ApplicationScoped
public class TextReportFormatter implements ReportFormatter {
    private static final int FIRST_COLUMN = 22;
    private static final int COLUMN = 14;

    @Override
    public String format(final HarnessReport report) {
        final StringBuilder builder = new StringBuilder();

        row(builder, "scenario", report.backends().stream().map(backend -> backend.backend().toString()).toList());
        builder.append(StringUtils.repeat('-', FIRST_COLUMN + COLUMN * report.backends().size()))
                .append(System.lineSeparator());

        for (final String scenario : report.scenarios()) {
            row(builder, scenario, report.backends().stream()
                    .map(backend -> scenarioCell(backend, scenario))
                    .toList());
        }

        for (final String phase : List.of(NoteStoreBenchmark.INSERT, NoteStoreBenchmark.LOOKUP, NoteStoreBenchmark.SEARCH)) {
            row(builder, phase + " ops/s", report.backends().stream()
                    .map(backend -> benchmarkCell(backend, phase))
                    .toList());
        }

        row(builder, "result", report.backends().stream()
                .map(backend -> backend.passed() ? "PASS" : "FAIL")
                .toList());

        final List<String> failures = failures(report);
        if (!failures.isEmpty()) {
            builder.append(System.lineSeparator()).append("Failures:").append(System.lineSeparator());
            failures.forEach(failure -> builder.append("  ").append(failure).append(System.lineSeparator()));
        }

        return builder.toString();
    }

    private String scenarioCell(final BackendReport backend, final String scenario) {
        if (backend.initFailure() != null) {
            return "n/a";
        }

        return backend.getScenario(scenario)
                .map(result -> result.passed() ? "pass" : "FAIL")
                .orElse("-");
    }

    private String benchmarkCell(final BackendReport backend, final String phase) {
        if (backend.benchmark() == null) {
            return "-";
        }

        return backend.benchmark().getPhase(phase)
                .map(result -> String.format(Locale.ROOT, "%.1f", result.operationsPerSecond()))
                .orElse("-");
    }

    private List<String> failures(final HarnessReport report) {
        final List<String> failures = new ArrayList<>();

        for (final BackendReport backend : report.backends()) {
            if (backend.initFailure() != null) {
                failures.add(backend.backend() + " unavailable: " + firstLine(backend.initFailure()));
            }

            backend.scenarios().stream()
                    .filter(result -> !result.passed())
                    .forEach(result -> failures.add(backend.backend() + " " + result.scenario() + ": "
                            + firstLine(result.failure())));

            if (backend.benchmarkFailure() != null) {
                failures.add(backend.backend() + " benchmark: " + firstLine(backend.benchmarkFailure()));
            }
        }

        return failures;
    }

    private String firstLine(final String text) {
        return StringUtils.abbreviate(StringUtils.substringBefore(StringUtils.defaultString(text), "\n").trim(), 300);
    }

    private void row(final StringBuilder builder, final String first, final List<String> cells) {
        builder.append(StringUtils.rightPad(first, FIRST_COLUMN));
        cells.forEach(cell -> builder.append(StringUtils.rightPad(cell, COLUMN)));
        builder.append(System.lineSeparator());
    }
}
