package notestore.domain.harness;

/**
 * Renders a harness report for people to read.
 */
public interface ReportFormatter {
    String format(HarnessReport report);
}
