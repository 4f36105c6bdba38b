package notestore.application.harness;

import jakarta.inject.Inject;
import notestore.Marker;
import notestore.domain.harness.HarnessReport;
import notestore.domain.harness.NotesHarness;
import notestore.domain.harness.ReportFormatter;
import org.jboss.weld.environment.se.Weld;
import org.jboss.weld.environment.se.WeldContainer;

/**
 * Runs the conformance scenarios and the benchmark against the configured backends and prints the comparison.
 * The exit code is 1 if any backend failed.
 */
public class Main {
    @Inject
    private NotesHarness notesHarness;

    @Inject
    private ReportFormatter reportFormatter;

    public static void main(final String[] args) {
        final Weld weld = new Weld();
        /*
        The marker class sits in the package shared by every module, so a recursive scan from it finds the beans
        in the core jar as well as this one.
         */
        final boolean passed;
        try (WeldContainer weldContainer = weld.addBeanClass(Main.class).addPackages(true, Marker.class).initialize()) {
            passed = weldContainer.select(Main.class).get().entry();
        }

        System.exit(passed ? 0 : 1);
    }

    public boolean entry() {
        final HarnessReport report = notesHarness.run();
        System.out.println(reportFormatter.format(report));
        return report.passed();
    }
}
