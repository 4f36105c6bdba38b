package notestore.domain.harness;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * The outcome of one scenario against one backend.
 *
 * @param scenario     The scenario name
 * @param passed       true if every expectation held and the observations matched the reference
 * @param failure      What went wrong, or null if the scenario passed
 * @param observations What the scenario observed, empty if it threw
 */
public record ScenarioResult(String scenario, boolean passed, @Nullable String failure, List<String> observations) {
    public static ScenarioResult passed(final String scenario, final List<String> observations) {
        return new ScenarioResult(scenario, true, null, observations);
    }

    public static ScenarioResult failed(final String scenario, final String failure) {
        return new ScenarioResult(scenario, false, failure, List.of());
    }

    public static ScenarioResult failed(final String scenario, final String failure, final List<String> observations) {
        return new ScenarioResult(scenario, false, failure, observations);
    }
}
