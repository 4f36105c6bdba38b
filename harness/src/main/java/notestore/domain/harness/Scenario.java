package notestore.domain.harness;

import notestore.domain.persist.NoteStore;

import java.util.List;

/**
 * A fixed sequence of note store calls with expected results.
 * <p>
 * Scenarios start from an empty store. They throw {@link ScenarioFailed} when a result is not what the contract
 * requires, and otherwise return observations that do not depend on the id format or the clock, so that the
 * observations of any backend can be compared with those of the in-memory reference.
 */
public interface Scenario {
    /**
     * @return The name shown in the report
     */
    String getName();

    /**
     * @return The position of the scenario in the report, lowest first
     */
    int getOrder();

    /**
     * @param noteStore An empty note store
     * @return What the scenario observed
     */
    List<String> run(NoteStore noteStore);
}
