package notestore.domain.harness.scenarios;

import jakarta.enterprise.context.ApplicationScoped;
import notestore.domain.harness.Scenario;
import notestore.domain.persist.NoteStore;

import java.util.ArrayList;
import java.util.List;

import static notestore.domain.harness.Expectations.equal;
import static notestore.domain.harness.Expectations.titles;

/**
 * Search matches title or content as a case-insensitive substring, newest first, up to the limit.
 */
@ApplicationScoped
public class SearchScenario implements Scenario {
    @Override
    public String getName() {
        return "search";
    }

    @Override
    public int getOrder() {
        return 50;
    }

    @Override
    public List<String> run(final NoteStore noteStore) {
        noteStore.add("Shopping list", "Buy MILK and bread", null);
        noteStore.add("Meeting", "Discuss the milkshake budget", null);
        noteStore.add("Gardening", "Water the plants", null);
        noteStore.add("Milk delivery", "Tomorrow morning", null);

        final List<String> observations = new ArrayList<>();
        observations.add("milk=" + equal(List.of("Milk delivery", "Meeting", "Shopping list"),
                titles(noteStore.search("milk", 10)), "search for milk"));
        observations.add("MILK=" + equal(List.of("Milk delivery", "Meeting", "Shopping list"),
                titles(noteStore.search("MILK", 10)), "search for MILK"));
        observations.add("limited=" + equal(List.of("Milk delivery", "Meeting"),
                titles(noteStore.search("milk", 2)), "search for milk with a limit of 2"));
        observations.add("plants=" + equal(List.of("Gardening"),
                titles(noteStore.search("the plants", 10)), "search across words"));
        observations.add("none=" + equal(List.of(),
                titles(noteStore.search("zebra", 10)), "search without matches"));
        return observations;
    }
}
