package notestore.domain.harness.scenarios;

import jakarta.enterprise.context.ApplicationScoped;
import notestore.domain.harness.Scenario;
import notestore.domain.persist.NoteStore;

import java.util.List;
import java.util.stream.IntStream;

import static notestore.domain.harness.Expectations.equal;
import static notestore.domain.harness.Expectations.titles;

@ApplicationScoped
public class RecentOrderScenario implements Scenario {
    @Override
    public String getName() {
        return "recent-order";
    }

    @Override
    public int getOrder() {
        return 70;
    }

    @Override
    public List<String> run(final NoteStore noteStore) {
        IntStream.rangeClosed(1, 5).forEach(i -> noteStore.add("Note " + i, "Number " + i, null));

        return List.of(
                "top3=" + equal(List.of("Note 5", "Note 4", "Note 3"), titles(noteStore.recent(3)), "three most recent"),
                "all=" + equal(List.of("Note 5", "Note 4", "Note 3", "Note 2", "Note 1"),
                        titles(noteStore.recent(20)), "recent with a limit above the count"));
    }
}
