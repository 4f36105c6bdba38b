package notestore.domain.harness.scenarios;

import jakarta.enterprise.context.ApplicationScoped;
import notestore.domain.harness.Scenario;
import notestore.domain.persist.NoteStore;

import java.util.List;
import java.util.stream.Stream;

import static notestore.domain.harness.Expectations.equal;
import static notestore.domain.harness.Expectations.titles;

/**
 * Characters that are wildcards or operators in SQL LIKE, regular expressions or URLs are matched literally.
 */
@ApplicationScoped
public class SpecialCharacterSearchScenario implements Scenario {
    @Override
    public String getName() {
        return "special-characters";
    }

    @Override
    public int getOrder() {
        return 60;
    }

    @Override
    public List<String> run(final NoteStore noteStore) {
        noteStore.add("50% off_sale (today)", "special", null);
        noteStore.add("Regex [a-z]+ test", "special", null);
        noteStore.add("Price $5.00 & up", "special", null);
        noteStore.add("Path C:\\temp?x=1#top", "special", null);
        noteStore.add("Plain words", "special", null);

        return Stream.of(
                        expect(noteStore, "%", "50% off_sale (today)"),
                        expect(noteStore, "_", "50% off_sale (today)"),
                        expect(noteStore, "(today)", "50% off_sale (today)"),
                        expect(noteStore, "[a-z]+", "Regex [a-z]+ test"),
                        expect(noteStore, "$5.0", "Price $5.00 & up"),
                        expect(noteStore, "& up", "Price $5.00 & up"),
                        expect(noteStore, "\\temp?x=1#", "Path C:\\temp?x=1#top"),
                        expect(noteStore, ".*"),
                        expect(noteStore, "[all"))
                .toList();
    }

    private String expect(final NoteStore noteStore, final String query, final String... expected) {
        return query + "=" + equal(List.of(expected), titles(noteStore.search(query, 10)),
                "search for " + query);
    }
}
