package notestore.domain.harness.scenarios;

import jakarta.enterprise.context.ApplicationScoped;
import notestore.domain.harness.Scenario;
import notestore.domain.persist.NoteStore;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static notestore.domain.harness.Expectations.equal;
import static notestore.domain.harness.Expectations.titles;

/**
 * Only notes due between now and the end of the window are returned, soonest first. Overdue notes and notes
 * without a reminder are never returned.
 */
@ApplicationScoped
public class ReminderWindowScenario implements Scenario {
    @Override
    public String getName() {
        return "reminder-window";
    }

    @Override
    public int getOrder() {
        return 80;
    }

    @Override
    public List<String> run(final NoteStore noteStore) {
        final Instant now = Instant.now();
        noteStore.add("In thirty minutes", "due", now.plus(Duration.ofMinutes(30)));
        noteStore.add("In two hours", "due", now.plus(Duration.ofHours(2)));
        noteStore.add("An hour ago", "overdue", now.minus(Duration.ofHours(1)));
        noteStore.add("In ten minutes", "due", now.plus(Duration.ofMinutes(10)));
        noteStore.add("Whenever", "no reminder", null);

        return List.of(
                "1h=" + equal(List.of("In ten minutes", "In thirty minutes"),
                        titles(noteStore.upcomingReminders(1)), "reminders in the next hour"),
                "3h=" + equal(List.of("In ten minutes", "In thirty minutes", "In two hours"),
                        titles(noteStore.upcomingReminders(3)), "reminders in the next three hours"),
                "0h=" + equal(List.of(), titles(noteStore.upcomingReminders(0)), "reminders in an empty window"));
    }
}
