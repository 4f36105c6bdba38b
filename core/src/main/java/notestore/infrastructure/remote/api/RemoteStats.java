package notestore.infrastructure.remote.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import notestore.domain.note.NoteStats;

@JsonIgnoreProperties(ignoreUnknown = true)
public record RemoteStats(
        @JsonProperty("total_notes") long totalNotes,
        @JsonProperty("notes_with_reminders") long notesWithReminders,
        @JsonProperty("notes_without_reminders") long notesWithoutReminders,
        @JsonProperty("recent_notes") long recentNotes) {

    public static RemoteStats fromStats(final NoteStats stats) {
        return new RemoteStats(stats.total(), stats.withReminder(), stats.withoutReminder(), stats.recentCount());
    }

    public NoteStats toStats() {
        return new NoteStats(totalNotes, notesWithReminders, notesWithoutReminders, recentNotes);
    }
}
