package notestore.domain.note;

/**
 * Counts over all the notes in a store.
 *
 * @param total           All notes
 * @param withReminder    Notes with a due time
 * @param withoutReminder Notes without a due time
 * @param recentCount     Notes created in the trailing seven days
 */
public record NoteStats(long total, long withReminder, long withoutReminder, long recentCount) {
}
