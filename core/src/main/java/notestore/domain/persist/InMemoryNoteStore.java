package notestore.domain.persist;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import notestore.domain.note.BackendType;
import notestore.domain.note.Note;
import notestore.domain.note.NoteId;
import notestore.domain.note.NoteStats;
import notestore.domain.note.NoteUpdate;
import notestore.domain.time.NoteClock;
import notestore.domain.validate.ValidateNote;
import org.apache.commons.lang3.StringUtils;
import org.jspecify.annotations.Nullable;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/**
 * Keeps notes in a map for the life of the process. This is the reference every other backend is compared against,
 * so it favours obviously correct code over speed.
 */
@ApplicationScoped
public class InMemoryNoteStore implements NoteStore {
    private static final Comparator<Note> NEWEST_FIRST = Comparator.comparing(Note::createdAt).reversed();

    private final Map<UUID, Note> notes = new ConcurrentHashMap<>();

    @Inject
    private NoteClock clock;

    @Inject
    private ValidateNote validateNote;

    @Inject
    private Logger logger;

    @Override
    public BackendType getBackendType() {
        return BackendType.IN_MEMORY;
    }

    @Override
    public NoteId parseId(final String raw) {
        final UUID key = toKey(new NoteId(BackendType.IN_MEMORY, StringUtils.trimToEmpty(raw)));
        return new NoteId(BackendType.IN_MEMORY, key.toString());
    }

    @Override
    public NoteId add(final String title, final String content, @Nullable final Instant dueAt) {
        validateNote.throwIfBlank(title, "title");
        validateNote.throwIfBlank(content, "content");

        final UUID key = UUID.randomUUID();
        final NoteId id = new NoteId(BackendType.IN_MEMORY, key.toString());
        notes.put(key, new Note(id, title, content, validateNote.normalize(dueAt), clock.nextCreationTime()));

        logger.info("Added note " + id);
        return id;
    }

    @Override
    public Optional<Note> get(final NoteId id) {
        return Optional.ofNullable(notes.get(toKey(id)));
    }

    @Override
    public boolean delete(final NoteId id) {
        final boolean removed = notes.remove(toKey(id)) != null;
        logger.info("Deleted note " + id + ": " + removed);
        return removed;
    }

    @Override
    public boolean update(final NoteId id, final NoteUpdate update) {
        final UUID key = toKey(id);
        final NoteUpdate validated = validateNote.validateUpdate(update);

        if (validated.isEmpty()) {
            return false;
        }

        final Note updated = notes.computeIfPresent(key, (k, existing) -> new Note(
                existing.id(),
                validated.title() == null ? existing.title() : validated.title(),
                validated.content() == null ? existing.content() : validated.content(),
                validated.dueAt() == null ? existing.dueAt() : validated.dueAt(),
                existing.createdAt()));

        logger.info("Updated note " + id + ": " + (updated != null));
        return updated != null;
    }

    @Override
    public List<Note> search(final String query, final int limit) {
        validateNote.validateQuery(query);
        validateNote.validateLimit(limit);

        return notes.values().stream()
                .filter(note -> SearchPatterns.containsIgnoreCase(note.title(), query)
                        || SearchPatterns.containsIgnoreCase(note.content(), query))
                .sorted(NEWEST_FIRST)
                .limit(limit)
                .toList();
    }

    @Override
    public List<Note> recent(final int limit) {
        validateNote.validateLimit(limit);

        return notes.values().stream()
                .sorted(NEWEST_FIRST)
                .limit(limit)
                .toList();
    }

    @Override
    public List<Note> upcomingReminders(final int hours) {
        validateNote.validateHours(hours);

        final Instant now = clock.now();
        final Instant end = now.plus(Duration.ofHours(hours));

        return notes.values().stream()
                .filter(Note::hasReminder)
                .filter(note -> !note.dueAt().isBefore(now) && !note.dueAt().isAfter(end))
                .sorted(Comparator.comparing(Note::dueAt))
                .toList();
    }

    @Override
    public NoteStats stats() {
        final Instant weekAgo = clock.now().minus(Duration.ofDays(7));
        final List<Note> snapshot = List.copyOf(notes.values());
        final long withReminder = snapshot.stream().filter(Note::hasReminder).count();
        final long recent = snapshot.stream().filter(note -> !note.createdAt().isBefore(weekAgo)).count();

        return new NoteStats(snapshot.size(), withReminder, snapshot.size() - withReminder, recent);
    }

    @Override
    public void clear() {
        notes.clear();
        logger.info("Cleared the in-memory note store");
    }

    private UUID toKey(final NoteId id) {
        return NoteIds.parseUuid(NoteIds.requireBackend(id, BackendType.IN_MEMORY));
    }
}
