package notestore.domain.persist;

import com.datastax.oss.driver.api.core.AllNodesFailedException;
import com.datastax.oss.driver.api.core.CqlSession;
import com.datastax.oss.driver.api.core.CqlSessionBuilder;
import com.datastax.oss.driver.api.core.DriverTimeoutException;
import com.datastax.oss.driver.api.core.config.DefaultDriverOption;
import com.datastax.oss.driver.api.core.config.DriverConfigLoader;
import com.datastax.oss.driver.api.core.cql.PreparedStatement;
import com.datastax.oss.driver.api.core.cql.Row;
import com.datastax.oss.driver.api.core.cql.SimpleStatement;
import io.vavr.API;
import io.vavr.CheckedFunction0;
import io.vavr.control.Try;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import notestore.domain.exceptionhandling.ExceptionHandler;
import notestore.domain.exceptions.BackendUnavailable;
import notestore.domain.exceptions.ExternalException;
import notestore.domain.exceptions.InternalException;
import notestore.domain.exceptions.QueryFailure;
import notestore.domain.note.BackendType;
import notestore.domain.note.Note;
import notestore.domain.note.NoteId;
import notestore.domain.note.NoteStats;
import notestore.domain.note.NoteUpdate;
import notestore.domain.persist.config.WideColumnConfig;
import notestore.domain.time.NoteClock;
import notestore.domain.validate.ValidateNote;
import org.apache.commons.lang3.StringUtils;
import org.jspecify.annotations.Nullable;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.logging.Logger;
import java.util.regex.Pattern;
import java.util.stream.StreamSupport;

import static com.google.common.base.Predicates.instanceOf;

/**
 * Stores notes in a Cassandra table keyed by UUID.
 * <p>
 * CQL has no substring predicate and can only sort within a partition, so {@link #search(String, int)} and
 * {@link #recent(int)} read the whole table and filter and sort here. The cost of both grows linearly with the number
 * of notes, which makes this backend a poor fit for anything but small data sets. Reminders and the statistics
 * sub-counts rely on ALLOW FILTERING scans for the same reason.
 */
@ApplicationScoped
public class WideColumnNoteStore implements NoteStore {
    private static final Pattern KEYSPACE_NAME = Pattern.compile("^[a-zA-Z][a-zA-Z0-9_]{0,47}$");
    private static final Instant EARLIEST = Instant.parse("0001-01-01T00:00:00Z");
    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(10);
    private static final Comparator<Note> NEWEST_FIRST = Comparator.comparing(Note::createdAt).reversed();

    @Inject
    private WideColumnConfig config;

    @Inject
    private NoteClock clock;

    @Inject
    private ValidateNote validateNote;

    @Inject
    private ExceptionHandler exceptionHandler;

    @Inject
    private Logger logger;

    private CqlSession session;
    private String table;
    private PreparedStatement insertNote;
    private PreparedStatement selectNote;
    private PreparedStatement deleteNote;
    private PreparedStatement selectAll;
    private PreparedStatement selectDueBetween;

    @PostConstruct
    public void postConstruct() {
        logger.info("Initializing the wide-column note store at " + config.getContactPoints() + ":" + config.getPort());

        Try.run(() -> {
                    final String keyspace = config.getKeyspace();
                    if (!KEYSPACE_NAME.matcher(keyspace).matches()) {
                        throw new IllegalArgumentException("\"" + keyspace + "\" is not a valid keyspace name");
                    }

                    session = buildSession();
                    table = keyspace + ".notes";

                    session.execute("CREATE KEYSPACE IF NOT EXISTS " + keyspace
                            + " WITH replication = {'class': 'SimpleStrategy', 'replication_factor': 1}");
                    session.execute("CREATE TABLE IF NOT EXISTS " + table
                            + " (id uuid PRIMARY KEY, title text, content text, due_at timestamp, created_at timestamp)");
                    session.execute("CREATE INDEX IF NOT EXISTS notes_title_idx ON " + table + " (title)");
                    session.execute("CREATE INDEX IF NOT EXISTS notes_created_at_idx ON " + table + " (created_at)");
                    session.execute("CREATE INDEX IF NOT EXISTS notes_due_at_idx ON " + table + " (due_at)");

                    insertNote = session.prepare("INSERT INTO " + table
                            + " (id, title, content, due_at, created_at) VALUES (?, ?, ?, ?, ?)");
                    selectNote = session.prepare("SELECT id, title, content, due_at, created_at FROM " + table
                            + " WHERE id = ?");
                    deleteNote = session.prepare("DELETE FROM " + table + " WHERE id = ? IF EXISTS");
                    selectAll = session.prepare("SELECT id, title, content, due_at, created_at FROM " + table);
                    selectDueBetween = session.prepare("SELECT id, title, content, due_at, created_at FROM " + table
                            + " WHERE due_at >= ? AND due_at <= ? ALLOW FILTERING");
                })
                .onSuccess(v -> logger.info("Initialized the wide-column note store"))
                .onFailure(ex -> logger.warning(exceptionHandler.getExceptionMessage(ex)))
                .onFailure(ex -> preDestroy())
                .mapFailure(API.Case(API.$(), ex -> new BackendUnavailable(
                        "Failed to connect to Cassandra at " + config.getContactPoints(), ex)))
                .get();
    }

    @PreDestroy
    public void preDestroy() {
        if (session != null) {
            session.close();
            session = null;
        }
    }

    @Override
    public BackendType getBackendType() {
        return BackendType.WIDE_COLUMN;
    }

    @Override
    public NoteId parseId(final String raw) {
        final UUID key = toKey(new NoteId(BackendType.WIDE_COLUMN, StringUtils.trimToEmpty(raw)));
        return new NoteId(BackendType.WIDE_COLUMN, key.toString());
    }

    @Override
    public NoteId add(final String title, final String content, @Nullable final Instant dueAt) {
        validateNote.throwIfBlank(title, "title");
        validateNote.throwIfBlank(content, "content");

        final UUID key = UUID.randomUUID();
        final Instant due = validateNote.normalize(dueAt);
        final Instant createdAt = clock.nextCreationTime();

        execute("add a note", () -> session.execute(insertNote.bind(key, title, content, due, createdAt)));

        final NoteId id = new NoteId(BackendType.WIDE_COLUMN, key.toString());
        logger.info("Added note " + id);
        return id;
    }

    @Override
    public Optional<Note> get(final NoteId id) {
        final UUID key = toKey(id);
        logger.fine("Getting note " + id);

        return execute("get a note", () -> Optional.ofNullable(session.execute(selectNote.bind(key)).one())
                .map(this::toNote));
    }

    @Override
    public boolean delete(final NoteId id) {
        final UUID key = toKey(id);

        final boolean deleted = execute("delete a note", () -> session.execute(deleteNote.bind(key)).wasApplied());

        logger.info("Deleted note " + id + ": " + deleted);
        return deleted;
    }

    @Override
    public boolean update(final NoteId id, final NoteUpdate update) {
        final UUID key = toKey(id);
        final NoteUpdate validated = validateNote.validateUpdate(update);

        if (validated.isEmpty()) {
            return false;
        }

        final List<String> assignments = new ArrayList<>();
        final List<Object> values = new ArrayList<>();
        if (validated.title() != null) {
            assignments.add("title = ?");
            values.add(validated.title());
        }
        if (validated.content() != null) {
            assignments.add("content = ?");
            values.add(validated.content());
        }
        if (validated.dueAt() != null) {
            assignments.add("due_at = ?");
            values.add(validated.dueAt());
        }
        values.add(key);

        final SimpleStatement statement = SimpleStatement.newInstance(
                "UPDATE " + table + " SET " + String.join(", ", assignments) + " WHERE id = ? IF EXISTS",
                values.toArray());

        final boolean updated = execute("update a note", () -> session.execute(statement).wasApplied());

        logger.info("Updated note " + id + ": " + updated);
        return updated;
    }

    @Override
    public List<Note> search(final String query, final int limit) {
        validateNote.validateQuery(query);
        validateNote.validateLimit(limit);

        try (TimedOperation ignored = new TimedOperation("wide-column search full scan")) {
            return scanAll("search notes").stream()
                    .filter(note -> SearchPatterns.containsIgnoreCase(note.title(), query)
                            || SearchPatterns.containsIgnoreCase(note.content(), query))
                    .sorted(NEWEST_FIRST)
                    .limit(limit)
                    .toList();
        }
    }

    @Override
    public List<Note> recent(final int limit) {
        validateNote.validateLimit(limit);

        try (TimedOperation ignored = new TimedOperation("wide-column recent full scan")) {
            return scanAll("list recent notes").stream()
                    .sorted(NEWEST_FIRST)
                    .limit(limit)
                    .toList();
        }
    }

    @Override
    public List<Note> upcomingReminders(final int hours) {
        validateNote.validateHours(hours);

        final Instant now = clock.now();
        final Instant end = now.plus(Duration.ofHours(hours));

        return execute("list reminders", () ->
                StreamSupport.stream(session.execute(selectDueBetween.bind(now, end)).spliterator(), false)
                        .map(this::toNote)
                        .sorted(Comparator.comparing(Note::dueAt).thenComparing(note -> note.id().value()))
                        .toList());
    }

    @Override
    public NoteStats stats() {
        final Instant weekAgo = clock.now().minus(Duration.ofDays(7));

        return execute("count notes", () -> {
            final long total = count(SimpleStatement.newInstance("SELECT COUNT(*) FROM " + table));
            final long withReminder = count(SimpleStatement.newInstance(
                    "SELECT COUNT(*) FROM " + table + " WHERE due_at >= ? ALLOW FILTERING", EARLIEST));
            final long recent = count(SimpleStatement.newInstance(
                    "SELECT COUNT(*) FROM " + table + " WHERE created_at >= ? ALLOW FILTERING", weekAgo));
            return new NoteStats(total, withReminder, total - withReminder, recent);
        });
    }

    @Override
    public void clear() {
        execute("clear notes", () -> session.execute("TRUNCATE " + table));
        logger.info("Cleared the wide-column note store");
    }

    private CqlSession buildSession() {
        final CqlSessionBuilder builder = CqlSession.builder()
                .withLocalDatacenter(config.getDatacenter())
                .withConfigLoader(DriverConfigLoader.programmaticBuilder()
                        .withDuration(DefaultDriverOption.REQUEST_TIMEOUT, REQUEST_TIMEOUT)
                        .withDuration(DefaultDriverOption.CONNECTION_INIT_QUERY_TIMEOUT, REQUEST_TIMEOUT)
                        .withDuration(DefaultDriverOption.METADATA_SCHEMA_REQUEST_TIMEOUT, REQUEST_TIMEOUT)
                        .build());

        config.getContactPoints()
                .forEach(host -> builder.addContactPoint(new InetSocketAddress(host, config.getPort())));

        if (config.getUser().isPresent() && config.getPassword().isPresent()) {
            builder.withAuthCredentials(config.getUser().get(), config.getPassword().get());
        }

        return builder.build();
    }

    private List<Note> scanAll(final String operation) {
        return execute(operation, () ->
                StreamSupport.stream(session.execute(selectAll.bind()).spliterator(), false)
                        .map(this::toNote)
                        .toList());
    }

    private long count(final SimpleStatement statement) {
        final Row row = session.execute(statement).one();
        return row == null ? 0 : row.getLong(0);
    }

    private <T> T execute(final String operation, final CheckedFunction0<T> body) {
        return Try.of(body)
                .onFailure(ex -> logger.warning(exceptionHandler.getExceptionMessage(ex)))
                .mapFailure(
                        API.Case(API.$(instanceOf(InternalException.class)), ex -> ex),
                        API.Case(API.$(instanceOf(ExternalException.class)), ex -> ex),
                        API.Case(API.$(instanceOf(AllNodesFailedException.class)),
                                ex -> new BackendUnavailable("No Cassandra node could " + operation, ex)),
                        API.Case(API.$(instanceOf(DriverTimeoutException.class)),
                                ex -> new BackendUnavailable("Cassandra timed out trying to " + operation, ex)),
                        API.Case(API.$(), ex -> new QueryFailure("Failed to " + operation, ex)))
                .get();
    }

    private Note toNote(final Row row) {
        return new Note(
                new NoteId(BackendType.WIDE_COLUMN, row.getUuid("id").toString()),
                row.getString("title"),
                row.getString("content"),
                row.getInstant("due_at"),
                row.getInstant("created_at"));
    }

    private UUID toKey(final NoteId id) {
        return NoteIds.parseUuid(NoteIds.requireBackend(id, BackendType.WIDE_COLUMN));
    }
}
