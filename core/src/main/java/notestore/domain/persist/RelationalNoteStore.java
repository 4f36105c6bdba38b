package notestore.domain.persist;

import io.vavr.API;
import io.vavr.CheckedFunction1;
import io.vavr.control.Try;
import jakarta.annotation.PostConstruct;
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
import notestore.domain.persist.config.RelationalConfig;
import notestore.domain.time.NoteClock;
import notestore.domain.validate.ValidateNote;
import org.apache.commons.lang3.StringUtils;
import org.jspecify.annotations.Nullable;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Properties;
import java.util.logging.Logger;

import static com.google.common.base.Predicates.instanceOf;

/**
 * Stores notes in a SQL table through plain JDBC. The statements stick to syntax shared by H2 and PostgreSQL.
 * A connection is opened for every call and closed before it returns, so the store holds no connection state.
 */
@ApplicationScoped
public class RelationalNoteStore implements NoteStore {
    private static final String[] SCHEMA = {
            """
            CREATE TABLE IF NOT EXISTS notes
            (id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
            title VARCHAR(1024) NOT NULL,
            content VARCHAR(1000000) NOT NULL,
            due_at TIMESTAMP WITH TIME ZONE,
            created_at TIMESTAMP WITH TIME ZONE NOT NULL)""",
            "CREATE INDEX IF NOT EXISTS idx_notes_created_at ON notes(created_at)",
            "CREATE INDEX IF NOT EXISTS idx_notes_due_at ON notes(due_at)"
    };

    private static final String COLUMNS = "id, title, content, due_at, created_at";

    @Inject
    private RelationalConfig config;

    @Inject
    private NoteClock clock;

    @Inject
    private ValidateNote validateNote;

    @Inject
    private ExceptionHandler exceptionHandler;

    @Inject
    private Logger logger;

    @PostConstruct
    public void postConstruct() {
        logger.info("Initializing the relational note store at " + config.getUrl());

        Try.withResources(this::openConnection)
                .of(connection -> {
                    try (Statement statement = connection.createStatement()) {
                        for (final String ddl : SCHEMA) {
                            statement.execute(ddl.stripIndent());
                        }
                    }
                    return connection.getMetaData().getDatabaseProductName();
                })
                .onSuccess(product -> logger.info("Initialized the relational note store on " + product))
                .onFailure(ex -> logger.warning(exceptionHandler.getExceptionMessage(ex)))
                .mapFailure(
                        API.Case(API.$(instanceOf(BackendUnavailable.class)), ex -> ex),
                        API.Case(API.$(), ex -> new BackendUnavailable("Failed to create the relational schema", ex)))
                .get();
    }

    @Override
    public BackendType getBackendType() {
        return BackendType.RELATIONAL;
    }

    @Override
    public NoteId parseId(final String raw) {
        final NoteId id = new NoteId(BackendType.RELATIONAL, StringUtils.trimToEmpty(raw));
        return new NoteId(BackendType.RELATIONAL, Long.toString(NoteIds.parsePositiveLong(id)));
    }

    @Override
    public NoteId add(final String title, final String content, @Nullable final Instant dueAt) {
        validateNote.throwIfBlank(title, "title");
        validateNote.throwIfBlank(content, "content");

        final Instant due = validateNote.normalize(dueAt);
        final Instant createdAt = clock.nextCreationTime();

        final long key = withConnection("add a note", connection -> {
            try (PreparedStatement statement = connection.prepareStatement(
                    "INSERT INTO notes (title, content, due_at, created_at) VALUES (?, ?, ?, ?)",
                    Statement.RETURN_GENERATED_KEYS)) {
                statement.setString(1, title);
                statement.setString(2, content);
                setTimestamp(statement, 3, due);
                setTimestamp(statement, 4, createdAt);
                statement.executeUpdate();

                try (ResultSet keys = statement.getGeneratedKeys()) {
                    if (!keys.next()) {
                        throw new QueryFailure("The database did not return the id of the new note");
                    }
                    return keys.getLong(1);
                }
            }
        });

        final NoteId id = new NoteId(BackendType.RELATIONAL, Long.toString(key));
        logger.info("Added note " + id);
        return id;
    }

    @Override
    public Optional<Note> get(final NoteId id) {
        final long key = toKey(id);
        logger.fine("Getting note " + id);

        return withConnection("get a note", connection -> {
            try (PreparedStatement statement = connection.prepareStatement(
                    "SELECT " + COLUMNS + " FROM notes WHERE id = ?")) {
                statement.setLong(1, key);
                return readNotes(statement).stream().findFirst();
            }
        });
    }

    @Override
    public boolean delete(final NoteId id) {
        final long key = toKey(id);

        final boolean deleted = withConnection("delete a note", connection -> {
            try (PreparedStatement statement = connection.prepareStatement("DELETE FROM notes WHERE id = ?")) {
                statement.setLong(1, key);
                return statement.executeUpdate() > 0;
            }
        });

        logger.info("Deleted note " + id + ": " + deleted);
        return deleted;
    }

    @Override
    public boolean update(final NoteId id, final NoteUpdate update) {
        final long key = toKey(id);
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
            values.add(toTimestamp(validated.dueAt()));
        }

        final boolean updated = withConnection("update a note", connection -> {
            try (PreparedStatement statement = connection.prepareStatement(
                    "UPDATE notes SET " + String.join(", ", assignments) + " WHERE id = ?")) {
                for (int i = 0; i < values.size(); i++) {
                    statement.setObject(i + 1, values.get(i));
                }
                statement.setLong(values.size() + 1, key);
                return statement.executeUpdate() > 0;
            }
        });

        logger.info("Updated note " + id + ": " + updated);
        return updated;
    }

    @Override
    public List<Note> search(final String query, final int limit) {
        validateNote.validateQuery(query);
        validateNote.validateLimit(limit);

        final String pattern = SearchPatterns.containsLikePattern(query);

        return withConnection("search notes", connection -> {
            try (PreparedStatement statement = connection.prepareStatement("""
                    SELECT %s FROM notes
                    WHERE LOWER(title) LIKE ? ESCAPE '\\'
                    OR LOWER(content) LIKE ? ESCAPE '\\'
                    ORDER BY created_at DESC, id DESC
                    LIMIT ?""".formatted(COLUMNS))) {
                statement.setString(1, pattern);
                statement.setString(2, pattern);
                statement.setInt(3, limit);
                return readNotes(statement);
            }
        });
    }

    @Override
    public List<Note> recent(final int limit) {
        validateNote.validateLimit(limit);

        return withConnection("list recent notes", connection -> {
            try (PreparedStatement statement = connection.prepareStatement(
                    "SELECT " + COLUMNS + " FROM notes ORDER BY created_at DESC, id DESC LIMIT ?")) {
                statement.setInt(1, limit);
                return readNotes(statement);
            }
        });
    }

    @Override
    public List<Note> upcomingReminders(final int hours) {
        validateNote.validateHours(hours);

        final Instant now = clock.now();

        return withConnection("list reminders", connection -> {
            try (PreparedStatement statement = connection.prepareStatement("""
                    SELECT %s FROM notes
                    WHERE due_at IS NOT NULL
                    AND due_at >= ?
                    AND due_at <= ?
                    ORDER BY due_at ASC, id ASC""".formatted(COLUMNS))) {
                setTimestamp(statement, 1, now);
                setTimestamp(statement, 2, now.plus(Duration.ofHours(hours)));
                return readNotes(statement);
            }
        });
    }

    @Override
    public NoteStats stats() {
        final Instant weekAgo = clock.now().minus(Duration.ofDays(7));

        return withConnection("count notes", connection -> {
            try (PreparedStatement statement = connection.prepareStatement("""
                    SELECT COUNT(*),
                    COUNT(due_at),
                    COALESCE(SUM(CASE WHEN created_at >= ? THEN 1 ELSE 0 END), 0)
                    FROM notes""")) {
                setTimestamp(statement, 1, weekAgo);
                try (ResultSet resultSet = statement.executeQuery()) {
                    resultSet.next();
                    final long total = resultSet.getLong(1);
                    final long withReminder = resultSet.getLong(2);
                    return new NoteStats(total, withReminder, total - withReminder, resultSet.getLong(3));
                }
            }
        });
    }

    @Override
    public void clear() {
        withConnection("clear notes", connection -> {
            try (Statement statement = connection.createStatement()) {
                return statement.executeUpdate("DELETE FROM notes");
            }
        });
        logger.info("Cleared the relational note store");
    }

    private Connection openConnection() {
        final Properties properties = new Properties();
        config.getUser().ifPresent(user -> properties.setProperty("user", user));
        config.getPassword().ifPresent(password -> properties.setProperty("password", password));

        return Try.of(() -> DriverManager.getConnection(config.getUrl(), properties))
                .getOrElseThrow(ex -> new BackendUnavailable("Failed to connect to " + config.getUrl(), ex));
    }

    /**
     * Runs the body with a fresh connection. Errors already in the note store taxonomy pass through, anything the
     * driver throws becomes a QueryFailure.
     */
    private <T> T withConnection(final String operation, final CheckedFunction1<Connection, T> body) {
        return Try.withResources(this::openConnection)
                .of(body)
                .onFailure(ex -> logger.warning(exceptionHandler.getExceptionMessage(ex)))
                .mapFailure(
                        API.Case(API.$(instanceOf(InternalException.class)), ex -> ex),
                        API.Case(API.$(instanceOf(ExternalException.class)), ex -> ex),
                        API.Case(API.$(), ex -> new QueryFailure("Failed to " + operation, ex)))
                .get();
    }

    private List<Note> readNotes(final PreparedStatement statement) throws SQLException {
        try (ResultSet resultSet = statement.executeQuery()) {
            final List<Note> notes = new ArrayList<>();
            while (resultSet.next()) {
                notes.add(new Note(
                        new NoteId(BackendType.RELATIONAL, Long.toString(resultSet.getLong("id"))),
                        resultSet.getString("title"),
                        resultSet.getString("content"),
                        toInstant(resultSet.getObject("due_at", OffsetDateTime.class)),
                        toInstant(resultSet.getObject("created_at", OffsetDateTime.class))));
            }
            return notes;
        }
    }

    private long toKey(final NoteId id) {
        return NoteIds.parsePositiveLong(NoteIds.requireBackend(id, BackendType.RELATIONAL));
    }

    private static void setTimestamp(final PreparedStatement statement, final int index, @Nullable final Instant instant)
            throws SQLException {
        if (instant == null) {
            statement.setNull(index, Types.TIMESTAMP_WITH_TIMEZONE);
        } else {
            statement.setObject(index, toTimestamp(instant));
        }
    }

    @Nullable
    private static OffsetDateTime toTimestamp(@Nullable final Instant instant) {
        return instant == null ? null : instant.atOffset(ZoneOffset.UTC);
    }

    @Nullable
    private static Instant toInstant(@Nullable final OffsetDateTime timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
