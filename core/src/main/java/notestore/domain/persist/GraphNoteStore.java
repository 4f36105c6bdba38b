package notestore.domain.persist;

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
import notestore.domain.persist.config.GraphConfig;
import notestore.domain.time.NoteClock;
import notestore.domain.validate.ValidateNote;
import org.apache.commons.lang3.StringUtils;
import org.jspecify.annotations.Nullable;
import org.neo4j.driver.AuthToken;
import org.neo4j.driver.AuthTokens;
import org.neo4j.driver.Driver;
import org.neo4j.driver.GraphDatabase;
import org.neo4j.driver.Record;
import org.neo4j.driver.Session;
import org.neo4j.driver.SessionConfig;
import org.neo4j.driver.TransactionCallback;
import org.neo4j.driver.Value;
import org.neo4j.driver.exceptions.ServiceUnavailableException;
import org.neo4j.driver.exceptions.SessionExpiredException;
import org.neo4j.driver.types.Node;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.logging.Logger;

import static com.google.common.base.Predicates.instanceOf;

/**
 * Stores each note as a {@code :Note} node. The driver is thread safe and pools connections; every call borrows a
 * session and returns it before the call ends.
 */
@ApplicationScoped
public class GraphNoteStore implements NoteStore {
    private static final List<String> SCHEMA = List.of(
            "CREATE CONSTRAINT note_id_unique IF NOT EXISTS FOR (n:Note) REQUIRE n.id IS UNIQUE",
            "CREATE INDEX note_created_at IF NOT EXISTS FOR (n:Note) ON (n.created_at)",
            "CREATE INDEX note_due_at IF NOT EXISTS FOR (n:Note) ON (n.due_at)");

    @Inject
    private GraphConfig config;

    @Inject
    private NoteClock clock;

    @Inject
    private ValidateNote validateNote;

    @Inject
    private ExceptionHandler exceptionHandler;

    @Inject
    private Logger logger;

    private Driver driver;

    @PostConstruct
    public void postConstruct() {
        logger.info("Initializing the graph note store at " + config.getUri());

        final AuthToken authToken = config.getPassword()
                .map(password -> AuthTokens.basic(config.getUser(), password))
                .orElseGet(AuthTokens::none);

        Try.run(() -> {
                    driver = GraphDatabase.driver(config.getUri(), authToken);
                    driver.verifyConnectivity();
                    try (Session session = driver.session(sessionConfig())) {
                        // Schema changes can not run inside an explicit transaction
                        SCHEMA.forEach(statement -> session.run(statement).consume());
                    }
                })
                .onSuccess(v -> logger.info("Initialized the graph note store"))
                .onFailure(ex -> logger.warning(exceptionHandler.getExceptionMessage(ex)))
                .onFailure(ex -> preDestroy())
                .mapFailure(API.Case(API.$(), ex -> new BackendUnavailable(
                        "Failed to connect to Neo4j at " + config.getUri(), ex)))
                .get();
    }

    @PreDestroy
    public void preDestroy() {
        if (driver != null) {
            driver.close();
            driver = null;
        }
    }

    @Override
    public BackendType getBackendType() {
        return BackendType.GRAPH;
    }

    @Override
    public NoteId parseId(final String raw) {
        final String key = toKey(new NoteId(BackendType.GRAPH, StringUtils.trimToEmpty(raw)));
        return new NoteId(BackendType.GRAPH, key);
    }

    @Override
    public NoteId add(final String title, final String content, @Nullable final Instant dueAt) {
        validateNote.throwIfBlank(title, "title");
        validateNote.throwIfBlank(content, "content");

        final String key = UUID.randomUUID().toString();
        final Map<String, Object> parameters = new HashMap<>();
        parameters.put("id", key);
        parameters.put("title", title);
        parameters.put("content", content);
        parameters.put("due_at", toDateTime(validateNote.normalize(dueAt)));
        parameters.put("created_at", toDateTime(clock.nextCreationTime()));

        write("add a note", tx -> tx.run("""
                CREATE (n:Note {id: $id, title: $title, content: $content, due_at: $due_at, created_at: $created_at})""",
                parameters).consume());

        final NoteId id = new NoteId(BackendType.GRAPH, key);
        logger.info("Added note " + id);
        return id;
    }

    @Override
    public Optional<Note> get(final NoteId id) {
        final String key = toKey(id);
        logger.fine("Getting note " + id);

        return read("get a note", tx -> tx.run("MATCH (n:Note {id: $id}) RETURN n", Map.of("id", key))
                .list(this::toNote))
                .stream()
                .findFirst();
    }

    @Override
    public boolean delete(final NoteId id) {
        final String key = toKey(id);

        final boolean deleted = write("delete a note", tx -> tx.run(
                        "MATCH (n:Note {id: $id}) DETACH DELETE n", Map.of("id", key))
                .consume()
                .counters()
                .nodesDeleted() > 0);

        logger.info("Deleted note " + id + ": " + deleted);
        return deleted;
    }

    @Override
    public boolean update(final NoteId id, final NoteUpdate update) {
        final String key = toKey(id);
        final NoteUpdate validated = validateNote.validateUpdate(update);

        if (validated.isEmpty()) {
            return false;
        }

        final List<String> assignments = new ArrayList<>();
        final Map<String, Object> parameters = new HashMap<>();
        parameters.put("id", key);
        if (validated.title() != null) {
            assignments.add("n.title = $title");
            parameters.put("title", validated.title());
        }
        if (validated.content() != null) {
            assignments.add("n.content = $content");
            parameters.put("content", validated.content());
        }
        if (validated.dueAt() != null) {
            assignments.add("n.due_at = $due_at");
            parameters.put("due_at", toDateTime(validated.dueAt()));
        }

        final boolean updated = write("update a note", tx -> !tx.run(
                        "MATCH (n:Note {id: $id}) SET " + String.join(", ", assignments) + " RETURN n.id",
                        parameters)
                .list()
                .isEmpty());

        logger.info("Updated note " + id + ": " + updated);
        return updated;
    }

    @Override
    public List<Note> search(final String query, final int limit) {
        validateNote.validateQuery(query);
        validateNote.validateLimit(limit);

        // Cypher regular expressions use Java syntax: case insensitive, unicode aware, and dot matches new lines
        final String pattern = "(?isu).*" + SearchPatterns.escapeRegex(query) + ".*";

        return read("search notes", tx -> tx.run("""
                        MATCH (n:Note)
                        WHERE n.title =~ $pattern OR n.content =~ $pattern
                        RETURN n
                        ORDER BY n.created_at DESC, n.id DESC
                        LIMIT $limit""",
                Map.of("pattern", pattern, "limit", limit)).list(this::toNote));
    }

    @Override
    public List<Note> recent(final int limit) {
        validateNote.validateLimit(limit);

        return read("list recent notes", tx -> tx.run(
                "MATCH (n:Note) RETURN n ORDER BY n.created_at DESC, n.id DESC LIMIT $limit",
                Map.of("limit", limit)).list(this::toNote));
    }

    @Override
    public List<Note> upcomingReminders(final int hours) {
        validateNote.validateHours(hours);

        final Instant now = clock.now();

        return read("list reminders", tx -> tx.run("""
                        MATCH (n:Note)
                        WHERE n.due_at IS NOT NULL AND n.due_at >= $now AND n.due_at <= $end
                        RETURN n
                        ORDER BY n.due_at ASC, n.id ASC""",
                Map.of("now", toDateTime(now), "end", toDateTime(now.plus(Duration.ofHours(hours)))))
                .list(this::toNote));
    }

    @Override
    public NoteStats stats() {
        final ZonedDateTime weekAgo = toDateTime(clock.now().minus(Duration.ofDays(7)));

        return read("count notes", tx -> {
            final Record record = tx.run("""
                            MATCH (n:Note)
                            RETURN count(n) AS total,
                            count(n.due_at) AS with_reminder,
                            sum(CASE WHEN n.created_at >= $week_ago THEN 1 ELSE 0 END) AS recent""",
                    Map.of("week_ago", weekAgo)).single();
            final long total = record.get("total").asLong();
            final long withReminder = record.get("with_reminder").asLong();
            return new NoteStats(total, withReminder, total - withReminder, record.get("recent").asLong());
        });
    }

    @Override
    public void clear() {
        write("clear notes", tx -> tx.run("MATCH (n:Note) DETACH DELETE n").consume());
        logger.info("Cleared the graph note store");
    }

    private SessionConfig sessionConfig() {
        return config.getDatabase()
                .filter(StringUtils::isNotBlank)
                .map(SessionConfig::forDatabase)
                .orElseGet(SessionConfig::defaultConfig);
    }

    private <T> T read(final String operation, final TransactionCallback<T> work) {
        return execute(operation, () -> {
            try (Session session = driver.session(sessionConfig())) {
                return session.executeRead(work);
            }
        });
    }

    private <T> T write(final String operation, final TransactionCallback<T> work) {
        return execute(operation, () -> {
            try (Session session = driver.session(sessionConfig())) {
                return session.executeWrite(work);
            }
        });
    }

    private <T> T execute(final String operation, final CheckedFunction0<T> body) {
        return Try.of(body)
                .onFailure(ex -> logger.warning(exceptionHandler.getExceptionMessage(ex)))
                .mapFailure(
                        API.Case(API.$(instanceOf(InternalException.class)), ex -> ex),
                        API.Case(API.$(instanceOf(ExternalException.class)), ex -> ex),
                        API.Case(API.$(instanceOf(ServiceUnavailableException.class)),
                                ex -> new BackendUnavailable("Neo4j is unavailable, failed to " + operation, ex)),
                        API.Case(API.$(instanceOf(SessionExpiredException.class)),
                                ex -> new BackendUnavailable("The Neo4j session expired, failed to " + operation, ex)),
                        API.Case(API.$(), ex -> new QueryFailure("Failed to " + operation, ex)))
                .get();
    }

    private Note toNote(final Record record) {
        final Node node = record.get("n").asNode();
        return new Note(
                new NoteId(BackendType.GRAPH, node.get("id").asString()),
                node.get("title").asString(),
                node.get("content").asString(),
                toInstant(node.get("due_at")),
                toInstant(node.get("created_at")));
    }

    private String toKey(final NoteId id) {
        return NoteIds.parseUuid(NoteIds.requireBackend(id, BackendType.GRAPH)).toString();
    }

    @Nullable
    private static ZonedDateTime toDateTime(@Nullable final Instant instant) {
        return instant == null ? null : instant.atZone(ZoneOffset.UTC);
    }

    @Nullable
    private static Instant toInstant(final Value value) {
        return value.isNull() ? null : value.asZonedDateTime().toInstant();
    }
}
