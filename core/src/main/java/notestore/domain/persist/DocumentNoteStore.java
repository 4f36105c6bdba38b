package notestore.domain.persist;

import com.mongodb.ConnectionString;
import com.mongodb.MongoClientSettings;
import com.mongodb.MongoSocketException;
import com.mongodb.MongoTimeoutException;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoDatabase;
import com.mongodb.client.model.Filters;
import com.mongodb.client.model.Indexes;
import com.mongodb.client.model.Sorts;
import com.mongodb.client.model.Updates;
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
import notestore.domain.exceptions.InvalidIdentifier;
import notestore.domain.exceptions.QueryFailure;
import notestore.domain.note.BackendType;
import notestore.domain.note.Note;
import notestore.domain.note.NoteId;
import notestore.domain.note.NoteStats;
import notestore.domain.note.NoteUpdate;
import notestore.domain.persist.config.DocumentConfig;
import notestore.domain.time.NoteClock;
import notestore.domain.validate.ValidateNote;
import org.apache.commons.lang3.StringUtils;
import org.bson.Document;
import org.bson.conversions.Bson;
import org.bson.types.ObjectId;
import org.jspecify.annotations.Nullable;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

import static com.google.common.base.Predicates.instanceOf;

/**
 * Stores notes as MongoDB documents. The client is thread safe and pools its own connections, so one client is
 * shared by every call.
 */
@ApplicationScoped
public class DocumentNoteStore implements NoteStore {
    private static final String ID = "_id";
    private static final String TITLE = "title";
    private static final String CONTENT = "content";
    private static final String DUE_AT = "due_at";
    private static final String CREATED_AT = "created_at";

    private static final Bson NEWEST_FIRST = Sorts.orderBy(Sorts.descending(CREATED_AT), Sorts.descending(ID));

    @Inject
    private DocumentConfig config;

    @Inject
    private NoteClock clock;

    @Inject
    private ValidateNote validateNote;

    @Inject
    private ExceptionHandler exceptionHandler;

    @Inject
    private Logger logger;

    private MongoClient client;

    private MongoCollection<Document> collection;

    @PostConstruct
    public void postConstruct() {
        logger.info("Initializing the document note store at " + config.getUri());

        final MongoClientSettings settings = MongoClientSettings.builder()
                .applyConnectionString(new ConnectionString(config.getUri()))
                .applyToClusterSettings(builder ->
                        builder.serverSelectionTimeout(config.getTimeoutSeconds(), TimeUnit.SECONDS))
                .applyToSocketSettings(builder ->
                        builder.connectTimeout(config.getTimeoutSeconds(), TimeUnit.SECONDS))
                .build();

        client = MongoClients.create(settings);

        Try.run(() -> {
                    final MongoDatabase database = client.getDatabase(config.getDatabase());
                    database.runCommand(new Document("ping", 1));
                    collection = database.getCollection(config.getCollection());
                    collection.createIndex(Indexes.compoundIndex(
                            Indexes.ascending(TITLE, CONTENT, DUE_AT),
                            Indexes.descending(CREATED_AT)));
                })
                .onSuccess(v -> logger.info("Initialized the document note store"))
                .onFailure(ex -> logger.warning(exceptionHandler.getExceptionMessage(ex)))
                .onFailure(ex -> client.close())
                .mapFailure(API.Case(API.$(), ex -> new BackendUnavailable(
                        "Failed to connect to MongoDB at " + config.getUri(), ex)))
                .get();
    }

    @PreDestroy
    public void preDestroy() {
        if (client != null) {
            client.close();
            client = null;
        }
    }

    @Override
    public BackendType getBackendType() {
        return BackendType.DOCUMENT;
    }

    @Override
    public NoteId parseId(final String raw) {
        final ObjectId key = toKey(new NoteId(BackendType.DOCUMENT, StringUtils.trimToEmpty(raw)));
        return new NoteId(BackendType.DOCUMENT, key.toHexString());
    }

    @Override
    public NoteId add(final String title, final String content, @Nullable final Instant dueAt) {
        validateNote.throwIfBlank(title, "title");
        validateNote.throwIfBlank(content, "content");

        final Document document = new Document(TITLE, title)
                .append(CONTENT, content)
                .append(DUE_AT, toDate(validateNote.normalize(dueAt)))
                .append(CREATED_AT, toDate(clock.nextCreationTime()));

        final ObjectId key = execute("add a note", () -> collection.insertOne(document)
                .getInsertedId()
                .asObjectId()
                .getValue());

        final NoteId id = new NoteId(BackendType.DOCUMENT, key.toHexString());
        logger.info("Added note " + id);
        return id;
    }

    @Override
    public Optional<Note> get(final NoteId id) {
        final ObjectId key = toKey(id);
        logger.fine("Getting note " + id);

        return execute("get a note", () -> Optional.ofNullable(collection.find(Filters.eq(ID, key)).first())
                .map(this::toNote));
    }

    @Override
    public boolean delete(final NoteId id) {
        final ObjectId key = toKey(id);

        final boolean deleted = execute("delete a note",
                () -> collection.deleteOne(Filters.eq(ID, key)).getDeletedCount() > 0);

        logger.info("Deleted note " + id + ": " + deleted);
        return deleted;
    }

    @Override
    public boolean update(final NoteId id, final NoteUpdate update) {
        final ObjectId key = toKey(id);
        final NoteUpdate validated = validateNote.validateUpdate(update);

        if (validated.isEmpty()) {
            return false;
        }

        final List<Bson> changes = new ArrayList<>();
        if (validated.title() != null) {
            changes.add(Updates.set(TITLE, validated.title()));
        }
        if (validated.content() != null) {
            changes.add(Updates.set(CONTENT, validated.content()));
        }
        if (validated.dueAt() != null) {
            changes.add(Updates.set(DUE_AT, toDate(validated.dueAt())));
        }

        final boolean updated = execute("update a note",
                () -> collection.updateOne(Filters.eq(ID, key), Updates.combine(changes)).getMatchedCount() > 0);

        logger.info("Updated note " + id + ": " + updated);
        return updated;
    }

    @Override
    public List<Note> search(final String query, final int limit) {
        validateNote.validateQuery(query);
        validateNote.validateLimit(limit);

        final String pattern = SearchPatterns.escapeRegex(query);
        final Bson filter = Filters.or(Filters.regex(TITLE, pattern, "i"), Filters.regex(CONTENT, pattern, "i"));

        return execute("search notes", () -> collection.find(filter)
                .sort(NEWEST_FIRST)
                .limit(limit)
                .map(this::toNote)
                .into(new ArrayList<>()));
    }

    @Override
    public List<Note> recent(final int limit) {
        validateNote.validateLimit(limit);

        return execute("list recent notes", () -> collection.find()
                .sort(NEWEST_FIRST)
                .limit(limit)
                .map(this::toNote)
                .into(new ArrayList<>()));
    }

    @Override
    public List<Note> upcomingReminders(final int hours) {
        validateNote.validateHours(hours);

        final Instant now = clock.now();
        final Bson filter = Filters.and(
                Filters.ne(DUE_AT, null),
                Filters.gte(DUE_AT, toDate(now)),
                Filters.lte(DUE_AT, toDate(now.plus(Duration.ofHours(hours)))));

        return execute("list reminders", () -> collection.find(filter)
                .sort(Sorts.orderBy(Sorts.ascending(DUE_AT), Sorts.ascending(ID)))
                .map(this::toNote)
                .into(new ArrayList<>()));
    }

    @Override
    public NoteStats stats() {
        final Date weekAgo = toDate(clock.now().minus(Duration.ofDays(7)));

        return execute("count notes", () -> {
            final long total = collection.countDocuments();
            final long withReminder = collection.countDocuments(Filters.ne(DUE_AT, null));
            final long recent = collection.countDocuments(Filters.gte(CREATED_AT, weekAgo));
            return new NoteStats(total, withReminder, total - withReminder, recent);
        });
    }

    @Override
    public void clear() {
        execute("clear notes", () -> collection.deleteMany(new Document()).getDeletedCount());
        logger.info("Cleared the document note store");
    }

    private <T> T execute(final String operation, final CheckedFunction0<T> body) {
        return Try.of(body)
                .onFailure(ex -> logger.warning(exceptionHandler.getExceptionMessage(ex)))
                .mapFailure(
                        API.Case(API.$(instanceOf(InternalException.class)), ex -> ex),
                        API.Case(API.$(instanceOf(ExternalException.class)), ex -> ex),
                        API.Case(API.$(instanceOf(MongoTimeoutException.class)),
                                ex -> new BackendUnavailable("MongoDB did not respond while trying to " + operation, ex)),
                        API.Case(API.$(instanceOf(MongoSocketException.class)),
                                ex -> new BackendUnavailable("Lost the connection to MongoDB while trying to " + operation, ex)),
                        API.Case(API.$(), ex -> new QueryFailure("Failed to " + operation, ex)))
                .get();
    }

    private Note toNote(final Document document) {
        return new Note(
                new NoteId(BackendType.DOCUMENT, document.getObjectId(ID).toHexString()),
                document.getString(TITLE),
                document.getString(CONTENT),
                toInstant(document.getDate(DUE_AT)),
                toInstant(document.getDate(CREATED_AT)));
    }

    private ObjectId toKey(final NoteId id) {
        NoteIds.requireBackend(id, BackendType.DOCUMENT);

        if (!ObjectId.isValid(id.value())) {
            throw new InvalidIdentifier("The id \"" + id.value() + "\" is not a 24 character hex ObjectId");
        }

        return new ObjectId(id.value());
    }

    @Nullable
    private static Date toDate(@Nullable final Instant instant) {
        return instant == null ? null : Date.from(instant);
    }

    @Nullable
    private static Instant toInstant(@Nullable final Date date) {
        return date == null ? null : date.toInstant();
    }
}
