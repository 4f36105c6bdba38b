package notestore.domain.persist;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import notestore.domain.note.BackendType;

/**
 * Resolves the adapter for a backend. Adapters are only constructed, and so only connect, when they are first
 * looked up.
 */
@ApplicationScoped
public class NoteStoreLookup {
    @Inject
    private Instance<RelationalNoteStore> relational;

    @Inject
    private Instance<DocumentNoteStore> document;

    @Inject
    private Instance<GraphNoteStore> graph;

    @Inject
    private Instance<WideColumnNoteStore> wideColumn;

    @Inject
    private Instance<InMemoryNoteStore> inMemory;

    @Inject
    private Instance<RemoteNoteStore> remote;

    public NoteStore getNoteStore(final BackendType backendType) {
        return switch (backendType) {
            case RELATIONAL -> relational.get();
            case DOCUMENT -> document.get();
            case GRAPH -> graph.get();
            case WIDE_COLUMN -> wideColumn.get();
            case IN_MEMORY -> inMemory.get();
            case REMOTE_PROXY -> remote.get();
        };
    }
}
