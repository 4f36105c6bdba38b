package notestore.domain.harness;

import io.vavr.control.Try;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Any;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import notestore.domain.exceptionhandling.ExceptionHandler;
import notestore.domain.note.BackendType;
import notestore.domain.persist.NoteStore;
import notestore.domain.persist.NoteStoreLookup;
import org.jspecify.annotations.Nullable;

import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Runs every scenario and the benchmark against each configured backend and collects the results.
 * <p>
 * The in-memory store is the reference. Its observations for each scenario are recorded first, and a backend only
 * passes a scenario when it meets the expectations and observes the same thing. A backend that can not be started,
 * or a scenario that throws, is recorded as a failure and the run carries on with the rest.
 */
@ApplicationScoped
public class NotesHarness {
    @Inject
    private HarnessConfig harnessConfig;

    @Inject
    private NoteStoreLookup noteStoreLookup;

    @Inject
    private NoteStoreBenchmark noteStoreBenchmark;

    @Inject
    @Any
    private Instance<Scenario> scenarios;

    @Inject
    private ExceptionHandler exceptionHandler;

    @Inject
    private Logger logger;

    public HarnessReport run() {
        final List<Scenario> ordered = scenarios.stream()
                .sorted(Comparator.comparingInt(Scenario::getOrder))
                .toList();

        final Map<String, List<String>> reference = getReferenceObservations(ordered);

        final List<BackendReport> backends = harnessConfig.getBackends()
                .stream()
                .map(backend -> runBackend(backend, ordered, reference))
                .toList();

        return new HarnessReport(ordered.stream().map(Scenario::getName).toList(), backends);
    }

    private Map<String, List<String>> getReferenceObservations(final List<Scenario> ordered) {
        final NoteStore inMemory = noteStoreLookup.getNoteStore(BackendType.IN_MEMORY);
        final Map<String, List<String>> reference = new HashMap<>();

        for (final Scenario scenario : ordered) {
            inMemory.clear();
            // A reference that fails its own scenario leaves nothing to compare against
            Try.of(() -> scenario.run(inMemory))
                    .onSuccess(observations -> reference.put(scenario.getName(), observations))
                    .onFailure(ex -> logger.severe("The in-memory reference failed " + scenario.getName() + ": "
                            + exceptionHandler.getExceptionMessage(ex)));
        }

        cleanUp(inMemory);
        return reference;
    }

    private BackendReport runBackend(final BackendType backend,
                                     final List<Scenario> ordered,
                                     final Map<String, List<String>> reference) {
        logger.info("Exercising the " + backend + " note store");

        // Stores are constructed on first use, so this is where an unreachable engine shows up
        final Try<NoteStore> noteStore = Try.of(() -> noteStoreLookup.getNoteStore(backend))
                .andThenTry(NoteStore::getBackendType);

        if (noteStore.isFailure()) {
            final String message = exceptionHandler.getExceptionMessage(noteStore.getCause());
            logger.warning("The " + backend + " note store could not be started: " + message);
            return BackendReport.unavailable(backend, message);
        }

        final NoteStore store = noteStore.get();

        final List<ScenarioResult> results = ordered.stream()
                .map(scenario -> runScenario(store, scenario, reference.get(scenario.getName())))
                .toList();

        final Try<BenchmarkResult> benchmark = Try.run(store::clear)
                .mapTry(v -> noteStoreBenchmark.run(store, harnessConfig.getBenchmarkSize()))
                .onFailure(ex -> logger.warning("The " + backend + " benchmark failed: "
                        + exceptionHandler.getExceptionMessage(ex)));

        cleanUp(store);

        return new BackendReport(
                backend,
                null,
                results,
                benchmark.getOrNull(),
                benchmark.isFailure() ? exceptionHandler.getExceptionMessage(benchmark.getCause()) : null);
    }

    private ScenarioResult runScenario(final NoteStore store,
                                       final Scenario scenario,
                                       @Nullable final List<String> reference) {
        final Try<List<String>> observations = Try.run(store::clear)
                .mapTry(v -> scenario.run(store));

        if (observations.isFailure()) {
            final String message = exceptionHandler.getExceptionMessage(observations.getCause());
            logger.warning(store.getBackendType() + " failed " + scenario.getName() + ": " + message);
            return ScenarioResult.failed(scenario.getName(), message);
        }

        if (reference == null) {
            return ScenarioResult.failed(scenario.getName(), "There is no reference result to compare with",
                    observations.get());
        }

        if (!Objects.equals(reference, observations.get())) {
            final String message = "Observed " + observations.get() + " but the reference observed " + reference;
            logger.warning(store.getBackendType() + " differs from the reference in " + scenario.getName() + ": "
                    + message);
            return ScenarioResult.failed(scenario.getName(), message, observations.get());
        }

        return ScenarioResult.passed(scenario.getName(), observations.get());
    }

    /**
     * Leaves the store empty. A failure here does not change the results, so it is only logged.
     */
    private void cleanUp(final NoteStore store) {
        Try.run(store::clear)
                .onFailure(ex -> logger.warning("Failed to clean up the " + store.getBackendType() + " note store: "
                        + exceptionHandler.getExceptionMessage(ex)));
    }
}
