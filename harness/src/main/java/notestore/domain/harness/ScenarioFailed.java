package notestore.domain.harness;

/**
 * Represents a scenario whose expectations were not met by a note store.
 */
public class ScenarioFailed extends RuntimeException {
    public ScenarioFailed() {
        super();
    }

    public ScenarioFailed(final String message) {
        super(message);
    }

    public ScenarioFailed(final String message, final Throwable cause) {
        super(message, cause);
    }

    public ScenarioFailed(final Throwable cause) {
        super(cause);
    }
}
