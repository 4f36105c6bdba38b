package notestore.domain.harness;

import notestore.domain.note.Note;

import java.util.List;
import java.util.Objects;

/**
 * Checks used by scenarios. Each failed check throws {@link ScenarioFailed}.
 */
public final class Expectations {
    private Expectations() {
    }

    public static void check(final boolean condition, final String message) {
        if (!condition) {
            throw new ScenarioFailed(message);
        }
    }

    public static <T> T equal(final T expected, final T actual, final String what) {
        if (!Objects.equals(expected, actual)) {
            throw new ScenarioFailed(what + ": expected " + expected + " but was " + actual);
        }
        return actual;
    }

    /**
     * Runs the call and expects it to throw the given exception.
     *
     * @return The simple name of the exception, as an observation
     */
    public static String raises(final Class<? extends Exception> expected, final Runnable call, final String what) {
        try {
            call.run();
        } catch (final Exception ex) {
            if (expected.isInstance(ex)) {
                return what + ":" + expected.getSimpleName();
            }
            throw new ScenarioFailed(what + ": expected " + expected.getSimpleName() + " but got "
                    + ex.getClass().getSimpleName() + " " + ex.getMessage(), ex);
        }
        throw new ScenarioFailed(what + ": expected " + expected.getSimpleName() + " but nothing was thrown");
    }

    public static List<String> titles(final List<Note> notes) {
        return notes.stream().map(Note::title).toList();
    }
}
