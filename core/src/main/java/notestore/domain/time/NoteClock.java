package notestore.domain.time;

import java.time.Instant;

/**
 * The source of time for every note store.
 */
public interface NoteClock {
    /**
     * @return The current time, truncated to milliseconds
     */
    Instant now();

    /**
     * A creation timestamp. Each call returns a value strictly later than the previous call, so notes created by
     * this process always have distinct, ordered creation times.
     *
     * @return The creation time for a new note, truncated to milliseconds
     */
    Instant nextCreationTime();
}
