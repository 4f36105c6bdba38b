package notestore.domain.time;

import jakarta.enterprise.context.ApplicationScoped;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Millisecond precision is the finest every supported engine can store, so all times are truncated to it.
 * Creation times never repeat: when two notes are added in the same millisecond the second one is pushed forward.
 */
@ApplicationScoped
public class MonotonicNoteClock implements NoteClock {

    private final AtomicLong lastCreationMillis = new AtomicLong(Long.MIN_VALUE);

    private final Clock clock;

    public MonotonicNoteClock() {
        this(Clock.systemUTC());
    }

    public MonotonicNoteClock(final Clock clock) {
        this.clock = clock;
    }

    @Override
    public Instant now() {
        return Instant.ofEpochMilli(clock.millis());
    }

    @Override
    public Instant nextCreationTime() {
        final long millis = lastCreationMillis.updateAndGet(last -> Math.max(last + 1, clock.millis()));
        return Instant.ofEpochMilli(millis);
    }
}
