package notestore.domain.time;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class MonotonicNoteClockTest {
    @Test
    public void testTruncatesToMillis() {
        final Clock fixed = Clock.fixed(Instant.parse("2024-03-01T10:15:30.123456789Z"), ZoneOffset.UTC);
        final MonotonicNoteClock clock = new MonotonicNoteClock(fixed);

        assertEquals(Instant.parse("2024-03-01T10:15:30.123Z"), clock.now());
    }

    @Test
    public void testCreationTimesNeverRepeat() {
        final Clock fixed = Clock.fixed(Instant.parse("2024-03-01T10:15:30.123Z"), ZoneOffset.UTC);
        final MonotonicNoteClock clock = new MonotonicNoteClock(fixed);

        assertEquals(Instant.parse("2024-03-01T10:15:30.123Z"), clock.nextCreationTime());
        assertEquals(Instant.parse("2024-03-01T10:15:30.124Z"), clock.nextCreationTime());
        assertEquals(Instant.parse("2024-03-01T10:15:30.125Z"), clock.nextCreationTime());
    }
}
