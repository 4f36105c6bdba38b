package notestore.domain.validate;

import notestore.domain.exceptions.ValidationFailed;
import notestore.domain.note.NoteUpdate;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class ValidateNoteFieldsTest {
    private final ValidateNoteFields validateNote = new ValidateNoteFields();

    @Test
    public void testBlankText() {
        assertEquals("x", validateNote.throwIfBlank("x", "title"));
        assertThrows(ValidationFailed.class, () -> validateNote.throwIfBlank(null, "title"));
        assertThrows(ValidationFailed.class, () -> validateNote.throwIfBlank(" \n\t", "content"));
    }

    @Test
    public void testUpdateChecksOnlySuppliedFields() {
        final NoteUpdate update = validateNote.validateUpdate(
                new NoteUpdate(null, "body", Instant.parse("2024-01-01T00:00:00.999999Z")));

        assertNull(update.title());
        assertEquals(Instant.parse("2024-01-01T00:00:00.999Z"), update.dueAt());
        assertThrows(ValidationFailed.class, () -> validateNote.validateUpdate(NoteUpdate.title("")));
    }

    @Test
    public void testNumericArguments() {
        assertEquals(1, validateNote.validateLimit(1));
        assertThrows(ValidationFailed.class, () -> validateNote.validateLimit(0));
        assertEquals(0, validateNote.validateHours(0));
        assertThrows(ValidationFailed.class, () -> validateNote.validateHours(-1));
        assertThrows(ValidationFailed.class, () -> validateNote.validateQuery("  "));
    }
}
