package com.sailfish.taskman.model;

import com.sailfish.taskman.exception.TaskValidationException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PriorityTest {

    @Test
    void parseIgnoresCase() {
        assertEquals(Priority.HIGH, Priority.parse("high"));
        assertEquals(Priority.MEDIUM, Priority.parse(" MEDIUM "));
        assertEquals(Priority.LOW, Priority.parse("Low"));
    }

    @Test
    void parseRejectsBlankAndUnknown() {
        assertThrows(TaskValidationException.class, () -> Priority.parse(""));
        assertThrows(TaskValidationException.class, () -> Priority.parse("critical"));
    }

    @Test
    void fromLabelIgnoresCase() {
        assertEquals(Priority.HIGH, Priority.fromLabel("HIGH"));
        assertThrows(IllegalArgumentException.class, () -> Priority.fromLabel("Urgent"));
    }

    @Test
    void rankOrdersBySeverity() {
        assertTrue(Priority.HIGH.rank() > Priority.MEDIUM.rank());
        assertTrue(Priority.MEDIUM.rank() > Priority.LOW.rank());
    }
}
