package com.rotalog;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PriorityTest {

    @Test
    void testOrderIsMostSevereFirst() {
        assertTrue(Priority.EXIT.compareTo(Priority.PANIC) < 0);
        assertTrue(Priority.PANIC.compareTo(Priority.WARNING) < 0);
        assertTrue(Priority.WARNING.compareTo(Priority.INFO) < 0);
        assertTrue(Priority.INFO.compareTo(Priority.DEBUG) < 0);
    }

    @Test
    void testThresholdAdmitsItselfAndMoreSevere() {
        for (Priority threshold : Priority.values()) {
            for (Priority priority : Priority.values()) {
                assertEquals(priority.ordinal() <= threshold.ordinal(), threshold.admits(priority),
                        threshold + " admits " + priority);
            }
        }
    }

    @Test
    void testParseIgnoresCase() {
        assertEquals(Priority.DEBUG, Priority.parse("debug"));
        assertEquals(Priority.WARNING, Priority.parse("Warning"));
        assertEquals(Priority.INFO, Priority.parse(" INFO "));
    }

    @Test
    void testParseRejectsUnknownName() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> Priority.parse("verbose"));
        assertEquals("Invalid priority string verbose", e.getMessage());
    }
}
