package com.rotalog;

import java.util.Locale;

/**
 * Severity of a log entry, most severe first. Also used as the logger's threshold:
 * a threshold admits every priority at or above its own severity.
 */
public enum Priority {
    /** Record written just before the process exits with a chosen status. */
    EXIT,
    /** Irrecoverable failure. The process exits with status 1 after the record is written. */
    PANIC,
    /** Recoverable error. */
    WARNING,
    /** High-level information about program execution. */
    INFO,
    /** Execution tracing. */
    DEBUG;

    /**
     * @return true if an entry of the given priority passes this threshold
     */
    public boolean admits(Priority priority) {
        return priority.compareTo(this) <= 0;
    }

    /**
     * Parses a priority name, ignoring case.
     *
     * @throws IllegalArgumentException if the name is not a priority
     */
    public static Priority parse(String name) {
        String normalized = name.trim().toUpperCase(Locale.ROOT);
        for (Priority priority : values()) {
            if (priority.name().equals(normalized)) {
                return priority;
            }
        }
        throw new IllegalArgumentException("Invalid priority string " + name);
    }
}
