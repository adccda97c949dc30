package com.rotalog;

import java.util.Arrays;
import java.util.IllegalFormatException;
import java.util.Objects;

/**
 * One log request as made by a caller. The message text is rendered lazily on the
 * logger thread, and only for entries that pass the filters.
 */
public final class LogEntry {

    private final Priority priority;
    private final SourceLocation location;
    private final String template;
    private final Object[] args;

    private LogEntry(Priority priority, SourceLocation location, String template, Object[] args) {
        this.priority = Objects.requireNonNull(priority, "priority");
        this.location = Objects.requireNonNull(location, "location");
        this.template = Objects.requireNonNull(template, "message");
        this.args = args;
    }

    /**
     * An entry whose message is used verbatim.
     */
    public static LogEntry plain(Priority priority, SourceLocation location, String message) {
        return new LogEntry(priority, location, message, null);
    }

    /**
     * An entry rendered with {@link String#format(String, Object...)}.
     */
    public static LogEntry formatted(Priority priority, SourceLocation location, String format, Object... args) {
        return new LogEntry(priority, location, format, args == null ? new Object[0] : args.clone());
    }

    public Priority priority() {
        return priority;
    }

    public SourceLocation location() {
        return location;
    }

    /**
     * Renders the message. A format that does not fit its arguments is not an error:
     * the template and the arguments are kept side by side with a marker.
     */
    public String message() {
        return render(template, args);
    }

    static String render(String template, Object[] args) {
        if (args == null) {
            return template;
        }
        try {
            return String.format(template, args);
        } catch (IllegalFormatException e) {
            return template + " " + Arrays.deepToString(args) + " (bad format: " + e.getMessage() + ")";
        }
    }

    @Override
    public String toString() {
        return "LogEntry{" + priority + " " + location.fileName() + ":" + location.line() + " " + template + "}";
    }
}
