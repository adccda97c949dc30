package com.rotalog;

import com.google.common.base.CharMatcher;
import com.rotalog.config.LogConfig;
import com.rotalog.fileset.LogTimestamps;

import java.time.Clock;

/**
 * Renders the records the logger writes:
 * <pre>
 * 2024-03-01T10:15:30.123456789+01:00 [INFO] -Main.java, line 14- Started
 * </pre>
 */
final class LogLineFormatter {

    private static final CharMatcher NEWLINE = CharMatcher.is('\n');

    private final Clock clock;

    LogLineFormatter(Clock clock) {
        this.clock = clock;
    }

    String entry(String tag, SourceLocation location, String message) {
        return LogTimestamps.now(clock)
                + " [" + tag + "] -" + location.fileName()
                + ", line " + location.line() + "- "
                + NEWLINE.trimTrailingFrom(message) + "\n";
    }

    /**
     * An entry followed by a stack trace block.
     */
    String entry(String tag, SourceLocation location, String message, String stackTrace) {
        String trace = NEWLINE.trimTrailingFrom(stackTrace);
        return trace.isEmpty() ? entry(tag, location, message) : entry(tag, location, message) + trace + "\n";
    }

    String configRecord(LogConfig config) {
        return LogTimestamps.now(clock) + " Log configuration:\n"
                + "  RootDir: " + config.getRootDir() + "\n"
                + "  FilePrefix: " + config.getFilePrefix() + "\n"
                + "  NumFiles: " + config.getMaxFiles() + "\n"
                + "  NumBytes: " + config.getMaxFileBytes() + "\n"
                + "  Priority: " + config.getPriority() + "\n"
                + "  Suppress: " + config.getSuppressedFilesText() + "\n";
    }
}
