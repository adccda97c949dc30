package com.rotalog.fileset;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.regex.Pattern;

/**
 * Timestamp formats shared by log lines and log file names.
 * Both are fixed width with nanosecond precision.
 */
public final class LogTimestamps {

    /** Local time with offset, e.g. {@code 2024-03-01T10:15:30.123456789+01:00}. */
    public static final DateTimeFormatter LINE = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSSSSSSSSXXX");

    /**
     * UTC, e.g. {@code 2024-03-01T09:15:30.123456789Z}. Using one zone keeps the
     * lexicographic order of file names equal to their creation order.
     */
    public static final DateTimeFormatter FILE_NAME = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSSSSSSSS'Z'")
            .withZone(ZoneOffset.UTC);

    private static final Pattern FILE_NAME_SHAPE =
            Pattern.compile("\\d{4}-\\d{2}-\\d{2}T\\d{2}:\\d{2}:\\d{2}\\.\\d{9}Z");

    private LogTimestamps() {
    }

    /**
     * @return the current time of the clock, formatted for a log line
     */
    public static String now(Clock clock) {
        return LINE.format(OffsetDateTime.now(clock));
    }

    /**
     * @return the instant formatted for use inside a file name
     */
    public static String forFileName(Instant instant) {
        return FILE_NAME.format(instant);
    }

    /**
     * @return true if the text has the shape produced by {@link #forFileName(Instant)}
     */
    public static boolean isFileNameTimestamp(String text) {
        return FILE_NAME_SHAPE.matcher(text).matches();
    }
}
