package com.rotalog;

import com.rotalog.config.LogConfig;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertEquals;

class LogLineFormatterTest {

    private final LogLineFormatter formatter = new LogLineFormatter(
            Clock.fixed(Instant.parse("2024-03-01T09:15:30.123456789Z"), ZoneOffset.ofHours(1)));

    @Test
    void testEntryLayout() {
        String line = formatter.entry("INFO", new SourceLocation("Main.java", 14), "Started\n");

        assertEquals("2024-03-01T10:15:30.123456789+01:00 [INFO] -Main.java, line 14- Started\n", line);
    }

    @Test
    void testTimestampKeepsFixedWidth() {
        LogLineFormatter whole = new LogLineFormatter(Clock.fixed(Instant.parse("2024-03-01T09:15:30Z"), ZoneOffset.UTC));

        String line = whole.entry("WARNING", new SourceLocation("Main.java", 1), "x");

        assertEquals("2024-03-01T09:15:30.000000000Z [WARNING] -Main.java, line 1- x\n", line);
    }

    @Test
    void testEntryWithStackTrace() {
        String line = formatter.entry("PANIC", new SourceLocation("Main.java", 3), "broken", "trace\n\tat a.B.c(B.java:1)\n");

        assertEquals("2024-03-01T10:15:30.123456789+01:00 [PANIC] -Main.java, line 3- broken\n"
                + "trace\n\tat a.B.c(B.java:1)\n", line);
    }

    @Test
    void testConfigRecord() {
        LogConfig config = new LogConfig()
                .setRootDir("logs")
                .setFilePrefix("app")
                .setMaxFiles(2)
                .setMaxFileBytes(500)
                .setPriority(Priority.DEBUG)
                .setSuppressedFiles("Parser,Lexer");

        assertEquals("2024-03-01T10:15:30.123456789+01:00 Log configuration:\n"
                + "  RootDir: logs\n"
                + "  FilePrefix: app\n"
                + "  NumFiles: 2\n"
                + "  NumBytes: 500\n"
                + "  Priority: DEBUG\n"
                + "  Suppress: Lexer,Parser\n", formatter.configRecord(config));
    }
}
