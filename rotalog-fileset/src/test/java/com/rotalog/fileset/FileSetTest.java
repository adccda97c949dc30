package com.rotalog.fileset;

import com.rotalog.actor.ActorClosedException;
import com.rotalog.actor.ActorState;
import com.rotalog.actor.ActorTimeoutException;
import com.rotalog.test.LogDirectory;
import com.rotalog.test.LogFileInspector;
import com.rotalog.test.TempLogDirectoryExtension;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@ExtendWith(TempLogDirectoryExtension.class)
class FileSetTest {

    private static final String PREFIX = "app";

    private FileSet fileSet;

    @AfterEach
    void tearDown() {
        if (fileSet != null) {
            fileSet.close();
        }
    }

    @Test
    void testOpenCreatesDirectoryAndFirstFileWithHeader(@LogDirectory Path logDir) {
        assertFalse(Files.exists(logDir));

        fileSet = FileSet.builder(logDir, PREFIX).maxFiles(4).maxFileBytes(500).open();

        List<Path> files = FileSet.listLogFiles(logDir, PREFIX);
        assertEquals(1, files.size());
        List<String> lines = LogFileInspector.linesOf(files.get(0));
        assertEquals(3, lines.size());
        assertTrue(lines.get(0).startsWith("File set configuration @ "), lines.get(0));
        assertEquals("Maximum file size 500 bytes", lines.get(1));
        assertEquals("Maximum 4 files", lines.get(2));
        assertEquals(ActorState.RUNNING, fileSet.getState());
    }

    @Test
    void testFileNameCarriesPrefixAndTimestamp(@LogDirectory Path logDir) {
        Clock clock = Clock.fixed(Instant.parse("2024-03-01T09:15:30.5Z"), ZoneOffset.UTC);
        fileSet = FileSet.builder(logDir, PREFIX).clock(clock).open();

        Path file = fileSet.listLogFiles().get(0);
        assertEquals("app_2024-03-01T09:15:30.500000000Z.log", file.getFileName().toString());
    }

    @Test
    void testWriteReturnsByteCountAndAppends(@LogDirectory Path logDir) {
        fileSet = FileSet.builder(logDir, PREFIX).open();

        assertEquals(6, fileSet.write("hello\n"));
        assertEquals(6, fileSet.write("world\n"));

        List<String> lines = new LogFileInspector(logDir, PREFIX).lines();
        assertEquals(List.of("hello", "world"), lines.subList(3, lines.size()));
    }

    @Test
    void testTwentyFiveTenByteLinesRotateIntoThreeFiles(@LogDirectory Path logDir) {
        fileSet = FileSet.builder(logDir, PREFIX).maxFiles(3).maxFileBytes(100).open();

        for (int i = 0; i < 25; i++) {
            fileSet.write(String.format("entry-%03d\n", i));
        }
        fileSet.close();

        List<Path> files = FileSet.listLogFiles(logDir, PREFIX);
        assertEquals(3, files.size());
        assertEquals(10, payload(files.get(0)).size());
        assertEquals(10, payload(files.get(1)).size());
        assertEquals(5, payload(files.get(2)).size());
        assertEquals("entry-000", payload(files.get(0)).get(0));
        assertEquals("entry-024", payload(files.get(2)).get(4));
    }

    @Test
    void testRetentionDeletesOldestFiles(@LogDirectory Path logDir) {
        fileSet = FileSet.builder(logDir, PREFIX).maxFiles(3).maxFileBytes(100).open();

        for (int i = 0; i < 45; i++) {
            fileSet.write(String.format("entry-%03d\n", i));
            assertTrue(fileSet.listLogFiles().size() <= 3);
        }

        List<Path> files = fileSet.listLogFiles();
        assertEquals(3, files.size());
        assertEquals("entry-020", payload(files.get(0)).get(0));
        assertEquals("entry-044", payload(files.get(2)).get(4));
    }

    @Test
    void testRotationOpensExactlyOneNewFileAndResetsCounter(@LogDirectory Path logDir) {
        fileSet = FileSet.builder(logDir, PREFIX).maxFiles(5).maxFileBytes(20).open();

        fileSet.write("0123456789012345678\n");
        assertEquals(2, fileSet.listLogFiles().size());

        fileSet.write("abc\n");
        assertEquals(2, fileSet.listLogFiles().size());
        List<Path> files = fileSet.listLogFiles();
        assertEquals(List.of("abc"), payload(files.get(1)));
    }

    @Test
    void testHeaderDoesNotCountTowardFileSize(@LogDirectory Path logDir) {
        fileSet = FileSet.builder(logDir, PREFIX).maxFiles(5).maxFileBytes(10).open();

        fileSet.write("123456789");
        assertEquals(1, fileSet.listLogFiles().size());
    }

    @Test
    void testSetConfigBelowCurrentSizeRotatesImmediately(@LogDirectory Path logDir) {
        fileSet = FileSet.builder(logDir, PREFIX).maxFiles(3).maxFileBytes(1000).open();
        for (int i = 0; i < 5; i++) {
            fileSet.write(String.format("entry-%03d\n", i));
        }
        assertEquals(1, fileSet.listLogFiles().size());

        fileSet.setConfig(3, 20);

        List<Path> files = fileSet.listLogFiles();
        assertEquals(2, files.size());
        assertTrue(payload(files.get(1)).isEmpty());
        assertEquals("Maximum file size 20 bytes", LogFileInspector.linesOf(files.get(1)).get(1));
    }

    @Test
    void testSetConfigAboveCurrentSizeKeepsFile(@LogDirectory Path logDir) {
        fileSet = FileSet.builder(logDir, PREFIX).maxFiles(3).maxFileBytes(1000).open();
        fileSet.write("entry-000\n");

        fileSet.setConfig(2, 10);

        assertEquals(1, fileSet.listLogFiles().size());
        fileSet.write("entry-001\n");
        assertEquals(2, fileSet.listLogFiles().size());
    }

    @Test
    void testSetConfigRejectsInvalidLimits(@LogDirectory Path logDir) {
        fileSet = FileSet.builder(logDir, PREFIX).open();

        assertThrows(IllegalArgumentException.class, () -> fileSet.setConfig(0, 100));
        assertThrows(IllegalArgumentException.class, () -> fileSet.setConfig(3, 0));
    }

    @Test
    void testCloseDeletesFileWithoutPayload(@LogDirectory Path logDir) {
        fileSet = FileSet.builder(logDir, PREFIX).open();
        assertEquals(1, fileSet.listLogFiles().size());

        fileSet.close();

        assertTrue(FileSet.listLogFiles(logDir, PREFIX).isEmpty());
        assertEquals(ActorState.CLOSED, fileSet.getState());
    }

    @Test
    void testCloseKeepsFileWithPayload(@LogDirectory Path logDir) {
        fileSet = FileSet.builder(logDir, PREFIX).open();
        fileSet.write("kept\n");

        fileSet.close();

        List<Path> files = FileSet.listLogFiles(logDir, PREFIX);
        assertEquals(1, files.size());
        assertEquals(List.of("kept"), payload(files.get(0)));
    }

    @Test
    void testCloseIsIdempotentAndLaterWritesFail(@LogDirectory Path logDir) {
        fileSet = FileSet.builder(logDir, PREFIX).open();
        fileSet.close();
        fileSet.close();

        assertThrows(ActorClosedException.class, () -> fileSet.write("late\n"));
        assertThrows(ActorClosedException.class, () -> fileSet.setConfig(3, 100));
        assertTrue(fileSet.awaitTermination(Duration.ofSeconds(1)));
    }

    @Test
    void testFileNamesIncreaseWhenClockStandsStill(@LogDirectory Path logDir) {
        Clock clock = Clock.fixed(Instant.parse("2024-03-01T09:15:30Z"), ZoneOffset.UTC);
        fileSet = FileSet.builder(logDir, PREFIX).clock(clock).maxFiles(10).maxFileBytes(5).open();

        fileSet.write("aaaaa");
        fileSet.write("bbbbb");

        List<Path> files = fileSet.listLogFiles();
        assertEquals(3, files.size());
        assertEquals("app_2024-03-01T09:15:30.000000000Z.log", files.get(0).getFileName().toString());
        assertEquals("app_2024-03-01T09:15:30.000000001Z.log", files.get(1).getFileName().toString());
        assertEquals("app_2024-03-01T09:15:30.000000002Z.log", files.get(2).getFileName().toString());
    }

    @Test
    void testListLogFilesOfMissingDirectoryIsEmpty(@LogDirectory Path logDir) {
        assertTrue(FileSet.listLogFiles(logDir.resolve("missing"), PREFIX).isEmpty());
    }

    @Test
    void testListLogFilesIgnoresOtherPrefixesAndSortsByName(@LogDirectory Path logDir) throws Exception {
        Files.createDirectories(logDir);
        Files.createFile(logDir.resolve("app_2024-01-02T00:00:00.000000000Z.log"));
        Files.createFile(logDir.resolve("app_2024-01-01T00:00:00.000000000Z.log"));
        Files.createFile(logDir.resolve("other_2024-01-01T00:00:00.000000000Z.log"));
        Files.createFile(logDir.resolve("app_notes.txt"));

        List<Path> files = FileSet.listLogFiles(logDir, PREFIX);

        assertEquals(List.of(
                logDir.resolve("app_2024-01-01T00:00:00.000000000Z.log"),
                logDir.resolve("app_2024-01-02T00:00:00.000000000Z.log")), files);
    }

    @Test
    void testNeighbouringPrefixIsNeitherListedNorDeleted(@LogDirectory Path logDir) throws Exception {
        Files.createDirectories(logDir);
        Path audit = logDir.resolve("app_audit_2020-01-01T00:00:00.000000000Z.log");
        Files.writeString(audit, "audit\n");
        Files.createFile(logDir.resolve("app_2020-01-01T00:00:00.log"));

        assertTrue(FileSet.listLogFiles(logDir, PREFIX).isEmpty());

        fileSet = FileSet.builder(logDir, PREFIX).maxFiles(1).maxFileBytes(10).open();
        fileSet.write("0123456789");
        fileSet.write("0123456789");

        assertEquals(1, fileSet.listLogFiles().size());
        assertTrue(Files.exists(audit));
        assertEquals(List.of(audit), FileSet.listLogFiles(logDir, "app_audit"));
    }

    @Test
    void testUnusableDirectoryFailsOpen(@LogDirectory Path logDir) throws Exception {
        Files.createDirectories(logDir.getParent());
        Files.createFile(logDir);

        FileSet.Builder builder = FileSet.builder(logDir, PREFIX);
        LogFileException e = assertThrows(LogFileException.class, builder::open);
        assertTrue(e.getMessage().contains("Cannot create log directory"), e.getMessage());
    }

    @Test
    void testMissingReplyRaisesTimeout(@LogDirectory Path logDir) {
        GatedClock clock = new GatedClock();
        fileSet = FileSet.builder(logDir, PREFIX)
                .clock(clock)
                .maxFileBytes(5)
                .replyTimeout(Duration.ofMillis(100))
                .open();

        clock.hold();
        try {
            ActorTimeoutException e = assertThrows(ActorTimeoutException.class, () -> fileSet.write("12345"));
            assertEquals(Duration.ofMillis(100), e.getTimeout());
        } finally {
            clock.release();
        }
    }

    private static List<String> payload(Path file) {
        List<String> lines = LogFileInspector.linesOf(file);
        return lines.subList(3, lines.size());
    }

    /**
     * Clock that can be made to block, which stalls the file set inside a rotation.
     */
    static final class GatedClock extends Clock {
        private volatile CountDownLatch gate;

        void hold() {
            gate = new CountDownLatch(1);
        }

        void release() {
            gate.countDown();
        }

        @Override
        public Instant instant() {
            CountDownLatch current = gate;
            if (current != null) {
                try {
                    current.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            return Instant.now();
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }
    }
}
