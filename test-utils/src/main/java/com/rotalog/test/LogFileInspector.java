package com.rotalog.test;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Read-only view of the log files one file set has written to a directory.
 * Files are those named {@code <prefix>_<UTC timestamp>.log}, oldest first.
 *
 * <p>Usage:
 * <pre>{@code
 * LogFileInspector inspector = new LogFileInspector(logDir, "app");
 * assertEquals(1, inspector.linesTagged("INFO").size());
 * }</pre>
 */
public class LogFileInspector {

    private final Path directory;
    private final Pattern fileName;

    public LogFileInspector(Path directory, String prefix) {
        this.directory = directory;
        this.fileName = Pattern.compile(Pattern.quote(prefix)
                + "_\\d{4}-\\d{2}-\\d{2}T\\d{2}:\\d{2}:\\d{2}\\.\\d{9}Z\\.log");
    }

    /**
     * @return the matching log files, sorted by name
     */
    public List<Path> files() {
        if (!Files.isDirectory(directory)) {
            return Collections.emptyList();
        }
        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory,
                file -> fileName.matcher(file.getFileName().toString()).matches())) {
            for (Path file : stream) {
                files.add(file);
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        Collections.sort(files);
        return files;
    }

    /**
     * @return every line of every file, oldest file first
     */
    public List<String> lines() {
        List<String> lines = new ArrayList<>();
        for (Path file : files()) {
            lines.addAll(linesOf(file));
        }
        return lines;
    }

    /**
     * @param tag the text between the brackets, e.g. {@code INFO} or {@code EXIT 3}
     * @return the log lines carrying that tag
     */
    public List<String> linesTagged(String tag) {
        String marker = " [" + tag + "] ";
        return lines().stream()
                .filter(line -> line.contains(marker))
                .collect(Collectors.toList());
    }

    /**
     * @return the lines that contain the given text
     */
    public List<String> linesContaining(String text) {
        return lines().stream()
                .filter(line -> line.contains(text))
                .collect(Collectors.toList());
    }

    /**
     * Reads one file. A file that vanished in the meantime reads as empty.
     */
    public static List<String> linesOf(Path file) {
        try {
            return Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            return Collections.emptyList();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * @return the size of the file in bytes, 0 if it does not exist
     */
    public static long sizeOf(Path file) {
        try {
            return Files.exists(file) ? Files.size(file) : 0;
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
