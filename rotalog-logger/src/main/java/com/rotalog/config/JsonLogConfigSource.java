package com.rotalog.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.rotalog.Priority;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Reads the logger configuration from a JSON file such as:
 * <pre>{@code
 * {
 *     "rootDir": "logs",
 *     "numFiles": 3,
 *     "fileNumBytes": 1000000,
 *     "priority": "INFO",
 *     "suppressedFiles": "Parser,Lexer"
 * }
 * }</pre>
 * The file is either given explicitly or found in a directory as the first regular file,
 * in name order, whose name ends with {@value #CONFIG_FILE_SUFFIX}. The file is located and
 * read again on every {@link #load()}, so it may be created or edited while the program runs.
 * <p>
 * Problems are reported as SLF4J warnings on this class's logger and never stop the
 * logger: a missing or unreadable file yields the defaults, an invalid field yields that
 * field's default. The same set of problems is reported once, not on every reload.
 * They never go to the managed log files. Applications route them to standard error
 * through their SLF4J binding, e.g. a Logback {@code ConsoleAppender} with
 * {@code <target>System.err</target>}; without a binding they are not shown at all.
 */
public class JsonLogConfigSource implements LogConfigSource {
    private static final Logger logger = LoggerFactory.getLogger(JsonLogConfigSource.class);

    public static final String CONFIG_FILE_SUFFIX = "logging.config";

    private final Path explicitFile;
    private final Path searchDirectory;
    private final String filePrefix;

    // Diagnostics of the previous load, so that a persisting problem is reported once
    private List<String> lastDiagnostics = Collections.emptyList();

    private JsonLogConfigSource(Path explicitFile, Path searchDirectory, String filePrefix) {
        this.explicitFile = explicitFile;
        this.searchDirectory = searchDirectory;
        this.filePrefix = Objects.requireNonNull(filePrefix, "filePrefix");
    }

    /**
     * Reads the given file.
     *
     * @param file       the JSON configuration file
     * @param filePrefix prefix of the log file names, which the file does not configure
     */
    public static JsonLogConfigSource ofFile(Path file, String filePrefix) {
        return new JsonLogConfigSource(Objects.requireNonNull(file, "file"), null, filePrefix);
    }

    /**
     * Reads the first file in {@code directory} whose name ends with {@value #CONFIG_FILE_SUFFIX}.
     */
    public static JsonLogConfigSource discover(Path directory, String filePrefix) {
        return new JsonLogConfigSource(null, Objects.requireNonNull(directory, "directory"), filePrefix);
    }

    /**
     * Discovers the configuration file in the working directory.
     */
    public static JsonLogConfigSource inWorkingDirectory(String filePrefix) {
        return discover(Paths.get("").toAbsolutePath(), filePrefix);
    }

    @Override
    public synchronized LogConfig load() {
        List<String> diagnostics = new ArrayList<>();
        LogConfig config = read(diagnostics);
        if (!diagnostics.equals(lastDiagnostics)) {
            for (String diagnostic : diagnostics) {
                logger.warn(diagnostic);
            }
        }
        lastDiagnostics = diagnostics;
        return config;
    }

    /**
     * @return the file the next {@link #load()} would read, if there is one
     */
    public Optional<Path> locate() {
        if (explicitFile != null) {
            return Files.isRegularFile(explicitFile) ? Optional.of(explicitFile) : Optional.empty();
        }
        if (!Files.isDirectory(searchDirectory)) {
            return Optional.empty();
        }
        List<Path> candidates = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(searchDirectory, "*" + CONFIG_FILE_SUFFIX)) {
            for (Path candidate : stream) {
                if (Files.isRegularFile(candidate)) {
                    candidates.add(candidate);
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot search " + searchDirectory + " for a logging config", e);
        }
        Collections.sort(candidates);
        return candidates.stream().findFirst();
    }

    private LogConfig read(List<String> diagnostics) {
        LogConfig defaults = new LogConfig().setFilePrefix(filePrefix);
        Optional<Path> file;
        try {
            file = locate();
        } catch (UncheckedIOException e) {
            diagnostics.add(e.getMessage() + ": " + e.getCause().getMessage() + ". Using defaults");
            return defaults;
        }
        if (file.isEmpty()) {
            diagnostics.add("No logging config file found. Using defaults");
            return defaults;
        }

        byte[] content;
        try {
            content = Files.readAllBytes(file.get());
        } catch (IOException e) {
            diagnostics.add("Warning reading " + file.get() + ": " + e + ". Using defaults");
            return defaults;
        }
        ConfigJson.Document document;
        try {
            document = ConfigJson.parse(content);
        } catch (JsonProcessingException e) {
            diagnostics.add("Error parsing " + file.get() + ": " + e.getOriginalMessage() + ". Using defaults");
            return defaults;
        } catch (IOException e) {
            diagnostics.add("Error parsing " + file.get() + ": " + e.getMessage() + ". Using defaults");
            return defaults;
        }
        return toConfig(document, defaults, diagnostics);
    }

    private static LogConfig toConfig(ConfigJson.Document document, LogConfig config, List<String> diagnostics) {
        if (document.rootDir != null && !document.rootDir.isEmpty()) {
            config.setRootDir(document.rootDir);
        }
        if (document.numFiles != null) {
            if (document.numFiles >= 1) {
                config.setMaxFiles(document.numFiles);
            } else {
                diagnostics.add("Invalid numFiles: " + document.numFiles + ". Using " + LogConfig.DEFAULT_MAX_FILES);
            }
        }
        if (document.fileNumBytes != null) {
            if (document.fileNumBytes >= 1) {
                config.setMaxFileBytes(document.fileNumBytes);
            } else {
                diagnostics.add("Invalid fileNumBytes: " + document.fileNumBytes
                        + ". Using " + LogConfig.DEFAULT_MAX_FILE_BYTES);
            }
        }
        if (document.priority != null && !document.priority.isEmpty()) {
            try {
                config.setPriority(Priority.parse(document.priority));
            } catch (IllegalArgumentException e) {
                diagnostics.add("Invalid priority string: " + document.priority + ". Using " + LogConfig.DEFAULT_PRIORITY);
            }
        }
        if (document.suppressedFiles != null) {
            config.setSuppressedFiles(document.suppressedFiles);
        }
        return config;
    }

    @Override
    public String toString() {
        return "JsonLogConfigSource{" + (explicitFile != null ? explicitFile : searchDirectory + "/*" + CONFIG_FILE_SUFFIX) + "}";
    }
}
