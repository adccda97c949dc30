package com.rotalog.config;

import com.google.common.base.Joiner;
import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableSortedSet;
import com.rotalog.Priority;

import java.util.Collection;
import java.util.Objects;
import java.util.Set;

/**
 * Configuration of a logger and the file set it writes to.
 * <p>
 * Instances are mutable through the fluent setters; {@link #copy()} returns an
 * independent instance, which is how the logger hands its configuration to callers.
 */
public class LogConfig {
    // Default values for logger configuration
    public static final String DEFAULT_ROOT_DIR = "/usr/local/var/log";
    public static final String DEFAULT_FILE_PREFIX = "rotalog";
    public static final int DEFAULT_MAX_FILES = 3;
    public static final long DEFAULT_MAX_FILE_BYTES = 1_000_000L;
    public static final Priority DEFAULT_PRIORITY = Priority.INFO;

    private static final Splitter STEM_SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();
    private static final Joiner STEM_JOINER = Joiner.on(',');

    private String rootDir;
    private String filePrefix;
    private int maxFiles;
    private long maxFileBytes;
    private Priority priority;
    private ImmutableSortedSet<String> suppressedFiles;

    /**
     * Creates a new LogConfig with default values.
     */
    public LogConfig() {
        this.rootDir = DEFAULT_ROOT_DIR;
        this.filePrefix = DEFAULT_FILE_PREFIX;
        this.maxFiles = DEFAULT_MAX_FILES;
        this.maxFileBytes = DEFAULT_MAX_FILE_BYTES;
        this.priority = DEFAULT_PRIORITY;
        this.suppressedFiles = ImmutableSortedSet.of();
    }

    /**
     * Parses a comma separated list of source file names into stems: entries are trimmed,
     * empty entries are skipped and a trailing extension such as {@code .java} is removed.
     */
    public static ImmutableSortedSet<String> parseStems(String commaSeparated) {
        ImmutableSortedSet.Builder<String> stems = ImmutableSortedSet.naturalOrder();
        for (String name : STEM_SPLITTER.split(commaSeparated)) {
            stems.add(stripExtension(name));
        }
        return stems.build();
    }

    private static String stripExtension(String name) {
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    public String getRootDir() {
        return rootDir;
    }

    public LogConfig setRootDir(String rootDir) {
        Preconditions.checkArgument(rootDir != null && !rootDir.isEmpty(), "rootDir must not be empty");
        this.rootDir = rootDir;
        return this;
    }

    public String getFilePrefix() {
        return filePrefix;
    }

    public LogConfig setFilePrefix(String filePrefix) {
        Preconditions.checkArgument(filePrefix != null && !filePrefix.isEmpty(), "filePrefix must not be empty");
        this.filePrefix = filePrefix;
        return this;
    }

    /**
     * @return the maximum number of log files kept on disk
     */
    public int getMaxFiles() {
        return maxFiles;
    }

    public LogConfig setMaxFiles(int maxFiles) {
        Preconditions.checkArgument(maxFiles >= 1, "maxFiles must be at least 1: %s", maxFiles);
        this.maxFiles = maxFiles;
        return this;
    }

    /**
     * @return the payload size at which a log file is rotated
     */
    public long getMaxFileBytes() {
        return maxFileBytes;
    }

    public LogConfig setMaxFileBytes(long maxFileBytes) {
        Preconditions.checkArgument(maxFileBytes >= 1, "maxFileBytes must be at least 1: %s", maxFileBytes);
        this.maxFileBytes = maxFileBytes;
        return this;
    }

    /**
     * @return the threshold; entries less severe than this are discarded
     */
    public Priority getPriority() {
        return priority;
    }

    public LogConfig setPriority(Priority priority) {
        this.priority = Objects.requireNonNull(priority, "priority");
        return this;
    }

    /**
     * @return stems of the source files whose DEBUG entries are discarded
     */
    public Set<String> getSuppressedFiles() {
        return suppressedFiles;
    }

    public LogConfig setSuppressedFiles(Collection<String> stems) {
        this.suppressedFiles = ImmutableSortedSet.copyOf(stems);
        return this;
    }

    /**
     * Sets the suppressed files from a comma separated list, see {@link #parseStems(String)}.
     */
    public LogConfig setSuppressedFiles(String commaSeparated) {
        this.suppressedFiles = parseStems(commaSeparated);
        return this;
    }

    /**
     * @return the suppressed stems as a comma separated list
     */
    public String getSuppressedFilesText() {
        return STEM_JOINER.join(suppressedFiles);
    }

    /**
     * @return true if DEBUG entries from this source file stem are discarded
     */
    public boolean isSuppressed(String stem) {
        return suppressedFiles.contains(stem);
    }

    /**
     * @return an independent instance with the same values
     */
    public LogConfig copy() {
        LogConfig copy = new LogConfig();
        copy.rootDir = rootDir;
        copy.filePrefix = filePrefix;
        copy.maxFiles = maxFiles;
        copy.maxFileBytes = maxFileBytes;
        copy.priority = priority;
        copy.suppressedFiles = suppressedFiles;
        return copy;
    }

    /**
     * Renders this configuration in the form read by {@link JsonLogConfigSource}.
     */
    public String toJson() {
        return ConfigJson.render(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof LogConfig)) {
            return false;
        }
        LogConfig that = (LogConfig) o;
        return maxFiles == that.maxFiles
                && maxFileBytes == that.maxFileBytes
                && rootDir.equals(that.rootDir)
                && filePrefix.equals(that.filePrefix)
                && priority == that.priority
                && suppressedFiles.equals(that.suppressedFiles);
    }

    @Override
    public int hashCode() {
        return Objects.hash(rootDir, filePrefix, maxFiles, maxFileBytes, priority, suppressedFiles);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("rootDir", rootDir)
                .add("filePrefix", filePrefix)
                .add("maxFiles", maxFiles)
                .add("maxFileBytes", maxFileBytes)
                .add("priority", priority)
                .add("suppressedFiles", suppressedFiles)
                .toString();
    }
}
