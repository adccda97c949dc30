package com.rotalog;

import com.google.common.base.Preconditions;
import com.rotalog.actor.ActorClosedException;
import com.rotalog.actor.ActorState;
import com.rotalog.actor.ActorTimeoutException;
import com.rotalog.actor.Delivery;
import com.rotalog.actor.ProcessTerminator;
import com.rotalog.actor.Reply;
import com.rotalog.actor.ThreadPoolFactory;
import com.rotalog.config.JsonLogConfigSource;
import com.rotalog.config.LogConfig;
import com.rotalog.config.LogConfigSource;
import com.rotalog.fileset.FileSet;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * A logger that writes to a self-managing set of rotating log files.
 * <p>
 * Every method may be called from any thread. Log methods return as soon as the entry is
 * queued; they block only while the queue is full. Each entry is tagged with the time and
 * with the source file and line of the call:
 * <pre>
 * 2024-03-01T10:15:30.123456789+01:00 [INFO] -Main.java, line 14- Started
 * </pre>
 * Usage:
 * <pre>{@code
 * try (RotaLog log = RotaLog.builder().filePrefix("orders").build()) {
 *     log.info("Started");
 *     log.debugf("Loaded %d orders", count);
 * }
 * }</pre>
 * {@link #exit(int, String)} and {@link #panic(String)} write a final record, close the
 * files and end the process; they never return. If the logger is already closing they
 * wait for it to finish and end the process without a final record.
 */
public final class RotaLog implements AutoCloseable {

    public static final Duration DEFAULT_RELOAD_INTERVAL = Duration.ofSeconds(10);
    public static final Duration DEFAULT_CLOSE_TIMEOUT = Duration.ofSeconds(10);
    public static final Duration CONFIG_REPLY_TIMEOUT = Duration.ofSeconds(10);
    public static final int PANIC_STATUS = 1;

    private final LoggerActor actor;
    private final ProcessTerminator terminator;
    private final Duration closeTimeout;
    private final CallerLocator locator = new CallerLocator(RotaLog.class);

    private RotaLog(LoggerActor actor, ProcessTerminator terminator, Duration closeTimeout) {
        this.actor = actor;
        this.terminator = terminator;
        this.closeTimeout = closeTimeout;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Delivery debug(String message) {
        return actor.tell(LogEntry.plain(Priority.DEBUG, locator.locate(), message));
    }

    public Delivery info(String message) {
        return actor.tell(LogEntry.plain(Priority.INFO, locator.locate(), message));
    }

    public Delivery warning(String message) {
        return actor.tell(LogEntry.plain(Priority.WARNING, locator.locate(), message));
    }

    public Delivery debugf(String format, Object... args) {
        return actor.tell(LogEntry.formatted(Priority.DEBUG, locator.locate(), format, args));
    }

    public Delivery infof(String format, Object... args) {
        return actor.tell(LogEntry.formatted(Priority.INFO, locator.locate(), format, args));
    }

    public Delivery warningf(String format, Object... args) {
        return actor.tell(LogEntry.formatted(Priority.WARNING, locator.locate(), format, args));
    }

    /**
     * Logs a message with the given priority.
     *
     * @param priority {@link Priority#WARNING}, {@link Priority#INFO} or {@link Priority#DEBUG}
     * @return {@link Delivery#DROPPED} if the logger has been closed
     * @throws IllegalArgumentException for {@link Priority#EXIT} and {@link Priority#PANIC},
     *                                  which have their own methods
     */
    public Delivery log(Priority priority, String message) {
        Preconditions.checkArgument(priority.compareTo(Priority.WARNING) >= 0,
                "Use exit() or panic() to log with priority %s", priority);
        return actor.tell(LogEntry.plain(priority, locator.locate(), message));
    }

    /**
     * Writes an {@code [EXIT status]} record after all entries queued before it, closes the
     * log files and terminates the process with {@code status}. Never returns.
     */
    public void exit(int status, String message) {
        CompletableFuture<Void> done = new CompletableFuture<>();
        terminate(new LoggerCommand.Exit(status, locator.locate(), message, done), done, status);
    }

    public void exitf(int status, String format, Object... args) {
        CompletableFuture<Void> done = new CompletableFuture<>();
        String message = LogEntry.render(format, args == null ? new Object[0] : args);
        terminate(new LoggerCommand.Exit(status, locator.locate(), message, done), done, status);
    }

    /**
     * Writes a {@code [PANIC]} record with the caller's stack trace, closes the log files
     * and terminates the process with status 1. Never returns.
     */
    public void panic(String message) {
        CompletableFuture<Void> done = new CompletableFuture<>();
        terminate(new LoggerCommand.Panic(locator.locate(), message, locator.stackTrace(), done), done, PANIC_STATUS);
    }

    public void panicf(String format, Object... args) {
        CompletableFuture<Void> done = new CompletableFuture<>();
        String message = LogEntry.render(format, args == null ? new Object[0] : args);
        terminate(new LoggerCommand.Panic(locator.locate(), message, locator.stackTrace(), done), done, PANIC_STATUS);
    }

    /**
     * Changes retention and threshold. Entries queued before this call are written under the
     * previous settings; the new configuration is then recorded in the log.
     *
     * @return {@link Delivery#DROPPED} if the logger has been closed
     */
    public Delivery setConfig(int maxFiles, long maxFileBytes, Priority priority) {
        Preconditions.checkArgument(maxFiles >= 1, "maxFiles must be at least 1: %s", maxFiles);
        Preconditions.checkArgument(maxFileBytes >= 1, "maxFileBytes must be at least 1: %s", maxFileBytes);
        Objects.requireNonNull(priority, "priority");
        return actor.command(new LoggerCommand.SetConfig(maxFiles, maxFileBytes, priority));
    }

    /**
     * Discards DEBUG entries from the listed source files, e.g. {@code "Parser,Lexer.java"}.
     * An empty string clears the list.
     *
     * @return {@link Delivery#DROPPED} if the logger has been closed
     */
    public Delivery suppress(String commaSeparatedFiles) {
        return actor.command(new LoggerCommand.Suppress(LogConfig.parseStems(commaSeparatedFiles)));
    }

    /**
     * @return a copy of the configuration in force
     * @throws IllegalStateException if the logger has been closed
     */
    public LogConfig getConfig() {
        CompletableFuture<LogConfig> reply = new CompletableFuture<>();
        if (actor.command(new LoggerCommand.GetConfig(reply)) == Delivery.DROPPED) {
            throw new ActorClosedException(actor.getActorId());
        }
        try {
            return Reply.from(reply, actor.getActorId(), "get config").get(CONFIG_REPLY_TIMEOUT);
        } catch (ActorTimeoutException e) {
            terminator.abort("Timeout waiting for log configuration", e);
            throw e;
        }
    }

    /**
     * @return this logger's log files, oldest first, including those of earlier runs
     */
    public List<Path> listLogFiles() {
        Path directory = actor.getLogDirectory();
        if (directory == null) {
            return Collections.emptyList();
        }
        return FileSet.listLogFiles(directory, actor.getFilePrefix());
    }

    public ActorState getState() {
        return actor.getState();
    }

    /**
     * Writes all queued entries and closes the log files. Later log calls are dropped.
     * Calling this again has no effect.
     */
    @Override
    public void close() {
        CompletableFuture<Void> done = new CompletableFuture<>();
        if (actor.command(new LoggerCommand.Close(done)) == Delivery.DROPPED) {
            actor.awaitTermination(closeTimeout);
            return;
        }
        try {
            Reply.from(done, actor.getActorId(), "close").get(closeTimeout);
        } catch (ActorTimeoutException e) {
            terminator.abort("Timeout closing the logger", e);
            throw e;
        }
    }

    private void terminate(LoggerCommand request, CompletableFuture<Void> done, int status) {
        if (actor.command(request) == Delivery.ACCEPTED) {
            try {
                Reply.from(done, actor.getActorId(), "shut down").get();
            } catch (RuntimeException e) {
                // The actor has already requested an abort
                throw new IllegalStateException("Logger failed before the process could exit", e);
            }
        } else if (!actor.awaitTermination(closeTimeout)) {
            // Another close, exit or panic is still draining
            ActorTimeoutException timeout = new ActorTimeoutException(actor.getActorId(), "close", closeTimeout);
            terminator.abort("Timeout waiting for the logger to close", timeout);
            throw timeout;
        }
        terminator.exit(status);
        throw new IllegalStateException("Process terminator returned from exit(" + status + ")");
    }

    /**
     * Builds and starts a {@link RotaLog}.
     */
    public static final class Builder {
        private String filePrefix = LogConfig.DEFAULT_FILE_PREFIX;
        private LogConfigSource configSource;
        private Path configFile;
        private ProcessTerminator terminator = ProcessTerminator.system();
        private Clock clock = Clock.systemDefaultZone();
        private Duration reloadInterval = DEFAULT_RELOAD_INTERVAL;
        private Duration closeTimeout = DEFAULT_CLOSE_TIMEOUT;
        private ThreadPoolFactory threadPoolFactory = new ThreadPoolFactory();

        private Builder() {
        }

        /**
         * Prefix of the log file names. Used by the default configuration source.
         */
        public Builder filePrefix(String filePrefix) {
            Preconditions.checkArgument(filePrefix != null && !filePrefix.isEmpty(), "filePrefix must not be empty");
            this.filePrefix = filePrefix;
            return this;
        }

        /**
         * Where the configuration comes from. Defaults to the first {@code *logging.config}
         * file in the working directory.
         */
        public Builder configSource(LogConfigSource configSource) {
            this.configSource = Objects.requireNonNull(configSource, "configSource");
            this.configFile = null;
            return this;
        }

        /**
         * Reads the configuration from the given JSON file.
         */
        public Builder configFile(Path file) {
            this.configSource = null;
            this.configFile = Objects.requireNonNull(file, "file");
            return this;
        }

        public Builder terminator(ProcessTerminator terminator) {
            this.terminator = Objects.requireNonNull(terminator, "terminator");
            return this;
        }

        /**
         * Clock for record timestamps and file names.
         */
        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        /**
         * How often the configuration source is read again. {@link Duration#ZERO} disables reloading.
         */
        public Builder reloadInterval(Duration reloadInterval) {
            Preconditions.checkArgument(!reloadInterval.isNegative(), "reloadInterval must not be negative");
            this.reloadInterval = reloadInterval;
            return this;
        }

        public Builder closeTimeout(Duration closeTimeout) {
            Preconditions.checkArgument(!closeTimeout.isNegative() && !closeTimeout.isZero(),
                    "closeTimeout must be positive");
            this.closeTimeout = closeTimeout;
            return this;
        }

        public Builder threadPoolFactory(ThreadPoolFactory threadPoolFactory) {
            this.threadPoolFactory = Objects.requireNonNull(threadPoolFactory, "threadPoolFactory");
            return this;
        }

        /**
         * Loads the configuration, opens the log files and writes the configuration record.
         *
         * @throws com.rotalog.fileset.LogFileException if the log files cannot be created
         */
        public RotaLog build() {
            LoggerActor actor = new LoggerActor(resolveConfigSource(), terminator, clock, reloadInterval,
                    threadPoolFactory);
            actor.start();
            return new RotaLog(actor, terminator, closeTimeout);
        }

        private LogConfigSource resolveConfigSource() {
            if (configSource != null) {
                return configSource;
            }
            if (configFile != null) {
                return JsonLogConfigSource.ofFile(configFile, filePrefix);
            }
            return JsonLogConfigSource.inWorkingDirectory(filePrefix);
        }
    }
}
