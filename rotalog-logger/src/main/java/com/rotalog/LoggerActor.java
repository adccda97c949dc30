package com.rotalog;

import com.rotalog.actor.Actor;
import com.rotalog.actor.ActorClosedException;
import com.rotalog.actor.FatalActorException;
import com.rotalog.actor.ProcessTerminator;
import com.rotalog.actor.ThreadPoolFactory;
import com.rotalog.config.LogConfig;
import com.rotalog.config.LogConfigSource;
import com.rotalog.fileset.FileSet;
import com.rotalog.fileset.LogFileException;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * The logging actor. Filters and formats entries and writes them through its {@link FileSet}.
 * <p>
 * Entries arrive on the bounded message channel, everything else on the command channel.
 * Closing, exiting and panicking all drain first: entries queued before the request are
 * written under the configuration in force, then the final record, then the file set is
 * closed.
 */
final class LoggerActor extends Actor<LogEntry, LoggerCommand> {

    static final int ENTRY_QUEUE_CAPACITY = 1024;

    private final LogConfigSource configSource;
    private final ProcessTerminator terminator;
    private final Clock clock;
    private final Duration reloadInterval;
    private final ThreadPoolFactory threadPoolFactory;
    private final LogLineFormatter formatter;
    private final ScheduledExecutorService reloadScheduler;

    private volatile Path logDirectory;
    private volatile String filePrefix;

    // Confined to the actor thread
    private LogConfig config;
    private LogConfig lastLoaded;
    private FileSet fileSet;

    LoggerActor(LogConfigSource configSource,
                ProcessTerminator terminator,
                Clock clock,
                Duration reloadInterval,
                ThreadPoolFactory threadPoolFactory) {
        super("logger", ENTRY_QUEUE_CAPACITY, threadPoolFactory);
        this.configSource = Objects.requireNonNull(configSource, "configSource");
        this.terminator = Objects.requireNonNull(terminator, "terminator");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.reloadInterval = Objects.requireNonNull(reloadInterval, "reloadInterval");
        this.threadPoolFactory = threadPoolFactory;
        this.formatter = new LogLineFormatter(clock);
        this.reloadScheduler = threadPoolFactory.createScheduledExecutorService("config-reload");
    }

    @Override
    protected void preStart() {
        config = configSource.load();
        lastLoaded = config.copy();
        logDirectory = Paths.get(config.getRootDir());
        filePrefix = config.getFilePrefix();
        fileSet = FileSet.builder(logDirectory, filePrefix)
                .maxFiles(config.getMaxFiles())
                .maxFileBytes(config.getMaxFileBytes())
                .clock(clock)
                .threadPoolFactory(threadPoolFactory)
                .open();
        writeConfigRecord();

        if (!reloadInterval.isZero()) {
            long millis = reloadInterval.toMillis();
            reloadScheduler.scheduleWithFixedDelay(
                    () -> command(new LoggerCommand.ReloadConfig()), millis, millis, TimeUnit.MILLISECONDS);
        }
        getLogger().debug("Logger started with {}", config);
    }

    @Override
    protected void receive(LogEntry entry) {
        if (admits(entry)) {
            write(formatter.entry(entry.priority().name(), entry.location(), entry.message()));
        }
    }

    @Override
    protected void onCommand(LoggerCommand command) {
        try {
            if (command instanceof LoggerCommand.Exit) {
                exit((LoggerCommand.Exit) command);
            } else if (command instanceof LoggerCommand.Panic) {
                panic((LoggerCommand.Panic) command);
            } else if (command instanceof LoggerCommand.SetConfig) {
                setConfig((LoggerCommand.SetConfig) command);
            } else if (command instanceof LoggerCommand.Suppress) {
                suppress((LoggerCommand.Suppress) command);
            } else if (command instanceof LoggerCommand.GetConfig) {
                ((LoggerCommand.GetConfig) command).reply().complete(config.copy());
            } else if (command instanceof LoggerCommand.ReloadConfig) {
                reload();
            } else if (command instanceof LoggerCommand.Close) {
                beginDraining();
                drainMessages();
                shutDown();
                ((LoggerCommand.Close) command).done().complete(null);
            }
        } catch (RuntimeException e) {
            command.fail(e);
            throw e;
        }
    }

    @Override
    protected void onDiscarded(LoggerCommand command) {
        if (command instanceof LoggerCommand.Exit) {
            ((LoggerCommand.Exit) command).done().complete(null);
        } else if (command instanceof LoggerCommand.Panic) {
            ((LoggerCommand.Panic) command).done().complete(null);
        } else if (command instanceof LoggerCommand.Close) {
            ((LoggerCommand.Close) command).done().complete(null);
        } else {
            command.fail(new ActorClosedException(getActorId()));
        }
    }

    @Override
    protected void onFatal(FatalActorException exception) {
        reloadScheduler.shutdownNow();
        terminator.abort("Logger failed: " + exception.getMessage(), exception);
    }

    @Override
    protected void postStop() {
        reloadScheduler.shutdownNow();
        super.postStop();
    }

    /**
     * @return the directory of the log files, null before the actor has started
     */
    Path getLogDirectory() {
        return logDirectory;
    }

    String getFilePrefix() {
        return filePrefix;
    }

    private boolean admits(LogEntry entry) {
        Priority priority = entry.priority();
        if (!config.getPriority().admits(priority)) {
            return false;
        }
        return priority != Priority.DEBUG || !config.isSuppressed(entry.location().stem());
    }

    private void exit(LoggerCommand.Exit exit) {
        beginDraining();
        drainMessages();
        write(formatter.entry("EXIT " + exit.status(), exit.location(), exit.message()));
        shutDown();
        exit.done().complete(null);
    }

    private void panic(LoggerCommand.Panic panic) {
        beginDraining();
        drainMessages();
        write(formatter.entry(Priority.PANIC.name(), panic.location(), panic.message(), panic.stackTrace()));
        shutDown();
        panic.done().complete(null);
    }

    private void setConfig(LoggerCommand.SetConfig update) {
        drainMessages();
        config.setMaxFiles(update.maxFiles())
                .setMaxFileBytes(update.maxFileBytes())
                .setPriority(update.priority());
        fileSet.setConfig(update.maxFiles(), update.maxFileBytes());
        writeConfigRecord();
    }

    private void suppress(LoggerCommand.Suppress suppress) {
        drainMessages();
        config.setSuppressedFiles(suppress.stems());
        writeConfigRecord();
    }

    /**
     * Adopts the reloaded configuration when it differs from the one in force, replacing
     * anything set through {@code setConfig} or {@code suppress}. The log directory and file
     * prefix belong to the open file set and stay as they were at startup.
     */
    private void reload() {
        LogConfig fresh = configSource.load();
        LogConfig previous = lastLoaded;
        lastLoaded = fresh.copy();

        // Reported once per change of the source, not on every reload
        if (!fresh.getRootDir().equals(config.getRootDir()) && !fresh.getRootDir().equals(previous.getRootDir())) {
            getLogger().warn("Log directory changed to {}; still writing to {} until restart",
                    fresh.getRootDir(), config.getRootDir());
        }
        if (!fresh.getFilePrefix().equals(config.getFilePrefix())
                && !fresh.getFilePrefix().equals(previous.getFilePrefix())) {
            getLogger().warn("Log file prefix changed to {}; still using {} until restart",
                    fresh.getFilePrefix(), config.getFilePrefix());
        }

        LogConfig adopted = fresh.copy()
                .setRootDir(config.getRootDir())
                .setFilePrefix(config.getFilePrefix());
        if (adopted.equals(config)) {
            return;
        }
        config = adopted;
        getLogger().debug("Adopted reloaded configuration {}", config);
        fileSet.setConfig(config.getMaxFiles(), config.getMaxFileBytes());
        writeConfigRecord();
    }

    private void writeConfigRecord() {
        write(formatter.configRecord(config));
    }

    private void write(String record) {
        try {
            fileSet.write(record);
        } catch (ActorClosedException e) {
            throw new LogFileException("Log file set is closed", e, getActorId());
        }
    }

    private void shutDown() {
        reloadScheduler.shutdownNow();
        fileSet.close();
        stopProcessing();
    }
}
