package com.rotalog.fileset;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.rotalog.actor.Actor;
import com.rotalog.actor.ActorClosedException;
import com.rotalog.actor.Delivery;
import com.rotalog.actor.FatalActorException;
import com.rotalog.actor.Reply;
import com.rotalog.actor.ThreadPoolFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Actor that owns a rotating set of log files in one directory.
 * <p>
 * Files are named {@code <prefix>_<timestamp>.log}. Bytes are appended to the newest
 * file until its payload reaches the size limit, at which point the file is closed, the
 * oldest files are deleted so that at most {@code maxFiles} remain, and a new file is
 * started. Every file begins with a short header that does not count toward its size.
 * <p>
 * All file handling happens on the actor thread. The public methods may be called from
 * any thread and wait a bounded time for the actor to answer; a missing answer raises
 * {@link com.rotalog.actor.ActorTimeoutException}. A failing filesystem operation raises
 * {@link LogFileException} and closes the file set.
 */
public class FileSet extends Actor<WriteRequest, FileSetCommand> {

    public static final int DEFAULT_MAX_FILES = 3;
    public static final long DEFAULT_MAX_FILE_BYTES = 1_000_000L;
    public static final Duration DEFAULT_REPLY_TIMEOUT = Duration.ofSeconds(1);
    static final int WRITE_QUEUE_CAPACITY = 1024;

    private final Path directory;
    private final String prefix;
    private final Clock clock;
    private final Duration replyTimeout;

    // Confined to the actor thread
    private int maxFiles;
    private long maxFileBytes;
    private FileChannel currentChannel;
    private Path currentFile;
    private long currentFileBytes;
    private Instant lastFileInstant = Instant.MIN;

    private FileSet(Builder builder) {
        super("fileset-" + builder.prefix, WRITE_QUEUE_CAPACITY, builder.threadPoolFactory);
        this.directory = builder.directory;
        this.prefix = builder.prefix;
        this.clock = builder.clock;
        this.replyTimeout = builder.replyTimeout;
        this.maxFiles = builder.maxFiles;
        this.maxFileBytes = builder.maxFileBytes;
    }

    /**
     * Starts describing a file set that writes {@code <prefix>_*.log} files into {@code directory}.
     */
    public static Builder builder(Path directory, String prefix) {
        return new Builder(directory, prefix);
    }

    /**
     * Lists the log files of a prefix, oldest first. Only names of the form
     * {@code <prefix>_<file name timestamp>.log} count. The timestamp is fixed width,
     * so name order is creation order.
     *
     * @param directory the log directory
     * @param prefix    the file name prefix
     * @return the matching files, or an empty list if the directory does not exist
     */
    public static List<Path> listLogFiles(Path directory, String prefix) {
        if (!Files.isDirectory(directory)) {
            return Collections.emptyList();
        }
        String head = prefix + "_";
        String tail = ".log";
        // "app_audit_<ts>.log" belongs to another file set
        DirectoryStream.Filter<Path> ownFiles = file -> {
            String name = file.getFileName().toString();
            return name.startsWith(head) && name.endsWith(tail) && name.length() > head.length() + tail.length()
                    && LogTimestamps.isFileNameTimestamp(name.substring(head.length(), name.length() - tail.length()));
        };
        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, ownFiles)) {
            for (Path file : stream) {
                files.add(file);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list log files in " + directory, e);
        }
        Collections.sort(files);
        return files;
    }

    /**
     * @return this file set's files, oldest first
     */
    public List<Path> listLogFiles() {
        return listLogFiles(directory, prefix);
    }

    /**
     * Appends the bytes to the current file, rotating afterwards if the file is full.
     *
     * @return the number of bytes written
     * @throws ActorClosedException if the file set has been closed
     * @throws LogFileException     if the write failed
     */
    public int write(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes");
        CompletableFuture<Integer> reply = new CompletableFuture<>();
        if (tell(new WriteRequest(bytes, reply)) == Delivery.DROPPED) {
            throw new ActorClosedException(getActorId());
        }
        return Reply.from(reply, getActorId(), "write").get(replyTimeout);
    }

    /**
     * Appends the UTF-8 encoding of the text.
     */
    public int write(String text) {
        return write(text.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Replaces the retention limits. The current file is rotated at once if it is already
     * larger than the new size limit.
     */
    public void setConfig(int maxFiles, long maxFileBytes) {
        Preconditions.checkArgument(maxFiles >= 1, "maxFiles must be at least 1: %s", maxFiles);
        Preconditions.checkArgument(maxFileBytes >= 1, "maxFileBytes must be at least 1: %s", maxFileBytes);
        Reply<Void> reply = ask(future -> new FileSetCommand.SetConfig(maxFiles, maxFileBytes, future), "set config");
        reply.get(replyTimeout);
    }

    /**
     * Writes out pending requests and closes the current file. A file that received no
     * payload is deleted. Calling this again has no effect.
     */
    public void close() {
        CompletableFuture<Void> done = new CompletableFuture<>();
        if (command(new FileSetCommand.Close(done)) == Delivery.DROPPED) {
            if (!isActorThread()) {
                awaitTermination(replyTimeout);
            }
            return;
        }
        Reply.from(done, getActorId(), "close").get(replyTimeout);
    }

    public Path getDirectory() {
        return directory;
    }

    public String getPrefix() {
        return prefix;
    }

    @Override
    protected void preStart() {
        getLogger().info("Log directory: {}", directory.toAbsolutePath());
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new LogFileException("Cannot create log directory " + directory, e, getActorId());
        }
        rotate();
    }

    @Override
    protected void receive(WriteRequest request) {
        try {
            request.reply().complete(append(request.bytes()));
        } catch (RuntimeException e) {
            request.reply().completeExceptionally(e);
            throw e;
        }
    }

    @Override
    protected void onCommand(FileSetCommand command) {
        try {
            if (command instanceof FileSetCommand.SetConfig) {
                applyConfig((FileSetCommand.SetConfig) command);
            } else if (command instanceof FileSetCommand.Close) {
                beginDraining();
                drainMessages();
                closeCurrentFile();
                stopProcessing();
            }
            command.reply().complete(null);
        } catch (RuntimeException e) {
            command.reply().completeExceptionally(e);
            throw e;
        }
    }

    @Override
    protected void onDiscarded(FileSetCommand command) {
        if (command instanceof FileSetCommand.Close) {
            command.reply().complete(null);
        } else {
            command.reply().completeExceptionally(new ActorClosedException(getActorId()));
        }
    }

    @Override
    protected void onFatal(FatalActorException exception) {
        if (currentChannel == null) {
            return;
        }
        try {
            currentChannel.close();
        } catch (IOException e) {
            exception.addSuppressed(e);
            getLogger().error("Failed to close {} after a fatal error", currentFile, e);
        }
        currentChannel = null;
    }

    private int append(byte[] bytes) {
        writeFully(bytes);
        currentFileBytes += bytes.length;
        if (currentFileBytes >= maxFileBytes) {
            rotate();
        }
        return bytes.length;
    }

    private void applyConfig(FileSetCommand.SetConfig config) {
        maxFiles = config.maxFiles();
        maxFileBytes = config.maxFileBytes();
        getLogger().debug("File set {} now keeps {} files of {} bytes", prefix, maxFiles, maxFileBytes);
        if (currentFileBytes > maxFileBytes) {
            rotate();
        }
    }

    private void rotate() {
        if (currentChannel != null) {
            closeChannel();
        }
        List<Path> files = listLogFiles();
        int excess = files.size() - maxFiles + 1;
        for (int i = 0; i < excess; i++) {
            delete(files.get(i));
        }
        openNewFile();
        currentFileBytes = 0;
    }

    private void openNewFile() {
        Instant instant = clock.instant();
        if (!instant.isAfter(lastFileInstant)) {
            instant = lastFileInstant.plusNanos(1);
        }
        lastFileInstant = instant;
        Path file = directory.resolve(prefix + "_" + LogTimestamps.forFileName(instant) + ".log");
        try {
            currentChannel = FileChannel.open(file, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new LogFileException("Cannot create log file " + file, e, getActorId());
        }
        currentFile = file;
        getLogger().debug("Opened log file {}", file);
        writeFully(header().getBytes(StandardCharsets.UTF_8));
    }

    private String header() {
        return "File set configuration @ " + LogTimestamps.now(clock) + "\n"
                + "Maximum file size " + maxFileBytes + " bytes\n"
                + "Maximum " + maxFiles + " files\n";
    }

    private void writeFully(byte[] bytes) {
        ByteBuffer buffer = ByteBuffer.wrap(bytes);
        try {
            while (buffer.hasRemaining()) {
                currentChannel.write(buffer);
            }
        } catch (IOException e) {
            throw new LogFileException("Cannot write to log file " + currentFile, e, getActorId());
        }
    }

    private void closeCurrentFile() {
        if (currentChannel == null) {
            return;
        }
        closeChannel();
        if (currentFileBytes < 1) {
            delete(currentFile);
        }
    }

    private void closeChannel() {
        try {
            currentChannel.close();
        } catch (IOException e) {
            throw new LogFileException("Cannot close log file " + currentFile, e, getActorId());
        } finally {
            currentChannel = null;
        }
    }

    private void delete(Path file) {
        try {
            Files.deleteIfExists(file);
            getLogger().debug("Deleted log file {}", file);
        } catch (IOException e) {
            throw new LogFileException("Cannot delete log file " + file, e, getActorId());
        }
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("directory", directory)
                .add("prefix", prefix)
                .add("state", getState())
                .toString();
    }

    /**
     * Collects the settings of a file set. {@link #open()} starts it.
     */
    public static final class Builder {
        private final Path directory;
        private final String prefix;
        private int maxFiles = DEFAULT_MAX_FILES;
        private long maxFileBytes = DEFAULT_MAX_FILE_BYTES;
        private Clock clock = Clock.systemDefaultZone();
        private Duration replyTimeout = DEFAULT_REPLY_TIMEOUT;
        private ThreadPoolFactory threadPoolFactory = new ThreadPoolFactory();

        private Builder(Path directory, String prefix) {
            this.directory = Objects.requireNonNull(directory, "directory");
            this.prefix = Objects.requireNonNull(prefix, "prefix");
            Preconditions.checkArgument(!prefix.isEmpty(), "prefix must not be empty");
        }

        public Builder maxFiles(int maxFiles) {
            Preconditions.checkArgument(maxFiles >= 1, "maxFiles must be at least 1: %s", maxFiles);
            this.maxFiles = maxFiles;
            return this;
        }

        public Builder maxFileBytes(long maxFileBytes) {
            Preconditions.checkArgument(maxFileBytes >= 1, "maxFileBytes must be at least 1: %s", maxFileBytes);
            this.maxFileBytes = maxFileBytes;
            return this;
        }

        /**
         * Clock for file names and headers.
         */
        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        /**
         * How long callers wait for the actor to answer a request.
         */
        public Builder replyTimeout(Duration replyTimeout) {
            Preconditions.checkArgument(!replyTimeout.isNegative() && !replyTimeout.isZero(),
                    "replyTimeout must be positive: %s", replyTimeout);
            this.replyTimeout = replyTimeout;
            return this;
        }

        public Builder threadPoolFactory(ThreadPoolFactory threadPoolFactory) {
            this.threadPoolFactory = Objects.requireNonNull(threadPoolFactory, "threadPoolFactory");
            return this;
        }

        /**
         * Creates the directory if needed, opens the first file and starts the actor.
         *
         * @throws LogFileException if the directory or the first file cannot be created
         */
        public FileSet open() {
            FileSet fileSet = new FileSet(this);
            fileSet.start();
            return fileSet;
        }
    }
}
