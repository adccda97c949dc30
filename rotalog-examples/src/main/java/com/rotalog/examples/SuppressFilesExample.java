package com.rotalog.examples;

import com.rotalog.Priority;
import com.rotalog.RotaLog;
import com.rotalog.config.LogConfig;
import com.rotalog.config.LogConfigSource;
import com.rotalog.examples.suppress.File1;
import com.rotalog.examples.suppress.File2;
import com.rotalog.examples.suppress.File3;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Suppresses the DEBUG entries of selected source files.
 * <p>
 * Three threads log interleaved DEBUG and INFO entries from three source files. After a
 * second the DEBUG entries of {@code File1} and {@code File2} are suppressed; their INFO
 * entries and everything from {@code File3} keep appearing.
 * <p>
 * Usage: {@code SuppressFilesExample [logDirectory]}, the directory defaults to {@code logs}.
 */
public class SuppressFilesExample {
    private static final Logger logger = LoggerFactory.getLogger(SuppressFilesExample.class);

    public static void main(String[] args) throws InterruptedException {
        String directory = args.length > 0 ? args[0] : "logs";
        LogConfig config = new LogConfig()
                .setRootDir(directory)
                .setFilePrefix("suppress-files")
                .setPriority(Priority.DEBUG);

        try (RotaLog log = RotaLog.builder().configSource(LogConfigSource.fixed(config)).build()) {
            AtomicBoolean running = new AtomicBoolean(true);
            List<Thread> workers = List.of(
                    File1.start(log, running),
                    File2.start(log, running),
                    File3.start(log, running));

            Thread.sleep(1000);

            // The extension is optional
            log.suppress("File1.java,File2");
            logger.info("Suppressed {}", log.getConfig().getSuppressedFiles());

            Thread.sleep(1000);
            running.set(false);
            for (Thread worker : workers) {
                worker.join();
            }
            log.info("Done");
        }
    }
}
