package com.rotalog.examples;

import com.rotalog.Priority;
import com.rotalog.RotaLog;
import com.rotalog.config.LogConfig;
import com.rotalog.config.LogConfigSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Changes file size and threshold of a running logger.
 * <p>
 * Starts at DEBUG with small files so that the first entries flow over two files, then
 * raises the size limit and the threshold: later DEBUG entries are discarded.
 * <p>
 * Usage: {@code SetConfigExample [logDirectory]}, the directory defaults to {@code logs}.
 */
public class SetConfigExample {
    private static final Logger logger = LoggerFactory.getLogger(SetConfigExample.class);

    public static void main(String[] args) {
        String directory = args.length > 0 ? args[0] : "logs";
        LogConfig initial = new LogConfig()
                .setRootDir(directory)
                .setFilePrefix("set-config")
                .setMaxFileBytes(400)
                .setPriority(Priority.DEBUG);

        try (RotaLog log = RotaLog.builder().configSource(LogConfigSource.fixed(initial)).build()) {
            log.info("Test started");

            for (int i = 0; i < 2; i++) {
                log.debugf("Debug %d", i);
                log.infof("Info %d", i);
            }

            log.setConfig(3, 10_000_000, Priority.INFO);

            // Debug entries are discarded from here on
            for (int i = 2; i < 5; i++) {
                log.debugf("Debug %d", i);
                log.infof("Info %d", i);
            }
            log.info("Done");
            logger.info("Configuration now {}", log.getConfig());
            logger.info("Log files: {}", log.listLogFiles());
        }
    }
}
