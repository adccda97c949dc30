package com.rotalog.examples;

import com.rotalog.RotaLog;
import com.rotalog.examples.basic.Pkga;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Basic use of the logger.
 * <p>
 * The configuration is read from the first {@code *logging.config} file in the working
 * directory, for example {@code basic.logging.config}:
 * <pre>{@code
 * { "rootDir": "logs" }
 * }</pre>
 * Without such a file the defaults apply and the files go to {@code /usr/local/var/log}.
 * The program ends with a panic, so the last record carries a stack trace and the exit
 * status is 1.
 */
public class BasicExample {
    private static final Logger logger = LoggerFactory.getLogger(BasicExample.class);

    public static void main(String[] args) {
        RotaLog log = RotaLog.builder().filePrefix("basic").build();
        logger.info("Writing to {}", log.listLogFiles());

        log.info("This message WILL appear in the log");
        Pkga.go(log);
        log.debug("This message will NOT appear in the log");

        log.panic("This is a panic");
    }
}
