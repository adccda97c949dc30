package com.rotalog.examples.basic;

import com.rotalog.RotaLog;

/**
 * A second source file. Its entries are tagged with {@code Pkga.java}.
 */
public final class Pkga {

    private Pkga() {
    }

    public static void go(RotaLog log) {
        log.info("This is pkga");
        log.debug("This debug message from pkga will NOT appear in the log");
    }
}
