package com.rotalog.sources;

import com.rotalog.RotaLog;

/**
 * Logs from its own source file, for suppression tests.
 */
public final class Pkgc {

    private Pkgc() {
    }

    public static void debug(RotaLog log, String message) {
        log.debug(message);
    }
}
