package com.rotalog.examples.suppress;

import com.rotalog.RotaLog;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Logs from {@code File3.java} until told to stop.
 */
public final class File3 {

    private File3() {
    }

    public static Thread start(RotaLog log, AtomicBoolean running) {
        Thread thread = new Thread(() -> {
            int i = 0;
            while (running.get()) {
                log.debugf("file3 debug %d", i);
                log.infof("file3 info %d", i);
                i++;
                try {
                    Thread.sleep(100);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
            }
        }, "file3");
        thread.start();
        return thread;
    }
}
