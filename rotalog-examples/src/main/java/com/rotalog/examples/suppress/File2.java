package com.rotalog.examples.suppress;

import com.rotalog.RotaLog;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Logs from {@code File2.java} until told to stop.
 */
public final class File2 {

    private File2() {
    }

    public static Thread start(RotaLog log, AtomicBoolean running) {
        Thread thread = new Thread(() -> {
            int i = 0;
            while (running.get()) {
                log.debugf("file2 debug %d", i);
                log.infof("file2 info %d", i);
                i++;
                try {
                    Thread.sleep(100);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
            }
        }, "file2");
        thread.start();
        return thread;
    }
}
