package com.rotalog.examples.suppress;

import com.rotalog.RotaLog;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Logs from {@code File1.java} until told to stop.
 */
public final class File1 {

    private File1() {
    }

    public static Thread start(RotaLog log, AtomicBoolean running) {
        Thread thread = new Thread(() -> {
            int i = 0;
            while (running.get()) {
                log.debugf("file1 debug %d", i);
                log.infof("file1 info %d", i);
                i++;
                try {
                    Thread.sleep(100);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
            }
        }, "file1");
        thread.start();
        return thread;
    }
}
