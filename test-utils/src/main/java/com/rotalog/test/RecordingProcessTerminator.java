package com.rotalog.test;

import com.rotalog.actor.ProcessTerminator;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * A {@link ProcessTerminator} that records termination requests instead of ending the JVM.
 */
public class RecordingProcessTerminator implements ProcessTerminator {

    private final List<Integer> exitStatuses = new CopyOnWriteArrayList<>();
    private final List<String> abortReasons = new CopyOnWriteArrayList<>();
    private final List<Throwable> abortCauses = new CopyOnWriteArrayList<>();
    private final CountDownLatch terminated = new CountDownLatch(1);

    @Override
    public void exit(int status) {
        exitStatuses.add(status);
        terminated.countDown();
    }

    @Override
    public void abort(String reason, Throwable cause) {
        abortReasons.add(reason);
        if (cause != null) {
            abortCauses.add(cause);
        }
        terminated.countDown();
    }

    /**
     * Waits for the first exit or abort.
     *
     * @return true if the process would have terminated within the timeout
     */
    public boolean awaitTermination(Duration timeout) {
        try {
            return terminated.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    public List<Integer> getExitStatuses() {
        return exitStatuses;
    }

    public List<String> getAbortReasons() {
        return abortReasons;
    }

    public List<Throwable> getAbortCauses() {
        return abortCauses;
    }

    public boolean wasAborted() {
        return !abortReasons.isEmpty();
    }
}
