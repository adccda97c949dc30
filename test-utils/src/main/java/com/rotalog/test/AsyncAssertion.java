package com.rotalog.test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.BooleanSupplier;
import java.util.function.Supplier;

/**
 * Polling assertions for state that an actor thread updates asynchronously, such as the
 * contents of a log file.
 *
 * <pre>{@code
 * AsyncAssertion.eventually(() -> inspector.linesTagged("INFO").size() == 3, Duration.ofSeconds(2));
 * }</pre>
 */
public final class AsyncAssertion {

    private static final long POLL_INTERVAL_MS = 20;

    private AsyncAssertion() {
    }

    /**
     * Polls until the condition holds. An exception thrown by the condition counts as
     * "not yet" and is reported if the timeout expires.
     *
     * @throws AssertionError if the condition does not hold within the timeout
     */
    public static void eventually(BooleanSupplier condition, Duration timeout) {
        Objects.requireNonNull(condition, "condition");
        long deadline = System.nanoTime() + timeout.toNanos();
        Throwable lastFailure = null;
        do {
            try {
                if (condition.getAsBoolean()) {
                    return;
                }
            } catch (RuntimeException | AssertionError e) {
                lastFailure = e;
            }
            pause();
        } while (System.nanoTime() < deadline);

        if (lastFailure == null) {
            throw new AssertionError("Condition still false after " + timeout);
        }
        throw new AssertionError("Condition still failing after " + timeout + ": " + lastFailure.getMessage(),
                lastFailure);
    }

    /**
     * Polls until the supplier yields {@code expected}.
     *
     * @return the matching value
     * @throws AssertionError listing the distinct values seen if it never matched
     */
    public static <T> T awaitValue(Supplier<T> supplier, T expected, Duration timeout) {
        Objects.requireNonNull(supplier, "supplier");
        long deadline = System.nanoTime() + timeout.toNanos();
        List<T> seen = new ArrayList<>();
        do {
            T value = supplier.get();
            if (Objects.equals(expected, value)) {
                return value;
            }
            if (seen.isEmpty() || !Objects.equals(seen.get(seen.size() - 1), value)) {
                seen.add(value);
            }
            pause();
        } while (System.nanoTime() < deadline);

        throw new AssertionError("Value did not become " + expected + " within " + timeout + ", saw " + seen);
    }

    private static void pause() {
        try {
            Thread.sleep(POLL_INTERVAL_MS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AssertionError("Interrupted while polling", e);
        }
    }
}
