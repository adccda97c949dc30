package com.rotalog.test;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class AsyncAssertionTest {

    @Test
    void testEventuallyReturnsOnceConditionHolds() {
        AtomicInteger written = new AtomicInteger();
        ScheduledExecutorService writer = Executors.newSingleThreadScheduledExecutor();
        try {
            writer.schedule(() -> written.set(3), 50, TimeUnit.MILLISECONDS);

            AsyncAssertion.eventually(() -> written.get() == 3, Duration.ofSeconds(2));
        } finally {
            writer.shutdownNow();
        }
    }

    @Test
    void testEventuallyFailsWithLastError() {
        AssertionError error = assertThrows(AssertionError.class, () ->
                AsyncAssertion.eventually(() -> {
                    throw new IllegalStateException("not yet");
                }, Duration.ofMillis(100)));

        assertTrue(error.getMessage().contains("not yet"));
    }

    @Test
    void testAwaitValueReportsHistory() {
        AtomicInteger counter = new AtomicInteger();

        AssertionError error = assertThrows(AssertionError.class, () ->
                AsyncAssertion.awaitValue(counter::incrementAndGet, -1, Duration.ofMillis(100)));

        assertTrue(error.getMessage().startsWith("Value did not become -1"));
    }

    @Test
    void testAwaitValueReturnsExpected() {
        AtomicInteger counter = new AtomicInteger();

        assertEquals(5, AsyncAssertion.awaitValue(counter::incrementAndGet, 5, Duration.ofSeconds(2)));
    }
}
