package com.rotalog.actor;

import org.junit.jupiter.api.Test;

import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class ThreadPoolFactoryTest {

    @Test
    void testActorThreadsAreNamedDaemons() {
        Thread thread = new ThreadPoolFactory().createThreadFactory("logger").newThread(() -> { });

        assertEquals("rotalog-logger-1", thread.getName());
        assertTrue(thread.isDaemon());
    }

    @Test
    void testPrefixAndDaemonAreConfigurable() {
        ThreadPoolFactory factory = new ThreadPoolFactory().setThreadPrefix("app").setDaemon(false);
        Thread thread = factory.createThreadFactory("fileset").newThread(() -> { });

        assertEquals("app-fileset-1", thread.getName());
        assertFalse(thread.isDaemon());
    }

    @Test
    void testSchedulerRunsOnNamedThread() throws Exception {
        ScheduledExecutorService scheduler = new ThreadPoolFactory().createScheduledExecutorService("logger");
        try {
            AtomicReference<String> name = new AtomicReference<>();
            scheduler.schedule(() -> name.set(Thread.currentThread().getName()), 1, TimeUnit.MILLISECONDS)
                    .get(2, TimeUnit.SECONDS);
            assertEquals("rotalog-logger-scheduler-1", name.get());
        } finally {
            scheduler.shutdownNow();
        }
    }
}
