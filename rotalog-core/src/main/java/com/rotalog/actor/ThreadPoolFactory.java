package com.rotalog.actor;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Creates the threads that actors and their timers run on.
 * Threads are named after the actor so they are easy to find in thread dumps.
 * By default they are daemon threads: a logging actor must never keep the JVM alive
 * on its own.
 */
public class ThreadPoolFactory {
    private static final String DEFAULT_THREAD_PREFIX = "rotalog";
    private static final boolean DEFAULT_DAEMON = true;

    private String threadPrefix = DEFAULT_THREAD_PREFIX;
    private boolean daemon = DEFAULT_DAEMON;

    /**
     * Creates a new ThreadPoolFactory with default settings.
     */
    public ThreadPoolFactory() {
        // Use defaults
    }

    /**
     * Creates a thread factory for the dedicated thread of one actor.
     *
     * @param actorId the actor the threads belong to
     * @return a thread factory producing named threads
     */
    public ThreadFactory createThreadFactory(String actorId) {
        return createNamedThreadFactory(threadPrefix + "-" + actorId);
    }

    /**
     * Creates a single-threaded scheduler, used for periodic self-messages.
     *
     * @param poolName Name prefix for the scheduler thread
     * @return A new scheduled executor service
     */
    public ScheduledExecutorService createScheduledExecutorService(String poolName) {
        return Executors.newSingleThreadScheduledExecutor(
                createNamedThreadFactory(threadPrefix + "-" + poolName + "-scheduler"));
    }

    private ThreadFactory createNamedThreadFactory(String prefix) {
        return new ThreadFactory() {
            private final AtomicInteger threadNumber = new AtomicInteger(1);

            @Override
            public Thread newThread(Runnable r) {
                Thread thread = new Thread(r, prefix + "-" + threadNumber.getAndIncrement());
                thread.setDaemon(daemon);
                return thread;
            }
        };
    }

    public String getThreadPrefix() {
        return threadPrefix;
    }

    public ThreadPoolFactory setThreadPrefix(String threadPrefix) {
        this.threadPrefix = threadPrefix;
        return this;
    }

    public boolean isDaemon() {
        return daemon;
    }

    public ThreadPoolFactory setDaemon(boolean daemon) {
        this.daemon = daemon;
        return this;
    }
}
