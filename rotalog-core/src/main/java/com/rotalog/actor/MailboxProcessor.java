package com.rotalog.actor;

import com.rotalog.mailbox.Mailbox;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.BiConsumer;

/**
 * Runs an actor's receive loop on one dedicated thread.
 * <p>
 * Two mailboxes are merged into the loop: a data channel and a control channel.
 * The loop alternates between them, so neither channel starves the other and no
 * priority exists between them. Within a channel, processing follows submission order.
 *
 * @param <M> The type of messages on the data channel
 * @param <C> The type of commands on the control channel
 */
public class MailboxProcessor<M, C> {
    private static final Logger logger = LoggerFactory.getLogger(MailboxProcessor.class);

    // Idle wait on the data channel before checking the control channel again
    private static final long POLL_TIMEOUT_MS = 1;

    private final String actorId;
    private final Mailbox<M> messages;
    private final Mailbox<C> commands;
    private final BiConsumer<Object, Throwable> exceptionHandler;
    private final ActorLifecycle<M, C> lifecycle;
    private final ThreadPoolFactory threadPoolFactory;

    private volatile boolean running = false;
    private volatile Thread thread;
    private volatile RuntimeException startFailure;
    private final CountDownLatch readyLatch = new CountDownLatch(1);

    /**
     * Creates a new mailbox processor.
     *
     * @param actorId           The ID of the actor for logging and thread naming
     * @param messages          The data channel
     * @param commands          The control channel
     * @param exceptionHandler  Receives the message or command whose handler threw
     * @param lifecycle         Callbacks into the actor
     * @param threadPoolFactory Creates the actor thread
     */
    public MailboxProcessor(
            String actorId,
            Mailbox<M> messages,
            Mailbox<C> commands,
            BiConsumer<Object, Throwable> exceptionHandler,
            ActorLifecycle<M, C> lifecycle,
            ThreadPoolFactory threadPoolFactory) {
        this.actorId = actorId;
        this.messages = messages;
        this.commands = commands;
        this.exceptionHandler = exceptionHandler;
        this.lifecycle = lifecycle;
        this.threadPoolFactory = threadPoolFactory;
    }

    /**
     * Starts the actor thread and blocks until {@code preStart} has completed on it.
     *
     * @param startTimeout how long to wait for {@code preStart}
     * @throws ActorTimeoutException if the actor did not start in time
     * @throws RuntimeException the exception {@code preStart} threw, if any
     */
    public void start(Duration startTimeout) {
        if (thread != null) {
            logger.debug("Actor {} mailbox already started", actorId);
            return;
        }
        running = true;
        logger.debug("Starting actor {} mailbox", actorId);
        thread = threadPoolFactory.createThreadFactory(actorId).newThread(this::processMailboxLoop);
        thread.start();

        try {
            if (!readyLatch.await(startTimeout.toNanos(), TimeUnit.NANOSECONDS)) {
                throw new ActorTimeoutException(actorId, "start", startTimeout);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ActorException("Interrupted while waiting for actor to start", e, actorId);
        }
        if (startFailure != null) {
            throw startFailure;
        }
    }

    /**
     * Makes the loop exit after the current message or command.
     * Safe to call from the actor thread itself.
     */
    public void requestStop() {
        running = false;
    }

    /**
     * Waits for the actor thread to finish.
     *
     * @param timeout the maximum time to wait
     * @return true if the thread has terminated
     */
    public boolean awaitTermination(Duration timeout) {
        Thread current = thread;
        if (current == null || current == Thread.currentThread()) {
            return current == null;
        }
        try {
            current.join(Math.max(1, timeout.toMillis()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return !current.isAlive();
    }

    /**
     * Returns true if the loop is still running.
     */
    public boolean isRunning() {
        return running;
    }

    /**
     * @return true if the caller is running on this actor's thread
     */
    public boolean isActorThread() {
        return Thread.currentThread() == thread;
    }

    /**
     * Gets the current number of messages on the data channel.
     */
    public int getCurrentSize() {
        return messages.size();
    }

    private void processMailboxLoop() {
        try {
            lifecycle.preStart();
        } catch (RuntimeException e) {
            logger.error("Actor {} failed to start", actorId, e);
            startFailure = e;
            running = false;
        } finally {
            readyLatch.countDown();
        }
        if (startFailure != null) {
            return;
        }

        while (running) {
            try {
                C command = commands.poll();
                if (command != null) {
                    dispatch(command, true);
                    if (!running) {
                        break;
                    }
                }
                M message = command != null
                        ? messages.poll()
                        : messages.poll(POLL_TIMEOUT_MS, TimeUnit.MILLISECONDS);
                if (message != null) {
                    dispatch(message, false);
                }
            } catch (InterruptedException e) {
                logger.debug("Actor {} mailbox interrupted", actorId);
                Thread.currentThread().interrupt();
                break;
            }
        }

        C leftover;
        while ((leftover = commands.poll()) != null) {
            try {
                lifecycle.onDiscarded(leftover);
            } catch (RuntimeException e) {
                logger.error("Actor {} error discarding command: {}", actorId, leftover, e);
            }
        }
        lifecycle.postStop();
        logger.debug("Actor {} mailbox stopped", actorId);
    }

    @SuppressWarnings("unchecked")
    private void dispatch(Object item, boolean isCommand) {
        try {
            if (isCommand) {
                lifecycle.onCommand((C) item);
            } else {
                lifecycle.receive((M) item);
            }
        } catch (Throwable e) {
            exceptionHandler.accept(item, e);
        }
    }
}
