package com.rotalog.actor;

import com.google.common.base.Preconditions;
import com.rotalog.mailbox.LinkedMailbox;
import com.rotalog.mailbox.Mailbox;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;

/**
 * Base class for an actor with two inbound channels.
 * <ul>
 *   <li>The <em>message</em> channel is bounded. Senders block while it is full.</li>
 *   <li>The <em>command</em> channel is unbounded and carries control requests, some of
 *   which expect a {@link Reply}.</li>
 * </ul>
 * All handlers run on the actor's single thread, so subclasses keep their state in plain
 * fields. Sends check the {@link ActorState} themselves: once the actor has begun draining,
 * {@link #tell(Object)} and {@link #command(Object)} return {@link Delivery#DROPPED}
 * instead of queueing.
 * <p>
 * A {@link FatalActorException} thrown by a handler closes the actor at once and is passed
 * to {@link #onFatal(FatalActorException)}. Any other exception is logged and the actor
 * keeps running.
 *
 * @param <M> The type of messages on the data channel
 * @param <C> The type of commands on the control channel
 */
public abstract class Actor<M, C> {

    private static final Logger logger = LoggerFactory.getLogger(Actor.class);
    private static final Duration DEFAULT_START_TIMEOUT = Duration.ofSeconds(10);
    // How long a blocked sender waits before re-checking whether the actor still accepts messages
    private static final long OFFER_RETRY_MS = 1;

    private final String actorId;
    private final Logger actorLogger;
    private final Mailbox<M> messages;
    private final Mailbox<C> commands;
    private final MailboxProcessor<M, C> mailboxProcessor;

    // Guards transitions out of the accepting states against in-flight sends
    private final ReentrantReadWriteLock channelLock = new ReentrantReadWriteLock();
    private volatile ActorState state = ActorState.STARTING;

    /**
     * Creates a new actor. The actor does not run until {@link #start()} is called.
     *
     * @param actorId           The actor ID, also used for the thread name
     * @param messageCapacity   Capacity of the bounded message channel
     * @param threadPoolFactory Creates the actor thread
     */
    protected Actor(String actorId, int messageCapacity, ThreadPoolFactory threadPoolFactory) {
        this.actorId = Objects.requireNonNull(actorId, "actorId");
        Preconditions.checkArgument(messageCapacity > 0, "messageCapacity must be positive: %s", messageCapacity);
        this.actorLogger = LoggerFactory.getLogger(getClass().getName() + "." + actorId);
        this.messages = new LinkedMailbox<>(messageCapacity);
        this.commands = new LinkedMailbox<>();
        this.mailboxProcessor = new MailboxProcessor<>(
                actorId,
                messages,
                commands,
                this::handleException,
                new ActorLifecycle<M, C>() {
                    @Override
                    public void preStart() {
                        startActor();
                    }

                    @Override
                    public void receive(M message) {
                        Actor.this.receive(message);
                    }

                    @Override
                    public void onCommand(C command) {
                        Actor.this.onCommand(command);
                    }

                    @Override
                    public void onDiscarded(C command) {
                        Actor.this.onDiscarded(command);
                    }

                    @Override
                    public void postStop() {
                        Actor.this.postStop();
                    }
                },
                threadPoolFactory == null ? new ThreadPoolFactory() : threadPoolFactory);
        logger.debug("Actor {} created with message capacity {}", actorId, messageCapacity);
    }

    /**
     * Processes a message from the data channel.
     *
     * @param message the message to process
     */
    protected abstract void receive(M message);

    /**
     * Processes a command from the control channel.
     *
     * @param command the command to process
     */
    protected abstract void onCommand(C command);

    /**
     * Called on the actor thread before any message is processed.
     * The actor is {@link ActorState#RUNNING} once this returns.
     */
    protected void preStart() {
        // Default implementation does nothing
    }

    /**
     * Called on the actor thread after the loop has stopped.
     */
    protected void postStop() {
        actorLogger.debug("Actor {} stopped.", actorId);
    }

    /**
     * Called for each command that was still queued when the actor stopped.
     * Subclasses release callers waiting on such commands here.
     *
     * @param command the command that will never be processed
     */
    protected void onDiscarded(C command) {
        actorLogger.debug("Actor {} discarded command {}", actorId, command);
    }

    /**
     * Called when a handler failed fatally. The actor is already closed.
     *
     * @param exception the fatal failure
     */
    protected void onFatal(FatalActorException exception) {
        // Default implementation does nothing beyond the error log
    }

    /**
     * Called when a handler threw a non-fatal exception.
     *
     * @param item      the message or command being processed
     * @param exception the exception that was thrown
     */
    protected void onError(Object item, Throwable exception) {
        // Default implementation does nothing beyond the error log
    }

    /**
     * Starts the actor thread and waits until {@link #preStart()} has completed on it.
     *
     * @throws ActorTimeoutException if {@code preStart} did not finish in time
     * @throws RuntimeException      whatever {@code preStart} threw
     */
    public void start() {
        mailboxProcessor.start(DEFAULT_START_TIMEOUT);
    }

    /**
     * Queues a message, blocking while the message channel is full.
     *
     * @param message the message
     * @return {@link Delivery#DROPPED} if the actor no longer accepts messages
     */
    public Delivery tell(M message) {
        Objects.requireNonNull(message, "message");
        try {
            while (true) {
                channelLock.readLock().lock();
                try {
                    if (!state.isAccepting()) {
                        return Delivery.DROPPED;
                    }
                    if (messages.offer(message, OFFER_RETRY_MS, TimeUnit.MILLISECONDS)) {
                        return Delivery.ACCEPTED;
                    }
                } finally {
                    channelLock.readLock().unlock();
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Delivery.DROPPED;
        }
    }

    /**
     * Queues a command on the control channel.
     *
     * @param command the command
     * @return {@link Delivery#DROPPED} if the actor no longer accepts commands
     */
    public Delivery command(C command) {
        Objects.requireNonNull(command, "command");
        channelLock.readLock().lock();
        try {
            if (!state.isAccepting()) {
                return Delivery.DROPPED;
            }
            commands.offer(command);
            return Delivery.ACCEPTED;
        } finally {
            channelLock.readLock().unlock();
        }
    }

    /**
     * Sends a command that carries its own reply future.
     * If the actor is no longer accepting commands the reply fails with {@link ActorClosedException}.
     *
     * @param request   builds the command around the reply future
     * @param operation what is being asked, used in timeout messages
     * @return the pending reply
     */
    protected <T> Reply<T> ask(Function<CompletableFuture<T>, ? extends C> request, String operation) {
        CompletableFuture<T> future = new CompletableFuture<>();
        if (command(request.apply(future)) == Delivery.DROPPED) {
            return Reply.failed(new ActorClosedException(actorId), actorId, operation);
        }
        return Reply.from(future, actorId, operation);
    }

    /**
     * Processes, in order, the messages that are queued right now. Messages that arrive
     * while the flush is running are left for the regular loop.
     * Must be called from a handler.
     *
     * @return the number of messages processed
     */
    protected int drainMessages() {
        int pending = messages.size();
        int processed = 0;
        while (processed < pending) {
            M message = messages.poll();
            if (message == null) {
                break;
            }
            processed++;
            try {
                receive(message);
            } catch (FatalActorException e) {
                throw e;
            } catch (RuntimeException e) {
                actorLogger.error("Actor {} error processing message: {}", actorId, message, e);
                onError(message, e);
            }
        }
        return processed;
    }

    /**
     * Stops accepting messages and commands. Already queued messages remain queued
     * for {@link #drainMessages()}. Must be called from a handler.
     */
    protected void beginDraining() {
        channelLock.writeLock().lock();
        try {
            if (state.isAccepting()) {
                state = ActorState.DRAINING;
            }
        } finally {
            channelLock.writeLock().unlock();
        }
    }

    /**
     * Moves the actor to {@link ActorState#CLOSED} and stops the loop once the current
     * handler returns.
     */
    protected void stopProcessing() {
        channelLock.writeLock().lock();
        try {
            state = ActorState.CLOSED;
        } finally {
            channelLock.writeLock().unlock();
        }
        mailboxProcessor.requestStop();
    }

    /**
     * Waits for the actor thread to exit.
     *
     * @param timeout the maximum time to wait
     * @return true if the thread has terminated
     */
    public boolean awaitTermination(Duration timeout) {
        return mailboxProcessor.awaitTermination(timeout);
    }

    public ActorState getState() {
        return state;
    }

    public String getActorId() {
        return actorId;
    }

    /**
     * @return the number of messages waiting on the data channel
     */
    public int getPendingMessages() {
        return mailboxProcessor.getCurrentSize();
    }

    /**
     * @return true if the caller is running on this actor's thread
     */
    protected boolean isActorThread() {
        return mailboxProcessor.isActorThread();
    }

    /**
     * Gets the logger for this actor, named after the actor class and ID.
     */
    protected Logger getLogger() {
        return actorLogger;
    }

    private void startActor() {
        try {
            preStart();
        } catch (RuntimeException e) {
            stopProcessing();
            if (e instanceof FatalActorException) {
                onFatal((FatalActorException) e);
            }
            throw e;
        }
        channelLock.writeLock().lock();
        try {
            if (state == ActorState.STARTING) {
                state = ActorState.RUNNING;
            }
        } finally {
            channelLock.writeLock().unlock();
        }
    }

    private void handleException(Object item, Throwable exception) {
        if (exception instanceof FatalActorException) {
            actorLogger.error("Actor {} failed fatally processing {}", actorId, item, exception);
            stopProcessing();
            onFatal((FatalActorException) exception);
        } else {
            actorLogger.error("Actor {} error processing {}", actorId, item, exception);
            onError(item, exception);
        }
    }
}
