package com.rotalog.actor;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * The pending answer to a command sent to an actor.
 * <p>
 * Two ways to wait:
 * <ul>
 *   <li>{@link #get(Duration)}: bounded. Expiry means the actor is stuck and raises the
 *   fatal {@link ActorTimeoutException}.</li>
 *   <li>{@link #get()}: unbounded, for callers that are meant to park until the actor
 *   finishes (process exit).</li>
 * </ul>
 * If the actor completed the reply exceptionally, the cause is rethrown as is when it
 * is unchecked, otherwise wrapped in a {@link ReplyException}.
 */
public interface Reply<T> {

    /**
     * Blocks until the reply arrives or the timeout expires.
     *
     * @throws ActorTimeoutException if no reply arrived in time
     */
    T get(Duration timeout);

    /**
     * Blocks until the reply arrives.
     */
    T get();

    /**
     * @return true once the actor has answered
     */
    boolean isDone();

    /**
     * Access the underlying CompletableFuture.
     */
    CompletableFuture<T> future();

    /**
     * Create a Reply from a CompletableFuture.
     *
     * @param future    the future the actor will complete
     * @param actorId   actor expected to complete it, used in timeout messages
     * @param operation what the actor was asked to do, used in timeout messages
     */
    static <T> Reply<T> from(CompletableFuture<T> future, String actorId, String operation) {
        return new PendingReply<>(future, actorId, operation);
    }

    /**
     * Create an already-failed Reply.
     */
    static <T> Reply<T> failed(Throwable error, String actorId, String operation) {
        return new PendingReply<>(CompletableFuture.failedFuture(error), actorId, operation);
    }
}
