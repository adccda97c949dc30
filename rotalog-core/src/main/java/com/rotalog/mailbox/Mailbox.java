package com.rotalog.mailbox;

import java.util.concurrent.TimeUnit;

/**
 * A FIFO channel into an actor. Many threads offer, only the actor thread polls.
 * Order holds within one mailbox; an actor with two mailboxes sees no order between them.
 *
 * @param <T> the element type
 */
public interface Mailbox<T> {

    /**
     * @return false if the mailbox is full
     */
    boolean offer(T element);

    /**
     * Waits up to {@code timeout} for room.
     *
     * @return false if the mailbox was still full when the timeout elapsed
     * @throws InterruptedException if interrupted while waiting
     */
    boolean offer(T element, long timeout, TimeUnit unit) throws InterruptedException;

    /**
     * @return the oldest element, or null if there is none
     */
    T poll();

    /**
     * @return the oldest element, or null if none arrived within the timeout
     * @throws InterruptedException if interrupted while waiting
     */
    T poll(long timeout, TimeUnit unit) throws InterruptedException;

    int size();

    /**
     * @return the bound, {@link Integer#MAX_VALUE} for an unbounded mailbox
     */
    int capacity();
}
