package com.rotalog.mailbox;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * {@link Mailbox} on a {@link LinkedBlockingQueue}. When bounded, a timed
 * {@link #offer(Object, long, TimeUnit)} parks the sender until the actor catches up.
 *
 * @param <T> the element type
 */
public class LinkedMailbox<T> implements Mailbox<T> {

    private final BlockingQueue<T> queue;
    private final int capacity;

    /**
     * Creates an unbounded mailbox, as used for commands.
     */
    public LinkedMailbox() {
        this(Integer.MAX_VALUE);
    }

    public LinkedMailbox(int capacity) {
        Preconditions.checkArgument(capacity > 0, "capacity must be positive: %s", capacity);
        this.queue = new LinkedBlockingQueue<>(capacity);
        this.capacity = capacity;
    }

    @Override
    public boolean offer(T element) {
        return queue.offer(Preconditions.checkNotNull(element, "element"));
    }

    @Override
    public boolean offer(T element, long timeout, TimeUnit unit) throws InterruptedException {
        return queue.offer(Preconditions.checkNotNull(element, "element"), timeout, unit);
    }

    @Override
    public T poll() {
        return queue.poll();
    }

    @Override
    public T poll(long timeout, TimeUnit unit) throws InterruptedException {
        return queue.poll(timeout, unit);
    }

    @Override
    public int size() {
        return queue.size();
    }

    @Override
    public int capacity() {
        return capacity;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("size", queue.size())
                .add("capacity", capacity == Integer.MAX_VALUE ? "unbounded" : String.valueOf(capacity))
                .toString();
    }
}
