package com.batonsystems.queue;

import java.time.Duration;
import java.util.Collection;

/**
 * Abstraction for a capacity-bounded FIFO buffer shared between producer and consumer threads.
 * This interface decouples the pipeline stages from a specific queue implementation.
 *
 * <p>Timeouts are expressed as a {@link Duration}; a {@code null} timeout means
 * "block indefinitely". Implementations measure timeouts against a monotonic clock.
 *
 * @param <T> The type of items stored in the buffer
 */
public interface BlockingBuffer<T> {

    /**
     * Inserts the specified item at the tail of this buffer, waiting as long as necessary
     * for space to become available.
     *
     * @param item the item to add
     * @throws InterruptedException if interrupted while waiting
     */
    void put(T item) throws InterruptedException;

    /**
     * Inserts the specified item at the tail of this buffer, waiting up to the
     * specified time if necessary for space to become available.
     *
     * @param item the item to add
     * @param timeout how long to wait before giving up, or null to wait indefinitely
     * @throws InterruptedException if interrupted while waiting
     * @throws QueueTimeoutException if the buffer was still full when the timeout elapsed;
     *                               the item has not been added
     */
    void put(T item, Duration timeout) throws InterruptedException, QueueTimeoutException;

    /**
     * Retrieves and removes the head of this buffer, waiting as long as necessary
     * for an item to become available.
     *
     * @return the head of this buffer
     * @throws InterruptedException if interrupted while waiting
     */
    T get() throws InterruptedException;

    /**
     * Retrieves and removes the head of this buffer, waiting up to the specified
     * time if necessary for an item to become available.
     *
     * @param timeout how long to wait before giving up, or null to wait indefinitely
     * @return the head of this buffer
     * @throws InterruptedException if interrupted while waiting
     * @throws QueueTimeoutException if the buffer was still empty when the timeout elapsed
     */
    T get(Duration timeout) throws InterruptedException, QueueTimeoutException;

    /**
     * Inserts the specified item if it is possible to do so immediately without
     * exceeding capacity.
     *
     * @param item the item to add
     * @return true if the item was added, false if the buffer is full
     */
    boolean offer(T item);

    /**
     * Retrieves and removes the head of this buffer, or returns null if it is empty.
     *
     * @return the head of this buffer, or null if empty
     */
    T poll();

    /**
     * Removes up to maxElements items from the head of this buffer and adds them,
     * in FIFO order, to the given collection.
     *
     * @param collection the collection to transfer items into
     * @param maxElements the maximum number of items to transfer
     * @return the number of items transferred
     */
    int drainTo(Collection<? super T> collection, int maxElements);

    /**
     * Removes all items from this buffer.
     */
    void clear();

    /**
     * Returns the number of items in this buffer. The value is a snapshot and may be
     * stale as soon as it is returned.
     *
     * @return the number of items
     */
    int size();

    /**
     * Returns the fixed maximum number of items this buffer can hold.
     *
     * @return the capacity
     */
    int capacity();

    /**
     * Returns true if this buffer contains no items.
     *
     * @return true if empty
     */
    default boolean isEmpty() {
        return size() == 0;
    }

    /**
     * Returns true if this buffer holds as many items as its capacity allows.
     *
     * @return true if full
     */
    default boolean isFull() {
        return size() >= capacity();
    }

    /**
     * Returns the number of additional items this buffer can accept without blocking.
     *
     * @return the remaining capacity
     */
    default int remainingCapacity() {
        return Math.max(0, capacity() - size());
    }
}
