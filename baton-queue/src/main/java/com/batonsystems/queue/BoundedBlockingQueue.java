package com.batonsystems.queue;

import com.batonsystems.config.InvalidConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Capacity-bounded FIFO buffer guarded by a single lock and two conditions.
 *
 * <p>Every check-mutate-signal sequence runs with the lock held; the lock is only released
 * implicitly while a caller waits on {@code notFull} or {@code notEmpty}. Waiters re-check
 * their predicate after every wake-up, so a spurious wake-up, or an item or slot taken by
 * another thread first, simply sends them back to waiting. Successful puts and gets signal
 * a single waiter of the opposite kind.
 *
 * <p>Timed waits use {@link Condition#awaitNanos(long)}, which measures against
 * {@link System#nanoTime()}; wall-clock adjustments never shorten or extend a wait, and each
 * re-wait only gets what is left of the original budget.
 *
 * <p>Recommended for:
 * - Producer/consumer hand-off where the producer must be slowed to the consumer's pace
 * - Small capacities, where a single lock is cheaper than the two-lock linked design
 *
 * @param <T> The type of items
 */
public class BoundedBlockingQueue<T> implements BlockingBuffer<T> {
    private static final Logger logger = LoggerFactory.getLogger(BoundedBlockingQueue.class);

    // The deque grows on demand; capacity is enforced by the capacity field, not the array.
    private static final int INITIAL_BUFFER_SIZE = 16;

    private final ArrayDeque<T> buffer;
    private final int capacity;
    private final ReentrantLock lock;
    private final Condition notFull;
    private final Condition notEmpty;

    /**
     * Creates a queue with the given capacity and a non-fair lock.
     *
     * @param capacity the maximum number of items, at least 1
     * @throws InvalidConfigurationException if capacity is zero or negative
     */
    public BoundedBlockingQueue(int capacity) {
        this(capacity, false);
    }

    /**
     * Creates a queue with the given capacity and lock fairness policy.
     *
     * @param capacity the maximum number of items, at least 1
     * @param fair if true, blocked threads acquire the lock in FIFO order
     * @throws InvalidConfigurationException if capacity is zero or negative
     */
    public BoundedBlockingQueue(int capacity, boolean fair) {
        this.capacity = InvalidConfigurationException.requirePositive("capacity", capacity);
        this.buffer = new ArrayDeque<>(Math.min(capacity, INITIAL_BUFFER_SIZE));
        this.lock = new ReentrantLock(fair);
        this.notFull = lock.newCondition();
        this.notEmpty = lock.newCondition();
        logger.debug("Created BoundedBlockingQueue with capacity: {}, fair: {}", capacity, fair);
    }

    @Override
    public void put(T item) throws InterruptedException {
        Objects.requireNonNull(item, "Item cannot be null");
        lock.lockInterruptibly();
        try {
            while (buffer.size() == capacity) {
                notFull.await();
            }
            enqueue(item);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void put(T item, Duration timeout) throws InterruptedException, QueueTimeoutException {
        if (timeout == null) {
            put(item);
            return;
        }
        Objects.requireNonNull(item, "Item cannot be null");
        long nanos = TimeUnit.NANOSECONDS.convert(timeout);
        lock.lockInterruptibly();
        try {
            while (buffer.size() == capacity) {
                if (nanos <= 0L) {
                    throw new QueueTimeoutException(QueueTimeoutException.Operation.PUT, timeout);
                }
                nanos = notFull.awaitNanos(nanos);
            }
            enqueue(item);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public T get() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (buffer.isEmpty()) {
                notEmpty.await();
            }
            return dequeue();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public T get(Duration timeout) throws InterruptedException, QueueTimeoutException {
        if (timeout == null) {
            return get();
        }
        long nanos = TimeUnit.NANOSECONDS.convert(timeout);
        lock.lockInterruptibly();
        try {
            while (buffer.isEmpty()) {
                if (nanos <= 0L) {
                    throw new QueueTimeoutException(QueueTimeoutException.Operation.GET, timeout);
                }
                nanos = notEmpty.awaitNanos(nanos);
            }
            return dequeue();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean offer(T item) {
        Objects.requireNonNull(item, "Item cannot be null");
        lock.lock();
        try {
            if (buffer.size() == capacity) {
                return false;
            }
            enqueue(item);
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public T poll() {
        lock.lock();
        try {
            return buffer.isEmpty() ? null : dequeue();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int drainTo(Collection<? super T> collection, int maxElements) {
        Objects.requireNonNull(collection, "Collection cannot be null");
        if (collection == this) {
            throw new IllegalArgumentException("Cannot drain to self");
        }
        lock.lock();
        try {
            int count = 0;
            while (count < maxElements && !buffer.isEmpty()) {
                collection.add(dequeue());
                count++;
            }
            return count;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void clear() {
        lock.lock();
        try {
            int removed = buffer.size();
            buffer.clear();
            if (removed > 0) {
                notFull.signalAll();
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int size() {
        lock.lock();
        try {
            return buffer.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int capacity() {
        return capacity;
    }

    @Override
    public boolean isEmpty() {
        lock.lock();
        try {
            return buffer.isEmpty();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean isFull() {
        lock.lock();
        try {
            return buffer.size() == capacity;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int remainingCapacity() {
        lock.lock();
        try {
            return capacity - buffer.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns true if the queue lock grants access in FIFO order.
     *
     * @return the fairness policy
     */
    public boolean isFair() {
        return lock.isFair();
    }

    @Override
    public String toString() {
        lock.lock();
        try {
            return "BoundedBlockingQueue{size=" + buffer.size() + ", capacity=" + capacity + '}';
        } finally {
            lock.unlock();
        }
    }

    // Callers must hold the lock.

    private void enqueue(T item) {
        buffer.addLast(item);
        notEmpty.signal();
    }

    private T dequeue() {
        T item = buffer.removeFirst();
        notFull.signal();
        return item;
    }
}
