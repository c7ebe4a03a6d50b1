package com.batonsystems.test;

import com.batonsystems.queue.BlockingBuffer;

import java.time.Duration;
import java.util.Objects;

/**
 * Inspector for examining buffer state during testing.
 * Provides visibility into queue depth, capacity and fill ratio.
 *
 * <p>Usage:
 * <pre>{@code
 * BufferInspector inspector = BufferInspector.of(queue);
 * producer.start();
 *
 * inspector.awaitFull(Duration.ofSeconds(1));
 * assertEquals(1.0, inspector.fillRatio());
 * }</pre>
 */
public class BufferInspector {

    private final BlockingBuffer<?> buffer;

    private BufferInspector(BlockingBuffer<?> buffer) {
        this.buffer = buffer;
    }

    /**
     * Creates a BufferInspector for the given buffer.
     *
     * @param buffer the buffer to inspect
     * @return a BufferInspector instance
     */
    public static BufferInspector of(BlockingBuffer<?> buffer) {
        return new BufferInspector(Objects.requireNonNull(buffer, "buffer cannot be null"));
    }

    /**
     * Gets the current number of items in the buffer.
     *
     * @return the current buffer size
     */
    public int size() {
        return buffer.size();
    }

    /**
     * Gets the maximum capacity of the buffer.
     *
     * @return the buffer capacity
     */
    public int capacity() {
        return buffer.capacity();
    }

    /**
     * Gets the current fill ratio (size/capacity).
     *
     * @return the fill ratio between 0.0 and 1.0
     */
    public double fillRatio() {
        return (double) buffer.size() / buffer.capacity();
    }

    public boolean isEmpty() {
        return buffer.isEmpty();
    }

    public boolean isFull() {
        return buffer.isFull();
    }

    /**
     * Waits until the buffer holds exactly the expected number of items.
     *
     * @param expected the expected size
     * @param timeout maximum time to wait
     * @throws AssertionError if the size does not match within timeout
     */
    public void awaitSize(int expected, Duration timeout) {
        try {
            AsyncAssertion.eventually(() -> buffer.size() == expected, timeout);
        } catch (AssertionError e) {
            throw new AssertionError(String.format(
                    "Buffer size did not become %d within %s. Final size: %d",
                    expected, timeout, buffer.size()), e);
        }
    }

    /**
     * Waits until the buffer is full.
     *
     * @param timeout maximum time to wait
     */
    public void awaitFull(Duration timeout) {
        awaitSize(buffer.capacity(), timeout);
    }

    /**
     * Waits until the buffer is empty.
     *
     * @param timeout maximum time to wait
     */
    public void awaitEmpty(Duration timeout) {
        awaitSize(0, timeout);
    }

    @Override
    public String toString() {
        return String.format("BufferInspector{size=%d, capacity=%d, fillRatio=%.2f}",
                size(), capacity(), fillRatio());
    }
}
