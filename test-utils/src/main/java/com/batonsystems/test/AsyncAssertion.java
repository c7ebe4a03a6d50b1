package com.batonsystems.test;

import java.time.Duration;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;
import java.util.function.BooleanSupplier;

/**
 * Utilities for async assertions in concurrency tests.
 * Provides better alternatives to a fixed Thread.sleep() for waiting on async conditions.
 *
 * <p>Usage:
 * <pre>{@code
 * // Wait for a condition to become true
 * AsyncAssertion.eventually(() -> queue.size() == 2, Duration.ofSeconds(2));
 *
 * // Wait until a thread is parked inside put() or get()
 * AsyncAssertion.awaitBlocked(producerThread, Duration.ofSeconds(2));
 * }</pre>
 */
public final class AsyncAssertion {

    private static final long DEFAULT_POLL_INTERVAL_MS = 10;

    private static final Set<Thread.State> BLOCKED_STATES =
            EnumSet.of(Thread.State.WAITING, Thread.State.TIMED_WAITING, Thread.State.BLOCKED);

    private AsyncAssertion() {
    }

    /**
     * Waits until the condition becomes true or timeout is reached.
     *
     * @param condition the condition to check
     * @param timeout the maximum time to wait
     * @throws AssertionError if condition doesn't become true within timeout
     */
    public static void eventually(BooleanSupplier condition, Duration timeout) {
        eventually(condition, timeout, DEFAULT_POLL_INTERVAL_MS);
    }

    /**
     * Waits until the condition becomes true or timeout is reached.
     *
     * @param condition the condition to check
     * @param timeout the maximum time to wait
     * @param pollIntervalMs the interval between checks in milliseconds
     * @throws AssertionError if condition doesn't become true within timeout
     */
    public static void eventually(BooleanSupplier condition, Duration timeout, long pollIntervalMs) {
        Objects.requireNonNull(condition, "condition cannot be null");
        Objects.requireNonNull(timeout, "timeout cannot be null");
        long deadline = System.nanoTime() + timeout.toNanos();
        Throwable lastError = null;

        do {
            try {
                if (condition.getAsBoolean()) {
                    return;
                }
            } catch (RuntimeException | AssertionError e) {
                lastError = e;
            }
            sleep(pollIntervalMs);
        } while (System.nanoTime() - deadline < 0);

        String message = "Condition did not become true within " + timeout;
        if (lastError != null) {
            throw new AssertionError(message + ". Last error: " + lastError.getMessage(), lastError);
        }
        throw new AssertionError(message);
    }

    /**
     * Waits until the given thread is parked, i.e. waiting on a lock or condition.
     * Use it to make sure a thread has actually entered a blocking call before
     * the test lets it proceed.
     *
     * @param thread the thread to watch
     * @param timeout the maximum time to wait
     * @throws AssertionError if the thread terminates or never blocks within timeout
     */
    public static void awaitBlocked(Thread thread, Duration timeout) {
        Objects.requireNonNull(thread, "thread cannot be null");
        eventually(() -> {
            Thread.State state = thread.getState();
            if (state == Thread.State.TERMINATED) {
                throw new AssertionError("Thread " + thread.getName() + " terminated instead of blocking");
            }
            return BLOCKED_STATES.contains(state);
        }, timeout);
    }

    /**
     * Asserts that the condition stays false for the whole duration.
     *
     * @param condition the condition that must not become true
     * @param duration how long to keep checking
     * @throws AssertionError as soon as the condition becomes true
     */
    public static void never(BooleanSupplier condition, Duration duration) {
        Objects.requireNonNull(condition, "condition cannot be null");
        Objects.requireNonNull(duration, "duration cannot be null");
        long deadline = System.nanoTime() + duration.toNanos();
        do {
            if (condition.getAsBoolean()) {
                throw new AssertionError("Condition became true within " + duration);
            }
            sleep(DEFAULT_POLL_INTERVAL_MS);
        } while (System.nanoTime() - deadline < 0);
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AssertionError("Interrupted while waiting for condition", e);
        }
    }
}
