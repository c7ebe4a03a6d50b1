package com.batonsystems.queue;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * Thrown when a timed {@code put} or {@code get} gives up before the buffer became
 * non-full or non-empty. The buffer is left exactly as it was before the call.
 */
public class QueueTimeoutException extends TimeoutException {

    private static final long serialVersionUID = 1L;

    /**
     * The blocking operation that timed out.
     */
    public enum Operation {
        PUT,
        GET
    }

    private final Operation operation;
    private final Duration timeout;

    /**
     * Creates a new QueueTimeoutException.
     *
     * @param operation the operation that timed out
     * @param timeout the timeout that elapsed
     */
    public QueueTimeoutException(Operation operation, Duration timeout) {
        super(describe(operation, timeout));
        this.operation = operation;
        this.timeout = timeout;
    }

    /**
     * Returns the operation that timed out.
     *
     * @return PUT or GET
     */
    public Operation getOperation() {
        return operation;
    }

    /**
     * Returns the timeout that elapsed.
     *
     * @return the timeout
     */
    public Duration getTimeout() {
        return timeout;
    }

    private static String describe(Operation operation, Duration timeout) {
        return operation == Operation.PUT
                ? "Buffer still full after waiting " + timeout
                : "Buffer still empty after waiting " + timeout;
    }
}
