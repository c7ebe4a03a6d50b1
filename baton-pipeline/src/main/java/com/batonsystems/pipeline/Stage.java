package com.batonsystems.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * A unit of concurrent work in a pipeline, running on its own thread.
 *
 * <p>A stage is started once, may be awaited any number of times, and is never restarted.
 * Whatever {@link #process()} throws is recorded and exposed through {@link #getFailure()}
 * once the stage has terminated; {@link Thread#join()} inside {@link #join()} gives the
 * awaiting thread visibility of everything the stage wrote.
 */
public abstract class Stage {
    private static final Logger logger = LoggerFactory.getLogger(Stage.class);

    /**
     * Lifecycle of a stage.
     */
    public enum State {
        NEW,
        RUNNING,
        TERMINATED
    }

    private final String role;
    private final ThreadFactory threadFactory;
    private final AtomicReference<State> state = new AtomicReference<>(State.NEW);

    private volatile Thread thread;
    private volatile Throwable failure;

    /**
     * @param role          the role of the stage, used for logging until a thread is assigned
     * @param threadFactory the factory creating this stage's thread
     */
    protected Stage(String role, ThreadFactory threadFactory) {
        this.role = Objects.requireNonNull(role, "role cannot be null");
        this.threadFactory = Objects.requireNonNull(threadFactory, "threadFactory cannot be null");
    }

    /**
     * The work of this stage. Runs once, on the stage's own thread.
     *
     * @throws Exception any failure, recorded as this stage's failure
     */
    protected abstract void process() throws Exception;

    /**
     * Starts the stage on a new thread.
     *
     * @throws IllegalStateException if the stage was already started
     */
    public void start() {
        if (!state.compareAndSet(State.NEW, State.RUNNING)) {
            throw new IllegalStateException("Stage " + getName() + " cannot be started twice");
        }
        Thread t = threadFactory.newThread(this::runStage);
        thread = t;
        logger.debug("Starting {} stage on thread {}", role, t.getName());
        t.start();
    }

    /**
     * Waits for the stage to terminate.
     *
     * @throws InterruptedException if interrupted while waiting
     * @throws IllegalStateException if the stage was never started
     */
    public void join() throws InterruptedException {
        requireStarted().join();
    }

    /**
     * Waits at most the given time for the stage to terminate.
     *
     * @param timeout the maximum time to wait
     * @return true if the stage has terminated
     * @throws InterruptedException if interrupted while waiting
     */
    public boolean join(Duration timeout) throws InterruptedException {
        Thread t = requireStarted();
        t.join(Math.max(1L, TimeUnit.MILLISECONDS.convert(timeout)));
        return !t.isAlive();
    }

    /**
     * Interrupts the stage's thread, if it has been started.
     */
    public void interrupt() {
        Thread t = thread;
        if (t != null) {
            t.interrupt();
        }
    }

    public boolean isAlive() {
        Thread t = thread;
        return t != null && t.isAlive();
    }

    public State getState() {
        return state.get();
    }

    /**
     * Returns the name of the stage's thread, or its role if it has not been started.
     *
     * @return the stage name
     */
    public String getName() {
        Thread t = thread;
        return t != null ? t.getName() : role;
    }

    /**
     * Returns the failure recorded by this stage.
     *
     * @return the failure, or null if the stage has not failed
     */
    public Throwable getFailure() {
        return failure;
    }

    public boolean hasFailed() {
        return failure != null;
    }

    private void runStage() {
        try {
            process();
            logger.debug("Stage {} finished", getName());
        } catch (Exception e) {
            failure = e;
            logger.warn("Stage {} failed: {}", getName(), e.toString());
        } catch (Error e) {
            failure = e;
            throw e;
        } finally {
            state.set(State.TERMINATED);
        }
    }

    private Thread requireStarted() {
        Thread t = thread;
        if (t == null) {
            throw new IllegalStateException("Stage " + role + " has not been started");
        }
        return t;
    }
}
