package com.batonsystems.pipeline;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Exception thrown when a pipeline stage fails.
 *
 * <p>When surfaced by {@link PipelineResult#getOrThrow()}, the exception carries the items
 * consumers had already drained, so callers can tell a partial run from an empty one.
 */
public class PipelineException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** The name of the stage where the failure occurred. */
    private final String stageName;

    private transient volatile List<Object> drainedItems = Collections.emptyList();

    /**
     * Creates a new PipelineException with the specified detail message and stage name.
     *
     * @param message the detail message
     * @param stageName the name of the failing stage
     */
    public PipelineException(String message, String stageName) {
        super(message);
        this.stageName = stageName;
    }

    /**
     * Creates a new PipelineException with the specified detail message, cause and stage name.
     *
     * @param message the detail message
     * @param cause the cause of the exception
     * @param stageName the name of the failing stage
     */
    public PipelineException(String message, Throwable cause, String stageName) {
        super(message, cause);
        this.stageName = stageName;
    }

    /**
     * Returns the name of the stage where the failure occurred.
     *
     * @return the stage name, e.g. "pipeline-producer-1"
     */
    public String getStageName() {
        return stageName;
    }

    /**
     * Returns the items that reached the destination before the pipeline shut down.
     *
     * @return an unmodifiable list, empty if nothing was drained
     */
    public List<Object> getDrainedItems() {
        return drainedItems;
    }

    void attachDrainedItems(List<?> items) {
        this.drainedItems = Collections.unmodifiableList(new ArrayList<>(items));
    }
}
