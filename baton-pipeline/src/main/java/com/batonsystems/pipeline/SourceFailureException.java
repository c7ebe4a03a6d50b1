package com.batonsystems.pipeline;

/**
 * Thrown when the producer's source fails while being iterated. The producer still
 * delivers the end-of-stream marker before this failure is reported.
 */
public class SourceFailureException extends PipelineException {

    private static final long serialVersionUID = 1L;

    /** Number of items taken from the source and enqueued before it failed. */
    private final long itemsProduced;

    public SourceFailureException(String message, Throwable cause, String stageName, long itemsProduced) {
        super(message, cause, stageName);
        this.itemsProduced = itemsProduced;
    }

    public long getItemsProduced() {
        return itemsProduced;
    }
}
