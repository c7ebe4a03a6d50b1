package com.batonsystems.pipeline;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of a pipeline run: either every item reached the destination, or a stage failed
 * and the items drained before shutdown are kept alongside the failure.
 * Sealed to ensure exhaustive handling.
 *
 * @param <T> The type of items
 */
public sealed interface PipelineResult<T> permits PipelineResult.Completed, PipelineResult.Failed {

    /**
     * The pipeline ran to completion.
     */
    record Completed<T>(List<T> items, PipelineStats stats) implements PipelineResult<T> {
        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public List<T> getOrThrow() {
            return items;
        }

        @Override
        public Optional<PipelineException> failure() {
            return Optional.empty();
        }
    }

    /**
     * A stage failed; consumers still drained and terminated.
     */
    record Failed<T>(List<T> items, PipelineStats stats, PipelineException error) implements PipelineResult<T> {
        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public List<T> getOrThrow() {
            throw error;
        }

        @Override
        public Optional<PipelineException> failure() {
            return Optional.of(error);
        }
    }

    boolean isSuccess();

    /**
     * Items that reached the destination, in consumer order.
     *
     * @return an unmodifiable list
     */
    List<T> items();

    PipelineStats stats();

    /**
     * Returns the items, or throws the recorded failure.
     *
     * @return the items
     * @throws PipelineException if a stage failed; {@link PipelineException#getDrainedItems()}
     *                           holds what was drained before shutdown
     */
    List<T> getOrThrow();

    Optional<PipelineException> failure();
}
