package com.batonsystems.pipeline;

import java.time.Duration;

/**
 * Counters collected over one pipeline run.
 *
 * @param produced items the producer enqueued
 * @param consumed items the consumers appended to their destinations
 * @param elapsed  wall time from queue construction until every stage terminated
 */
public record PipelineStats(long produced, long consumed, Duration elapsed) {
}
