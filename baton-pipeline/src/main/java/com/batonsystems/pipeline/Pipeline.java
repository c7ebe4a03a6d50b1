package com.batonsystems.pipeline;

import com.batonsystems.config.PipelineConfig;
import com.batonsystems.config.StageThreadFactory;
import com.batonsystems.queue.BlockingBuffer;
import com.batonsystems.queue.BoundedBlockingQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ThreadFactory;

/**
 * Wires a source, a fresh {@link BoundedBlockingQueue} and the destination together:
 * one {@link Producer} feeding one or more {@link Consumer}s.
 *
 * <p>Each call to {@link #execute(Iterable)} builds its own queue and stages, starts them,
 * waits until every stage has terminated and only then reports the outcome. A pipeline
 * instance holds no run state and may be executed repeatedly.
 *
 * <p>Usage:
 * <pre>{@code
 * List<Integer> out = Pipeline.run(List.of(1, 2, 3), 2);
 *
 * PipelineResult<String> result = new Pipeline(new PipelineConfig()
 *         .setQueueCapacity(64)
 *         .setGetTimeout(Duration.ofSeconds(30)))
 *         .execute(lines);
 * }</pre>
 */
public class Pipeline {
    private static final Logger logger = LoggerFactory.getLogger(Pipeline.class);

    private static final Duration ABANDON_POLL_INTERVAL = Duration.ofMillis(10);

    private final PipelineConfig config;

    /**
     * Creates a pipeline with default configuration.
     */
    public Pipeline() {
        this(new PipelineConfig());
    }

    /**
     * Creates a pipeline with the given configuration.
     *
     * @param config the pipeline configuration
     * @throws com.batonsystems.config.InvalidConfigurationException if the configuration is invalid
     */
    public Pipeline(PipelineConfig config) {
        this.config = Objects.requireNonNull(config, "config cannot be null").validate();
    }

    /**
     * Pipes the source through a queue of the given capacity and returns what the consumer
     * received.
     *
     * @param source    the items to send
     * @param queueSize the queue capacity
     * @param <T>       the item type
     * @return the destination items, in source order
     * @throws InterruptedException if interrupted while waiting for the stages
     * @throws PipelineException    if a stage failed, after the consumer has terminated
     * @throws com.batonsystems.config.InvalidConfigurationException if queueSize is not positive
     */
    public static <T> List<T> run(Iterable<? extends T> source, int queueSize) throws InterruptedException {
        return new Pipeline(new PipelineConfig().setQueueCapacity(queueSize)).<T>execute(source).getOrThrow();
    }

    /**
     * Runs one producer/consumer session over the source.
     *
     * @param source the items to send
     * @param <T>    the item type
     * @return the outcome of the run
     * @throws InterruptedException if interrupted while waiting; all stages are interrupted first
     */
    public <T> PipelineResult<T> execute(Iterable<? extends T> source) throws InterruptedException {
        Objects.requireNonNull(source, "source cannot be null");
        config.validate();
        long start = System.nanoTime();

        BoundedBlockingQueue<Envelope<T>> queue =
                new BoundedBlockingQueue<>(config.getQueueCapacity(), config.isFairLock());
        StageThreadFactory threads = new StageThreadFactory(config);

        ThreadFactory consumerThreads = threads.forRole("consumer");
        List<Consumer<T>> consumers = new ArrayList<>(config.getConsumerCount());
        for (int i = 0; i < config.getConsumerCount(); i++) {
            consumers.add(new Consumer<>(queue, new ArrayList<>(), config.getGetTimeout(), consumerThreads));
        }
        Producer<T> producer = new Producer<>(source, queue, config.getPutTimeout(),
                config.getConsumerCount(), threads.forRole("producer"));

        logger.debug("Starting pipeline with {}", config);
        consumers.forEach(Stage::start);
        producer.start();

        try {
            awaitCompletion(producer, consumers, queue);
        } catch (InterruptedException e) {
            logger.warn("Interrupted while waiting for pipeline stages, shutting them down");
            abandon(producer, consumers, queue);
            throw e;
        }

        return collect(producer, consumers, Duration.ofNanos(System.nanoTime() - start));
    }

    public PipelineConfig getConfig() {
        return config;
    }

    private void awaitCompletion(Producer<?> producer,
                                 List<? extends Consumer<?>> consumers,
                                 BlockingBuffer<?> queue) throws InterruptedException {
        boolean consumerFailed = false;
        for (Consumer<?> consumer : consumers) {
            consumer.join();
            consumerFailed |= consumer.hasFailed();
        }
        if (consumerFailed && producer.isAlive()) {
            // Nobody is left to make room for a producer blocked on a full queue.
            logger.warn("Consumer failed while producer {} is still running, abandoning the run",
                    producer.getName());
            abandon(producer, consumers, queue);
        }
        producer.join();
    }

    private void abandon(Producer<?> producer, List<? extends Consumer<?>> consumers, BlockingBuffer<?> queue) {
        boolean interrupted = false;
        consumers.forEach(Stage::interrupt);
        while (producer.isAlive() || anyAlive(consumers)) {
            producer.interrupt();
            queue.clear();
            try {
                producer.join(ABANDON_POLL_INTERVAL);
                for (Consumer<?> consumer : consumers) {
                    consumer.join(ABANDON_POLL_INTERVAL);
                }
            } catch (InterruptedException e) {
                interrupted = true;
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    private static boolean anyAlive(List<? extends Stage> stages) {
        for (Stage stage : stages) {
            if (stage.isAlive()) {
                return true;
            }
        }
        return false;
    }

    private <T> PipelineResult<T> collect(Producer<T> producer, List<Consumer<T>> consumers, Duration elapsed) {
        List<T> items = new ArrayList<>();
        long consumed = 0;
        for (Consumer<T> consumer : consumers) {
            items.addAll(consumer.getDestination());
            consumed += consumer.consumedCount();
        }
        List<T> result = Collections.unmodifiableList(items);
        PipelineStats stats = new PipelineStats(producer.producedCount(), consumed, elapsed);

        PipelineException failure = toPipelineException(producer);
        for (Consumer<T> consumer : consumers) {
            PipelineException consumerFailure = toPipelineException(consumer);
            if (consumerFailure == null) {
                continue;
            }
            if (failure == null) {
                failure = consumerFailure;
            } else {
                failure.addSuppressed(consumerFailure);
            }
        }

        if (failure != null) {
            failure.attachDrainedItems(result);
            logger.warn("Pipeline failed in stage {} after draining {} of {} produced items: {}",
                    failure.getStageName(), consumed, stats.produced(), failure.getMessage());
            return new PipelineResult.Failed<>(result, stats, failure);
        }
        logger.info("Pipeline completed: {} items through queue of capacity {} in {} ms",
                consumed, config.getQueueCapacity(), elapsed.toMillis());
        return new PipelineResult.Completed<>(result, stats);
    }

    private static PipelineException toPipelineException(Stage stage) {
        Throwable failure = stage.getFailure();
        if (failure == null) {
            return null;
        }
        if (failure instanceof PipelineException) {
            return (PipelineException) failure;
        }
        return new PipelineException("Stage " + stage.getName() + " failed: " + failure, failure, stage.getName());
    }
}
