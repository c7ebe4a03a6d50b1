package com.batonsystems.pipeline;

import com.batonsystems.config.PipelineConfig;
import com.batonsystems.config.StageThreadFactory;
import com.batonsystems.queue.BlockingBuffer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Takes items from a queue into a destination list, in the order received, until it sees
 * the end-of-stream marker. The marker itself is never added to the destination.
 *
 * <p>The destination is only touched by the consumer thread; read it after {@link #join()}.
 *
 * @param <T> The type of items consumed
 */
public class Consumer<T> extends Stage {
    private static final Logger logger = LoggerFactory.getLogger(Consumer.class);

    private final BlockingBuffer<Envelope<T>> queue;
    private final List<T> destination;
    private final Duration getTimeout;
    private final AtomicLong consumed = new AtomicLong();

    /**
     * Creates a consumer that collects into a fresh list and blocks indefinitely on every get.
     *
     * @param queue the queue to drain
     */
    public Consumer(BlockingBuffer<Envelope<T>> queue) {
        this(queue, new ArrayList<>(), null,
                new StageThreadFactory(PipelineConfig.DEFAULT_THREAD_NAME_PREFIX, false).forRole("consumer"));
    }

    /**
     * @param queue         the queue to drain
     * @param destination   the list receiving consumed items
     * @param getTimeout    how long to wait for each item, or null to wait indefinitely
     * @param threadFactory the factory creating the consumer thread
     */
    public Consumer(BlockingBuffer<Envelope<T>> queue,
                    List<T> destination,
                    Duration getTimeout,
                    ThreadFactory threadFactory) {
        super("consumer", threadFactory);
        this.queue = Objects.requireNonNull(queue, "queue cannot be null");
        this.destination = Objects.requireNonNull(destination, "destination cannot be null");
        this.getTimeout = getTimeout;
    }

    @Override
    protected void process() throws Exception {
        while (true) {
            Envelope<T> envelope = queue.get(getTimeout);
            if (envelope.isEndOfStream()) {
                logger.debug("Consumer {} reached end-of-stream after {} items", getName(), consumed.get());
                return;
            }
            destination.add(envelope.payload());
            consumed.incrementAndGet();
        }
    }

    /**
     * Returns the destination list. Safe to read once the consumer has terminated.
     *
     * @return the destination list
     */
    public List<T> getDestination() {
        return destination;
    }

    public long consumedCount() {
        return consumed.get();
    }
}
