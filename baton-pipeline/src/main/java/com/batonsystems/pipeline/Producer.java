package com.batonsystems.pipeline;

import com.batonsystems.config.InvalidConfigurationException;
import com.batonsystems.config.PipelineConfig;
import com.batonsystems.config.StageThreadFactory;
import com.batonsystems.queue.BlockingBuffer;
import com.batonsystems.queue.QueueTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Iterator;
import java.util.Objects;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Drains a source into a queue, one {@code put} per item, in source order, and finishes
 * with one end-of-stream marker per consumer.
 *
 * <p>The markers are delivered even when the source or a put fails, so consumers never wait
 * forever on a producer that died mid-stream. Marker puts block indefinitely. The original
 * failure is then recorded as the stage failure; a failure of the marker delivery itself is
 * attached to it as suppressed, or becomes the failure when there was none.
 *
 * @param <T> The type of items produced
 */
public class Producer<T> extends Stage {
    private static final Logger logger = LoggerFactory.getLogger(Producer.class);

    private final Iterable<? extends T> source;
    private final BlockingBuffer<Envelope<T>> queue;
    private final Duration putTimeout;
    private final int endOfStreamCount;
    private final AtomicLong produced = new AtomicLong();

    /**
     * Creates a producer that blocks indefinitely on every put and emits a single
     * end-of-stream marker.
     *
     * @param source the items to produce
     * @param queue  the queue to fill
     */
    public Producer(Iterable<? extends T> source, BlockingBuffer<Envelope<T>> queue) {
        this(source, queue, null, 1,
                new StageThreadFactory(PipelineConfig.DEFAULT_THREAD_NAME_PREFIX, false).forRole("producer"));
    }

    /**
     * @param source           the items to produce
     * @param queue            the queue to fill
     * @param putTimeout       how long to wait for room for each item, or null to wait indefinitely
     * @param endOfStreamCount the number of end-of-stream markers to emit, one per consumer
     * @param threadFactory    the factory creating the producer thread
     */
    public Producer(Iterable<? extends T> source,
                    BlockingBuffer<Envelope<T>> queue,
                    Duration putTimeout,
                    int endOfStreamCount,
                    ThreadFactory threadFactory) {
        super("producer", threadFactory);
        this.source = Objects.requireNonNull(source, "source cannot be null");
        this.queue = Objects.requireNonNull(queue, "queue cannot be null");
        this.putTimeout = putTimeout;
        this.endOfStreamCount = InvalidConfigurationException.requirePositive("endOfStreamCount", endOfStreamCount);
    }

    @Override
    protected void process() throws Exception {
        try {
            produceAll();
        } catch (Throwable t) {
            deliverEndOfStreamAfter(t);
            throw t;
        }
        deliverEndOfStream();
        logger.debug("Producer {} enqueued {} items and {} end-of-stream marker(s)",
                getName(), produced.get(), endOfStreamCount);
    }

    /**
     * Returns the number of items enqueued so far.
     *
     * @return the number of items successfully put
     */
    public long producedCount() {
        return produced.get();
    }

    private void produceAll() throws InterruptedException, QueueTimeoutException {
        Iterator<? extends T> items;
        try {
            items = source.iterator();
        } catch (Exception | Error e) {
            throw sourceFailure(e);
        }
        while (true) {
            T item;
            try {
                if (!items.hasNext()) {
                    return;
                }
                item = items.next();
            } catch (Exception | Error e) {
                throw sourceFailure(e);
            }
            queue.put(Envelope.of(item), putTimeout);
            produced.incrementAndGet();
        }
    }

    private void deliverEndOfStream() throws InterruptedException {
        for (int i = 0; i < endOfStreamCount; i++) {
            queue.put(Envelope.endOfStream());
        }
    }

    private void deliverEndOfStreamAfter(Throwable cause) {
        // A pending interrupt would fail the marker put straight away; restore it afterwards.
        boolean interrupted = Thread.interrupted() || cause instanceof InterruptedException;
        try {
            deliverEndOfStream();
            logger.debug("Producer {} delivered end-of-stream after failure: {}", getName(), cause.toString());
        } catch (InterruptedException e) {
            interrupted = true;
            logger.error("Producer {} interrupted while delivering end-of-stream", getName(), e);
            cause.addSuppressed(e);
        } catch (RuntimeException e) {
            logger.error("Producer {} failed to deliver end-of-stream", getName(), e);
            cause.addSuppressed(e);
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    /**
     * Wraps anything the source's iterator throws, including errors and undeclared checked
     * exceptions, so every source failure surfaces as a {@link SourceFailureException}.
     */
    private SourceFailureException sourceFailure(Throwable cause) {
        if (cause instanceof InterruptedException) {
            Thread.currentThread().interrupt();
        }
        long count = produced.get();
        return new SourceFailureException(
                "Source failed after " + count + " item(s): " + cause, cause, getName(), count);
    }
}
