package com.batonsystems.pipeline;

/**
 * Carrier for items travelling from a {@link Producer} to a {@link Consumer}.
 *
 * <p>Every payload, {@code null} included, travels in its own envelope. The end of the
 * stream is signalled by the single {@link #endOfStream()} instance, which consumers
 * recognise by reference identity. Envelopes deliberately keep {@link Object#equals}
 * identity-based, so no payload can ever compare equal to the marker.
 *
 * @param <T> The type of the payload
 */
public final class Envelope<T> {

    private static final Envelope<?> END_OF_STREAM = new Envelope<>(null);

    private final T payload;

    private Envelope(T payload) {
        this.payload = payload;
    }

    /**
     * Wraps a payload.
     *
     * @param payload the payload, may be null
     * @param <T> the payload type
     * @return a new envelope, never identical to the end-of-stream marker
     */
    public static <T> Envelope<T> of(T payload) {
        return new Envelope<>(payload);
    }

    /**
     * Returns the shared end-of-stream marker.
     *
     * @param <T> the payload type of the stream being terminated
     * @return the end-of-stream marker
     */
    @SuppressWarnings("unchecked")
    public static <T> Envelope<T> endOfStream() {
        return (Envelope<T>) END_OF_STREAM;
    }

    public boolean isEndOfStream() {
        return this == END_OF_STREAM;
    }

    /**
     * Returns the wrapped payload.
     *
     * @return the payload, possibly null
     * @throws IllegalStateException if this is the end-of-stream marker
     */
    public T payload() {
        if (isEndOfStream()) {
            throw new IllegalStateException("End-of-stream marker carries no payload");
        }
        return payload;
    }

    @Override
    public String toString() {
        return isEndOfStream() ? "Envelope[END_OF_STREAM]" : "Envelope[" + payload + "]";
    }
}
