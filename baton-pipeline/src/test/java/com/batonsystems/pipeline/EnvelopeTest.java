package com.batonsystems.pipeline;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class EnvelopeTest {

    @Test
    void testEndOfStreamIsASingleton() {
        assertSame(Envelope.endOfStream(), Envelope.<String>endOfStream());
        assertTrue(Envelope.endOfStream().isEndOfStream());
    }

    @Test
    void testPayloadEnvelopesAreNeverTheMarker() {
        assertFalse(Envelope.of(null).isEndOfStream());
        assertFalse(Envelope.of("Envelope[END_OF_STREAM]").isEndOfStream());
        assertFalse(Envelope.<Object>of(Envelope.endOfStream()).isEndOfStream());
        assertNotEquals(Envelope.endOfStream(), Envelope.of(null));
    }

    @Test
    void testPayload() {
        assertEquals("a", Envelope.of("a").payload());
        assertNull(Envelope.of(null).payload());
        assertThrows(IllegalStateException.class, () -> Envelope.endOfStream().payload());
    }

    @Test
    void testToString() {
        assertEquals("Envelope[42]", Envelope.of(42).toString());
        assertEquals("Envelope[END_OF_STREAM]", Envelope.endOfStream().toString());
    }
}
