package com.batonsystems.config;

import org.junit.jupiter.api.Test;

import java.util.concurrent.ThreadFactory;

import static org.junit.jupiter.api.Assertions.*;

class StageThreadFactoryTest {

    @Test
    void testThreadsAreNamedPerRole() {
        StageThreadFactory factory = new StageThreadFactory(new PipelineConfig().setThreadNamePrefix("etl"));

        ThreadFactory producers = factory.forRole("producer");
        ThreadFactory consumers = factory.forRole("consumer");

        assertEquals("etl-producer-1", producers.newThread(() -> { }).getName());
        assertEquals("etl-consumer-1", consumers.newThread(() -> { }).getName());
        assertEquals("etl-consumer-2", consumers.newThread(() -> { }).getName());
    }

    @Test
    void testThreadsAreUnstartedAndHonourDaemonFlag() {
        Thread daemon = new StageThreadFactory("p", true).forRole("consumer").newThread(() -> { });
        Thread user = new StageThreadFactory("p", false).forRole("consumer").newThread(() -> { });

        assertEquals(Thread.State.NEW, daemon.getState());
        assertTrue(daemon.isDaemon());
        assertFalse(user.isDaemon());
    }
}
