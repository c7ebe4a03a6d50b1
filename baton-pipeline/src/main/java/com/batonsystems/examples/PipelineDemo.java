package com.batonsystems.examples;

import com.batonsystems.pipeline.Pipeline;

import java.util.List;

/**
 * Pipes a fixed sequence through a queue smaller than the sequence, forcing the producer
 * to block at least once, and prints what went in and what came out.
 */
public class PipelineDemo {

    static final List<Integer> SOURCE = List.of(1, 2, 3);
    static final int QUEUE_CAPACITY = 2;

    public static void main(String[] args) throws InterruptedException {
        List<Integer> consumed = Pipeline.run(SOURCE, QUEUE_CAPACITY);

        System.out.println("Produced: " + SOURCE);
        System.out.println("Consumed: " + consumed);
    }
}
