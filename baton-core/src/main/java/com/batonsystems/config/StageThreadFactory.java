package com.batonsystems.config;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Creates named platform threads for pipeline stages, for better thread identification
 * in logs and profilers. Threads are named {@code <prefix>-<role>-<n>}, numbered per role
 * starting at 1.
 */
public class StageThreadFactory {

    private final String prefix;
    private final boolean daemon;

    /**
     * Creates a factory from the thread settings of a pipeline configuration.
     *
     * @param config the pipeline configuration
     */
    public StageThreadFactory(PipelineConfig config) {
        this(config.getThreadNamePrefix(), config.isDaemonThreads());
    }

    /**
     * Creates a factory with an explicit prefix and daemon flag.
     *
     * @param prefix the thread name prefix
     * @param daemon whether created threads are daemon threads
     */
    public StageThreadFactory(String prefix, boolean daemon) {
        this.prefix = prefix;
        this.daemon = daemon;
    }

    /**
     * Returns a thread factory for one stage role, e.g. "producer" or "consumer".
     *
     * @param role the stage role
     * @return a thread factory that creates named, unstarted threads
     */
    public ThreadFactory forRole(String role) {
        String rolePrefix = prefix + "-" + role;
        return new ThreadFactory() {
            private final AtomicInteger threadNumber = new AtomicInteger(1);

            @Override
            public Thread newThread(Runnable r) {
                Thread thread = new Thread(r, rolePrefix + "-" + threadNumber.getAndIncrement());
                thread.setDaemon(daemon);
                return thread;
            }
        };
    }

    public String getPrefix() {
        return prefix;
    }

    public boolean isDaemon() {
        return daemon;
    }
}
