package com.rpgtools.prereq.common.async;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Creates the worker pools used for batch work. Pluggable so callers can supply instrumented or shared pools.
 */
public interface ExecutorServiceFactory {

    /**
     * @param threads          desired concurrency, at least one thread is always created
     * @param threadNamePrefix prefix for thread names
     */
    ExecutorService create(int threads, String threadNamePrefix);

    default String name() {
        return getClass().getSimpleName();
    }

    /** Fixed pool of named daemon threads. */
    static ExecutorServiceFactory fixed() {
        return new ExecutorServiceFactory() {
            @Override
            public ExecutorService create(int threads, String prefix) {
                return Executors.newFixedThreadPool(Math.max(1, threads), new NamedDaemonThreadFactory(prefix));
            }

            @Override
            public String name() {
                return "fixed";
            }
        };
    }
}
