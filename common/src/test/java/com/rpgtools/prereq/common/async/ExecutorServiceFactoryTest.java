package com.rpgtools.prereq.common.async;

import org.junit.jupiter.api.Test;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ExecutorServiceFactoryTest {

    @Test
    void fixedPoolUsesNamedDaemonThreads() throws Exception {
        ExecutorServiceFactory factory = ExecutorServiceFactory.fixed();
        ExecutorService pool = factory.create(2, "batch");
        try {
            Thread t = pool.submit(Thread::currentThread).get(5, TimeUnit.SECONDS);
            assertTrue(t.getName().startsWith("batch-"), t.getName());
            assertTrue(t.isDaemon());
            assertEquals("fixed", factory.name());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void nonPositiveThreadCountStillYieldsAUsablePool() throws Exception {
        ExecutorService pool = ExecutorServiceFactory.fixed().create(0, null);
        try {
            assertEquals("ok", pool.submit(() -> "ok").get(5, TimeUnit.SECONDS));
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void threadNamesAreNumberedFromOne() {
        NamedDaemonThreadFactory factory = new NamedDaemonThreadFactory("prereq-batch");
        assertEquals("prereq-batch-1", factory.newThread(() -> {}).getName());
        assertEquals("prereq-batch-2", factory.newThread(() -> {}).getName());
        assertEquals("pool-1", new NamedDaemonThreadFactory(null).newThread(() -> {}).getName());
    }
}
