package com.rpgtools.prereq.common.async;

import java.util.Objects;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/** Daemon threads named {@code prefix-1}, {@code prefix-2}, ... so pools never block JVM exit. */
public final class NamedDaemonThreadFactory implements ThreadFactory {
    private final String prefix;
    private final AtomicInteger seq = new AtomicInteger(1);

    public NamedDaemonThreadFactory(String prefix) {
        this.prefix = Objects.requireNonNullElse(prefix, "pool");
    }

    @Override
    public Thread newThread(Runnable task) {
        Thread t = new Thread(task, prefix + "-" + seq.getAndIncrement());
        t.setDaemon(true);
        return t;
    }
}
