package io.eventlog.util;

import java.util.Objects;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread factory for the publisher and retry worker pools.
 *
 * <p>Threads are named {@code <prefix>1}, {@code <prefix>2}, etc. (for example
 * {@code eventlog-retry-worker-1}) and are daemon threads so they do not keep the JVM alive.
 */
public final class DaemonThreadFactory implements ThreadFactory {
    private final String prefix;
    private final AtomicInteger counter = new AtomicInteger(1);

    public DaemonThreadFactory(String prefix) {
        this.prefix = Objects.requireNonNull(prefix, "prefix");
    }

    @Override
    public Thread newThread(Runnable runnable) {
        Thread thread = new Thread(runnable, prefix + counter.getAndIncrement());
        thread.setDaemon(true);
        return thread;
    }
}
