package com.omniva.dbnotify.engine.crankshaft;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.NonNull;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * ThreadFactory for listener threads with:
 * - Meaningful thread names
 * - Daemon flag chosen per pool
 * - Uncaught failures logged instead of lost
 */
public class DbNotifyThreadFactory implements ThreadFactory {

    private static final Logger log = LoggerFactory.getLogger(DbNotifyThreadFactory.class);

    private final AtomicInteger threadCounter = new AtomicInteger(0);
    private final String namePrefix;
    private final boolean daemon;

    /**
     * @param namePrefix Prefix for thread names (e.g., "DbNotify-handler")
     * @param daemon     whether the threads may be abandoned at JVM exit
     */
    public DbNotifyThreadFactory(String namePrefix, boolean daemon) {
        this.namePrefix = namePrefix;
        this.daemon = daemon;
    }

    @Override
    public Thread newThread(@NonNull Runnable r) {
        Thread t = new Thread(r, namePrefix + "-" + threadCounter.getAndIncrement());
        t.setDaemon(daemon);
        t.setPriority(Thread.NORM_PRIORITY);
        t.setUncaughtExceptionHandler((thread, e) ->
                log.error("Uncaught failure in thread {}: {}", thread.getName(), e.getMessage(), e));
        return t;
    }

    public int getCreatedThreadCount() {
        return threadCounter.get();
    }
}
