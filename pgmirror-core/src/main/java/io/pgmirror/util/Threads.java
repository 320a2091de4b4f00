/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgmirror.util;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Utilities related to threads and threading.
 */
public class Threads {

    private static final String THREAD_NAME_PREFIX = "pgmirror-";
    private static final Logger LOGGER = LoggerFactory.getLogger(Threads.class);

    /**
     * A timer that reports when a fixed period has passed.
     */
    public interface Timer {
        boolean expired();

        Duration remaining();
    }

    /**
     * Obtain a {@link Timer} that uses the given clock to indicate that a pre-defined time period expired.
     *
     * @param clock the clock; may not be null
     * @param time a time interval to expire
     * @return the {@link Timer} object; never null
     */
    public static Timer timer(Clock clock, Duration time) {
        final long start = clock.currentTimeInMillis();

        return new Timer() {

            @Override
            public boolean expired() {
                return clock.currentTimeInMillis() - start > time.toMillis();
            }

            @Override
            public Duration remaining() {
                long left = time.toMillis() - (clock.currentTimeInMillis() - start);
                return Duration.ofMillis(Math.max(0L, left));
            }
        };
    }

    /**
     * Returns a thread factory that creates threads named {@code pgmirror-<database>-<name>[-<index>]}.
     *
     * @param database the logical name of the replicated database
     * @param name the name of the thread
     * @param indexed true if the thread name should be appended with an index
     * @param daemon true if the thread should be a daemon thread
     * @return the thread factory setting the correct name
     */
    public static ThreadFactory threadFactory(String database, String name, boolean indexed, boolean daemon) {
        LOGGER.debug("Requested thread factory for database {} named {}", database, name);

        return new ThreadFactory() {
            private final AtomicInteger index = new AtomicInteger(0);

            @Override
            public Thread newThread(Runnable r) {
                StringBuilder threadName = new StringBuilder(THREAD_NAME_PREFIX)
                        .append(database)
                        .append('-')
                        .append(name);
                if (indexed) {
                    threadName.append('-').append(index.getAndIncrement());
                }
                LOGGER.debug("Creating thread {}", threadName);
                final Thread t = new Thread(r, threadName.toString());
                t.setDaemon(daemon);
                return t;
            }
        };
    }

    public static ExecutorService newSingleThreadExecutor(String database, String name) {
        return Executors.newSingleThreadExecutor(threadFactory(database, name, false, false));
    }

    public static ExecutorService newFixedThreadPool(String database, String name, int threadCount) {
        return Executors.newFixedThreadPool(threadCount, threadFactory(database, name, true, false));
    }
}
