/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgmirror.pipeline;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.pgmirror.annotation.ThreadSafe;
import io.pgmirror.util.Clock;
import io.pgmirror.util.Threads;
import io.pgmirror.util.Threads.Timer;

/**
 * A bounded queue that hands work from one producer to one consumer.
 * <p>
 * Unlike a plain blocking queue the producer may choose not to wait: {@link #offer(Object)} reports a full queue
 * so the producer can apply its own backpressure policy instead of stalling every other consumer. The consumer
 * drains the queue in batches via {@link #poll()}, waiting at most the poll interval for the first element.
 *
 * @param <T> the type of queued element
 */
@ThreadSafe
public class ChangeEventQueue<T> {

    private static final Logger LOGGER = LoggerFactory.getLogger(ChangeEventQueue.class);

    private final Duration pollInterval;
    private final int maxBatchSize;
    private final int maxQueueSize;

    private final Lock lock;
    private final Condition isNotEmpty;
    private final Condition isNotFull;

    private final Queue<T> queue;

    private ChangeEventQueue(Duration pollInterval, int maxQueueSize, int maxBatchSize) {
        this.pollInterval = pollInterval;
        this.maxBatchSize = maxBatchSize;
        this.maxQueueSize = maxQueueSize;

        this.lock = new ReentrantLock();
        this.isNotEmpty = lock.newCondition();
        this.isNotFull = lock.newCondition();

        this.queue = new ArrayDeque<>(maxQueueSize);
    }

    public static class Builder<T> {

        private Duration pollInterval = Duration.ofMillis(100);
        private int maxQueueSize = 64;
        private int maxBatchSize = 16;

        public Builder<T> pollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
            return this;
        }

        public Builder<T> maxQueueSize(int maxQueueSize) {
            this.maxQueueSize = maxQueueSize;
            return this;
        }

        public Builder<T> maxBatchSize(int maxBatchSize) {
            this.maxBatchSize = maxBatchSize;
            return this;
        }

        public ChangeEventQueue<T> build() {
            if (maxQueueSize <= 0 || maxBatchSize <= 0) {
                throw new IllegalArgumentException("Queue and batch sizes must be positive");
            }
            return new ChangeEventQueue<T>(pollInterval, maxQueueSize, maxBatchSize);
        }
    }

    /**
     * Add the element if there is room for it.
     *
     * @param element the element; may not be null
     * @return {@code true} if the element was queued, {@code false} if the queue is full
     */
    public boolean offer(T element) {
        try {
            this.lock.lock();
            if (queue.size() >= maxQueueSize) {
                LOGGER.trace("Queue is full, rejecting '{}'", element);
                return false;
            }
            queue.add(element);
            this.isNotEmpty.signalAll();
            return true;
        }
        finally {
            this.lock.unlock();
        }
    }

    /**
     * Add the element, waiting for room in the queue if necessary.
     *
     * @param element the element; may not be null
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    public void enqueue(T element) throws InterruptedException {
        if (Thread.interrupted()) {
            throw new InterruptedException();
        }
        try {
            this.lock.lock();
            while (queue.size() >= maxQueueSize) {
                this.isNotFull.await(pollInterval.toMillis(), TimeUnit.MILLISECONDS);
            }
            queue.add(element);
            this.isNotEmpty.signalAll();
        }
        finally {
            this.lock.unlock();
        }
    }

    /**
     * Remove up to the maximum batch size of elements, waiting at most the poll interval when the queue is empty.
     *
     * @return the elements in queue order; never null but possibly empty
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    public List<T> poll() throws InterruptedException {
        final Timer timeout = Threads.timer(Clock.SYSTEM, pollInterval);
        try {
            this.lock.lock();
            while (queue.isEmpty() && !timeout.expired()) {
                long remaining = timeout.remaining().toMillis();
                if (remaining <= 0) {
                    break;
                }
                this.isNotEmpty.await(remaining, TimeUnit.MILLISECONDS);
            }
            int count = Math.min(maxBatchSize, queue.size());
            List<T> elements = new ArrayList<>(count);
            for (int i = 0; i < count; i++) {
                elements.add(queue.poll());
            }
            if (count > 0) {
                this.isNotFull.signalAll();
            }
            return elements;
        }
        finally {
            this.lock.unlock();
        }
    }

    public boolean isEmpty() {
        try {
            this.lock.lock();
            return queue.isEmpty();
        }
        finally {
            this.lock.unlock();
        }
    }

    public int remainingCapacity() {
        try {
            this.lock.lock();
            return maxQueueSize - queue.size();
        }
        finally {
            this.lock.unlock();
        }
    }
}
