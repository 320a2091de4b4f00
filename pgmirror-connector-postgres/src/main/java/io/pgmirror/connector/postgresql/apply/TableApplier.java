/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgmirror.connector.postgresql.apply;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.pgmirror.annotation.ThreadSafe;
import io.pgmirror.connector.postgresql.PositionTracker.PendingCommit;
import io.pgmirror.connector.postgresql.ReplicationSession;
import io.pgmirror.connector.postgresql.TableDescriptor;
import io.pgmirror.connector.postgresql.TableState;
import io.pgmirror.connector.postgresql.connection.Lsn;
import io.pgmirror.destination.MutationBatch;
import io.pgmirror.pipeline.ChangeEventQueue;
import io.pgmirror.pipeline.ErrorHandler;
import io.pgmirror.relational.TableId;
import io.pgmirror.util.DelayStrategy;
import io.pgmirror.util.Threads;

/**
 * Applies the batches of one table to the destination, in order, on a thread of its own.
 * <p>
 * Batches are handed over through a bounded queue. When the queue is full {@link #offer} returns false instead of
 * blocking, leaving the decision of what to do to the caller.
 */
@ThreadSafe
public class TableApplier implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(TableApplier.class);

    private static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(10);

    private static final class Work {
        private final MutationBatch batch;
        private final long generation;
        private final PendingCommit commit;

        Work(MutationBatch batch, long generation, PendingCommit commit) {
            this.batch = batch;
            this.generation = generation;
            this.commit = commit;
        }
    }

    private final TableId tableId;
    private final ReplicationSession session;
    private final ErrorHandler errorHandler;
    private final ChangeEventQueue<Work> queue;
    private final ExecutorService executor;
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicBoolean running = new AtomicBoolean(true);
    private final AtomicBoolean failed = new AtomicBoolean();

    public TableApplier(TableId tableId, ReplicationSession session, ErrorHandler errorHandler) {
        this.tableId = tableId;
        this.session = session;
        this.errorHandler = errorHandler;
        this.queue = new ChangeEventQueue.Builder<Work>()
                .pollInterval(session.getConfig().getPollInterval())
                .maxQueueSize(session.getConfig().getMaxQueueSize())
                .maxBatchSize(session.getConfig().getMaxBatchSize())
                .build();
        this.executor = Threads.newSingleThreadExecutor(session.getLogicalName(), "applier-" + tableId.identifier());
        this.executor.submit(this::run);
    }

    public TableId tableId() {
        return tableId;
    }

    /**
     * Queue a batch if there is room for it.
     *
     * @param batch the batch
     * @param generation the generation of the table the batch was built for
     * @param commit the transaction of the batch, released once the batch is applied or discarded
     * @return true if the batch was queued
     */
    public boolean offer(MutationBatch batch, long generation, PendingCommit commit) {
        inFlight.incrementAndGet();
        if (!queue.offer(new Work(batch, generation, commit))) {
            inFlight.decrementAndGet();
            return false;
        }
        return true;
    }

    /**
     * @return true if every queued batch has been applied or discarded
     */
    public boolean isIdle() {
        return inFlight.get() == 0;
    }

    private void run() {
        LOGGER.debug("Applier of table {} started", tableId);
        try {
            while (running.get()) {
                final List<Work> batches = queue.poll();
                for (Work work : batches) {
                    try {
                        apply(work);
                    }
                    finally {
                        inFlight.decrementAndGet();
                    }
                }
            }
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        catch (RuntimeException e) {
            failed.set(true);
            errorHandler.setProducerThrowable(e);
        }
        LOGGER.debug("Applier of table {} stopped", tableId);
    }

    private void apply(Work work) throws InterruptedException {
        if (failed.get()) {
            return;
        }
        final Optional<TableDescriptor> descriptor = session.getStateMachine().get(tableId);
        if (!descriptor.isPresent() || descriptor.get().generation() != work.generation || descriptor.get().state() != TableState.STREAMING) {
            LOGGER.debug("Discarding {} of table {} which is no longer streaming", work.batch, tableId);
            work.commit.release();
            return;
        }
        final int retries = session.getConfig().destinationRetries();
        final DelayStrategy delay = DelayStrategy.constant(session.getConfig().destinationRetryDelay());
        for (int attempt = 0;; attempt++) {
            try {
                session.getDestination().applyBatch(descriptor.get().destinationId(), work.batch);
                break;
            }
            catch (RuntimeException e) {
                if (attempt >= retries) {
                    LOGGER.error("Failed to apply {} to table {} after {} attempts", work.batch, tableId, attempt + 1);
                    failed.set(true);
                    errorHandler.setProducerThrowable(e);
                    return;
                }
                LOGGER.warn("Failed to apply {} to table {}, retrying: {}", work.batch, tableId, e.getMessage());
                delay.sleepWhen(true);
                if (Thread.currentThread().isInterrupted()) {
                    throw new InterruptedException("Interrupted while retrying " + work.batch);
                }
            }
        }
        session.getStateMachine().applied(tableId, work.generation, Lsn.valueOf(work.batch.position()));
        work.commit.release();
        LOGGER.trace("Applied {}", work.batch);
    }

    @Override
    public void close() {
        running.set(false);
        executor.shutdown();
        try {
            if (!executor.awaitTermination(SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
                LOGGER.warn("Applier of table {} did not stop in time", tableId);
                executor.shutdownNow();
            }
        }
        catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
