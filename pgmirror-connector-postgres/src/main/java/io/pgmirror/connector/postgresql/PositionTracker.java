/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgmirror.connector.postgresql;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.pgmirror.annotation.ThreadSafe;
import io.pgmirror.connector.postgresql.connection.Lsn;
import io.pgmirror.relational.TableId;

/**
 * Computes the position that may be confirmed to the source.
 * <p>
 * Committed transactions are registered in commit order. A transaction is complete once it is sealed and all batches
 * dispatched for it are applied. The confirmed position is the end of the longest complete prefix of transactions,
 * capped by the holds placed for tables that will need part of the stream again, and it never moves backwards.
 */
@ThreadSafe
public class PositionTracker {

    private static final Logger LOGGER = LoggerFactory.getLogger(PositionTracker.class);

    private final Deque<PendingCommit> pending = new ArrayDeque<>();
    private final Map<TableId, Lsn> holds = new HashMap<>();
    private Lsn appliedPrefix;
    private Lsn confirmed;

    public PositionTracker(Lsn confirmed) {
        this.confirmed = confirmed;
        this.appliedPrefix = confirmed;
    }

    /**
     * Register a committed transaction. The caller {@link PendingCommit#acquire() acquires} the commit once per
     * dispatched batch and {@link PendingCommit#seal() seals} it when all batches are dispatched.
     *
     * @param endLsn the end of the transaction's commit record
     * @return the pending commit
     */
    public synchronized PendingCommit commit(Lsn endLsn) {
        final PendingCommit commit = new PendingCommit(endLsn);
        pending.addLast(commit);
        return commit;
    }

    /**
     * Keep the confirmed position at or before the given one until the hold is released.
     */
    public synchronized void hold(TableId tableId, Lsn lsn) {
        final Lsn position = Lsn.max(lsn, confirmed);
        LOGGER.debug("Holding confirmed position at {} for table {}", position, tableId);
        holds.merge(tableId, position, Lsn::min);
    }

    public synchronized void release(TableId tableId) {
        if (holds.remove(tableId) != null) {
            LOGGER.debug("Released hold of table {}", tableId);
            advance();
        }
    }

    public synchronized boolean isHeld(TableId tableId) {
        return holds.containsKey(tableId);
    }

    public synchronized Map<TableId, Lsn> holds() {
        return Collections.unmodifiableMap(new HashMap<>(holds));
    }

    /**
     * Forget all registered transactions, as the stream will be read again from the confirmed position. Only valid
     * once nothing dispatched is still being applied.
     */
    public synchronized void reset() {
        if (!pending.isEmpty()) {
            LOGGER.debug("Discarding {} pending commits", pending.size());
            pending.clear();
        }
        appliedPrefix = confirmed;
    }

    public synchronized Lsn confirmed() {
        return confirmed;
    }

    /**
     * @return the number of registered transactions that are not yet part of the complete prefix
     */
    public synchronized int pendingCount() {
        return pending.size();
    }

    private synchronized void completed() {
        advance();
    }

    private void advance() {
        while (!pending.isEmpty() && pending.peekFirst().isComplete()) {
            appliedPrefix = Lsn.max(appliedPrefix, pending.removeFirst().endLsn);
        }
        Lsn candidate = appliedPrefix;
        for (Lsn hold : holds.values()) {
            candidate = Lsn.min(candidate, hold);
        }
        if (candidate.isAfter(confirmed)) {
            LOGGER.trace("Confirmed position moves to {}", candidate);
            confirmed = candidate;
        }
    }

    /**
     * A committed transaction whose batches may still be in flight.
     */
    public final class PendingCommit {

        private final Lsn endLsn;
        // starts with the token released by seal()
        private final AtomicInteger outstanding = new AtomicInteger(1);

        private PendingCommit(Lsn endLsn) {
            this.endLsn = endLsn;
        }

        public Lsn endLsn() {
            return endLsn;
        }

        public void acquire() {
            outstanding.incrementAndGet();
        }

        /**
         * Called once for every {@link #acquire()} when the batch is applied or discarded.
         */
        public void release() {
            if (outstanding.decrementAndGet() == 0) {
                completed();
            }
        }

        public void seal() {
            release();
        }

        boolean isComplete() {
            return outstanding.get() == 0;
        }

        @Override
        public String toString() {
            return "PendingCommit{" + endLsn + ", outstanding=" + outstanding.get() + "}";
        }
    }
}
