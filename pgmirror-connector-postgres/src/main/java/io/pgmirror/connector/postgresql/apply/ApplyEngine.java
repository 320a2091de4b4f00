/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgmirror.connector.postgresql.apply;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.pgmirror.annotation.SingleThreadAccess;
import io.pgmirror.connector.postgresql.PositionTracker;
import io.pgmirror.connector.postgresql.PositionTracker.PendingCommit;
import io.pgmirror.connector.postgresql.ReplicaIdentityResolver;
import io.pgmirror.connector.postgresql.ReplicationSession;
import io.pgmirror.connector.postgresql.SchemaDriftDetector;
import io.pgmirror.connector.postgresql.TableDescriptor;
import io.pgmirror.connector.postgresql.TableState;
import io.pgmirror.connector.postgresql.UnsupportedTypeException;
import io.pgmirror.connector.postgresql.ValueConversionException;
import io.pgmirror.connector.postgresql.apply.TransactionBuffer.BufferedChange;
import io.pgmirror.connector.postgresql.connection.Lsn;
import io.pgmirror.connector.postgresql.connection.ReplicationMessage;
import io.pgmirror.connector.postgresql.connection.ReplicationStreamException;
import io.pgmirror.connector.postgresql.connection.pgoutput.ColumnValue;
import io.pgmirror.connector.postgresql.connection.pgoutput.RelationMessage;
import io.pgmirror.connector.postgresql.connection.pgoutput.RowMessage;
import io.pgmirror.connector.postgresql.connection.pgoutput.TransactionMessage;
import io.pgmirror.connector.postgresql.connection.pgoutput.TruncateMessage;
import io.pgmirror.connector.postgresql.connection.pgoutput.TupleData;
import io.pgmirror.destination.Mutation;
import io.pgmirror.destination.MutationBatch;
import io.pgmirror.destination.UnchangedToastedPlaceholder;
import io.pgmirror.pipeline.ErrorHandler;
import io.pgmirror.relational.TableId;
import io.pgmirror.relational.ValueConverter;
import io.pgmirror.util.Clock;
import io.pgmirror.util.Threads;
import io.pgmirror.util.Threads.Timer;

/**
 * Turns the decoded replication stream into per-table mutation batches and hands them to the table appliers.
 * <p>
 * Only tables that were streaming when the current stream was started are <em>active</em>. Changes of all other
 * tables are dropped; a table that starts streaming later, or that fell behind because its applier could not keep up,
 * catches up through a {@link #isRewindRequested() rewind}, which replays the stream from the confirmed position.
 * Transactions a table has already received are filtered out by their position, so replays apply every change
 * exactly once; the relation and row messages of such transactions are ignored as they may describe an older layout
 * of the table.
 */
@SingleThreadAccess("pipeline thread")
public class ApplyEngine implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(ApplyEngine.class);

    /**
     * A relation the stream announced that is not replicated.
     */
    private static final TableId IGNORED = new TableId("", "");

    private final ReplicationSession session;
    private final PositionTracker tracker;
    private final ErrorHandler errorHandler;
    private final SchemaDriftDetector driftDetector;
    private final TransactionBuffer buffer = new TransactionBuffer();

    private final Map<Integer, TableId> relations = new HashMap<>();
    private final Map<TableId, Long> active = new HashMap<>();
    private final Map<TableId, Lsn> lastDispatched = new HashMap<>();
    private final Set<TableId> lagging = new HashSet<>();
    private final Map<TableId, TableApplier> appliers = new HashMap<>();
    private Lsn transactionLsn = Lsn.INVALID;

    public ApplyEngine(ReplicationSession session, PositionTracker tracker, ErrorHandler errorHandler) {
        this.session = session;
        this.tracker = tracker;
        this.errorHandler = errorHandler;
        this.driftDetector = new SchemaDriftDetector(session.getSchema().getIdentityResolver());
    }

    /**
     * Prepare for a new stream: forget the relations of the previous stream and activate every streaming table.
     * Must only be called when no applier is busy.
     */
    public void reset() {
        if (buffer.abandon()) {
            LOGGER.debug("Abandoned the open transaction");
        }
        relations.clear();
        active.clear();
        lastDispatched.clear();
        tracker.reset();
        for (TableId tableId : lagging) {
            tracker.release(tableId);
        }
        lagging.clear();
        for (TableDescriptor descriptor : session.getStateMachine().descriptors()) {
            if (descriptor.state() == TableState.STREAMING) {
                active.put(descriptor.id(), descriptor.generation());
                lastDispatched.put(descriptor.id(), descriptor.appliedLsn());
                tracker.release(descriptor.id());
            }
        }
        final Iterator<Map.Entry<TableId, TableApplier>> iterator = appliers.entrySet().iterator();
        while (iterator.hasNext()) {
            final Map.Entry<TableId, TableApplier> entry = iterator.next();
            if (!active.containsKey(entry.getKey())) {
                entry.getValue().close();
                iterator.remove();
            }
        }
        LOGGER.debug("Active tables: {}", active.keySet());
    }

    /**
     * Release the holds of tables that no longer need any part of the stream, because they were removed or skipped.
     */
    public void releaseObsoleteHolds() {
        for (TableId tableId : tracker.holds().keySet()) {
            final Optional<TableDescriptor> descriptor = session.getStateMachine().get(tableId);
            if (!descriptor.isPresent() || descriptor.get().state() == TableState.SKIPPED) {
                lagging.remove(tableId);
                tracker.release(tableId);
            }
        }
    }

    /**
     * @return the tables whose changes are currently applied
     */
    public Set<TableId> activeTables() {
        return new HashSet<>(active.keySet());
    }

    public void handle(ReplicationMessage message) {
        switch (message.getOperation()) {
            case BEGIN:
                final TransactionMessage begin = (TransactionMessage) message;
                buffer.begin(begin.getTransactionId());
                transactionLsn = begin.getCommitLsn();
                break;
            case COMMIT:
                commit((TransactionMessage) message);
                break;
            case RELATION:
                relation((RelationMessage) message);
                break;
            case INSERT:
            case UPDATE:
            case DELETE:
                row((RowMessage) message);
                break;
            case TRUNCATE:
                truncate((TruncateMessage) message);
                break;
            case NOOP:
            default:
                LOGGER.trace("Ignoring {}", message);
        }
    }

    private void relation(RelationMessage relation) {
        final TableId tableId = relation.getTableId();
        final Optional<TableDescriptor> descriptor = session.getStateMachine().get(tableId);
        if (!descriptor.isPresent()) {
            LOGGER.debug("Ignoring relation {} of table {} which is not replicated", relation.getRelationId(), tableId);
            relations.put(relation.getRelationId(), IGNORED);
            return;
        }
        relations.put(relation.getRelationId(), tableId);
        if (!isActive(descriptor.get()) || !isNewTransaction(tableId)) {
            return;
        }
        final Optional<String> drift = driftDetector.detect(descriptor.get(), relation);
        if (drift.isPresent()) {
            skip(descriptor.get(), drift.get());
            return;
        }
        session.getStateMachine().relationAccepted(tableId, descriptor.get().generation(), relation.getRelationId());
        LOGGER.trace("Accepted {}", relation);
    }

    private void row(RowMessage message) {
        final TableId tableId = relations.get(message.getRelationId());
        if (tableId == null) {
            throw new ReplicationStreamException("Received " + message.getOperation() + " for relation " + message.getRelationId()
                    + " which the stream has not described");
        }
        if (tableId == IGNORED) {
            return;
        }
        if (!buffer.isOpen()) {
            throw new ReplicationStreamException("Received " + message.getOperation() + " for table " + tableId + " outside of a transaction");
        }
        final Optional<TableDescriptor> descriptor = session.getStateMachine().get(tableId);
        if (!descriptor.isPresent() || !isActive(descriptor.get()) || lagging.contains(tableId) || !isNewTransaction(tableId)) {
            return;
        }
        try {
            convert(descriptor.get(), message);
        }
        catch (ValueConversionException | UnsupportedTypeException e) {
            buffer.discard(tableId);
            skip(descriptor.get(), e.getMessage());
        }
    }

    private void convert(TableDescriptor descriptor, RowMessage message) {
        final List<Integer> identity = descriptor.identityColumns();
        switch (message.getOperation()) {
            case INSERT: {
                final Object[] row = toRow(descriptor, message.getNewTuple());
                buffer.add(descriptor.id(), BufferedChange.upsert(ReplicaIdentityResolver.extractIdentity(row, identity), row));
                break;
            }
            case UPDATE: {
                final Object[] row = toRow(descriptor, message.getNewTuple());
                List<Object> oldKey = null;
                if (message.getOldTuple() != null) {
                    final Object[] oldRow = toRow(descriptor, message.getOldTuple());
                    if (!message.isOldTupleKeyOnly()) {
                        for (int i = 0; i < row.length; i++) {
                            if (row[i] instanceof UnchangedToastedPlaceholder && !(oldRow[i] instanceof UnchangedToastedPlaceholder)) {
                                row[i] = oldRow[i];
                            }
                        }
                    }
                    oldKey = ReplicaIdentityResolver.extractIdentity(oldRow, identity);
                }
                final List<Object> key = ReplicaIdentityResolver.extractIdentity(row, identity);
                if (oldKey != null && !oldKey.equals(key)) {
                    buffer.add(descriptor.id(), BufferedChange.delete(oldKey));
                }
                buffer.add(descriptor.id(), BufferedChange.upsert(key, row));
                break;
            }
            case DELETE: {
                if (message.getOldTuple() == null) {
                    throw new ReplicationStreamException("Received a delete without old values for table " + descriptor.id());
                }
                final Object[] oldRow = toRow(descriptor, message.getOldTuple());
                buffer.add(descriptor.id(), BufferedChange.delete(ReplicaIdentityResolver.extractIdentity(oldRow, identity)));
                break;
            }
            default:
                throw new IllegalArgumentException("Not a row message: " + message);
        }
    }

    private Object[] toRow(TableDescriptor descriptor, TupleData tuple) {
        final List<ValueConverter> converters = descriptor.converters();
        if (tuple.size() != descriptor.columns().size()) {
            throw new ValueConversionException("column count mismatch: expected " + descriptor.columns().size()
                    + " values but received " + tuple.size());
        }
        final Object[] row = new Object[tuple.size()];
        for (int i = 0; i < row.length; i++) {
            final ColumnValue value = tuple.get(i);
            switch (value.kind()) {
                case NULL:
                    row[i] = null;
                    break;
                case UNCHANGED_TOAST:
                    row[i] = UnchangedToastedPlaceholder.getInstance();
                    break;
                case BINARY:
                    row[i] = converters.get(i).convert(new String(value.asBytes(), StandardCharsets.UTF_8));
                    break;
                case TEXT:
                default:
                    row[i] = converters.get(i).convert(value.asText());
            }
        }
        return row;
    }

    private void truncate(TruncateMessage message) {
        for (Integer relationId : message.getRelationIds()) {
            final TableId tableId = relations.get(relationId);
            if (tableId == null) {
                throw new ReplicationStreamException("Received TRUNCATE for relation " + relationId + " which the stream has not described");
            }
            if (tableId == IGNORED) {
                continue;
            }
            final Optional<TableDescriptor> descriptor = session.getStateMachine().get(tableId);
            if (descriptor.isPresent() && isActive(descriptor.get()) && isNewTransaction(tableId)) {
                buffer.discard(tableId);
                skip(descriptor.get(), "truncate of the source table");
            }
        }
    }

    private void commit(TransactionMessage commit) {
        if (!buffer.isOpen()) {
            throw new ReplicationStreamException("Received a commit at " + commit.getEndLsn() + " outside of a transaction");
        }
        final Lsn endLsn = commit.getEndLsn();
        final Map<TableId, List<BufferedChange>> changes = buffer.commit();
        final PendingCommit pending = tracker.commit(endLsn);
        try {
            changes.forEach((tableId, tableChanges) -> dispatch(tableId, tableChanges, endLsn, pending));
        }
        finally {
            pending.seal();
        }
    }

    private void dispatch(TableId tableId, List<BufferedChange> changes, Lsn endLsn, PendingCommit pending) {
        final Optional<TableDescriptor> descriptor = session.getStateMachine().get(tableId);
        if (!descriptor.isPresent() || !isActive(descriptor.get()) || lagging.contains(tableId)) {
            return;
        }
        final Lsn dispatched = lastDispatched.getOrDefault(tableId, Lsn.INVALID);
        if (!endLsn.isAfter(dispatched)) {
            LOGGER.trace("Table {} already received transaction ending at {}", tableId, endLsn);
            return;
        }
        final List<Mutation> mutations = new ArrayList<>(changes.size());
        for (BufferedChange change : changes) {
            mutations.add(change.toMutation(endLsn.asLong()));
        }
        final MutationBatch batch = new MutationBatch(descriptor.get().destinationId(), mutations, endLsn.asLong());
        pending.acquire();
        if (applier(tableId).offer(batch, descriptor.get().generation(), pending)) {
            lastDispatched.put(tableId, endLsn);
            return;
        }
        pending.release();
        LOGGER.info("Table {} is falling behind, its changes after {} will be replayed", tableId, dispatched);
        lagging.add(tableId);
        tracker.hold(tableId, dispatched);
    }

    private TableApplier applier(TableId tableId) {
        return appliers.computeIfAbsent(tableId, id -> new TableApplier(id, session, errorHandler));
    }

    /**
     * @return true unless the open transaction commits before the last transaction dispatched to the table
     */
    private boolean isNewTransaction(TableId tableId) {
        if (!buffer.isOpen()) {
            return true;
        }
        return transactionLsn.compareTo(lastDispatched.getOrDefault(tableId, Lsn.INVALID)) >= 0;
    }

    private boolean isActive(TableDescriptor descriptor) {
        return descriptor.state() == TableState.STREAMING && Objects.equals(active.get(descriptor.id()), descriptor.generation());
    }

    private void skip(TableDescriptor descriptor, String reason) {
        session.getStateMachine().skip(descriptor.id(), descriptor.generation(), reason);
        active.remove(descriptor.id());
    }

    /**
     * @return true if a table needs changes the current stream has already passed
     */
    public boolean isRewindRequested() {
        for (TableId tableId : lagging) {
            final TableApplier applier = appliers.get(tableId);
            if (applier == null || applier.isIdle()) {
                return true;
            }
        }
        for (TableDescriptor descriptor : session.getStateMachine().descriptors()) {
            if (descriptor.state() == TableState.STREAMING && !Objects.equals(active.get(descriptor.id()), descriptor.generation())) {
                return true;
            }
        }
        return false;
    }

    /**
     * Wait until every dispatched batch is applied or discarded.
     *
     * @return true if all appliers became idle in time
     */
    public boolean awaitIdle(Clock clock, Duration timeout) throws InterruptedException {
        final Timer timer = Threads.timer(clock, timeout);
        while (!isIdle()) {
            if (timer.expired()) {
                return false;
            }
            Thread.sleep(Math.min(10, Math.max(1, timer.remaining().toMillis())));
        }
        return true;
    }

    public boolean isIdle() {
        for (TableApplier applier : appliers.values()) {
            if (!applier.isIdle()) {
                return false;
            }
        }
        return true;
    }

    /**
     * Abandon the open transaction and stop all appliers once the batches they hold are applied.
     */
    @Override
    public void close() {
        final long transactionId = buffer.transactionId();
        if (buffer.abandon()) {
            LOGGER.info("Abandoned the open transaction {}", transactionId);
        }
        try {
            if (!awaitIdle(session.getClock(), session.getConfig().getPollInterval().multipliedBy(50))) {
                LOGGER.warn("Not all queued batches were applied before shutdown");
            }
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        for (TableApplier applier : appliers.values()) {
            applier.close();
        }
        appliers.clear();
    }
}
