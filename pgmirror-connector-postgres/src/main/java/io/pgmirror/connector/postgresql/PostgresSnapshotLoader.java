/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgmirror.connector.postgresql;

import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.pgmirror.connector.postgresql.TableSyncStateMachine.StaleGenerationException;
import io.pgmirror.connector.postgresql.connection.Lsn;
import io.pgmirror.connector.postgresql.connection.PostgresConnection;
import io.pgmirror.connector.postgresql.connection.ReplicationConnection;
import io.pgmirror.connector.postgresql.connection.RetriableReplicationException;
import io.pgmirror.connector.postgresql.connection.SlotCreationResult;
import io.pgmirror.connector.postgresql.connection.SnapshotTransaction;
import io.pgmirror.connector.postgresql.connection.SourceTable;
import io.pgmirror.destination.Destination;
import io.pgmirror.destination.Mutation;
import io.pgmirror.destination.MutationBatch;
import io.pgmirror.relational.Column;
import io.pgmirror.relational.TableId;
import io.pgmirror.relational.ValueConverter;
import io.pgmirror.util.DelayStrategy;
import io.pgmirror.util.Strings;
import io.pgmirror.util.Threads;
import io.pgmirror.util.Threads.Timer;

/**
 * Performs the initial load of tables from an exported snapshot of the source.
 * <p>
 * A table is read inside a {@code REPEATABLE READ} transaction that imports the snapshot, so its rows are exactly the
 * rows as of the snapshot's consistent point, which becomes the table's applied position. A failed load drops the
 * destination table and starts over after a growing delay. Loads failing on transient errors are restarted for as
 * long as the table stays in the load; other failures are restarted up to {@code snapshot.max.retries} times, after
 * which the table is skipped.
 */
public class PostgresSnapshotLoader {

    private static final Logger LOGGER = LoggerFactory.getLogger(PostgresSnapshotLoader.class);

    private static final Duration LOG_INTERVAL = Duration.ofMillis(10_000);
    private static final int MAX_SLOT_NAME_LENGTH = 63;

    private final ReplicationSession session;
    private final PostgresConnectorConfig config;

    public PostgresSnapshotLoader(ReplicationSession session) {
        this.session = session;
        this.config = session.getConfig();
    }

    /**
     * Load the tables from the snapshot exported by the creation of the permanent slot, in parallel on the executor.
     * Returns once every table is either streaming or skipped.
     */
    public void load(ExecutorService executor, SlotCreationResult slot, List<TableDescriptor> tables) throws InterruptedException {
        LOGGER.info("Loading {} table(s) from snapshot {} at {}", tables.size(), slot.snapshotName(), slot.consistentPoint());
        final long start = session.getClock().currentTimeInMillis();
        final CompletionService<Void> completionService = new ExecutorCompletionService<>(executor);
        int order = 1;
        for (TableDescriptor table : tables) {
            final int tableOrder = order++;
            completionService.submit(() -> {
                load(slot.snapshotName(), slot.consistentPoint(), table, tableOrder, tables.size());
                return null;
            });
        }
        for (int i = 0; i < tables.size(); i++) {
            try {
                completionService.take().get();
            }
            catch (ExecutionException e) {
                if (e.getCause() instanceof InterruptedException) {
                    throw new InterruptedException("Interrupted during initial load");
                }
                throw new RetriableReplicationException("Initial load failed", e.getCause());
            }
        }
        LOGGER.info("Initial load of {} table(s) completed in {}", tables.size(), Strings.duration(session.getClock().currentTimeInMillis() - start));
    }

    /**
     * Load one table from the snapshot of a temporary slot, while other tables keep streaming from the permanent one.
     */
    public void loadWithTemporarySlot(TableDescriptor table) throws InterruptedException {
        final String slotName = temporarySlotName(table);
        final DelayStrategy retryDelay = retryDelay();
        int failures = 0;
        while (true) {
            try (ReplicationConnection connection = session.getConnectionFactory().newReplicationConnection(slotName, config.publicationName())) {
                final SlotCreationResult slot = connection.createTemporarySlot(slotName);
                LOGGER.info("Loading table {} from snapshot {} of temporary slot '{}' at {}", table.id(), slot.snapshotName(), slotName,
                        slot.consistentPoint());
                load(slot.snapshotName(), slot.consistentPoint(), table, 1, 1);
                return;
            }
            catch (SQLException e) {
                if (Thread.currentThread().isInterrupted()) {
                    throw new InterruptedException("Interrupted while loading table " + table.id());
                }
                if (!PostgresErrorHandler.isTransient(e) && ++failures > config.snapshotMaxRetries()) {
                    session.getStateMachine().skip(table.id(), table.generation(), "snapshot failure: " + e.getMessage());
                    return;
                }
                LOGGER.warn("Unable to create temporary slot for table {}, retrying: {}", table.id(), e.getMessage());
                pause(retryDelay, table);
            }
        }
    }

    private void load(String snapshotName, Lsn consistentPoint, TableDescriptor table, int tableOrder, int tableCount)
            throws InterruptedException {
        final TableSyncStateMachine stateMachine = session.getStateMachine();
        TableDescriptor snapshotting;
        try {
            snapshotting = stateMachine.startSnapshot(table.id(), table.generation());
        }
        catch (StaleGenerationException e) {
            LOGGER.info("Not loading table {} which changed before its load started", table.id());
            return;
        }
        final DelayStrategy retryDelay = retryDelay();
        int failures = 0;
        while (true) {
            if (!isCurrent(snapshotting)) {
                LOGGER.info("Abandoning load of table {} which changed while it was loaded", table.id());
                return;
            }
            try {
                final Optional<TableDescriptor> loaded = loadTable(snapshotName, consistentPoint, snapshotting, tableOrder, tableCount);
                if (loaded.isPresent() && !stateMachine.snapshotCompleted(loaded.get()).isPresent()
                        && !stateMachine.get(table.id()).isPresent()) {
                    session.getDestination().dropTable(loaded.get().destinationId());
                }
                return;
            }
            catch (UnsupportedTypeException | ReplicaIdentityAmbiguityException | ValueConversionException e) {
                stateMachine.skip(table.id(), table.generation(), e.getMessage());
                return;
            }
            catch (SQLException | RuntimeException e) {
                if (Thread.currentThread().isInterrupted()) {
                    throw new InterruptedException("Interrupted while loading table " + table.id());
                }
                if (PostgresErrorHandler.isTransient(e)) {
                    LOGGER.warn("Load of table {} failed on a transient error, restarting it: {}", table.id(), e.getMessage());
                }
                else if (++failures > config.snapshotMaxRetries()) {
                    LOGGER.error("Load of table {} failed {} times", table.id(), failures, e);
                    stateMachine.skip(table.id(), table.generation(), "snapshot failure: " + e.getMessage());
                    return;
                }
                else {
                    LOGGER.warn("Load of table {} failed, restarting it: {}", table.id(), e.getMessage());
                }
                pause(retryDelay, table);
            }
        }
    }

    private DelayStrategy retryDelay() {
        final Duration initial = config.snapshotRetryDelay();
        final Duration max = config.getRetriableRestartWait();
        return DelayStrategy.exponential(initial, max.compareTo(initial) > 0 ? max : initial.multipliedBy(2));
    }

    private static void pause(DelayStrategy retryDelay, TableDescriptor table) throws InterruptedException {
        retryDelay.sleepWhen(true);
        if (Thread.currentThread().isInterrupted()) {
            throw new InterruptedException("Interrupted while loading table " + table.id());
        }
    }

    private boolean isCurrent(TableDescriptor table) {
        final Optional<TableDescriptor> current = session.getStateMachine().get(table.id());
        return current.isPresent() && current.get().generation() == table.generation() && current.get().state() == TableState.SNAPSHOTTING;
    }

    /**
     * @return the loaded table, or empty if it does not exist in the snapshot
     */
    private Optional<TableDescriptor> loadTable(String snapshotName, Lsn consistentPoint, TableDescriptor table, int tableOrder, int tableCount)
            throws SQLException, InterruptedException {
        final Destination destination = session.getDestination();
        try (PostgresConnection connection = session.getConnectionFactory().newConnection();
                SnapshotTransaction transaction = connection.openSnapshotTransaction(snapshotName)) {
            final Optional<SourceTable> sourceTable = transaction.readTableSchema(table.id());
            if (!sourceTable.isPresent()) {
                session.getStateMachine().skip(table.id(), table.generation(), "table does not exist");
                return Optional.empty();
            }
            session.getSchema().resolveTypes(sourceTable.get().columns(), transaction::readType);
            final TableDescriptor described = session.getSchema().describe(table, sourceTable.get(), consistentPoint);

            destination.dropTable(described.destinationId());
            destination.createTable(session.getSchema().tableDefinition(described));

            final long exportStart = session.getClock().currentTimeInMillis();
            LOGGER.info("Exporting data from table '{}' ({} of {} tables)", table.id(), tableOrder, tableCount);
            final List<String> columnNames = new ArrayList<>();
            for (Column column : described.columns()) {
                columnNames.add(column.name());
            }
            final List<ValueConverter> converters = described.converters();
            final List<Mutation> mutations = new ArrayList<>(config.snapshotBatchSize());
            final long version = consistentPoint.asLong();
            final Timer[] logTimer = { Threads.timer(session.getClock(), LOG_INTERVAL) };
            final long[] exported = { 0 };
            final long rows = transaction.scan(table.id(), columnNames, config.snapshotFetchSize(), values -> {
                final Object[] row = new Object[values.length];
                for (int i = 0; i < values.length; i++) {
                    row[i] = converters.get(i).convert(values[i]);
                }
                mutations.add(Mutation.upsert(ReplicaIdentityResolver.extractIdentity(row, described.identityColumns()), row, version));
                exported[0]++;
                if (mutations.size() >= config.snapshotBatchSize()) {
                    flush(described, mutations, version);
                }
                if (logTimer[0].expired()) {
                    LOGGER.info("\t Exported {} records for table '{}' after {}", exported[0], table.id(),
                            Strings.duration(session.getClock().currentTimeInMillis() - exportStart));
                    logTimer[0] = Threads.timer(session.getClock(), LOG_INTERVAL);
                }
                if (Thread.currentThread().isInterrupted()) {
                    throw new InterruptedException("Interrupted while loading table " + table.id());
                }
            });
            flush(described, mutations, version);
            LOGGER.info("\t Finished exporting {} records for table '{}' ({} of {} tables); total duration '{}'",
                    rows, table.id(), tableOrder, tableCount, Strings.duration(session.getClock().currentTimeInMillis() - exportStart));
            return Optional.of(described);
        }
    }

    private void flush(TableDescriptor table, List<Mutation> mutations, long version) {
        if (mutations.isEmpty()) {
            return;
        }
        session.getDestination().applyBatch(table.destinationId(), new MutationBatch(table.destinationId(), mutations, version));
        mutations.clear();
    }

    private String temporarySlotName(TableDescriptor table) {
        final String name = config.slotName() + "_tmp_" + table.generation();
        return name.length() > MAX_SLOT_NAME_LENGTH ? name.substring(name.length() - MAX_SLOT_NAME_LENGTH) : name;
    }
}
