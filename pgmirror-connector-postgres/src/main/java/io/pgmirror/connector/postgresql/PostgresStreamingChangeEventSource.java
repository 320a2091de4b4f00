/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgmirror.connector.postgresql;

import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.pgmirror.connector.postgresql.apply.ApplyEngine;
import io.pgmirror.connector.postgresql.connection.Lsn;
import io.pgmirror.connector.postgresql.connection.PostgresConnection;
import io.pgmirror.connector.postgresql.connection.ReplicationConnection;
import io.pgmirror.connector.postgresql.connection.ReplicationMessage;
import io.pgmirror.connector.postgresql.connection.ReplicationMessage.Operation;
import io.pgmirror.connector.postgresql.connection.ReplicationMessageStream;
import io.pgmirror.connector.postgresql.connection.ReplicationSlotLostException;
import io.pgmirror.connector.postgresql.connection.RetriableReplicationException;
import io.pgmirror.connector.postgresql.connection.SlotCreationResult;
import io.pgmirror.connector.postgresql.connection.pgoutput.PgOutputMessageDecoder;
import io.pgmirror.connector.postgresql.offset.OffsetState;
import io.pgmirror.pipeline.ErrorHandler;
import io.pgmirror.relational.TableId;
import io.pgmirror.util.DelayStrategy;
import io.pgmirror.util.Threads;
import io.pgmirror.util.Threads.Timer;

/**
 * The replication pipeline: brings the replicated tables into a consistent state, then consumes the slot's change
 * stream and applies it until it is stopped or fails.
 * <p>
 * On the first start the permanent slot is created and all tables are loaded from its exported snapshot. Later starts
 * resume from the confirmed position of the offset store; tables still waiting for their initial load are then loaded
 * from a temporary slot of their own while the other tables keep streaming. When a table needs a part of the stream
 * that was already consumed, because it just finished loading or because it fell behind, the stream is restarted from
 * the confirmed position and every table skips what it already applied.
 */
public class PostgresStreamingChangeEventSource {

    private static final Logger LOGGER = LoggerFactory.getLogger(PostgresStreamingChangeEventSource.class);

    /**
     * Number of empty polls before the loop pauses for the poll interval.
     */
    private static final int THROTTLE_NO_MESSAGE_BEFORE_PAUSE = 5;

    private static final String UNDEFINED_TABLE = "42P01";

    /**
     * Tells the pipeline whether it should keep running.
     */
    @FunctionalInterface
    public interface ChangeEventSourceContext {
        boolean isRunning();
    }

    private final ReplicationSession session;
    private final PostgresConnectorConfig config;
    private final ErrorHandler errorHandler;
    private final Queue<TableCommand> commands;
    private final PublicationManager publicationManager;
    private final PostgresSnapshotLoader snapshotLoader;
    private final PgOutputMessageDecoder decoder = new PgOutputMessageDecoder();
    private final DelayStrategy pauseNoMessage;

    private PositionTracker tracker;
    private ApplyEngine engine;
    private ReplicationConnection replicationConnection;
    private ReplicationMessageStream stream;
    private ExecutorService snapshotExecutor;

    public PostgresStreamingChangeEventSource(ReplicationSession session, ErrorHandler errorHandler, Queue<TableCommand> commands) {
        this.session = session;
        this.config = session.getConfig();
        this.errorHandler = errorHandler;
        this.commands = commands;
        this.publicationManager = new PublicationManager(config);
        this.snapshotLoader = new PostgresSnapshotLoader(session);
        this.pauseNoMessage = DelayStrategy.constant(config.getPollInterval());
    }

    /**
     * Run the pipeline until the context stops running or a failure is recorded with the error handler.
     */
    public void execute(ChangeEventSourceContext context) throws InterruptedException {
        snapshotExecutor = Threads.newFixedThreadPool(session.getLogicalName(), "snapshot", config.snapshotMaxThreads());
        try (PostgresConnection connection = session.getConnectionFactory().newConnection()) {
            session.getSchema().getTypeRegistry().prime(connection);
            final Set<TableId> configured = configuredTables(connection);
            publicationManager.ensurePublication(connection, configured);

            final Optional<OffsetState> stored = session.getOffsetStore().load();
            if (stored.isPresent()) {
                resume(connection, stored.get(), configured);
            }
            else {
                initialLoad(connection, configured);
            }
            processMessages(context, connection);
        }
        catch (InterruptedException e) {
            throw e;
        }
        catch (Throwable e) {
            errorHandler.setProducerThrowable(e);
        }
        finally {
            cleanUpStreamingOnStop();
        }
    }

    private Set<TableId> configuredTables(PostgresConnection connection) throws SQLException {
        final List<TableId> includeList = config.tableIncludeList();
        if (!includeList.isEmpty()) {
            return new LinkedHashSet<>(includeList);
        }
        final Set<TableId> tables = connection.readTableIds(config.schemaName());
        LOGGER.info("Replicating all {} table(s) of schema '{}'", tables.size(), config.schemaName());
        return tables;
    }

    private void initialLoad(PostgresConnection connection, Set<TableId> configured) throws SQLException, InterruptedException {
        final String slotName = publicationManager.slotName();
        LOGGER.info("No stored replication state found, creating slot '{}' and loading all tables", slotName);
        replicationConnection = session.getConnectionFactory().newReplicationConnection(slotName, config.publicationName());
        Optional<SlotCreationResult> slot = replicationConnection.createReplicationSlot();
        if (!slot.isPresent()) {
            LOGGER.warn("Replication slot '{}' already exists but there is no stored replication state, recreating it", slotName);
            replicationConnection.close();
            connection.dropReplicationSlot(slotName);
            replicationConnection = session.getConnectionFactory().newReplicationConnection(slotName, config.publicationName());
            slot = replicationConnection.createReplicationSlot();
            if (!slot.isPresent()) {
                throw new RetriableReplicationException("Replication slot '" + slotName + "' could not be recreated");
            }
        }
        final Lsn consistentPoint = slot.get().consistentPoint();

        final Set<TableId> tableIds = new LinkedHashSet<>(configured);
        for (TableDescriptor descriptor : session.getStateMachine().descriptors()) {
            tableIds.add(descriptor.id());
        }
        final List<TableDescriptor> tables = new ArrayList<>();
        for (TableId tableId : tableIds) {
            tables.add(session.getStateMachine().add(tableId));
        }
        session.getOffsetStore().save(new OffsetState(slotName, consistentPoint, session.getStateMachine().descriptors()));

        snapshotLoader.load(snapshotExecutor, slot.get(), tables);

        tracker = new PositionTracker(consistentPoint);
        engine = new ApplyEngine(session, tracker, errorHandler);
        startStreaming(consistentPoint);
    }

    private void resume(PostgresConnection connection, OffsetState state, Set<TableId> configured) throws SQLException {
        final String slotName = publicationManager.slotName();
        if (!publicationManager.slotState(connection).isPresent()) {
            throw new ReplicationSlotLostException("Replication slot '" + slotName + "' no longer exists, "
                    + "the replica can only be rebuilt by dropping its stored state");
        }
        LOGGER.info("Resuming replication from slot '{}' at {}", slotName, state.confirmedLsn());
        final TableSyncStateMachine stateMachine = session.getStateMachine();
        if (stateMachine.descriptors().isEmpty()) {
            for (TableDescriptor descriptor : state.tables()) {
                restore(connection, descriptor);
            }
        }
        for (TableId tableId : configured) {
            if (!stateMachine.get(tableId).isPresent()) {
                stateMachine.add(tableId);
            }
        }

        tracker = new PositionTracker(state.confirmedLsn());
        engine = new ApplyEngine(session, tracker, errorHandler);
        replicationConnection = session.getConnectionFactory().newReplicationConnection(slotName, config.publicationName());
        startStreaming(state.confirmedLsn());

        for (TableDescriptor descriptor : stateMachine.descriptors()) {
            if (descriptor.state() == TableState.NOT_LOADED || descriptor.state() == TableState.SNAPSHOTTING) {
                scheduleLoad(descriptor);
            }
        }
    }

    private void restore(PostgresConnection connection, TableDescriptor descriptor) throws SQLException {
        if (descriptor.state() != TableState.STREAMING) {
            session.getStateMachine().restore(descriptor);
            return;
        }
        try {
            session.getSchema().resolveTypes(descriptor.columns(), connection::readType);
            session.getStateMachine().restore(session.getSchema().withConverters(descriptor));
        }
        catch (UnsupportedTypeException e) {
            session.getStateMachine().restore(descriptor);
            session.getStateMachine().skip(descriptor.id(), descriptor.generation(), e.getMessage());
        }
    }

    private void scheduleLoad(TableDescriptor descriptor) {
        tracker.hold(descriptor.id(), tracker.confirmed());
        snapshotExecutor.submit(() -> {
            try {
                snapshotLoader.loadWithTemporarySlot(descriptor);
            }
            catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            catch (RuntimeException e) {
                errorHandler.setProducerThrowable(e);
            }
        });
    }

    private void startStreaming(Lsn from) throws SQLException {
        engine.reset();
        stream = new ReplicationMessageStream(replicationConnection.startStreaming(from), decoder);
        LOGGER.info("Streaming changes of {} table(s) from {}", engine.activeTables().size(), from);
    }

    private void processMessages(ChangeEventSourceContext context, PostgresConnection connection) throws SQLException, InterruptedException {
        LOGGER.info("Processing messages");
        Timer statusUpdateTimer = Threads.timer(session.getClock(), config.statusUpdateInterval());
        int noMessageIterations = 0;
        while (context.isRunning() && errorHandler.getProducerThrowable() == null) {
            if (Thread.currentThread().isInterrupted()) {
                throw new InterruptedException("Replication pipeline interrupted");
            }
            processCommands(connection);

            final ReplicationMessage message = stream.next();
            if (message != null) {
                noMessageIterations = 0;
                engine.handle(message);
            }
            else {
                noMessageIterations++;
                if (noMessageIterations >= THROTTLE_NO_MESSAGE_BEFORE_PAUSE) {
                    noMessageIterations = 0;
                    pauseNoMessage.sleepWhen(true);
                }
            }
            if ((message == null || message.getOperation() == Operation.COMMIT) && engine.isRewindRequested()) {
                rewind();
            }
            if (statusUpdateTimer.expired()) {
                commitOffsets();
                statusUpdateTimer = Threads.timer(session.getClock(), config.statusUpdateInterval());
            }
        }
    }

    private void processCommands(PostgresConnection connection) throws SQLException {
        TableCommand command;
        while ((command = commands.peek()) != null) {
            final TableId tableId = command.tableId();
            switch (command.type()) {
                case ADD:
                    final TableDescriptor added = session.getStateMachine().add(tableId);
                    try {
                        publicationManager.addTable(connection, tableId);
                    }
                    catch (SQLException e) {
                        if (!UNDEFINED_TABLE.equals(e.getSQLState())) {
                            throw e;
                        }
                        session.getStateMachine().skip(tableId, added.generation(), "table does not exist");
                        break;
                    }
                    scheduleLoad(added);
                    break;
                case REMOVE:
                    final Optional<TableDescriptor> removed = session.getStateMachine().remove(tableId);
                    removed.ifPresent(descriptor -> session.getDestination().dropTable(descriptor.destinationId()));
                    publicationManager.removeTable(connection, tableId);
                    tracker.release(tableId);
                    break;
                default:
                    throw new IllegalStateException("Unknown command " + command);
            }
            commands.remove();
        }
    }

    /**
     * Restart the stream from the confirmed position once every dispatched batch is settled.
     */
    private void rewind() throws SQLException, InterruptedException {
        stream.close();
        replicationConnection.close();
        final Duration timeout = config.getPollInterval().multipliedBy(50);
        if (!engine.awaitIdle(session.getClock(), timeout)) {
            throw new RetriableReplicationException("Table appliers did not become idle within " + timeout + " before restarting the stream");
        }
        final Lsn from = tracker.confirmed();
        LOGGER.info("Restarting the change stream from {}", from);
        replicationConnection = session.getConnectionFactory().newReplicationConnection(publicationManager.slotName(), config.publicationName());
        startStreaming(from);
    }

    private void commitOffsets() throws SQLException {
        engine.releaseObsoleteHolds();
        final Lsn confirmed = tracker.confirmed();
        session.getOffsetStore().save(new OffsetState(publicationManager.slotName(), confirmed, session.getStateMachine().descriptors()));
        stream.flushLsn(confirmed);
        session.getDestination().pruneBefore(confirmed.asLong());
        LOGGER.debug("Confirmed {} with {} pending transaction(s)", confirmed, tracker.pendingCount());
    }

    private void cleanUpStreamingOnStop() {
        LOGGER.debug("Stopping streaming...");
        snapshotExecutor.shutdownNow();
        if (engine != null) {
            engine.close();
            if (stream != null) {
                try {
                    commitOffsets();
                }
                catch (Exception e) {
                    LOGGER.warn("Unable to commit offsets while stopping", e);
                }
            }
        }
        try {
            if (!snapshotExecutor.awaitTermination(10, TimeUnit.SECONDS)) {
                LOGGER.warn("Table loads did not stop in time");
            }
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        closeQuietly(stream);
        closeQuietly(replicationConnection);
        stream = null;
        replicationConnection = null;
        engine = null;
        tracker = null;
    }

    private static void closeQuietly(AutoCloseable closeable) {
        if (closeable == null) {
            return;
        }
        try {
            closeable.close();
        }
        catch (Exception e) {
            LOGGER.debug("Exception while closing {}", closeable, e);
        }
    }
}
