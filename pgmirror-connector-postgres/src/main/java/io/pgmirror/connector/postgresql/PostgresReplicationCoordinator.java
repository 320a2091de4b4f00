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
import java.util.Map;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import org.apache.kafka.connect.errors.ConnectException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.pgmirror.annotation.ThreadSafe;
import io.pgmirror.config.Configuration;
import io.pgmirror.connector.postgresql.connection.JdbcPostgresConnectionFactory;
import io.pgmirror.connector.postgresql.connection.PostgresConnection;
import io.pgmirror.connector.postgresql.connection.PostgresConnectionFactory;
import io.pgmirror.connector.postgresql.offset.FileOffsetStore;
import io.pgmirror.connector.postgresql.offset.MemoryOffsetStore;
import io.pgmirror.connector.postgresql.offset.OffsetStore;
import io.pgmirror.destination.Destination;
import io.pgmirror.relational.TableId;
import io.pgmirror.util.Clock;
import io.pgmirror.util.Threads;
import io.pgmirror.util.Threads.Timer;

/**
 * Replicates one source database into a destination: runs the replication pipeline on its own thread, restarts it
 * after retriable failures and exposes the state of every replicated table.
 * <p>
 * Changes of the replicated table set requested with {@link #addTable(TableId)} and {@link #removeTable(TableId)} are
 * queued and carried out by the pipeline, so they take effect once it is streaming.
 */
@ThreadSafe
public class PostgresReplicationCoordinator {

    private static final Logger LOGGER = LoggerFactory.getLogger(PostgresReplicationCoordinator.class);

    private static final Duration SHUTDOWN_WAIT_TIMEOUT = Duration.ofSeconds(90);
    private static final String SCHEMA_CHANGED = "schema changed";
    private static final String REPLICA_IDENTITY_CHANGED = "replica identity changed";

    private final ReplicationSession session;
    private final PostgresConnectorConfig config;
    private final Queue<TableCommand> commands = new ConcurrentLinkedQueue<>();
    private final PostgresErrorHandler errorHandler;
    private final AtomicReference<RuntimeException> lastError = new AtomicReference<>();
    private final AtomicReference<Throwable> failure = new AtomicReference<>();

    private ExecutorService executor;
    private volatile boolean running;

    /**
     * Replicate into the destination from the database the configuration points to, keeping the replication state in
     * the configured offset file, or in memory if none is configured.
     */
    public PostgresReplicationCoordinator(Configuration configuration, Destination destination) {
        this(new PostgresConnectorConfig(configuration), destination, Clock.system());
    }

    private PostgresReplicationCoordinator(PostgresConnectorConfig config, Destination destination, Clock clock) {
        this(config, new JdbcPostgresConnectionFactory(config), destination, offsetStore(config), clock);
    }

    public PostgresReplicationCoordinator(PostgresConnectorConfig config, PostgresConnectionFactory connectionFactory, Destination destination,
                                          OffsetStore offsetStore, Clock clock) {
        this.config = config;
        this.session = new ReplicationSession(config, clock, connectionFactory, destination, offsetStore);
        this.errorHandler = new PostgresErrorHandler(lastError::set);
        session.getStateMachine().addListener(this::onTransition);
    }

    private static OffsetStore offsetStore(PostgresConnectorConfig config) {
        return config.offsetFile() != null ? new FileOffsetStore(config.offsetFile()) : new MemoryOffsetStore();
    }

    /**
     * Validate the configuration and start replicating in the background.
     *
     * @throws ConnectException if the configuration is not valid
     */
    public synchronized void start() {
        if (running) {
            return;
        }
        final List<String> problems = new ArrayList<>();
        if (!config.validateAndRecord(problems::add)) {
            problems.forEach(LOGGER::error);
            throw new ConnectException("Error configuring replication of database '" + config.getLogicalName() + "': " + problems);
        }
        LOGGER.info("Starting replication of database '{}' with configuration: {}", config.getLogicalName(), config.getConfig());
        failure.set(null);
        running = true;
        executor = Threads.newSingleThreadExecutor(config.getLogicalName(), "replication-coordinator");
        executor.submit(() -> {
            try {
                run();
            }
            catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOGGER.warn("Replication pipeline was interrupted", e);
            }
            finally {
                running = false;
            }
        });
    }

    private void run() throws InterruptedException {
        int retries = 0;
        while (running) {
            errorHandler.reset();
            lastError.set(null);
            final PostgresStreamingChangeEventSource source = new PostgresStreamingChangeEventSource(session, errorHandler, commands);
            LOGGER.info("Starting replication pipeline");
            source.execute(() -> running);
            LOGGER.info("Replication pipeline finished");

            final Throwable error = errorHandler.getProducerThrowable();
            if (error == null || !running) {
                return;
            }
            if (!errorHandler.isRetriable(error)) {
                fail(lastError.get() != null ? lastError.get() : error);
                return;
            }
            final int maxRetries = config.getMaxRetriesOnError();
            if (maxRetries >= 0 && ++retries > maxRetries) {
                LOGGER.error("The maximum number of {} retries has been attempted", maxRetries);
                fail(error);
                return;
            }
            final Duration wait = config.getRetriableRestartWait();
            LOGGER.warn("Restarting replication pipeline in {} ms after a retriable error (attempt {})", wait.toMillis(), retries);
            final Timer timer = Threads.timer(session.getClock(), wait);
            while (running && !timer.expired()) {
                Thread.sleep(Math.min(100, Math.max(1, timer.remaining().toMillis())));
            }
        }
    }

    private void fail(Throwable error) {
        LOGGER.error("Replication of database '{}' stopped after a fatal error", config.getLogicalName(), error);
        failure.set(error);
        running = false;
    }

    /**
     * Stop replicating once every queued batch is applied and the final position is stored.
     */
    public synchronized void stop() throws InterruptedException {
        running = false;
        if (executor == null) {
            return;
        }
        // Clear interrupt flag so the graceful termination is always attempted
        Thread.interrupted();
        executor.shutdown();
        if (!executor.awaitTermination(SHUTDOWN_WAIT_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
            LOGGER.warn("Coordinator didn't stop in the expected time, shutting down executor now");
            executor.shutdownNow();
            executor.awaitTermination(SHUTDOWN_WAIT_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
        }
        executor = null;
        LOGGER.info("Stopped replication of database '{}'", config.getLogicalName());
    }

    /**
     * Stop replicating and remove every trace of the replica: the destination tables, the stored state, the replication
     * slot and the publication.
     */
    public synchronized void drop() throws InterruptedException, SQLException {
        stop();
        LOGGER.info("Dropping replica of database '{}'", config.getLogicalName());
        for (TableDescriptor descriptor : session.getStateMachine().descriptors()) {
            session.getStateMachine().remove(descriptor.id());
            session.getDestination().dropTable(descriptor.destinationId());
        }
        commands.clear();
        try (PostgresConnection connection = session.getConnectionFactory().newConnection()) {
            new PublicationManager(config).drop(connection);
        }
        session.getOffsetStore().clear();
    }

    /**
     * Start replicating the table, or reload it from scratch if it is already replicated.
     */
    public void addTable(TableId tableId) {
        LOGGER.info("Requested to add table {}", tableId);
        commands.add(TableCommand.add(qualified(tableId)));
    }

    /**
     * Stop replicating the table and drop its destination table.
     */
    public void removeTable(TableId tableId) {
        LOGGER.info("Requested to remove table {}", tableId);
        commands.add(TableCommand.remove(qualified(tableId)));
    }

    private TableId qualified(TableId tableId) {
        return tableId.schema() == null ? new TableId(config.schemaName(), tableId.table()) : tableId;
    }

    public Map<TableId, TableState> tableStates() {
        return session.getStateMachine().states();
    }

    public Optional<TableDescriptor> table(TableId tableId) {
        return session.getStateMachine().get(qualified(tableId));
    }

    /**
     * @return the error that stopped replication, or empty if it is running or was stopped
     */
    public Optional<Throwable> failure() {
        return Optional.ofNullable(failure.get());
    }

    public boolean isRunning() {
        return running;
    }

    private void onTransition(TableDescriptor previous, TableDescriptor current) {
        if (current == null || current.state() != TableState.SKIPPED || (previous != null && previous.state() == TableState.SKIPPED)) {
            return;
        }
        final Destination destination = session.getDestination();
        if (destination.tableExists(current.destinationId())) {
            destination.markStale(current.destinationId(), current.skipReason());
        }
        final String reason = current.skipReason();
        if (config.schemaChangeAutoReload() && reason != null
                && (reason.startsWith(SCHEMA_CHANGED) || reason.startsWith(REPLICA_IDENTITY_CHANGED))) {
            LOGGER.info("Reloading table {} after its schema changed", current.id());
            commands.add(TableCommand.add(current.id()));
        }
    }
}
