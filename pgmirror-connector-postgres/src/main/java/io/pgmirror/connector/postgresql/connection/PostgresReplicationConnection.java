/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgmirror.connector.postgresql.connection;

import java.nio.ByteBuffer;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

import org.postgresql.PGConnection;
import org.postgresql.replication.PGReplicationStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.pgmirror.connector.postgresql.PostgresConnectorConfig;

/**
 * {@link ReplicationConnection} over a pgjdbc connection opened with {@code replication=database}, streaming with the
 * {@code pgoutput} plugin in protocol version 1.
 */
public class PostgresReplicationConnection implements ReplicationConnection {

    private static final Logger LOGGER = LoggerFactory.getLogger(PostgresReplicationConnection.class);

    private static final String DUPLICATE_OBJECT = "42710";

    private final Connection connection;
    private final String slotName;
    private final String publicationName;
    private final Duration statusUpdateInterval;

    public PostgresReplicationConnection(Connection connection, String slotName, String publicationName, Duration statusUpdateInterval) {
        this.connection = connection;
        this.slotName = slotName;
        this.publicationName = publicationName;
        this.statusUpdateInterval = statusUpdateInterval;
    }

    @Override
    public Optional<SlotCreationResult> createReplicationSlot() throws SQLException {
        try {
            final SlotCreationResult result = createSlot("CREATE_REPLICATION_SLOT " + JdbcPostgresConnection.quote(slotName) + " LOGICAL "
                    + PostgresConnectorConfig.PLUGIN_NAME + " EXPORT_SNAPSHOT");
            LOGGER.info("Created replication slot '{}' at {}", slotName, result.consistentPoint());
            return Optional.of(result);
        }
        catch (SQLException e) {
            if (DUPLICATE_OBJECT.equals(e.getSQLState())) {
                LOGGER.debug("Replication slot '{}' already exists", slotName);
                return Optional.empty();
            }
            throw e;
        }
    }

    @Override
    public SlotCreationResult createTemporarySlot(String name) throws SQLException {
        final SlotCreationResult result = createSlot("CREATE_REPLICATION_SLOT " + JdbcPostgresConnection.quote(name) + " TEMPORARY LOGICAL "
                + PostgresConnectorConfig.PLUGIN_NAME + " EXPORT_SNAPSHOT");
        LOGGER.debug("Created temporary replication slot '{}' at {}", name, result.consistentPoint());
        return result;
    }

    private SlotCreationResult createSlot(String command) throws SQLException {
        try (Statement statement = connection.createStatement();
                ResultSet rs = statement.executeQuery(command)) {
            if (!rs.next()) {
                throw new SQLException("No result returned by '" + command + "'");
            }
            return new SlotCreationResult(rs.getString("slot_name"), Lsn.valueOf(rs.getString("consistent_point")),
                    rs.getString("snapshot_name"), rs.getString("output_plugin"));
        }
    }

    @Override
    public ReplicationStream startStreaming(Lsn from) throws SQLException {
        LOGGER.debug("Starting streaming from slot '{}' at {}", slotName, from);
        final PGReplicationStream stream = connection.unwrap(PGConnection.class)
                .getReplicationAPI()
                .replicationStream()
                .logical()
                .withSlotName(slotName)
                .withSlotOption("proto_version", 1)
                .withSlotOption("publication_names", publicationName)
                .withStartPosition(from.asLogSequenceNumber())
                .withStatusInterval((int) statusUpdateInterval.toMillis(), TimeUnit.MILLISECONDS)
                .start();
        return new JdbcReplicationStream(stream, from);
    }

    @Override
    public String slotName() {
        return slotName;
    }

    @Override
    public void close() throws SQLException {
        connection.close();
    }

    private static class JdbcReplicationStream implements ReplicationStream {

        private final PGReplicationStream stream;
        private final Lsn startLsn;

        JdbcReplicationStream(PGReplicationStream stream, Lsn startLsn) {
            this.stream = stream;
            this.startLsn = startLsn;
        }

        @Override
        public ByteBuffer readPending() throws SQLException {
            return stream.readPending();
        }

        @Override
        public void flushLsn(Lsn lsn) throws SQLException {
            if (!lsn.isValid()) {
                return;
            }
            stream.setAppliedLSN(lsn.asLogSequenceNumber());
            stream.setFlushedLSN(lsn.asLogSequenceNumber());
            stream.forceUpdateStatus();
        }

        @Override
        public Lsn lastReceivedLsn() {
            return Lsn.valueOf(stream.getLastReceiveLSN());
        }

        @Override
        public Lsn startLsn() {
            return startLsn;
        }

        @Override
        public void close() throws SQLException {
            if (!stream.isClosed()) {
                stream.close();
            }
        }
    }
}
