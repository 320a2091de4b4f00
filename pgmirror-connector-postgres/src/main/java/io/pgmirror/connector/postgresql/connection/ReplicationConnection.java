/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgmirror.connector.postgresql.connection;

import java.sql.SQLException;
import java.util.Optional;

/**
 * A connection in replication mode to the source database, bound to one logical replication slot.
 */
public interface ReplicationConnection extends AutoCloseable {

    /**
     * Create the permanent replication slot of this connection, exporting a snapshot.
     *
     * @return the slot position and snapshot, or empty if a slot of the same name already exists
     * @throws SQLException if the slot cannot be created
     */
    Optional<SlotCreationResult> createReplicationSlot() throws SQLException;

    /**
     * Create a slot that lives as long as this connection and export a snapshot from it.
     *
     * @param slotName the name of the slot; must be unique among all slots
     * @return the slot position and snapshot; never null
     * @throws SQLException if the slot cannot be created
     */
    SlotCreationResult createTemporarySlot(String slotName) throws SQLException;

    /**
     * Start streaming from the permanent slot. Transactions that end at or before the given position, or at or before
     * the slot's confirmed position, are not sent.
     *
     * @param from the position to stream from
     * @return the stream; never null
     * @throws SQLException if streaming cannot be started
     */
    ReplicationStream startStreaming(Lsn from) throws SQLException;

    String slotName();

    @Override
    void close() throws SQLException;
}
