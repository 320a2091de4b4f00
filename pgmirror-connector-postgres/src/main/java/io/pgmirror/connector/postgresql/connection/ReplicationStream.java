/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgmirror.connector.postgresql.connection;

import java.nio.ByteBuffer;
import java.sql.SQLException;

/**
 * A stream of raw logical decoding messages from a replication slot.
 */
public interface ReplicationStream extends AutoCloseable {

    /**
     * Read the next message if one is available, without blocking.
     *
     * @return the message positioned at its type byte, or null if none is pending
     * @throws SQLException if anything fails
     */
    ByteBuffer readPending() throws SQLException;

    /**
     * Report to the server that all changes up to and including the given position are durably applied, so that the
     * slot may release the WAL before it.
     *
     * @param lsn the position; may not be null
     * @throws SQLException if the status update cannot be sent
     */
    void flushLsn(Lsn lsn) throws SQLException;

    /**
     * @return the position of the last message received, or {@link Lsn#INVALID} if none
     */
    Lsn lastReceivedLsn();

    /**
     * @return the position the stream was started from
     */
    Lsn startLsn();

    @Override
    void close() throws SQLException;
}
