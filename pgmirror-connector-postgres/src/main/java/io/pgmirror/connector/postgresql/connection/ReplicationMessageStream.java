/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgmirror.connector.postgresql.connection;

import java.nio.ByteBuffer;
import java.sql.SQLException;

import io.pgmirror.annotation.NotThreadSafe;
import io.pgmirror.connector.postgresql.connection.pgoutput.PgOutputMessageDecoder;

/**
 * The decoded messages of a {@link ReplicationStream}, in stream order. Messages are decoded only when read.
 * A stream cannot be rewound; to read again from an earlier position a new stream must be started.
 */
@NotThreadSafe
public class ReplicationMessageStream implements AutoCloseable {

    private final ReplicationStream stream;
    private final PgOutputMessageDecoder decoder;

    public ReplicationMessageStream(ReplicationStream stream, PgOutputMessageDecoder decoder) {
        this.stream = stream;
        this.decoder = decoder;
    }

    /**
     * @return the next message, or null if none is pending
     * @throws ReplicationStreamException if the pending message cannot be decoded
     */
    public ReplicationMessage next() throws SQLException {
        final ByteBuffer buffer = stream.readPending();
        if (buffer == null) {
            return null;
        }
        return decoder.decode(buffer);
    }

    public void flushLsn(Lsn lsn) throws SQLException {
        stream.flushLsn(lsn);
    }

    public Lsn lastReceivedLsn() {
        return stream.lastReceivedLsn();
    }

    public Lsn startLsn() {
        return stream.startLsn();
    }

    @Override
    public void close() throws SQLException {
        stream.close();
    }
}
