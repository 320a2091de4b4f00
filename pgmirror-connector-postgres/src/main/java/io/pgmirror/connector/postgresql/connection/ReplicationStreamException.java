/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgmirror.connector.postgresql.connection;

import io.pgmirror.PgMirrorException;

/**
 * The replication stream carried data that cannot be decoded or that violates the protocol.
 * Such a stream is never retried event by event; the session is restarted from the last confirmed position.
 */
public class ReplicationStreamException extends PgMirrorException {

    private static final long serialVersionUID = 1L;

    public ReplicationStreamException(String message) {
        super(message);
    }

    public ReplicationStreamException(String message, Throwable cause) {
        super(message, cause);
    }
}
