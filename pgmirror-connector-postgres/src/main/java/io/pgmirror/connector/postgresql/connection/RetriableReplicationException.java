/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgmirror.connector.postgresql.connection;

import io.pgmirror.PgMirrorException;

/**
 * A transient failure after which replication can resume from the last confirmed position.
 */
public class RetriableReplicationException extends PgMirrorException {

    private static final long serialVersionUID = 1L;

    public RetriableReplicationException(String message) {
        super(message);
    }

    public RetriableReplicationException(String message, Throwable cause) {
        super(message, cause);
    }
}
