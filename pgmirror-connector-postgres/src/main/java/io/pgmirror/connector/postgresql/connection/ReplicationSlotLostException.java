/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgmirror.connector.postgresql.connection;

import io.pgmirror.PgMirrorException;

/**
 * The replication slot that the stored position refers to no longer exists, so changes may have been lost.
 */
public class ReplicationSlotLostException extends PgMirrorException {

    private static final long serialVersionUID = 1L;

    public ReplicationSlotLostException(String message) {
        super(message);
    }
}
