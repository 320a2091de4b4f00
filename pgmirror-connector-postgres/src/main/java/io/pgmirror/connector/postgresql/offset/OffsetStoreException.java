/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgmirror.connector.postgresql.offset;

import io.pgmirror.PgMirrorException;

/**
 * The replication state could not be read or written.
 */
public class OffsetStoreException extends PgMirrorException {

    private static final long serialVersionUID = 1L;

    public OffsetStoreException(String message) {
        super(message);
    }

    public OffsetStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
