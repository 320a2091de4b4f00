/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgmirror.connector.postgresql.offset;

/**
 * The stored replication state exists but cannot be trusted. Replication cannot resume from it.
 */
public class OffsetStoreCorruptedException extends OffsetStoreException {

    private static final long serialVersionUID = 1L;

    public OffsetStoreCorruptedException(String message) {
        super(message);
    }

    public OffsetStoreCorruptedException(String message, Throwable cause) {
        super(message, cause);
    }
}
