/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgmirror.connector.postgresql;

import io.pgmirror.PgMirrorException;

/**
 * The replica identity of a table does not let changes address individual rows.
 */
public class ReplicaIdentityAmbiguityException extends PgMirrorException {

    private static final long serialVersionUID = 1L;

    public ReplicaIdentityAmbiguityException(String message) {
        super(message);
    }
}
