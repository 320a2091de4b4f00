/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgmirror.connector.postgresql;

import io.pgmirror.PgMirrorException;

/**
 * A column has a source type that has no destination representation.
 */
public class UnsupportedTypeException extends PgMirrorException {

    private static final long serialVersionUID = 1L;

    public UnsupportedTypeException(String message) {
        super(message);
    }
}
