/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgmirror.destination;

import io.pgmirror.PgMirrorException;

/**
 * Signals that the destination store rejected or failed to perform a write.
 */
public class DestinationException extends PgMirrorException {

    private static final long serialVersionUID = 1L;

    public DestinationException(String message) {
        super(message);
    }

    public DestinationException(String message, Throwable cause) {
        super(message, cause);
    }
}
