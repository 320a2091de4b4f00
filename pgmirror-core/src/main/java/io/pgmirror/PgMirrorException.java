/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgmirror;

/**
 * Base of all unchecked exceptions raised by the replication engine.
 */
public class PgMirrorException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public PgMirrorException() {
        super();
    }

    public PgMirrorException(String message) {
        super(message);
    }

    public PgMirrorException(Throwable cause) {
        super(cause);
    }

    public PgMirrorException(String message, Throwable cause) {
        super(message, cause);
    }
}
