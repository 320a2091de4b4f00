/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgmirror.connector.postgresql.connection.pgoutput;

import io.pgmirror.annotation.Immutable;
import io.pgmirror.connector.postgresql.connection.ReplicationMessage;

/**
 * A decoded message that the replica has no use for.
 */
@Immutable
public final class NoopMessage implements ReplicationMessage {

    private final char type;

    public NoopMessage(char type) {
        this.type = type;
    }

    @Override
    public Operation getOperation() {
        return Operation.NOOP;
    }

    public char getType() {
        return type;
    }

    @Override
    public String toString() {
        return "NOOP{" + type + "}";
    }
}
