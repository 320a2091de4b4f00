/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgmirror.connector.postgresql.connection;

/**
 * A decoded logical replication message.
 */
public interface ReplicationMessage {

    /**
     * Kinds of messages carried by the stream.
     */
    enum Operation {
        BEGIN,
        COMMIT,
        RELATION,
        INSERT,
        UPDATE,
        DELETE,
        TRUNCATE,
        /**
         * A message that carries nothing the replica needs, such as type, origin or logical decoding messages.
         */
        NOOP
    }

    Operation getOperation();

    default boolean isTransactionalMessage() {
        return getOperation() == Operation.BEGIN || getOperation() == Operation.COMMIT;
    }

    default boolean isRowMessage() {
        Operation op = getOperation();
        return op == Operation.INSERT || op == Operation.UPDATE || op == Operation.DELETE;
    }
}
