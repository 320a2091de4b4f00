/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgmirror.connector.postgresql.connection.pgoutput;

import io.pgmirror.annotation.Immutable;
import io.pgmirror.connector.postgresql.connection.ReplicationMessage;

/**
 * An inserted, updated or deleted row.
 * <p>
 * Inserts carry only a new tuple. Deletes carry only an old tuple. Updates carry a new tuple and, when the
 * identity changed or the table uses full identity, an old tuple.
 */
@Immutable
public final class RowMessage implements ReplicationMessage {

    private final Operation operation;
    private final int relationId;
    private final TupleData oldTuple;
    private final boolean oldTupleIsKeyOnly;
    private final TupleData newTuple;

    private RowMessage(Operation operation, int relationId, TupleData oldTuple, boolean oldTupleIsKeyOnly, TupleData newTuple) {
        this.operation = operation;
        this.relationId = relationId;
        this.oldTuple = oldTuple;
        this.oldTupleIsKeyOnly = oldTupleIsKeyOnly;
        this.newTuple = newTuple;
    }

    public static RowMessage insert(int relationId, TupleData newTuple) {
        return new RowMessage(Operation.INSERT, relationId, null, false, newTuple);
    }

    public static RowMessage update(int relationId, TupleData oldTuple, boolean oldTupleIsKeyOnly, TupleData newTuple) {
        return new RowMessage(Operation.UPDATE, relationId, oldTuple, oldTupleIsKeyOnly, newTuple);
    }

    public static RowMessage delete(int relationId, TupleData oldTuple, boolean oldTupleIsKeyOnly) {
        return new RowMessage(Operation.DELETE, relationId, oldTuple, oldTupleIsKeyOnly, null);
    }

    @Override
    public Operation getOperation() {
        return operation;
    }

    public int getRelationId() {
        return relationId;
    }

    /**
     * @return the old row, or null when the server did not send one
     */
    public TupleData getOldTuple() {
        return oldTuple;
    }

    /**
     * @return true when the old tuple only carries the identity columns and all other columns are null
     */
    public boolean isOldTupleKeyOnly() {
        return oldTupleIsKeyOnly;
    }

    public TupleData getNewTuple() {
        return newTuple;
    }

    @Override
    public String toString() {
        return operation + "{relation=" + relationId + ", old=" + oldTuple + ", new=" + newTuple + "}";
    }
}
