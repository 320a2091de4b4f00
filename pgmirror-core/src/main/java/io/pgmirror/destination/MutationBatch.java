/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgmirror.destination;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import io.pgmirror.annotation.Immutable;
import io.pgmirror.relational.TableId;

/**
 * The ordered mutations of one table produced by one or more fully received source transactions.
 * The batch becomes durable at {@link #position()}, the log position of its last transaction.
 */
@Immutable
public final class MutationBatch {

    private final TableId tableId;
    private final List<Mutation> mutations;
    private final long position;

    public MutationBatch(TableId tableId, List<Mutation> mutations, long position) {
        this.tableId = tableId;
        this.mutations = Collections.unmodifiableList(new ArrayList<>(mutations));
        this.position = position;
    }

    public TableId tableId() {
        return tableId;
    }

    public List<Mutation> mutations() {
        return mutations;
    }

    public long position() {
        return position;
    }

    public int size() {
        return mutations.size();
    }

    public boolean isEmpty() {
        return mutations.isEmpty();
    }

    @Override
    public String toString() {
        return "MutationBatch{table=" + tableId + ", size=" + mutations.size() + ", position=" + position + "}";
    }
}
