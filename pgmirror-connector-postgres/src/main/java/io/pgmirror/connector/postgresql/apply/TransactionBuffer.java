/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgmirror.connector.postgresql.apply;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import io.pgmirror.annotation.NotThreadSafe;
import io.pgmirror.destination.Mutation;
import io.pgmirror.relational.TableId;

/**
 * Collects the row changes of the transaction being received, per table and in source order, until its commit.
 */
@NotThreadSafe
public class TransactionBuffer {

    /**
     * A converted row change waiting for the position of its commit.
     */
    public static final class BufferedChange {

        private final Mutation.Type type;
        private final List<Object> key;
        private final Object[] row;

        BufferedChange(Mutation.Type type, List<Object> key, Object[] row) {
            this.type = type;
            this.key = key;
            this.row = row;
        }

        static BufferedChange upsert(List<Object> key, Object[] row) {
            return new BufferedChange(Mutation.Type.UPSERT, key, row);
        }

        static BufferedChange delete(List<Object> key) {
            return new BufferedChange(Mutation.Type.DELETE, key, null);
        }

        Mutation toMutation(long version) {
            return type == Mutation.Type.DELETE ? Mutation.delete(key, version) : Mutation.upsert(key, row, version);
        }

        @Override
        public String toString() {
            return type + " " + key;
        }
    }

    private final Map<TableId, List<BufferedChange>> changes = new LinkedHashMap<>();
    private long transactionId = -1;

    public void begin(long transactionId) {
        if (isOpen()) {
            throw new IllegalStateException("Transaction " + this.transactionId + " was not committed before " + transactionId + " began");
        }
        this.transactionId = transactionId;
    }

    public boolean isOpen() {
        return transactionId >= 0;
    }

    public long transactionId() {
        return transactionId;
    }

    void add(TableId tableId, BufferedChange change) {
        changes.computeIfAbsent(tableId, id -> new ArrayList<>()).add(change);
    }

    /**
     * Forget the changes of a table, as it will not receive this transaction.
     */
    void discard(TableId tableId) {
        changes.remove(tableId);
    }

    /**
     * Close the transaction, handing out its changes.
     *
     * @return the changes per table in the order the tables were first changed
     */
    Map<TableId, List<BufferedChange>> commit() {
        final Map<TableId, List<BufferedChange>> committed = new LinkedHashMap<>(changes);
        clear();
        return Collections.unmodifiableMap(committed);
    }

    /**
     * Drop the open transaction without applying any of it.
     *
     * @return true if a transaction was open
     */
    public boolean abandon() {
        final boolean open = isOpen();
        clear();
        return open;
    }

    public int size() {
        int size = 0;
        for (List<BufferedChange> tableChanges : changes.values()) {
            size += tableChanges.size();
        }
        return size;
    }

    private void clear() {
        changes.clear();
        transactionId = -1;
    }
}
