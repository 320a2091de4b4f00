/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgmirror.connector.postgresql;

import io.pgmirror.annotation.Immutable;
import io.pgmirror.relational.TableId;

/**
 * A change of the set of replicated tables, requested while replication is running and carried out by the pipeline.
 */
@Immutable
public final class TableCommand {

    public enum Type {
        /**
         * Start replicating the table, or reload it from scratch if it is already replicated.
         */
        ADD,
        /**
         * Stop replicating the table and drop its destination table.
         */
        REMOVE
    }

    public static TableCommand add(TableId tableId) {
        return new TableCommand(Type.ADD, tableId);
    }

    public static TableCommand remove(TableId tableId) {
        return new TableCommand(Type.REMOVE, tableId);
    }

    private final Type type;
    private final TableId tableId;

    private TableCommand(Type type, TableId tableId) {
        this.type = type;
        this.tableId = tableId;
    }

    public Type type() {
        return type;
    }

    public TableId tableId() {
        return tableId;
    }

    @Override
    public String toString() {
        return type + " " + tableId;
    }
}
