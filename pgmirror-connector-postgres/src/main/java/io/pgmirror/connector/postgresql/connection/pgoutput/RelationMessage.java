/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgmirror.connector.postgresql.connection.pgoutput;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import io.pgmirror.annotation.Immutable;
import io.pgmirror.connector.postgresql.connection.ReplicaIdentityInfo.ReplicaIdentity;
import io.pgmirror.connector.postgresql.connection.ReplicationMessage;
import io.pgmirror.relational.TableId;

/**
 * Describes the layout of a table. The server sends it before the first row of the table in a session and again
 * whenever the layout changes.
 */
@Immutable
public final class RelationMessage implements ReplicationMessage {

    /**
     * A column of the relation.
     */
    @Immutable
    public static final class Column {
        private final boolean key;
        private final String name;
        private final int typeOid;
        private final int typeModifier;

        public Column(boolean key, String name, int typeOid, int typeModifier) {
            this.key = key;
            this.name = name;
            this.typeOid = typeOid;
            this.typeModifier = typeModifier;
        }

        /**
         * @return whether the column is part of the replica identity
         */
        public boolean isKey() {
            return key;
        }

        public String name() {
            return name;
        }

        public int typeOid() {
            return typeOid;
        }

        public int typeModifier() {
            return typeModifier;
        }

        @Override
        public String toString() {
            return name + ":" + typeOid + "(" + typeModifier + ")" + (key ? "*" : "");
        }
    }

    private final int relationId;
    private final TableId tableId;
    private final ReplicaIdentity replicaIdentity;
    private final List<Column> columns;

    public RelationMessage(int relationId, TableId tableId, ReplicaIdentity replicaIdentity, List<Column> columns) {
        this.relationId = relationId;
        this.tableId = tableId;
        this.replicaIdentity = replicaIdentity;
        this.columns = Collections.unmodifiableList(new ArrayList<>(columns));
    }

    @Override
    public Operation getOperation() {
        return Operation.RELATION;
    }

    public int getRelationId() {
        return relationId;
    }

    public TableId getTableId() {
        return tableId;
    }

    public ReplicaIdentity getReplicaIdentity() {
        return replicaIdentity;
    }

    public List<Column> getColumns() {
        return columns;
    }

    @Override
    public String toString() {
        return "RELATION{" + relationId + " " + tableId + " " + replicaIdentity + " " + columns + "}";
    }
}
