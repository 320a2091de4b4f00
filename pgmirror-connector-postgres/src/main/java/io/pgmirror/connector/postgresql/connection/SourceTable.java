/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgmirror.connector.postgresql.connection;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import io.pgmirror.annotation.Immutable;
import io.pgmirror.relational.Column;
import io.pgmirror.relational.TableId;

/**
 * The catalog description of a source table: its columns, its replica identity setting and the columns of the
 * keys the identity may be derived from.
 */
@Immutable
public final class SourceTable {

    private final TableId id;
    private final int relationId;
    private final List<Column> columns;
    private final ReplicaIdentityInfo replicaIdentity;
    private final List<String> primaryKeyColumns;
    private final List<String> identityIndexColumns;

    public SourceTable(TableId id, int relationId, List<Column> columns, ReplicaIdentityInfo replicaIdentity,
                       List<String> primaryKeyColumns, List<String> identityIndexColumns) {
        this.id = id;
        this.relationId = relationId;
        this.columns = Collections.unmodifiableList(new ArrayList<>(columns));
        this.replicaIdentity = replicaIdentity;
        this.primaryKeyColumns = Collections.unmodifiableList(new ArrayList<>(primaryKeyColumns));
        this.identityIndexColumns = Collections.unmodifiableList(new ArrayList<>(identityIndexColumns));
    }

    public TableId id() {
        return id;
    }

    /**
     * @return the oid of the table in {@code pg_class}
     */
    public int relationId() {
        return relationId;
    }

    public List<Column> columns() {
        return columns;
    }

    public ReplicaIdentityInfo replicaIdentity() {
        return replicaIdentity;
    }

    public List<String> primaryKeyColumns() {
        return primaryKeyColumns;
    }

    /**
     * @return the columns of the index designated with {@code REPLICA IDENTITY USING INDEX}, empty if there is none
     */
    public List<String> identityIndexColumns() {
        return identityIndexColumns;
    }

    @Override
    public String toString() {
        return "SourceTable{" + id + ", relid=" + relationId + ", columns=" + columns + ", identity=" + replicaIdentity
                + ", pk=" + primaryKeyColumns + "}";
    }
}
