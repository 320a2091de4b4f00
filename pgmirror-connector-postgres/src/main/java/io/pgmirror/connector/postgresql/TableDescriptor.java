/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgmirror.connector.postgresql;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import io.pgmirror.annotation.Immutable;
import io.pgmirror.connector.postgresql.connection.Lsn;
import io.pgmirror.connector.postgresql.connection.ReplicaIdentityInfo;
import io.pgmirror.relational.Column;
import io.pgmirror.relational.TableId;
import io.pgmirror.relational.ValueConverter;

/**
 * Everything known about one replicated table at a point in time. Descriptors are immutable; a change of the table's
 * state produces a new descriptor through {@link TableSyncStateMachine}.
 * <p>
 * The generation distinguishes successive additions of the same table, so that work started for a table that was
 * since removed or re-added can be recognized and discarded.
 */
@Immutable
public final class TableDescriptor {

    private final TableId id;
    private final TableId destinationId;
    private final long generation;
    private final int relationId;
    private final List<Column> columns;
    private final ReplicaIdentityInfo replicaIdentity;
    private final List<Integer> identityColumns;
    private final List<ValueConverter> converters;
    private final TableState state;
    private final String skipReason;
    private final Lsn appliedLsn;

    private TableDescriptor(Builder builder) {
        this.id = Objects.requireNonNull(builder.id);
        this.destinationId = builder.destinationId != null ? builder.destinationId : builder.id;
        this.generation = builder.generation;
        this.relationId = builder.relationId;
        this.columns = Collections.unmodifiableList(new ArrayList<>(builder.columns));
        this.replicaIdentity = builder.replicaIdentity;
        this.identityColumns = Collections.unmodifiableList(new ArrayList<>(builder.identityColumns));
        this.converters = Collections.unmodifiableList(new ArrayList<>(builder.converters));
        this.state = Objects.requireNonNull(builder.state);
        this.skipReason = builder.skipReason;
        this.appliedLsn = builder.appliedLsn;
    }

    /**
     * @return a descriptor of a table that was just added
     */
    public static TableDescriptor notLoaded(TableId id, long generation) {
        return new Builder(id).generation(generation).state(TableState.NOT_LOADED).build();
    }

    public static Builder builder(TableId id) {
        return new Builder(id);
    }

    public Builder edit() {
        return new Builder(id)
                .destinationId(destinationId)
                .generation(generation)
                .relationId(relationId)
                .columns(columns)
                .replicaIdentity(replicaIdentity)
                .identityColumns(identityColumns)
                .converters(converters)
                .state(state)
                .skipReason(skipReason)
                .appliedLsn(appliedLsn);
    }

    public TableId id() {
        return id;
    }

    public TableId destinationId() {
        return destinationId;
    }

    public long generation() {
        return generation;
    }

    /**
     * @return the oid of the source table, or 0 if not known yet
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

    /**
     * @return the positions of the columns that identify a row
     */
    public List<Integer> identityColumns() {
        return identityColumns;
    }

    public List<Column> identityColumnDefinitions() {
        final List<Column> result = new ArrayList<>(identityColumns.size());
        for (int position : identityColumns) {
            result.add(columns.get(position));
        }
        return result;
    }

    /**
     * @return one converter per column, or an empty list while the table is not loaded
     */
    public List<ValueConverter> converters() {
        return converters;
    }

    public TableState state() {
        return state;
    }

    public String skipReason() {
        return skipReason;
    }

    /**
     * @return the end position of the last transaction applied to the table, or of the snapshot it was loaded from
     */
    public Lsn appliedLsn() {
        return appliedLsn;
    }

    /**
     * @return a digest of the columns and the identity, which changes with any change of the table's layout
     */
    public String fingerprint() {
        return fingerprint(columns, identityColumns);
    }

    public static String fingerprint(List<Column> columns, List<Integer> identityColumns) {
        final StringBuilder sb = new StringBuilder();
        for (Column column : columns) {
            sb.append(column.name()).append(':').append(column.typeOid()).append(':').append(column.typeModifier()).append(';');
        }
        sb.append(identityColumns);
        return String.format("%08x", sb.toString().hashCode());
    }

    @Override
    public String toString() {
        return "TableDescriptor{" + id + ", state=" + state + (skipReason != null ? " (" + skipReason + ")" : "")
                + ", generation=" + generation + ", relid=" + relationId + ", applied=" + appliedLsn + ", columns=" + columns + "}";
    }

    /**
     * A builder of descriptors.
     */
    public static final class Builder {
        private final TableId id;
        private TableId destinationId;
        private long generation;
        private int relationId;
        private List<Column> columns = Collections.emptyList();
        private ReplicaIdentityInfo replicaIdentity;
        private List<Integer> identityColumns = Collections.emptyList();
        private List<ValueConverter> converters = Collections.emptyList();
        private TableState state = TableState.NOT_LOADED;
        private String skipReason;
        private Lsn appliedLsn = Lsn.INVALID;

        private Builder(TableId id) {
            this.id = id;
        }

        public Builder destinationId(TableId destinationId) {
            this.destinationId = destinationId;
            return this;
        }

        public Builder generation(long generation) {
            this.generation = generation;
            return this;
        }

        public Builder relationId(int relationId) {
            this.relationId = relationId;
            return this;
        }

        public Builder columns(List<Column> columns) {
            this.columns = columns;
            return this;
        }

        public Builder replicaIdentity(ReplicaIdentityInfo replicaIdentity) {
            this.replicaIdentity = replicaIdentity;
            return this;
        }

        public Builder identityColumns(List<Integer> identityColumns) {
            this.identityColumns = identityColumns;
            return this;
        }

        public Builder converters(List<ValueConverter> converters) {
            this.converters = converters;
            return this;
        }

        public Builder state(TableState state) {
            this.state = state;
            return this;
        }

        public Builder skipReason(String skipReason) {
            this.skipReason = skipReason;
            return this;
        }

        public Builder appliedLsn(Lsn appliedLsn) {
            this.appliedLsn = appliedLsn;
            return this;
        }

        public TableDescriptor build() {
            return new TableDescriptor(this);
        }
    }
}
