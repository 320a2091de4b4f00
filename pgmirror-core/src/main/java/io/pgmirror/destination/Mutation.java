/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgmirror.destination;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import io.pgmirror.annotation.Immutable;

/**
 * A single row level write against a destination table.
 * <p>
 * Every mutation carries a version, the source log position of the change. A destination never lets a mutation
 * overwrite state written by a mutation with a higher version, which makes re-applying a batch harmless.
 */
@Immutable
public final class Mutation {

    public enum Type {
        /**
         * Row read by an initial load.
         */
        INSERT,
        /**
         * Row inserted or updated by the replication stream.
         */
        UPSERT,
        DELETE
    }

    public static Mutation insert(List<Object> key, Object[] row, long version) {
        return new Mutation(Type.INSERT, key, Objects.requireNonNull(row), version);
    }

    public static Mutation upsert(List<Object> key, Object[] row, long version) {
        return new Mutation(Type.UPSERT, key, Objects.requireNonNull(row), version);
    }

    public static Mutation delete(List<Object> key, long version) {
        return new Mutation(Type.DELETE, key, null, version);
    }

    private final Type type;
    private final List<Object> key;
    private final Object[] row;
    private final long version;

    private Mutation(Type type, List<Object> key, Object[] row, long version) {
        this.type = type;
        this.key = Collections.unmodifiableList(Objects.requireNonNull(key));
        this.row = row;
        this.version = version;
    }

    public Type type() {
        return type;
    }

    public List<Object> key() {
        return key;
    }

    /**
     * @return a copy of the row values, or null for deletes
     */
    public Object[] row() {
        return row == null ? null : row.clone();
    }

    public long version() {
        return version;
    }

    @Override
    public String toString() {
        return type + " " + key + (row != null ? " " + Arrays.toString(row) : "") + " @" + version;
    }
}
