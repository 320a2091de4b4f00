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

/**
 * The column values of one row, in the order of the columns of the relation they belong to.
 */
@Immutable
public final class TupleData {

    private final List<ColumnValue> values;

    public TupleData(List<ColumnValue> values) {
        this.values = Collections.unmodifiableList(new ArrayList<>(values));
    }

    public int size() {
        return values.size();
    }

    public ColumnValue get(int index) {
        return values.get(index);
    }

    public List<ColumnValue> values() {
        return values;
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
