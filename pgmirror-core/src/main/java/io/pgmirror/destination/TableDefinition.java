/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgmirror.destination;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.kafka.connect.data.Field;
import org.apache.kafka.connect.data.Schema;

import io.pgmirror.annotation.Immutable;
import io.pgmirror.relational.TableId;

/**
 * Describes a destination table: its row layout as a Kafka Connect struct schema and the columns forming its key.
 */
@Immutable
public final class TableDefinition {

    private final TableId id;
    private final Schema rowSchema;
    private final List<String> keyColumns;

    public TableDefinition(TableId id, Schema rowSchema, List<String> keyColumns) {
        if (rowSchema.type() != Schema.Type.STRUCT) {
            throw new IllegalArgumentException("Row schema of " + id + " must be a struct");
        }
        this.id = id;
        this.rowSchema = rowSchema;
        this.keyColumns = Collections.unmodifiableList(new ArrayList<>(keyColumns));
    }

    public TableId id() {
        return id;
    }

    public Schema rowSchema() {
        return rowSchema;
    }

    public List<String> keyColumns() {
        return keyColumns;
    }

    public List<String> columnNames() {
        List<String> names = new ArrayList<>();
        for (Field field : rowSchema.fields()) {
            names.add(field.name());
        }
        return names;
    }

    public int columnCount() {
        return rowSchema.fields().size();
    }

    @Override
    public String toString() {
        return "TableDefinition{" + id + ", columns=" + columnNames() + ", key=" + keyColumns + "}";
    }
}
