/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgmirror.connector.postgresql;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import io.pgmirror.connector.postgresql.connection.ReplicaIdentityInfo.ReplicaIdentity;
import io.pgmirror.connector.postgresql.connection.SourceTable;
import io.pgmirror.connector.postgresql.connection.pgoutput.RelationMessage;
import io.pgmirror.destination.UnchangedToastedPlaceholder;
import io.pgmirror.relational.Column;
import io.pgmirror.relational.TableId;

/**
 * Determines which columns identify a row of a table.
 * <p>
 * An index designated with {@code REPLICA IDENTITY USING INDEX} takes precedence, then the primary key, then the
 * full row. A table with {@code REPLICA IDENTITY NOTHING} cannot be replicated.
 */
public class ReplicaIdentityResolver {

    /**
     * Resolve the identity from the catalog description of the table.
     *
     * @return the positions of the identity columns within the table's columns, in identity order
     * @throws ReplicaIdentityAmbiguityException if rows of the table cannot be identified
     */
    public List<Integer> resolve(SourceTable table) {
        final ReplicaIdentity identity = table.replicaIdentity().getReplicaIdentity();
        switch (identity) {
            case NOTHING:
                throw ambiguous(table.id(), "its replica identity is NOTHING");
            case INDEX:
                if (table.identityIndexColumns().isEmpty()) {
                    throw ambiguous(table.id(), "its replica identity index " + table.replicaIdentity().getIndexName() + " does not exist");
                }
                return positionsOf(table, table.identityIndexColumns());
            case DEFAULT:
                if (!table.primaryKeyColumns().isEmpty()) {
                    return positionsOf(table, table.primaryKeyColumns());
                }
                return allColumns(table.columns().size());
            case FULL:
            default:
                return allColumns(table.columns().size());
        }
    }

    /**
     * Resolve the identity from a relation message, whose key flags mark the identity columns.
     *
     * @return the positions of the identity columns within the relation's columns
     * @throws ReplicaIdentityAmbiguityException if rows of the table cannot be identified
     */
    public List<Integer> resolve(RelationMessage relation) {
        if (relation.getReplicaIdentity() == ReplicaIdentity.NOTHING) {
            throw ambiguous(relation.getTableId(), "its replica identity is NOTHING");
        }
        final List<Integer> keys = new ArrayList<>();
        final List<RelationMessage.Column> columns = relation.getColumns();
        for (int i = 0; i < columns.size(); i++) {
            if (columns.get(i).isKey()) {
                keys.add(i);
            }
        }
        if (!keys.isEmpty()) {
            return Collections.unmodifiableList(keys);
        }
        if (relation.getReplicaIdentity() == ReplicaIdentity.INDEX) {
            throw ambiguous(relation.getTableId(), "its replica identity index has no columns");
        }
        return allColumns(columns.size());
    }

    /**
     * Build the identity key of a row.
     *
     * @param row the row values
     * @param identity the identity column positions
     * @return the key; never null
     * @throws ValueConversionException if an identity value is not part of the row
     */
    public static List<Object> extractIdentity(Object[] row, List<Integer> identity) {
        final List<Object> key = new ArrayList<>(identity.size());
        for (int position : identity) {
            final Object value = row[position];
            if (value instanceof UnchangedToastedPlaceholder) {
                throw new ValueConversionException("Identity column at position " + position + " has no value");
            }
            key.add(value);
        }
        return key;
    }

    /**
     * An identity change that keeps the identity columns, by name and type, does not affect how rows are addressed.
     *
     * @param before the identity columns before the change
     * @param after the identity columns after the change
     * @return true if both identify rows by the same columns
     */
    public static boolean isPureWidening(List<Column> before, List<Column> after) {
        if (before.size() != after.size()) {
            return false;
        }
        for (int i = 0; i < before.size(); i++) {
            if (!before.get(i).name().equals(after.get(i).name()) || before.get(i).typeOid() != after.get(i).typeOid()) {
                return false;
            }
        }
        return true;
    }

    private static List<Integer> positionsOf(SourceTable table, List<String> columnNames) {
        final List<Integer> positions = new ArrayList<>(columnNames.size());
        for (String name : columnNames) {
            int position = -1;
            for (int i = 0; i < table.columns().size(); i++) {
                if (table.columns().get(i).name().equals(name)) {
                    position = i;
                    break;
                }
            }
            if (position < 0) {
                throw ambiguous(table.id(), "its identity column " + name + " is not a column of the table");
            }
            positions.add(position);
        }
        return Collections.unmodifiableList(positions);
    }

    private static List<Integer> allColumns(int count) {
        final List<Integer> positions = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            positions.add(i);
        }
        return Collections.unmodifiableList(positions);
    }

    private static ReplicaIdentityAmbiguityException ambiguous(TableId tableId, String reason) {
        return new ReplicaIdentityAmbiguityException("Rows of table " + tableId + " cannot be identified because " + reason);
    }
}
