/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgmirror.connector.postgresql;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import io.pgmirror.connector.postgresql.connection.pgoutput.RelationMessage;
import io.pgmirror.relational.Column;

/**
 * Compares the layout the replication stream announces for a table with the layout the table was loaded with.
 * <p>
 * Any difference in the columns, their order, their types or type modifiers is incompatible, as the rows that follow
 * can no longer be mapped onto the destination table. So is a new relation id, which means the table was dropped
 * and created again. A change of the replica identity is tolerated only while rows stay identified by the same
 * columns.
 */
public class SchemaDriftDetector {

    private final ReplicaIdentityResolver identityResolver;

    public SchemaDriftDetector(ReplicaIdentityResolver identityResolver) {
        this.identityResolver = identityResolver;
    }

    /**
     * @param stored the descriptor of the streaming table
     * @param relation the relation message received for it
     * @return a description of the incompatible change, or empty if the relation matches the table
     */
    public Optional<String> detect(TableDescriptor stored, RelationMessage relation) {
        if (stored.relationId() != 0 && stored.relationId() != relation.getRelationId()) {
            return Optional.of("schema changed: relation id changed from " + stored.relationId() + " to " + relation.getRelationId());
        }
        final List<Column> columns = stored.columns();
        final List<RelationMessage.Column> received = relation.getColumns();
        if (columns.size() != received.size()) {
            return Optional.of("schema changed: column count changed from " + columns.size() + " to " + received.size());
        }
        for (int i = 0; i < columns.size(); i++) {
            final Column column = columns.get(i);
            final RelationMessage.Column other = received.get(i);
            if (!column.name().equals(other.name())) {
                return Optional.of("schema changed: column " + (i + 1) + " changed from '" + column.name() + "' to '" + other.name() + "'");
            }
            if (column.typeOid() != other.typeOid()) {
                return Optional.of("schema changed: type of column '" + column.name() + "' changed from oid " + column.typeOid()
                        + " to oid " + other.typeOid());
            }
            if (column.typeModifier() != other.typeModifier()) {
                return Optional.of("schema changed: type modifier of column '" + column.name() + "' changed from " + column.typeModifier()
                        + " to " + other.typeModifier());
            }
        }
        final List<Integer> identity;
        try {
            identity = identityResolver.resolve(relation);
        }
        catch (ReplicaIdentityAmbiguityException e) {
            return Optional.of("replica identity changed: " + e.getMessage());
        }
        // key flags come in column order, a primary key in index order
        final List<Column> newIdentity = inColumnOrder(columns, identity);
        final List<Column> storedIdentity = inColumnOrder(columns, stored.identityColumns());
        if (!ReplicaIdentityResolver.isPureWidening(storedIdentity, newIdentity)) {
            return Optional.of("replica identity changed from " + names(storedIdentity) + " to " + names(newIdentity));
        }
        return Optional.empty();
    }

    private static List<Column> inColumnOrder(List<Column> columns, List<Integer> positions) {
        final List<Integer> sorted = new ArrayList<>(positions);
        Collections.sort(sorted);
        final List<Column> result = new ArrayList<>(sorted.size());
        for (int position : sorted) {
            result.add(columns.get(position));
        }
        return result;
    }

    private static List<String> names(List<Column> columns) {
        final List<String> names = new ArrayList<>(columns.size());
        columns.forEach(c -> names.add(c.name()));
        return names;
    }
}
