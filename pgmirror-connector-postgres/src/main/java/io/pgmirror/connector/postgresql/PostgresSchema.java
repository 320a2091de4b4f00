/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgmirror.connector.postgresql;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

import org.apache.kafka.connect.data.SchemaBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.pgmirror.connector.postgresql.TypeRegistry.TypeLoader;
import io.pgmirror.connector.postgresql.connection.Lsn;
import io.pgmirror.connector.postgresql.connection.SourceTable;
import io.pgmirror.destination.TableDefinition;
import io.pgmirror.relational.Column;
import io.pgmirror.relational.ValueConverter;

/**
 * Derives the replication view of tables from their catalog description: the row identity, the per-column value
 * converters and the layout of the destination table.
 */
public class PostgresSchema {

    private static final Logger LOGGER = LoggerFactory.getLogger(PostgresSchema.class);

    private final TypeRegistry typeRegistry;
    private final PostgresValueConverter valueConverter;
    private final ReplicaIdentityResolver identityResolver;

    public PostgresSchema(TypeRegistry typeRegistry, ReplicaIdentityResolver identityResolver) {
        this.typeRegistry = typeRegistry;
        this.valueConverter = new PostgresValueConverter(typeRegistry);
        this.identityResolver = identityResolver;
    }

    public TypeRegistry getTypeRegistry() {
        return typeRegistry;
    }

    public ReplicaIdentityResolver getIdentityResolver() {
        return identityResolver;
    }

    /**
     * Make sure the types of all columns are known, reading the ones that are not.
     */
    public void resolveTypes(List<Column> columns, TypeLoader loader) throws SQLException {
        for (Column column : columns) {
            typeRegistry.resolve(column.typeOid(), loader);
        }
    }

    /**
     * Describe a loaded table.
     *
     * @param base the descriptor of the table being loaded
     * @param table the catalog description of the table
     * @param appliedLsn the position the table's data corresponds to
     * @return the descriptor, in the state of {@code base}
     * @throws UnsupportedTypeException if a column cannot be replicated
     * @throws ReplicaIdentityAmbiguityException if rows of the table cannot be identified
     */
    public TableDescriptor describe(TableDescriptor base, SourceTable table, Lsn appliedLsn) {
        final List<Integer> identity = identityResolver.resolve(table);
        final TableDescriptor descriptor = base.edit()
                .relationId(table.relationId())
                .columns(table.columns())
                .replicaIdentity(table.replicaIdentity())
                .identityColumns(identity)
                .converters(converters(table.columns()))
                .appliedLsn(appliedLsn)
                .build();
        LOGGER.debug("Described {} with identity {}", descriptor, identity);
        return descriptor;
    }

    /**
     * Attach converters to a descriptor read back from the offset store.
     */
    public TableDescriptor withConverters(TableDescriptor descriptor) {
        return descriptor.edit().converters(converters(descriptor.columns())).build();
    }

    public List<ValueConverter> converters(List<Column> columns) {
        final List<ValueConverter> converters = new ArrayList<>(columns.size());
        for (Column column : columns) {
            converters.add(valueConverter.converter(column));
        }
        return converters;
    }

    /**
     * @return the definition of the destination table of a described table
     */
    public TableDefinition tableDefinition(TableDescriptor descriptor) {
        final SchemaBuilder row = SchemaBuilder.struct().name(descriptor.destinationId().identifier());
        for (Column column : descriptor.columns()) {
            row.field(column.name(), valueConverter.schemaBuilder(column).build());
        }
        final List<String> keyColumns = new ArrayList<>();
        for (Column column : descriptor.identityColumnDefinitions()) {
            keyColumns.add(column.name());
        }
        return new TableDefinition(descriptor.destinationId(), row.build(), keyColumns);
    }
}
