/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgmirror.destination;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.pgmirror.annotation.ThreadSafe;
import io.pgmirror.relational.TableId;

/**
 * A {@link Destination} that keeps every table in memory as a map from key to the latest versioned row.
 * <p>
 * Deleted keys leave a tombstone carrying the version of the deletion, so that an older upsert replayed after
 * the deletion cannot resurrect the row. Tombstones are kept until {@link #pruneBefore(long)} passes their version.
 */
@ThreadSafe
public class InMemoryDestination implements Destination {

    private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryDestination.class);

    private final Map<TableId, StoredTable> tables = new ConcurrentHashMap<>();
    private final Map<TableId, String> staleTables = new ConcurrentHashMap<>();

    @Override
    public void createTable(TableDefinition definition) {
        LOGGER.info("Creating destination table {}", definition);
        tables.put(definition.id(), new StoredTable(definition));
        staleTables.remove(definition.id());
    }

    @Override
    public void applyBatch(TableId tableId, MutationBatch batch) {
        final StoredTable table = table(tableId);
        synchronized (table) {
            // validate first so that a bad mutation leaves the table untouched
            for (Mutation mutation : batch.mutations()) {
                Object[] row = mutation.row();
                if (row != null && row.length != table.definition.columnCount()) {
                    throw new DestinationException("Row of " + row.length + " values does not match the "
                            + table.definition.columnCount() + " columns of table " + tableId);
                }
            }
            for (Mutation mutation : batch.mutations()) {
                table.apply(mutation);
            }
        }
        LOGGER.trace("Applied {} to {}", batch, tableId);
    }

    @Override
    public List<Object[]> query(TableId tableId, Predicate<Object[]> predicate) {
        final StoredTable table = table(tableId);
        final List<Object[]> result = new ArrayList<>();
        synchronized (table) {
            for (VersionedRow row : table.rows.values()) {
                if (!row.deleted && predicate.test(row.values)) {
                    result.add(row.values.clone());
                }
            }
        }
        return result;
    }

    /**
     * Return copies of all live rows of the table.
     */
    public List<Object[]> rows(TableId tableId) {
        return query(tableId, row -> true);
    }

    public int rowCount(TableId tableId) {
        return rows(tableId).size();
    }

    @Override
    public void dropTable(TableId tableId) {
        if (tables.remove(tableId) != null) {
            LOGGER.info("Dropped destination table {}", tableId);
        }
        staleTables.remove(tableId);
    }

    @Override
    public boolean tableExists(TableId tableId) {
        return tables.containsKey(tableId);
    }

    @Override
    public Optional<TableDefinition> tableDefinition(TableId tableId) {
        StoredTable table = tables.get(tableId);
        return table == null ? Optional.empty() : Optional.of(table.definition);
    }

    @Override
    public void markStale(TableId tableId, String reason) {
        LOGGER.info("Destination table {} is stale: {}", tableId, reason);
        staleTables.put(tableId, reason);
    }

    @Override
    public boolean isStale(TableId tableId) {
        return staleTables.containsKey(tableId);
    }

    @Override
    public void pruneBefore(long version) {
        for (Map.Entry<TableId, StoredTable> entry : tables.entrySet()) {
            final StoredTable table = entry.getValue();
            synchronized (table) {
                final int pruned = table.pruneTombstones(version);
                if (pruned > 0) {
                    LOGGER.debug("Pruned {} tombstone(s) older than {} from {}", pruned, version, entry.getKey());
                }
            }
        }
    }

    /**
     * @return the number of deleted keys whose tombstones are still kept
     */
    public int tombstoneCount(TableId tableId) {
        final StoredTable table = table(tableId);
        synchronized (table) {
            return table.tombstones;
        }
    }

    private StoredTable table(TableId tableId) {
        StoredTable table = tables.get(tableId);
        if (table == null) {
            throw new DestinationException("Table " + tableId + " does not exist");
        }
        return table;
    }

    private static final class VersionedRow {
        private final Object[] values;
        private final long version;
        private final boolean deleted;

        VersionedRow(Object[] values, long version, boolean deleted) {
            this.values = values;
            this.version = version;
            this.deleted = deleted;
        }
    }

    private static final class StoredTable {
        private final TableDefinition definition;
        private final Map<List<Object>, VersionedRow> rows = new LinkedHashMap<>();
        private int tombstones;

        StoredTable(TableDefinition definition) {
            this.definition = definition;
        }

        void apply(Mutation mutation) {
            final VersionedRow existing = rows.get(mutation.key());
            if (existing != null && existing.version > mutation.version()) {
                LOGGER.trace("Ignoring {} older than stored version {}", mutation, existing.version);
                return;
            }
            if (existing != null && existing.deleted) {
                tombstones--;
            }
            if (mutation.type() == Mutation.Type.DELETE) {
                rows.put(mutation.key(), new VersionedRow(null, mutation.version(), true));
                tombstones++;
                return;
            }
            final Object[] values = mutation.row();
            for (int i = 0; i < values.length; i++) {
                if (values[i] instanceof UnchangedToastedPlaceholder) {
                    values[i] = existing != null && !existing.deleted ? existing.values[i] : null;
                }
            }
            rows.put(mutation.key(), new VersionedRow(values, mutation.version(), false));
        }

        int pruneTombstones(long version) {
            if (tombstones == 0) {
                return 0;
            }
            int pruned = 0;
            for (Iterator<VersionedRow> iterator = rows.values().iterator(); iterator.hasNext();) {
                final VersionedRow row = iterator.next();
                if (row.deleted && row.version < version) {
                    iterator.remove();
                    pruned++;
                }
            }
            tombstones -= pruned;
            return pruned;
        }
    }
}
