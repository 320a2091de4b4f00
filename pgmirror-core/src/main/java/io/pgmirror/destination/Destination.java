/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgmirror.destination;

import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

import io.pgmirror.relational.TableId;

/**
 * The store that holds the materialized copies of the replicated tables.
 * <p>
 * Implementations must apply a {@link MutationBatch} atomically and must keep version order: a mutation never
 * overwrites a row or a deletion written at a higher version, so that applying the same batch twice has the same
 * effect as applying it once. Calls for different tables may arrive concurrently; calls for one table never do.
 */
public interface Destination {

    /**
     * Create the table, replacing any existing table with the same identifier.
     *
     * @param definition the table definition; may not be null
     */
    void createTable(TableDefinition definition);

    /**
     * Apply all mutations of the batch in order, or none of them.
     *
     * @param tableId the destination table
     * @param batch the batch; may not be null
     * @throws DestinationException if the batch could not be applied
     */
    void applyBatch(TableId tableId, MutationBatch batch);

    /**
     * Return copies of the live rows matching the predicate.
     */
    List<Object[]> query(TableId tableId, Predicate<Object[]> predicate);

    /**
     * Remove the table and all of its rows. Does nothing if the table does not exist.
     */
    void dropTable(TableId tableId);

    boolean tableExists(TableId tableId);

    Optional<TableDefinition> tableDefinition(TableId tableId);

    /**
     * Flag the table as no longer being kept up to date. Its rows stay queryable.
     *
     * @param tableId the destination table
     * @param reason why replication of the table stopped
     */
    void markStale(TableId tableId, String reason);

    boolean isStale(TableId tableId);

    /**
     * Signals that no mutation with a version lower than the given one will be applied again, so that the store may
     * discard what it keeps only to reject such mutations. Does nothing by default.
     *
     * @param version the lowest version that may still be applied
     */
    default void pruneBefore(long version) {
    }
}
