/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgmirror.connector.postgresql.connection;

import java.sql.SQLException;
import java.util.List;
import java.util.Optional;

import io.pgmirror.connector.postgresql.PostgresType;
import io.pgmirror.relational.TableId;

/**
 * A read-only {@code REPEATABLE READ} transaction that imported an exported snapshot, so that every read sees the
 * database exactly as of the snapshot's consistent point.
 */
public interface SnapshotTransaction extends AutoCloseable {

    /**
     * Receives the rows of a scan.
     */
    @FunctionalInterface
    interface RowConsumer {
        /**
         * @param values the values of one row in the server's text output format, aligned with the scanned columns;
         *               null for SQL nulls
         */
        void accept(String[] values) throws InterruptedException;
    }

    /**
     * Read the description of the table as of the snapshot.
     *
     * @return the table, or empty if it did not exist
     */
    Optional<SourceTable> readTableSchema(TableId tableId) throws SQLException;

    Optional<PostgresType> readType(int oid) throws SQLException;

    /**
     * Read all rows of the table, fetching them from the server in pages.
     *
     * @param tableId the table
     * @param columns the names of the columns to read, in order
     * @param fetchSize the number of rows fetched per round trip
     * @param consumer receives each row
     * @return the number of rows read
     */
    long scan(TableId tableId, List<String> columns, int fetchSize, RowConsumer consumer) throws SQLException, InterruptedException;

    @Override
    void close() throws SQLException;
}
