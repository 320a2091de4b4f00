/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgmirror.connector.postgresql.connection;

import java.sql.SQLException;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import io.pgmirror.connector.postgresql.PostgresType;
import io.pgmirror.relational.TableId;

/**
 * A regular (non replication) connection to the source database, used for catalog queries, publication management
 * and snapshot reads.
 */
public interface PostgresConnection extends AutoCloseable {

    /**
     * @return all ordinary and partitioned tables of the schema
     */
    Set<TableId> readTableIds(String schemaName) throws SQLException;

    /**
     * @return the description of the table, or empty if there is no such table
     */
    Optional<SourceTable> readTableSchema(TableId tableId) throws SQLException;

    List<PostgresType> readTypes() throws SQLException;

    Optional<PostgresType> readType(int oid) throws SQLException;

    /**
     * @return the state of the slot, or empty if there is no slot of that name
     */
    Optional<SlotState> readReplicationSlotState(String slotName) throws SQLException;

    void dropReplicationSlot(String slotName) throws SQLException;

    boolean publicationExists(String publicationName) throws SQLException;

    /**
     * Create the publication for the given tables, or for all tables when the collection is empty.
     */
    void createPublication(String publicationName, Collection<TableId> tables) throws SQLException;

    /**
     * @return the tables the publication includes
     */
    Set<TableId> readPublicationTables(String publicationName) throws SQLException;

    void addTableToPublication(String publicationName, TableId tableId) throws SQLException;

    void removeTableFromPublication(String publicationName, TableId tableId) throws SQLException;

    void dropPublication(String publicationName) throws SQLException;

    /**
     * Begin a snapshot transaction on this connection. The connection serves nothing else until the transaction is
     * closed.
     *
     * @param snapshotName the name of an exported snapshot
     * @return the transaction; never null
     */
    SnapshotTransaction openSnapshotTransaction(String snapshotName) throws SQLException;

    @Override
    void close() throws SQLException;
}
