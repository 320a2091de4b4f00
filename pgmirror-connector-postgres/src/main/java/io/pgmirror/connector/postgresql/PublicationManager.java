/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgmirror.connector.postgresql;

import java.sql.SQLException;
import java.util.Collection;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.pgmirror.connector.postgresql.connection.PostgresConnection;
import io.pgmirror.connector.postgresql.connection.SlotState;
import io.pgmirror.relational.TableId;

/**
 * Manages the publication and the replication slot the replica consumes on the source.
 * <p>
 * Nothing is ever removed from the source on failures; only {@link #drop(PostgresConnection)} removes the slot and the
 * publication.
 */
public class PublicationManager {

    private static final Logger LOGGER = LoggerFactory.getLogger(PublicationManager.class);

    private final String publicationName;
    private final String slotName;
    private final boolean allTables;

    public PublicationManager(PostgresConnectorConfig config) {
        this.publicationName = config.publicationName();
        this.slotName = config.slotName();
        this.allTables = config.tableIncludeList().isEmpty();
    }

    public String publicationName() {
        return publicationName;
    }

    public String slotName() {
        return slotName;
    }

    /**
     * Create the publication for the tables, or add the tables missing from an existing publication.
     *
     * @param tables the replicated tables; when empty the publication includes all tables
     */
    public void ensurePublication(PostgresConnection connection, Collection<TableId> tables) throws SQLException {
        if (!connection.publicationExists(publicationName)) {
            LOGGER.info("Creating publication '{}' for {}", publicationName, tables.isEmpty() ? "all tables" : tables);
            connection.createPublication(publicationName, tables);
            return;
        }
        final Set<TableId> published = connection.readPublicationTables(publicationName);
        for (TableId tableId : tables) {
            if (!published.contains(tableId)) {
                LOGGER.info("Adding table {} to existing publication '{}'", tableId, publicationName);
                connection.addTableToPublication(publicationName, tableId);
            }
        }
    }

    public void addTable(PostgresConnection connection, TableId tableId) throws SQLException {
        if (allTables || connection.readPublicationTables(publicationName).contains(tableId)) {
            return;
        }
        LOGGER.info("Adding table {} to publication '{}'", tableId, publicationName);
        connection.addTableToPublication(publicationName, tableId);
    }

    /**
     * Remove the table from the publication. A publication of all tables keeps publishing it; its changes are then
     * ignored.
     */
    public void removeTable(PostgresConnection connection, TableId tableId) throws SQLException {
        if (allTables || !connection.readPublicationTables(publicationName).contains(tableId)) {
            return;
        }
        LOGGER.info("Removing table {} from publication '{}'", tableId, publicationName);
        connection.removeTableFromPublication(publicationName, tableId);
    }

    public Optional<SlotState> slotState(PostgresConnection connection) throws SQLException {
        return connection.readReplicationSlotState(slotName);
    }

    /**
     * Remove the slot and the publication from the source.
     */
    public void drop(PostgresConnection connection) throws SQLException {
        final Optional<SlotState> slot = slotState(connection);
        if (slot.isPresent()) {
            LOGGER.info("Dropping replication slot '{}'", slotName);
            connection.dropReplicationSlot(slotName);
        }
        if (connection.publicationExists(publicationName)) {
            LOGGER.info("Dropping publication '{}'", publicationName);
            connection.dropPublication(publicationName);
        }
    }
}
