/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgmirror.connector.postgresql.connection;

import java.sql.SQLException;

/**
 * Opens connections to one source database.
 */
public interface PostgresConnectionFactory {

    PostgresConnection newConnection() throws SQLException;

    /**
     * Open a connection in replication mode bound to the given slot and publication.
     */
    ReplicationConnection newReplicationConnection(String slotName, String publicationName) throws SQLException;
}
