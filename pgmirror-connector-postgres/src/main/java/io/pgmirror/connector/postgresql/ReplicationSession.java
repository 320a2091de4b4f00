/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgmirror.connector.postgresql;

import io.pgmirror.connector.postgresql.connection.PostgresConnectionFactory;
import io.pgmirror.connector.postgresql.offset.OffsetStore;
import io.pgmirror.destination.Destination;
import io.pgmirror.util.Clock;

/**
 * Everything the components replicating one source database share: the configuration, the source and the
 * destination, the durable state and the table lifecycle.
 */
public class ReplicationSession {

    private final PostgresConnectorConfig config;
    private final Clock clock;
    private final PostgresConnectionFactory connectionFactory;
    private final Destination destination;
    private final OffsetStore offsetStore;
    private final TableSyncStateMachine stateMachine;
    private final PostgresSchema schema;

    public ReplicationSession(PostgresConnectorConfig config, Clock clock, PostgresConnectionFactory connectionFactory,
                              Destination destination, OffsetStore offsetStore) {
        this.config = config;
        this.clock = clock;
        this.connectionFactory = connectionFactory;
        this.destination = destination;
        this.offsetStore = offsetStore;
        this.stateMachine = new TableSyncStateMachine();
        this.schema = new PostgresSchema(new TypeRegistry(), new ReplicaIdentityResolver());
    }

    public PostgresConnectorConfig getConfig() {
        return config;
    }

    public Clock getClock() {
        return clock;
    }

    public PostgresConnectionFactory getConnectionFactory() {
        return connectionFactory;
    }

    public Destination getDestination() {
        return destination;
    }

    public OffsetStore getOffsetStore() {
        return offsetStore;
    }

    public TableSyncStateMachine getStateMachine() {
        return stateMachine;
    }

    public PostgresSchema getSchema() {
        return schema;
    }

    public String getLogicalName() {
        return config.getLogicalName();
    }
}
