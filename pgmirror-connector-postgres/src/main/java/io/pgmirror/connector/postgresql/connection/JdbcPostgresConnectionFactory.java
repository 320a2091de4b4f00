/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgmirror.connector.postgresql.connection;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Properties;

import org.postgresql.PGProperty;

import io.pgmirror.connector.postgresql.PostgresConnectorConfig;

/**
 * Opens pgjdbc connections to the database described by the connector configuration.
 */
public class JdbcPostgresConnectionFactory implements PostgresConnectionFactory {

    private static final String APPLICATION_NAME = "pgmirror";

    private final PostgresConnectorConfig config;
    private final String url;

    public JdbcPostgresConnectionFactory(PostgresConnectorConfig config) {
        this.config = config;
        this.url = "jdbc:postgresql://" + config.hostname() + ":" + config.port() + "/" + config.databaseName();
    }

    @Override
    public PostgresConnection newConnection() throws SQLException {
        return new JdbcPostgresConnection(DriverManager.getConnection(url, properties()));
    }

    @Override
    public ReplicationConnection newReplicationConnection(String slotName, String publicationName) throws SQLException {
        final Properties props = properties();
        PGProperty.ASSUME_MIN_SERVER_VERSION.set(props, "10");
        PGProperty.REPLICATION.set(props, "database");
        PGProperty.PREFER_QUERY_MODE.set(props, "simple");
        final Connection connection = DriverManager.getConnection(url, props);
        return new PostgresReplicationConnection(connection, slotName, publicationName, config.statusUpdateInterval());
    }

    private Properties properties() {
        final Properties props = new Properties();
        PGProperty.USER.set(props, config.user());
        if (config.password() != null) {
            PGProperty.PASSWORD.set(props, config.password());
        }
        PGProperty.APPLICATION_NAME.set(props, APPLICATION_NAME);
        return props;
    }

    @Override
    public String toString() {
        return url;
    }
}
