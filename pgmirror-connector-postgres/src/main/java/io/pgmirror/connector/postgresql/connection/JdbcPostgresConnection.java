/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgmirror.connector.postgresql.connection;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.pgmirror.connector.postgresql.PostgresType;
import io.pgmirror.connector.postgresql.connection.ReplicaIdentityInfo.ReplicaIdentity;
import io.pgmirror.relational.Column;
import io.pgmirror.relational.TableId;

/**
 * {@link PostgresConnection} over a regular pgjdbc connection.
 */
public class JdbcPostgresConnection implements PostgresConnection {

    private static final Logger LOGGER = LoggerFactory.getLogger(JdbcPostgresConnection.class);

    private static final String SQL_TABLE_IDS = "SELECT c.relname FROM pg_catalog.pg_class c "
            + "JOIN pg_catalog.pg_namespace n ON n.oid = c.relnamespace "
            + "WHERE n.nspname = ? AND c.relkind IN ('r', 'p') AND NOT c.relispartition ORDER BY c.relname";

    private static final String SQL_TABLE = "SELECT c.oid, c.relreplident FROM pg_catalog.pg_class c "
            + "JOIN pg_catalog.pg_namespace n ON n.oid = c.relnamespace "
            + "WHERE n.nspname = ? AND c.relname = ? AND c.relkind IN ('r', 'p')";

    private static final String SQL_COLUMNS = "SELECT a.attname, a.atttypid, t.typname, a.atttypmod, a.attndims, a.attnotnull "
            + "FROM pg_catalog.pg_attribute a JOIN pg_catalog.pg_type t ON t.oid = a.atttypid "
            + "WHERE a.attrelid = ? AND a.attnum > 0 AND NOT a.attisdropped ORDER BY a.attnum";

    private static final String SQL_PRIMARY_KEY = "SELECT a.attname FROM pg_catalog.pg_index i "
            + "JOIN pg_catalog.pg_attribute a ON a.attrelid = i.indrelid AND a.attnum = ANY(i.indkey) "
            + "WHERE i.indrelid = ? AND i.indisprimary ORDER BY array_position(i.indkey::smallint[], a.attnum)";

    private static final String SQL_IDENTITY_INDEX = "SELECT ic.relname, a.attname FROM pg_catalog.pg_index i "
            + "JOIN pg_catalog.pg_class ic ON ic.oid = i.indexrelid "
            + "JOIN pg_catalog.pg_attribute a ON a.attrelid = i.indrelid AND a.attnum = ANY(i.indkey) "
            + "WHERE i.indrelid = ? AND i.indisreplident ORDER BY array_position(i.indkey::smallint[], a.attnum)";

    private static final String SQL_TYPES = "SELECT t.oid, t.typname, t.typcategory, t.typelem FROM pg_catalog.pg_type t";

    private static final String SQL_SLOT_STATE = "SELECT slot_name, plugin, confirmed_flush_lsn, active FROM pg_catalog.pg_replication_slots "
            + "WHERE slot_name = ? AND database = current_database()";

    private final Connection connection;

    public JdbcPostgresConnection(Connection connection) {
        this.connection = connection;
    }

    @Override
    public Set<TableId> readTableIds(String schemaName) throws SQLException {
        final Set<TableId> tableIds = new LinkedHashSet<>();
        try (PreparedStatement statement = connection.prepareStatement(SQL_TABLE_IDS)) {
            statement.setString(1, schemaName);
            try (ResultSet rs = statement.executeQuery()) {
                while (rs.next()) {
                    tableIds.add(new TableId(schemaName, rs.getString(1)));
                }
            }
        }
        return tableIds;
    }

    @Override
    public Optional<SourceTable> readTableSchema(TableId tableId) throws SQLException {
        return readTableSchema(connection, tableId);
    }

    @Override
    public List<PostgresType> readTypes() throws SQLException {
        final List<PostgresType> types = new ArrayList<>();
        try (Statement statement = connection.createStatement();
                ResultSet rs = statement.executeQuery(SQL_TYPES)) {
            while (rs.next()) {
                types.add(type(rs));
            }
        }
        return types;
    }

    @Override
    public Optional<PostgresType> readType(int oid) throws SQLException {
        return readType(connection, oid);
    }

    @Override
    public Optional<SlotState> readReplicationSlotState(String slotName) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(SQL_SLOT_STATE)) {
            statement.setString(1, slotName);
            try (ResultSet rs = statement.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(new SlotState(rs.getString(1), rs.getString(2), Lsn.valueOf(rs.getString(3)), rs.getBoolean(4)));
            }
        }
    }

    @Override
    public void dropReplicationSlot(String slotName) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement("SELECT pg_catalog.pg_drop_replication_slot(?)")) {
            statement.setString(1, slotName);
            statement.execute();
        }
    }

    @Override
    public boolean publicationExists(String publicationName) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement("SELECT 1 FROM pg_catalog.pg_publication WHERE pubname = ?")) {
            statement.setString(1, publicationName);
            try (ResultSet rs = statement.executeQuery()) {
                return rs.next();
            }
        }
    }

    @Override
    public void createPublication(String publicationName, Collection<TableId> tables) throws SQLException {
        final String target = tables.isEmpty() ? "ALL TABLES"
                : "TABLE " + tables.stream().map(TableId::toDoubleQuotedString).collect(Collectors.joining(", "));
        execute("CREATE PUBLICATION " + quote(publicationName) + " FOR " + target
                + " WITH (publish = 'insert, update, delete, truncate')");
    }

    @Override
    public Set<TableId> readPublicationTables(String publicationName) throws SQLException {
        final Set<TableId> tables = new LinkedHashSet<>();
        try (PreparedStatement statement = connection.prepareStatement(
                "SELECT schemaname, tablename FROM pg_catalog.pg_publication_tables WHERE pubname = ?")) {
            statement.setString(1, publicationName);
            try (ResultSet rs = statement.executeQuery()) {
                while (rs.next()) {
                    tables.add(new TableId(rs.getString(1), rs.getString(2)));
                }
            }
        }
        return tables;
    }

    @Override
    public void addTableToPublication(String publicationName, TableId tableId) throws SQLException {
        execute("ALTER PUBLICATION " + quote(publicationName) + " ADD TABLE " + tableId.toDoubleQuotedString());
    }

    @Override
    public void removeTableFromPublication(String publicationName, TableId tableId) throws SQLException {
        execute("ALTER PUBLICATION " + quote(publicationName) + " DROP TABLE " + tableId.toDoubleQuotedString());
    }

    @Override
    public void dropPublication(String publicationName) throws SQLException {
        execute("DROP PUBLICATION IF EXISTS " + quote(publicationName));
    }

    @Override
    public SnapshotTransaction openSnapshotTransaction(String snapshotName) throws SQLException {
        connection.setAutoCommit(false);
        connection.setTransactionIsolation(Connection.TRANSACTION_REPEATABLE_READ);
        try (Statement statement = connection.createStatement()) {
            statement.execute("SET TRANSACTION SNAPSHOT '" + snapshotName.replace("'", "''") + "'");
        }
        catch (SQLException e) {
            rollbackQuietly();
            throw e;
        }
        LOGGER.debug("Imported snapshot {}", snapshotName);
        return new JdbcSnapshotTransaction();
    }

    @Override
    public void close() throws SQLException {
        connection.close();
    }

    private void execute(String sql) throws SQLException {
        LOGGER.debug("Executing '{}'", sql);
        try (Statement statement = connection.createStatement()) {
            statement.execute(sql);
        }
    }

    private void rollbackQuietly() {
        try {
            connection.rollback();
            connection.setAutoCommit(true);
        }
        catch (SQLException e) {
            LOGGER.debug("Rollback of snapshot transaction failed", e);
        }
    }

    static String quote(String identifier) {
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }

    private static Optional<SourceTable> readTableSchema(Connection connection, TableId tableId) throws SQLException {
        final int relationId;
        final char identityCode;
        try (PreparedStatement statement = connection.prepareStatement(SQL_TABLE)) {
            statement.setString(1, tableId.schema());
            statement.setString(2, tableId.table());
            try (ResultSet rs = statement.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                relationId = (int) rs.getLong(1);
                identityCode = rs.getString(2).charAt(0);
            }
        }

        final List<Column> columns = new ArrayList<>();
        try (PreparedStatement statement = connection.prepareStatement(SQL_COLUMNS)) {
            statement.setLong(1, relationId & 0xFFFFFFFFL);
            try (ResultSet rs = statement.executeQuery()) {
                int position = 1;
                while (rs.next()) {
                    columns.add(Column.editor()
                            .name(rs.getString(1))
                            .position(position++)
                            .type(rs.getString(3), (int) rs.getLong(2))
                            .typeModifier(rs.getInt(4))
                            .arrayDimensions(rs.getInt(5))
                            .optional(!rs.getBoolean(6))
                            .create());
                }
            }
        }

        final List<String> primaryKey = readColumnNames(connection, SQL_PRIMARY_KEY, relationId, 1);
        String indexName = null;
        final List<String> indexColumns = new ArrayList<>();
        try (PreparedStatement statement = connection.prepareStatement(SQL_IDENTITY_INDEX)) {
            statement.setLong(1, relationId & 0xFFFFFFFFL);
            try (ResultSet rs = statement.executeQuery()) {
                while (rs.next()) {
                    indexName = rs.getString(1);
                    indexColumns.add(rs.getString(2));
                }
            }
        }
        final ReplicaIdentityInfo identity = new ReplicaIdentityInfo(ReplicaIdentity.parse(identityCode), indexName);
        return Optional.of(new SourceTable(tableId, relationId, columns, identity, primaryKey, indexColumns));
    }

    private static List<String> readColumnNames(Connection connection, String sql, int relationId, int column) throws SQLException {
        final List<String> names = new ArrayList<>();
        try (PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setLong(1, relationId & 0xFFFFFFFFL);
            try (ResultSet rs = statement.executeQuery()) {
                while (rs.next()) {
                    names.add(rs.getString(column));
                }
            }
        }
        return Collections.unmodifiableList(names);
    }

    private static Optional<PostgresType> readType(Connection connection, int oid) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(SQL_TYPES + " WHERE t.oid = ?")) {
            statement.setLong(1, oid & 0xFFFFFFFFL);
            try (ResultSet rs = statement.executeQuery()) {
                return rs.next() ? Optional.of(type(rs)) : Optional.empty();
            }
        }
    }

    private static PostgresType type(ResultSet rs) throws SQLException {
        final String category = rs.getString(3);
        return new PostgresType((int) rs.getLong(1), rs.getString(2), category == null || category.isEmpty() ? 'X' : category.charAt(0),
                (int) rs.getLong(4));
    }

    /**
     * Reads inside the transaction that imported the snapshot. Closing it ends the transaction.
     */
    private class JdbcSnapshotTransaction implements SnapshotTransaction {

        @Override
        public Optional<SourceTable> readTableSchema(TableId tableId) throws SQLException {
            return JdbcPostgresConnection.readTableSchema(connection, tableId);
        }

        @Override
        public Optional<PostgresType> readType(int oid) throws SQLException {
            return JdbcPostgresConnection.readType(connection, oid);
        }

        @Override
        public long scan(TableId tableId, List<String> columns, int fetchSize, RowConsumer consumer) throws SQLException, InterruptedException {
            final String sql = "SELECT " + columns.stream().map(JdbcPostgresConnection::quote).collect(Collectors.joining(", "))
                    + " FROM " + tableId.toDoubleQuotedString();
            long rows = 0;
            try (Statement statement = connection.createStatement()) {
                statement.setFetchSize(fetchSize);
                try (ResultSet rs = statement.executeQuery(sql)) {
                    final int columnCount = columns.size();
                    while (rs.next()) {
                        final String[] values = new String[columnCount];
                        for (int i = 0; i < columnCount; i++) {
                            values[i] = rs.getString(i + 1);
                        }
                        consumer.accept(values);
                        rows++;
                    }
                }
            }
            return rows;
        }

        @Override
        public void close() throws SQLException {
            try {
                connection.commit();
            }
            finally {
                connection.setAutoCommit(true);
            }
        }
    }
}
