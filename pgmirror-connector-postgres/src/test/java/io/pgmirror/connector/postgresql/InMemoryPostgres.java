/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgmirror.connector.postgresql;

import java.io.ByteArrayOutputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Predicate;

import io.pgmirror.connector.postgresql.connection.Lsn;
import io.pgmirror.connector.postgresql.connection.PostgresConnection;
import io.pgmirror.connector.postgresql.connection.PostgresConnectionFactory;
import io.pgmirror.connector.postgresql.connection.ReplicaIdentityInfo;
import io.pgmirror.connector.postgresql.connection.ReplicaIdentityInfo.ReplicaIdentity;
import io.pgmirror.connector.postgresql.connection.ReplicationConnection;
import io.pgmirror.connector.postgresql.connection.ReplicationStream;
import io.pgmirror.connector.postgresql.connection.SlotCreationResult;
import io.pgmirror.connector.postgresql.connection.SlotState;
import io.pgmirror.connector.postgresql.connection.SnapshotTransaction;
import io.pgmirror.connector.postgresql.connection.SourceTable;
import io.pgmirror.connector.postgresql.connection.pgoutput.PgOutputMessageDecoder;
import io.pgmirror.relational.Column;
import io.pgmirror.relational.TableId;

/**
 * A single PostgreSQL database kept in memory, with just enough of the server to replicate from it: a catalog, a
 * write-ahead log of committed transactions, logical replication slots exporting snapshots, publications, and a
 * {@code pgoutput} encoder producing the same protocol version 1 frames the server sends.
 * <p>
 * Row values are kept in the server's text output format. All state is guarded by the instance monitor, so writes
 * from test threads interleave with streaming and snapshot reads the way committed transactions would.
 */
public class InMemoryPostgres implements PostgresConnectionFactory {

    public static final String DEFAULT_SCHEMA = "public";

    /**
     * Unchanged values longer than this are sent as unchanged TOAST values in updates.
     */
    public static final int TOAST_THRESHOLD = 2000;

    private static final List<PostgresType> EXTRA_TYPES = Arrays.asList(
            PostgresType.base(600, "point", 'G'),
            PostgresType.base(790, "money", 'N'),
            PostgresType.base(142, "xml", 'U'));

    private static final Map<String, String> TYPE_ALIASES = new HashMap<>();

    static {
        TYPE_ALIASES.put("integer", "int4");
        TYPE_ALIASES.put("int", "int4");
        TYPE_ALIASES.put("bigint", "int8");
        TYPE_ALIASES.put("smallint", "int2");
        TYPE_ALIASES.put("boolean", "bool");
        TYPE_ALIASES.put("real", "float4");
        TYPE_ALIASES.put("float", "float8");
        TYPE_ALIASES.put("character", "bpchar");
    }

    private final Map<TableId, TableData> tables = new LinkedHashMap<>();
    private final List<PostgresType> userTypes = new ArrayList<>();
    private final List<WalTransaction> wal = new ArrayList<>();
    private final Map<String, Slot> slots = new LinkedHashMap<>();
    private final Map<String, Publication> publications = new LinkedHashMap<>();
    private final Map<String, ExportedSnapshot> snapshots = new HashMap<>();
    private final Set<FakeReplicationConnection> replicationConnections = new HashSet<>();

    private long currentLsn = 0x16B3748L;
    private long nextXid = 750;
    private int nextOid = 16384;
    private int snapshotCounter;
    private int failingReplicationConnects;
    private int failingScans;
    private String failingScanState;
    private int replicationConnectCount;

    // ------------------------------------------------------------------------------------------------------------
    // Schema
    // ------------------------------------------------------------------------------------------------------------

    /**
     * Create a table. Each definition is either {@code name type [NOT NULL]} or {@code PRIMARY KEY (a, b)}; types
     * may carry a modifier such as {@code numeric(10,2)} and array brackets such as {@code int4[][]}.
     */
    public synchronized TableId createTable(String name, String... definitions) {
        final TableId id = tableId(name);
        if (tables.containsKey(id)) {
            throw new IllegalStateException("relation \"" + id + "\" already exists");
        }
        final List<ColumnDef> columns = new ArrayList<>();
        List<String> primaryKey = Collections.emptyList();
        for (String definition : definitions) {
            final String trimmed = definition.trim();
            if (trimmed.toUpperCase(Locale.ROOT).startsWith("PRIMARY KEY")) {
                primaryKey = columnList(trimmed.substring("PRIMARY KEY".length()));
            }
            else {
                columns.add(parseColumn(trimmed));
            }
        }
        final TableSchema schema = new TableSchema(id, nextOid++, columns, primaryKey, ReplicaIdentity.DEFAULT, null,
                Collections.emptyList());
        tables.put(id, new TableData(schema, new ArrayList<>()));
        return id;
    }

    /**
     * Drop the table and create it again with the same definition and no rows, which gives it a new relation id.
     */
    public synchronized void recreateTable(String name) {
        final TableData table = table(name);
        final TableSchema old = table.schema;
        table.schema = new TableSchema(old.id, nextOid++, old.columns, old.primaryKey, old.identity, old.indexName, old.indexColumns);
        table.rows = new ArrayList<>();
    }

    public synchronized void createEnum(String name) {
        final int oid = nextOid++;
        userTypes.add(PostgresType.enumType(oid, name));
        userTypes.add(PostgresType.array(nextOid++, "_" + name, oid));
    }

    public synchronized void addColumn(String table, String definition) {
        final TableData data = table(table);
        final TableSchema old = data.schema;
        final List<ColumnDef> columns = new ArrayList<>(old.columns);
        columns.add(parseColumn(definition));
        data.schema = old.withColumns(columns);
        final List<String[]> rows = new ArrayList<>(data.rows.size());
        for (String[] row : data.rows) {
            rows.add(Arrays.copyOf(row, columns.size()));
        }
        data.rows = rows;
    }

    public synchronized void alterColumnType(String table, String column, String type) {
        final TableData data = table(table);
        final TableSchema old = data.schema;
        final int position = old.position(column);
        final List<ColumnDef> columns = new ArrayList<>(old.columns);
        final ColumnDef changed = parseColumn(column + " " + type);
        columns.set(position, new ColumnDef(changed.name, changed.type, changed.typeModifier, changed.dimensions, old.columns.get(position).notNull));
        data.schema = old.withColumns(columns);
    }

    public synchronized void setReplicaIdentity(String table, ReplicaIdentity identity) {
        if (identity == ReplicaIdentity.INDEX) {
            throw new IllegalArgumentException("Use setReplicaIdentityUsingIndex");
        }
        final TableData data = table(table);
        data.schema = data.schema.withIdentity(identity, null, Collections.emptyList());
    }

    public synchronized void setReplicaIdentityUsingIndex(String table, String indexName, String... columns) {
        final TableData data = table(table);
        for (String column : columns) {
            data.schema.position(column);
        }
        data.schema = data.schema.withIdentity(ReplicaIdentity.INDEX, indexName, Arrays.asList(columns));
    }

    // ------------------------------------------------------------------------------------------------------------
    // Data
    // ------------------------------------------------------------------------------------------------------------

    /**
     * Run the body as one transaction, committed when it returns.
     */
    public synchronized Lsn transaction(Consumer<Transaction> body) {
        final Transaction transaction = new Transaction();
        body.accept(transaction);
        return commit(transaction.changes);
    }

    public Lsn insert(String table, Object... values) {
        return transaction(tx -> tx.insert(table, values));
    }

    public Lsn insertRows(String table, Collection<Object[]> rows) {
        return transaction(tx -> rows.forEach(row -> tx.insert(table, row)));
    }

    public Lsn update(String table, Predicate<Row> filter, Consumer<Row> change) {
        return transaction(tx -> tx.update(table, filter, change));
    }

    public Lsn delete(String table, Predicate<Row> filter) {
        return transaction(tx -> tx.delete(table, filter));
    }

    public Lsn truncate(String... tableNames) {
        return transaction(tx -> tx.truncate(tableNames));
    }

    /**
     * @return copies of the rows of the table in text format, in insertion order
     */
    public synchronized List<String[]> rows(String table) {
        final List<String[]> copy = new ArrayList<>();
        for (String[] row : table(table).rows) {
            copy.add(row.clone());
        }
        return copy;
    }

    public synchronized int rowCount(String table) {
        return table(table).rows.size();
    }

    public synchronized Lsn currentLsn() {
        return Lsn.valueOf(currentLsn);
    }

    // ------------------------------------------------------------------------------------------------------------
    // Replication control
    // ------------------------------------------------------------------------------------------------------------

    public synchronized boolean slotExists(String slotName) {
        return slots.containsKey(slotName);
    }

    public synchronized Optional<Lsn> confirmedFlushLsn(String slotName) {
        final Slot slot = slots.get(slotName);
        return slot == null ? Optional.empty() : Optional.of(Lsn.valueOf(slot.confirmed));
    }

    public synchronized boolean publicationExists(String publicationName) {
        return publications.containsKey(publicationName);
    }

    public synchronized Set<TableId> publicationTables(String publicationName) {
        return publicationTableIds(publications.get(publicationName));
    }

    /**
     * Create a permanent slot outside of any replica, like a leftover of an earlier one.
     */
    public synchronized void createSlot(String slotName) {
        slots.put(slotName, new Slot(slotName, currentLsn, false, null));
    }

    public synchronized void dropSlot(String slotName) {
        slots.remove(slotName);
    }

    /**
     * Terminate every open replication connection, as {@code pg_terminate_backend} would.
     */
    public synchronized void terminateReplicationConnections() {
        for (FakeReplicationConnection connection : new ArrayList<>(replicationConnections)) {
            connection.terminated = true;
            connection.release();
        }
    }

    /**
     * Refuse the next replication connections.
     */
    public synchronized void failReplicationConnects(int count) {
        failingReplicationConnects = count;
    }

    /**
     * Fail the next snapshot scans with a serialization failure.
     */
    public synchronized void failSnapshotScans(int count) {
        failSnapshotScans(count, "40001");
    }

    /**
     * Fail the next snapshot scans with an error of the given SQL state.
     */
    public synchronized void failSnapshotScans(int count, String sqlState) {
        failingScans = count;
        failingScanState = sqlState;
    }

    public synchronized int replicationConnectCount() {
        return replicationConnectCount;
    }

    // ------------------------------------------------------------------------------------------------------------
    // PostgresConnectionFactory
    // ------------------------------------------------------------------------------------------------------------

    @Override
    public PostgresConnection newConnection() {
        return new FakeConnection();
    }

    @Override
    public synchronized ReplicationConnection newReplicationConnection(String slotName, String publicationName) throws SQLException {
        replicationConnectCount++;
        if (failingReplicationConnects > 0) {
            failingReplicationConnects--;
            throw new SQLException("Connection to localhost:5432 refused", "08001");
        }
        final FakeReplicationConnection connection = new FakeReplicationConnection(slotName, publicationName);
        replicationConnections.add(connection);
        return connection;
    }

    // ------------------------------------------------------------------------------------------------------------
    // Internals
    // ------------------------------------------------------------------------------------------------------------

    private Lsn commit(List<Change> changes) {
        final long xid = nextXid++;
        final long commitLsn = currentLsn + 0x28 + 0x40L * changes.size() + 0x30;
        final long endLsn = commitLsn + 0x30;
        currentLsn = endLsn;
        wal.add(new WalTransaction(xid, commitLsn, endLsn, Instant.now(), new ArrayList<>(changes)));
        return Lsn.valueOf(endLsn);
    }

    private TableData table(String name) {
        final TableData table = tables.get(tableId(name));
        if (table == null) {
            throw new IllegalArgumentException("relation \"" + name + "\" does not exist");
        }
        return table;
    }

    private static TableId tableId(String name) {
        final TableId id = TableId.parse(name);
        return id.schema() == null ? new TableId(DEFAULT_SCHEMA, id.table()) : id;
    }

    private List<PostgresType> allTypes() {
        final List<PostgresType> types = new ArrayList<>(TypeRegistry.getBuiltinTypes());
        types.addAll(EXTRA_TYPES);
        types.addAll(userTypes);
        return types;
    }

    private PostgresType typeNamed(String name) {
        for (PostgresType type : allTypes()) {
            if (type.getName().equals(name)) {
                return type;
            }
        }
        throw new IllegalArgumentException("type \"" + name + "\" does not exist");
    }

    private Optional<PostgresType> typeWithOid(int oid) {
        for (PostgresType type : allTypes()) {
            if (type.getOid() == oid) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    private ColumnDef parseColumn(String definition) {
        String rest = definition.trim();
        final int space = rest.indexOf(' ');
        if (space < 0) {
            throw new IllegalArgumentException("Column definition without type: " + definition);
        }
        final String name = rest.substring(0, space);
        rest = rest.substring(space + 1).trim();
        boolean notNull = false;
        if (rest.toUpperCase(Locale.ROOT).endsWith("NOT NULL")) {
            notNull = true;
            rest = rest.substring(0, rest.length() - "NOT NULL".length()).trim();
        }
        int dimensions = 0;
        while (rest.endsWith("[]")) {
            dimensions++;
            rest = rest.substring(0, rest.length() - 2).trim();
        }
        String modifier = null;
        final int paren = rest.indexOf('(');
        if (paren >= 0) {
            modifier = rest.substring(paren + 1, rest.lastIndexOf(')')).replace(" ", "");
            rest = rest.substring(0, paren).trim();
        }
        final String baseName = TYPE_ALIASES.getOrDefault(rest.toLowerCase(Locale.ROOT), rest.toLowerCase(Locale.ROOT));
        final PostgresType baseType = typeNamed(baseName);
        final PostgresType type = dimensions > 0 ? typeNamed("_" + baseType.getName()) : baseType;
        return new ColumnDef(name, type, typeModifier(baseType, modifier), dimensions, notNull);
    }

    private static int typeModifier(PostgresType type, String modifier) {
        if (modifier == null) {
            return -1;
        }
        final String[] parts = modifier.split(",");
        switch (type.getName()) {
            case "numeric":
                final int precision = Integer.parseInt(parts[0]);
                final int scale = parts.length > 1 ? Integer.parseInt(parts[1]) : 0;
                return ((precision << 16) | scale) + 4;
            case "varchar":
            case "bpchar":
                return Integer.parseInt(parts[0]) + 4;
            default:
                return Integer.parseInt(parts[0]);
        }
    }

    private static List<String> columnList(String text) {
        final String inner = text.substring(text.indexOf('(') + 1, text.lastIndexOf(')'));
        final List<String> names = new ArrayList<>();
        for (String part : inner.split(",")) {
            names.add(part.trim());
        }
        return names;
    }

    private static String toText(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Boolean) {
            return (Boolean) value ? "t" : "f";
        }
        return value.toString();
    }

    private boolean isPublished(TableId tableId) {
        for (Publication publication : publications.values()) {
            if (publication.allTables || publication.tables.contains(tableId)) {
                return true;
            }
        }
        return false;
    }

    private Set<TableId> publicationTableIds(Publication publication) {
        if (publication == null) {
            return Collections.emptySet();
        }
        final Set<TableId> ids = new LinkedHashSet<>();
        for (TableId id : tables.keySet()) {
            if (publication.allTables || publication.tables.contains(id)) {
                ids.add(id);
            }
        }
        return ids;
    }

    private Map<TableId, TableData> copyTables() {
        final Map<TableId, TableData> copy = new LinkedHashMap<>();
        tables.forEach((id, data) -> copy.put(id, new TableData(data.schema, new ArrayList<>(data.rows))));
        return copy;
    }

    private SlotCreationResult createSlot(String slotName, boolean temporary, FakeReplicationConnection owner) throws SQLException {
        if (slots.containsKey(slotName)) {
            throw new SQLException("replication slot \"" + slotName + "\" already exists", "42710");
        }
        slots.put(slotName, new Slot(slotName, currentLsn, temporary, owner));
        final String snapshotName = String.format("00000003-%08X-1", ++snapshotCounter);
        snapshots.put(snapshotName, new ExportedSnapshot(owner, copyTables()));
        return new SlotCreationResult(slotName, Lsn.valueOf(currentLsn), snapshotName, PostgresConnectorConfig.PLUGIN_NAME);
    }

    private SourceTable sourceTable(TableSchema schema) {
        final List<Column> columns = new ArrayList<>();
        for (int i = 0; i < schema.columns.size(); i++) {
            final ColumnDef column = schema.columns.get(i);
            columns.add(Column.editor()
                    .name(column.name)
                    .position(i + 1)
                    .type(column.type.getName(), column.type.getOid())
                    .typeModifier(column.typeModifier)
                    .arrayDimensions(column.dimensions)
                    .optional(!column.notNull && !schema.primaryKey.contains(column.name))
                    .create());
        }
        return new SourceTable(schema.id, schema.relationId, columns, new ReplicaIdentityInfo(schema.identity, schema.indexName),
                schema.primaryKey, schema.identity == ReplicaIdentity.INDEX ? schema.indexColumns : Collections.emptyList());
    }

    /**
     * A row of a table being changed.
     */
    public static final class Row {

        private final TableSchema schema;
        private final String[] values;

        private Row(TableSchema schema, String[] values) {
            this.schema = schema;
            this.values = values;
        }

        public String get(String column) {
            return values[schema.position(column)];
        }

        public int getInt(String column) {
            return Integer.parseInt(get(column));
        }

        public long getLong(String column) {
            return Long.parseLong(get(column));
        }

        public void set(String column, Object value) {
            values[schema.position(column)] = toText(value);
        }
    }

    /**
     * The changes of one transaction; applied to the tables as they are made.
     */
    public final class Transaction {

        private final List<Change> changes = new ArrayList<>();

        public Transaction insert(String table, Object... values) {
            final TableData data = table(table);
            if (values.length != data.schema.columns.size()) {
                throw new IllegalArgumentException("INSERT has " + values.length + " values for " + data.schema.columns.size() + " columns");
            }
            final String[] row = new String[values.length];
            for (int i = 0; i < values.length; i++) {
                row[i] = toText(values[i]);
            }
            data.rows.add(row);
            changes.add(Change.row('I', data.schema, null, row));
            return this;
        }

        public int update(String table, Predicate<Row> filter, Consumer<Row> change) {
            final TableData data = table(table);
            int count = 0;
            for (int i = 0; i < data.rows.size(); i++) {
                final String[] old = data.rows.get(i);
                if (!filter.test(new Row(data.schema, old.clone()))) {
                    continue;
                }
                checkIdentity(data.schema, "update");
                final String[] updated = old.clone();
                change.accept(new Row(data.schema, updated));
                data.rows.set(i, updated);
                changes.add(Change.row('U', data.schema, old, updated));
                count++;
            }
            return count;
        }

        public int delete(String table, Predicate<Row> filter) {
            final TableData data = table(table);
            int count = 0;
            final Iterator<String[]> iterator = data.rows.iterator();
            while (iterator.hasNext()) {
                final String[] old = iterator.next();
                if (!filter.test(new Row(data.schema, old.clone()))) {
                    continue;
                }
                checkIdentity(data.schema, "delete from");
                iterator.remove();
                changes.add(Change.row('D', data.schema, old, null));
                count++;
            }
            return count;
        }

        public void truncate(String... tableNames) {
            final List<TableSchema> truncated = new ArrayList<>();
            for (String name : tableNames) {
                final TableData data = table(name);
                data.rows = new ArrayList<>();
                truncated.add(data.schema);
            }
            changes.add(Change.truncate(truncated));
        }

        private void checkIdentity(TableSchema schema, String operation) {
            if (schema.identityPositions().isEmpty() && isPublished(schema.id)) {
                throw new IllegalStateException("cannot " + operation + " table \"" + schema.id.table()
                        + "\" because it does not have a replica identity and publishes " + operation.split(" ")[0] + "s");
            }
        }
    }

    private static final class ColumnDef {
        final String name;
        final PostgresType type;
        final int typeModifier;
        final int dimensions;
        final boolean notNull;

        ColumnDef(String name, PostgresType type, int typeModifier, int dimensions, boolean notNull) {
            this.name = name;
            this.type = type;
            this.typeModifier = typeModifier;
            this.dimensions = dimensions;
            this.notNull = notNull;
        }
    }

    /**
     * One version of the definition of a table. Every change creates a new instance.
     */
    private static final class TableSchema {
        final TableId id;
        final int relationId;
        final List<ColumnDef> columns;
        final List<String> primaryKey;
        final ReplicaIdentity identity;
        final String indexName;
        final List<String> indexColumns;

        TableSchema(TableId id, int relationId, List<ColumnDef> columns, List<String> primaryKey, ReplicaIdentity identity, String indexName,
                    List<String> indexColumns) {
            this.id = id;
            this.relationId = relationId;
            this.columns = Collections.unmodifiableList(new ArrayList<>(columns));
            this.primaryKey = primaryKey;
            this.identity = identity;
            this.indexName = indexName;
            this.indexColumns = indexColumns;
        }

        TableSchema withColumns(List<ColumnDef> newColumns) {
            return new TableSchema(id, relationId, newColumns, primaryKey, identity, indexName, indexColumns);
        }

        TableSchema withIdentity(ReplicaIdentity newIdentity, String newIndexName, List<String> newIndexColumns) {
            return new TableSchema(id, relationId, columns, primaryKey, newIdentity, newIndexName, newIndexColumns);
        }

        int position(String column) {
            for (int i = 0; i < columns.size(); i++) {
                if (columns.get(i).name.equals(column)) {
                    return i;
                }
            }
            throw new IllegalArgumentException("column \"" + column + "\" of relation \"" + id + "\" does not exist");
        }

        /**
         * @return the positions of the columns the server logs as the old key
         */
        Set<Integer> identityPositions() {
            final Set<Integer> positions = new LinkedHashSet<>();
            switch (identity) {
                case FULL:
                    for (int i = 0; i < columns.size(); i++) {
                        positions.add(i);
                    }
                    break;
                case INDEX:
                    indexColumns.forEach(c -> positions.add(position(c)));
                    break;
                case DEFAULT:
                    primaryKey.forEach(c -> positions.add(position(c)));
                    break;
                case NOTHING:
                default:
                    break;
            }
            return positions;
        }
    }

    private static final class TableData {
        TableSchema schema;
        List<String[]> rows;

        TableData(TableSchema schema, List<String[]> rows) {
            this.schema = schema;
            this.rows = rows;
        }
    }

    private static final class Change {
        final char operation;
        final TableSchema schema;
        final String[] oldRow;
        final String[] newRow;
        final List<TableSchema> truncated;

        private Change(char operation, TableSchema schema, String[] oldRow, String[] newRow, List<TableSchema> truncated) {
            this.operation = operation;
            this.schema = schema;
            this.oldRow = oldRow;
            this.newRow = newRow;
            this.truncated = truncated;
        }

        static Change row(char operation, TableSchema schema, String[] oldRow, String[] newRow) {
            return new Change(operation, schema, oldRow, newRow, Collections.emptyList());
        }

        static Change truncate(List<TableSchema> tables) {
            return new Change('T', null, null, null, tables);
        }
    }

    private static final class WalTransaction {
        final long xid;
        final long commitLsn;
        final long endLsn;
        final Instant commitTime;
        final List<Change> changes;

        WalTransaction(long xid, long commitLsn, long endLsn, Instant commitTime, List<Change> changes) {
            this.xid = xid;
            this.commitLsn = commitLsn;
            this.endLsn = endLsn;
            this.commitTime = commitTime;
            this.changes = changes;
        }
    }

    private static final class Slot {
        final String name;
        final boolean temporary;
        final FakeReplicationConnection owner;
        long confirmed;
        FakeReplicationConnection activeOn;

        Slot(String name, long confirmed, boolean temporary, FakeReplicationConnection owner) {
            this.name = name;
            this.confirmed = confirmed;
            this.temporary = temporary;
            this.owner = owner;
        }
    }

    private static final class Publication {
        final boolean allTables;
        final Set<TableId> tables = new LinkedHashSet<>();

        Publication(boolean allTables) {
            this.allTables = allTables;
        }
    }

    private static final class ExportedSnapshot {
        final FakeReplicationConnection owner;
        final Map<TableId, TableData> tables;

        ExportedSnapshot(FakeReplicationConnection owner, Map<TableId, TableData> tables) {
            this.owner = owner;
            this.tables = tables;
        }
    }

    private class FakeConnection implements PostgresConnection {

        @Override
        public Set<TableId> readTableIds(String schemaName) {
            synchronized (InMemoryPostgres.this) {
                final Set<TableId> ids = new LinkedHashSet<>();
                for (TableId id : tables.keySet()) {
                    if (id.schema().equals(schemaName)) {
                        ids.add(id);
                    }
                }
                return ids;
            }
        }

        @Override
        public Optional<SourceTable> readTableSchema(TableId tableId) {
            synchronized (InMemoryPostgres.this) {
                final TableData data = tables.get(tableId);
                return data == null ? Optional.empty() : Optional.of(sourceTable(data.schema));
            }
        }

        @Override
        public List<PostgresType> readTypes() {
            synchronized (InMemoryPostgres.this) {
                return allTypes();
            }
        }

        @Override
        public Optional<PostgresType> readType(int oid) {
            synchronized (InMemoryPostgres.this) {
                return typeWithOid(oid);
            }
        }

        @Override
        public Optional<SlotState> readReplicationSlotState(String slotName) {
            synchronized (InMemoryPostgres.this) {
                final Slot slot = slots.get(slotName);
                return slot == null ? Optional.empty()
                        : Optional.of(new SlotState(slotName, PostgresConnectorConfig.PLUGIN_NAME, Lsn.valueOf(slot.confirmed), slot.activeOn != null));
            }
        }

        @Override
        public void dropReplicationSlot(String slotName) throws SQLException {
            synchronized (InMemoryPostgres.this) {
                final Slot slot = slots.get(slotName);
                if (slot == null) {
                    throw new SQLException("replication slot \"" + slotName + "\" does not exist", "42704");
                }
                if (slot.activeOn != null) {
                    throw new SQLException("replication slot \"" + slotName + "\" is active", "55006");
                }
                slots.remove(slotName);
            }
        }

        @Override
        public boolean publicationExists(String publicationName) {
            synchronized (InMemoryPostgres.this) {
                return publications.containsKey(publicationName);
            }
        }

        @Override
        public void createPublication(String publicationName, Collection<TableId> tableIds) throws SQLException {
            synchronized (InMemoryPostgres.this) {
                if (publications.containsKey(publicationName)) {
                    throw new SQLException("publication \"" + publicationName + "\" already exists", "42710");
                }
                final Publication publication = new Publication(tableIds.isEmpty());
                for (TableId tableId : tableIds) {
                    checkTable(tableId);
                    publication.tables.add(tableId);
                }
                publications.put(publicationName, publication);
            }
        }

        @Override
        public Set<TableId> readPublicationTables(String publicationName) {
            synchronized (InMemoryPostgres.this) {
                return publicationTableIds(publications.get(publicationName));
            }
        }

        @Override
        public void addTableToPublication(String publicationName, TableId tableId) throws SQLException {
            synchronized (InMemoryPostgres.this) {
                final Publication publication = publication(publicationName);
                if (publication.allTables) {
                    throw new SQLException("publication \"" + publicationName + "\" is defined as FOR ALL TABLES", "55000");
                }
                checkTable(tableId);
                publication.tables.add(tableId);
            }
        }

        @Override
        public void removeTableFromPublication(String publicationName, TableId tableId) throws SQLException {
            synchronized (InMemoryPostgres.this) {
                final Publication publication = publication(publicationName);
                if (publication.allTables) {
                    throw new SQLException("publication \"" + publicationName + "\" is defined as FOR ALL TABLES", "55000");
                }
                publication.tables.remove(tableId);
            }
        }

        @Override
        public void dropPublication(String publicationName) {
            synchronized (InMemoryPostgres.this) {
                publications.remove(publicationName);
            }
        }

        @Override
        public SnapshotTransaction openSnapshotTransaction(String snapshotName) throws SQLException {
            synchronized (InMemoryPostgres.this) {
                final ExportedSnapshot snapshot = snapshots.get(snapshotName);
                if (snapshot == null) {
                    throw new SQLException("invalid snapshot identifier: \"" + snapshotName + "\"", "22023");
                }
                return new FakeSnapshotTransaction(snapshot.tables);
            }
        }

        private Publication publication(String publicationName) throws SQLException {
            final Publication publication = publications.get(publicationName);
            if (publication == null) {
                throw new SQLException("publication \"" + publicationName + "\" does not exist", "42704");
            }
            return publication;
        }

        private void checkTable(TableId tableId) throws SQLException {
            if (!tables.containsKey(tableId)) {
                throw new SQLException("relation \"" + tableId + "\" does not exist", "42P01");
            }
        }

        @Override
        public void close() {
        }
    }

    private class FakeSnapshotTransaction implements SnapshotTransaction {

        private final Map<TableId, TableData> tables;

        FakeSnapshotTransaction(Map<TableId, TableData> tables) {
            this.tables = tables;
        }

        @Override
        public Optional<SourceTable> readTableSchema(TableId tableId) {
            final TableData data = tables.get(tableId);
            return data == null ? Optional.empty() : Optional.of(sourceTable(data.schema));
        }

        @Override
        public Optional<PostgresType> readType(int oid) {
            synchronized (InMemoryPostgres.this) {
                return typeWithOid(oid);
            }
        }

        @Override
        public long scan(TableId tableId, List<String> columns, int fetchSize, RowConsumer consumer) throws SQLException, InterruptedException {
            synchronized (InMemoryPostgres.this) {
                if (failingScans > 0) {
                    failingScans--;
                    throw new SQLException("canceling statement due to conflict with recovery", failingScanState);
                }
            }
            final TableData data = tables.get(tableId);
            if (data == null) {
                throw new SQLException("relation \"" + tableId + "\" does not exist", "42P01");
            }
            final int[] positions = new int[columns.size()];
            for (int i = 0; i < positions.length; i++) {
                positions[i] = data.schema.position(columns.get(i));
            }
            long count = 0;
            for (String[] row : data.rows) {
                final String[] values = new String[positions.length];
                for (int i = 0; i < positions.length; i++) {
                    values[i] = row[positions[i]];
                }
                consumer.accept(values);
                count++;
            }
            return count;
        }

        @Override
        public void close() {
        }
    }

    private class FakeReplicationConnection implements ReplicationConnection {

        private final String slotName;
        private final String publicationName;
        private volatile boolean terminated;
        private boolean closed;

        FakeReplicationConnection(String slotName, String publicationName) {
            this.slotName = slotName;
            this.publicationName = publicationName;
        }

        @Override
        public Optional<SlotCreationResult> createReplicationSlot() throws SQLException {
            synchronized (InMemoryPostgres.this) {
                checkOpen();
                if (slots.containsKey(slotName)) {
                    return Optional.empty();
                }
                return Optional.of(createSlot(slotName, false, this));
            }
        }

        @Override
        public SlotCreationResult createTemporarySlot(String name) throws SQLException {
            synchronized (InMemoryPostgres.this) {
                checkOpen();
                return createSlot(name, true, this);
            }
        }

        @Override
        public ReplicationStream startStreaming(Lsn from) throws SQLException {
            synchronized (InMemoryPostgres.this) {
                checkOpen();
                invalidateSnapshots();
                final Slot slot = slots.get(slotName);
                if (slot == null) {
                    throw new SQLException("replication slot \"" + slotName + "\" does not exist", "42704");
                }
                if (slot.activeOn != null) {
                    throw new SQLException("replication slot \"" + slotName + "\" is active", "55006");
                }
                if (!publications.containsKey(publicationName)) {
                    throw new SQLException("publication \"" + publicationName + "\" does not exist", "42704");
                }
                slot.activeOn = this;
                return new FakeReplicationStream(this, slot, from);
            }
        }

        @Override
        public String slotName() {
            return slotName;
        }

        void checkOpen() throws SQLException {
            if (terminated) {
                throw new SQLException("terminating connection due to administrator command", "57P01");
            }
            if (closed) {
                throw new SQLException("This connection has been closed.", "08003");
            }
        }

        void invalidateSnapshots() {
            snapshots.values().removeIf(snapshot -> snapshot.owner == this);
        }

        void release() {
            invalidateSnapshots();
            final Iterator<Slot> iterator = slots.values().iterator();
            while (iterator.hasNext()) {
                final Slot slot = iterator.next();
                if (slot.activeOn == this) {
                    slot.activeOn = null;
                }
                if (slot.temporary && slot.owner == this) {
                    iterator.remove();
                }
            }
            replicationConnections.remove(this);
        }

        @Override
        public void close() {
            synchronized (InMemoryPostgres.this) {
                if (!closed) {
                    closed = true;
                    release();
                }
            }
        }
    }

    private class FakeReplicationStream implements ReplicationStream {

        private final FakeReplicationConnection connection;
        private final Slot slot;
        private final Lsn startLsn;
        private final long startPoint;
        private final Deque<ByteBuffer> pending = new ArrayDeque<>();
        private final Map<Integer, TableSchema> sentRelations = new HashMap<>();
        private int nextTransaction;
        private long lastReceived;
        private boolean closed;

        FakeReplicationStream(FakeReplicationConnection connection, Slot slot, Lsn from) {
            this.connection = connection;
            this.slot = slot;
            this.startLsn = from;
            this.startPoint = Math.max(from.asLong(), slot.confirmed);
        }

        @Override
        public ByteBuffer readPending() throws SQLException {
            synchronized (InMemoryPostgres.this) {
                checkOpen();
                while (pending.isEmpty() && nextTransaction < wal.size()) {
                    final WalTransaction transaction = wal.get(nextTransaction++);
                    if (transaction.endLsn > startPoint) {
                        encode(transaction);
                        lastReceived = transaction.endLsn;
                    }
                }
                return pending.poll();
            }
        }

        @Override
        public void flushLsn(Lsn lsn) throws SQLException {
            synchronized (InMemoryPostgres.this) {
                checkOpen();
                if (lsn.isValid() && lsn.asLong() > slot.confirmed) {
                    slot.confirmed = lsn.asLong();
                }
            }
        }

        @Override
        public Lsn lastReceivedLsn() {
            synchronized (InMemoryPostgres.this) {
                return Lsn.valueOf(lastReceived);
            }
        }

        @Override
        public Lsn startLsn() {
            return startLsn;
        }

        @Override
        public void close() {
            synchronized (InMemoryPostgres.this) {
                closed = true;
                if (slot.activeOn == connection) {
                    slot.activeOn = null;
                }
            }
        }

        private void checkOpen() throws SQLException {
            connection.checkOpen();
            if (closed) {
                throw new SQLException("Replication stream is closed", "08003");
            }
        }

        private void encode(WalTransaction transaction) {
            final Publication publication = publications.get(connection.publicationName);
            final long commitTime = PgOutputMessageDecoder.toPgEpochMicros(transaction.commitTime);
            pending.add(message(out -> {
                out.writeByte('B');
                out.writeLong(transaction.commitLsn);
                out.writeLong(commitTime);
                out.writeInt((int) transaction.xid);
            }));
            for (Change change : transaction.changes) {
                if (change.operation == 'T') {
                    final List<TableSchema> published = new ArrayList<>();
                    for (TableSchema schema : change.truncated) {
                        if (isPublishedBy(publication, schema.id)) {
                            relation(schema);
                            published.add(schema);
                        }
                    }
                    if (!published.isEmpty()) {
                        pending.add(message(out -> {
                            out.writeByte('T');
                            out.writeInt(published.size());
                            out.writeByte(0);
                            for (TableSchema schema : published) {
                                out.writeInt(schema.relationId);
                            }
                        }));
                    }
                }
                else if (isPublishedBy(publication, change.schema.id)) {
                    relation(change.schema);
                    pending.add(rowMessage(change));
                }
            }
            pending.add(message(out -> {
                out.writeByte('C');
                out.writeByte(0);
                out.writeLong(transaction.commitLsn);
                out.writeLong(transaction.endLsn);
                out.writeLong(commitTime);
            }));
        }

        private boolean isPublishedBy(Publication publication, TableId tableId) {
            return publication != null && (publication.allTables || publication.tables.contains(tableId));
        }

        private void relation(TableSchema schema) {
            if (sentRelations.get(schema.relationId) == schema) {
                return;
            }
            sentRelations.put(schema.relationId, schema);
            final Set<Integer> keys = schema.identityPositions();
            pending.add(message(out -> {
                out.writeByte('R');
                out.writeInt(schema.relationId);
                writeString(out, schema.id.schema());
                writeString(out, schema.id.table());
                out.writeByte(schema.identity.code());
                out.writeShort(schema.columns.size());
                for (int i = 0; i < schema.columns.size(); i++) {
                    final ColumnDef column = schema.columns.get(i);
                    out.writeByte(keys.contains(i) ? 1 : 0);
                    writeString(out, column.name);
                    out.writeInt(column.type.getOid());
                    out.writeInt(column.typeModifier);
                }
            }));
        }

        private ByteBuffer rowMessage(Change change) {
            final TableSchema schema = change.schema;
            final Set<Integer> keys = schema.identityPositions();
            final boolean full = schema.identity == ReplicaIdentity.FULL;
            return message(out -> {
                switch (change.operation) {
                    case 'I':
                        out.writeByte('I');
                        out.writeInt(schema.relationId);
                        out.writeByte('N');
                        writeTuple(out, change.newRow, null);
                        break;
                    case 'U':
                        out.writeByte('U');
                        out.writeInt(schema.relationId);
                        if (full) {
                            out.writeByte('O');
                            writeTuple(out, change.oldRow, null);
                        }
                        else if (keyChanged(keys, change.oldRow, change.newRow)) {
                            out.writeByte('K');
                            writeTuple(out, change.oldRow, keys);
                        }
                        out.writeByte('N');
                        writeNewTuple(out, change.oldRow, change.newRow, full ? Collections.emptySet() : keys);
                        break;
                    case 'D':
                        out.writeByte('D');
                        out.writeInt(schema.relationId);
                        out.writeByte(full ? 'O' : 'K');
                        writeTuple(out, change.oldRow, full ? null : keys);
                        break;
                    default:
                        throw new IllegalStateException("Unknown change " + change.operation);
                }
            });
        }

        private boolean keyChanged(Set<Integer> keys, String[] oldRow, String[] newRow) {
            for (int position : keys) {
                if (!Objects.equals(oldRow[position], newRow[position])) {
                    return true;
                }
            }
            return false;
        }

        /**
         * @param only the positions to send, all others are sent as null; null to send all values
         */
        private void writeTuple(DataOutputStream out, String[] values, Set<Integer> only) throws IOException {
            out.writeShort(values.length);
            for (int i = 0; i < values.length; i++) {
                if (only != null && !only.contains(i)) {
                    out.writeByte('n');
                }
                else {
                    writeValue(out, values[i]);
                }
            }
        }

        private void writeNewTuple(DataOutputStream out, String[] oldValues, String[] newValues, Set<Integer> keys) throws IOException {
            out.writeShort(newValues.length);
            for (int i = 0; i < newValues.length; i++) {
                final String value = newValues[i];
                if (!keys.contains(i) && value != null && value.length() > TOAST_THRESHOLD && value.equals(oldValues[i])) {
                    out.writeByte('u');
                }
                else {
                    writeValue(out, value);
                }
            }
        }

        private void writeValue(DataOutputStream out, String value) throws IOException {
            if (value == null) {
                out.writeByte('n');
                return;
            }
            final byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
            out.writeByte('t');
            out.writeInt(bytes.length);
            out.write(bytes);
        }

        private void writeString(DataOutputStream out, String value) throws IOException {
            out.write(value.getBytes(StandardCharsets.UTF_8));
            out.writeByte(0);
        }
    }

    @FunctionalInterface
    private interface MessageWriter {
        void write(DataOutputStream out) throws IOException;
    }

    private static ByteBuffer message(MessageWriter writer) {
        final ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (DataOutputStream out = new DataOutputStream(bytes)) {
            writer.write(out);
        }
        catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return ByteBuffer.wrap(bytes.toByteArray());
    }
}
