/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgmirror.connector.postgresql;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Consumer;

import org.apache.kafka.common.config.ConfigDef;
import org.apache.kafka.common.config.ConfigDef.Importance;
import org.apache.kafka.common.config.ConfigDef.Type;
import org.apache.kafka.common.config.ConfigDef.Width;

import io.pgmirror.config.Configuration;
import io.pgmirror.config.Field;
import io.pgmirror.relational.TableId;

/**
 * The configuration properties of a replicated source database.
 */
public class PostgresConnectorConfig {

    public static final String DATABASE_CONFIG_PREFIX = "database.";

    public static final String DEFAULT_SLOT_NAME = "pgmirror";
    public static final String DEFAULT_PUBLICATION_NAME = "pgmirror_publication";
    public static final String PLUGIN_NAME = "pgoutput";

    private static final String GROUP_CONNECTION = "Connection";
    private static final String GROUP_REPLICATION = "Replication";
    private static final String GROUP_SNAPSHOT = "Snapshot";
    private static final String GROUP_ADVANCED = "Advanced";

    public static final Field HOSTNAME = Field.create(DATABASE_CONFIG_PREFIX + "hostname")
            .withDisplayName("Hostname")
            .withType(Type.STRING)
            .withWidth(Width.MEDIUM)
            .withImportance(Importance.HIGH)
            .required()
            .withDescription("Resolvable hostname or IP address of the database server.");

    public static final Field PORT = Field.create(DATABASE_CONFIG_PREFIX + "port")
            .withDisplayName("Port")
            .withType(Type.INT)
            .withWidth(Width.SHORT)
            .withDefault(5432)
            .withImportance(Importance.HIGH)
            .withValidation(Field::isPositiveInteger)
            .withDescription("Port of the database server.");

    public static final Field USER = Field.create(DATABASE_CONFIG_PREFIX + "user")
            .withDisplayName("User")
            .withType(Type.STRING)
            .withWidth(Width.SHORT)
            .withImportance(Importance.HIGH)
            .required()
            .withDescription("Name of the database user to be used when connecting to the database. "
                    + "The user needs the REPLICATION attribute and must own the replicated tables to manage the publication.");

    public static final Field PASSWORD = Field.create(DATABASE_CONFIG_PREFIX + "password")
            .withDisplayName("Password")
            .withType(Type.PASSWORD)
            .withWidth(Width.SHORT)
            .withImportance(Importance.HIGH)
            .withDescription("Password of the database user to be used when connecting to the database.");

    public static final Field DATABASE_NAME = Field.create(DATABASE_CONFIG_PREFIX + "dbname")
            .withDisplayName("Database")
            .withType(Type.STRING)
            .withWidth(Width.MEDIUM)
            .withImportance(Importance.HIGH)
            .required()
            .withDescription("The name of the database from which changes are replicated.");

    public static final Field SCHEMA_NAME = Field.create("schema.name")
            .withDisplayName("Schema")
            .withType(Type.STRING)
            .withWidth(Width.MEDIUM)
            .withImportance(Importance.MEDIUM)
            .withDefault("public")
            .withDescription("The schema whose tables are replicated. Tables of the include list that are not schema-qualified "
                    + "belong to this schema.");

    public static final Field TABLE_INCLUDE_LIST = Field.create("table.include.list")
            .withDisplayName("Include Tables")
            .withType(Type.LIST)
            .withWidth(Width.LONG)
            .withImportance(Importance.HIGH)
            .withValidation(PostgresConnectorConfig::validateTableList)
            .withDescription("A comma-separated list of the tables to replicate. When empty, every table of the schema is replicated.");

    public static final Field SLOT_NAME = Field.create("slot.name")
            .withDisplayName("Slot")
            .withType(Type.STRING)
            .withWidth(Width.MEDIUM)
            .withImportance(Importance.MEDIUM)
            .withDefault(DEFAULT_SLOT_NAME)
            .withValidation(PostgresConnectorConfig::validateReplicationSlotName)
            .withDescription("The name of the Postgres logical decoding slot created for streaming changes. "
                    + "Defaults to '" + DEFAULT_SLOT_NAME + "'");

    public static final Field PUBLICATION_NAME = Field.create("publication.name")
            .withDisplayName("Publication")
            .withType(Type.STRING)
            .withWidth(Width.MEDIUM)
            .withImportance(Importance.MEDIUM)
            .withDefault(DEFAULT_PUBLICATION_NAME)
            .withDescription("The name of the Postgres publication the slot streams changes for. It is created when absent. "
                    + "Defaults to '" + DEFAULT_PUBLICATION_NAME + "'");

    public static final Field SNAPSHOT_FETCH_SIZE = Field.create("snapshot.fetch.size")
            .withDisplayName("Snapshot fetch size")
            .withType(Type.INT)
            .withWidth(Width.SHORT)
            .withImportance(Importance.MEDIUM)
            .withDefault(10240)
            .withValidation(Field::isPositiveInteger)
            .withDescription("The maximum number of rows read from the server in one round trip while loading a table.");

    public static final Field SNAPSHOT_BATCH_SIZE = Field.create("snapshot.batch.size")
            .withDisplayName("Snapshot batch size")
            .withType(Type.INT)
            .withWidth(Width.SHORT)
            .withImportance(Importance.LOW)
            .withDefault(1024)
            .withValidation(Field::isPositiveInteger)
            .withDescription("The number of rows written to the destination in one batch while loading a table.");

    public static final Field SNAPSHOT_MAX_THREADS = Field.create("snapshot.max.threads")
            .withDisplayName("Snapshot maximum threads")
            .withType(Type.INT)
            .withWidth(Width.SHORT)
            .withImportance(Importance.MEDIUM)
            .withDefault(1)
            .withValidation(Field::isPositiveInteger)
            .withDescription("The number of tables loaded in parallel.");

    public static final Field SNAPSHOT_MAX_RETRIES = Field.create("snapshot.max.retries")
            .withDisplayName("Snapshot maximum retries")
            .withType(Type.INT)
            .withWidth(Width.SHORT)
            .withImportance(Importance.LOW)
            .withDefault(3)
            .withValidation(Field::isNonNegativeInteger)
            .withDescription("How many times a load of a table that failed on a non-transient error is restarted before the table is skipped. "
                    + "Loads failing on transient errors, such as a lost connection or a serialization failure, are restarted until they succeed.");

    public static final Field SNAPSHOT_RETRY_DELAY_MS = Field.create("snapshot.retry.delay.ms")
            .withDisplayName("Snapshot retry delay (ms)")
            .withType(Type.LONG)
            .withWidth(Width.SHORT)
            .withImportance(Importance.LOW)
            .withDefault(1_000L)
            .withValidation(Field::isPositiveLong)
            .withDescription("Time to wait before the first restart of a failed table load. The wait doubles on every further failure, "
                    + "up to the retriable restart wait.");

    public static final Field MAX_QUEUE_SIZE = Field.create("max.queue.size")
            .withDisplayName("Change event buffer size")
            .withType(Type.INT)
            .withWidth(Width.SHORT)
            .withImportance(Importance.MEDIUM)
            .withDefault(64)
            .withValidation(Field::isPositiveInteger)
            .withDescription("Maximum number of batches waiting to be applied to one table. A table whose queue is full "
                    + "is caught up later by re-reading the stream, so that it never blocks other tables.");

    public static final Field MAX_BATCH_SIZE = Field.create("max.batch.size")
            .withDisplayName("Change event batch size")
            .withType(Type.INT)
            .withWidth(Width.SHORT)
            .withImportance(Importance.LOW)
            .withDefault(16)
            .withValidation(Field::isPositiveInteger)
            .withDescription("Maximum number of queued batches an applier takes at once.");

    public static final Field POLL_INTERVAL_MS = Field.create("poll.interval.ms")
            .withDisplayName("Poll interval (ms)")
            .withType(Type.LONG)
            .withWidth(Width.SHORT)
            .withImportance(Importance.MEDIUM)
            .withDefault(100L)
            .withValidation(Field::isPositiveLong)
            .withDescription("Time to wait for new change events when none are available.");

    public static final Field STATUS_UPDATE_INTERVAL_MS = Field.create("status.update.interval.ms")
            .withDisplayName("Status update interval (ms)")
            .withType(Type.INT)
            .withWidth(Width.SHORT)
            .withImportance(Importance.MEDIUM)
            .withDefault(1_000)
            .withValidation(Field::isPositiveInteger)
            .withDescription("Frequency for persisting the replication position and confirming it to the server, given in milliseconds.");

    public static final Field DESTINATION_RETRIES = Field.create("destination.retries")
            .withDisplayName("Destination retries")
            .withType(Type.INT)
            .withWidth(Width.SHORT)
            .withImportance(Importance.LOW)
            .withDefault(5)
            .withValidation(Field::isNonNegativeInteger)
            .withDescription("How many times a batch that failed to apply is retried before replication stops.");

    public static final Field DESTINATION_RETRY_DELAY_MS = Field.create("destination.retry.delay.ms")
            .withDisplayName("Destination retry delay (ms)")
            .withType(Type.LONG)
            .withWidth(Width.SHORT)
            .withImportance(Importance.LOW)
            .withDefault(500L)
            .withValidation(Field::isPositiveLong)
            .withDescription("Time to wait between two attempts to apply a batch.");

    public static final Field RETRIABLE_RESTART_WAIT = Field.create("retriable.restart.wait.ms")
            .withDisplayName("Retriable restart wait (ms)")
            .withType(Type.LONG)
            .withWidth(Width.MEDIUM)
            .withImportance(Importance.LOW)
            .withDefault(10_000L)
            .withValidation(Field::isPositiveLong)
            .withDescription("Time to wait before reconnecting after a retriable error.");

    public static final Field MAX_RETRIES_ON_ERROR = Field.create("errors.max.retries")
            .withDisplayName("The maximum number of retries")
            .withType(Type.INT)
            .withWidth(Width.MEDIUM)
            .withImportance(Importance.LOW)
            .withDefault(-1)
            .withValidation(Field::isInteger)
            .withDescription("The maximum number of retries on connection errors before failing (-1 = no limit, 0 = disabled, > 0 = num of retries).");

    public static final Field OFFSET_STORAGE_FILE_FILENAME = Field.create("offset.storage.file.filename")
            .withDisplayName("Offset file")
            .withType(Type.STRING)
            .withWidth(Width.LONG)
            .withImportance(Importance.HIGH)
            .withDescription("The file where the replication position and the state of every table are stored. "
                    + "When not set the state is kept in memory only.");

    public static final Field SCHEMA_CHANGE_AUTO_RELOAD = Field.create("schema.change.auto.reload")
            .withDisplayName("Reload tables on schema change")
            .withType(Type.BOOLEAN)
            .withWidth(Width.SHORT)
            .withImportance(Importance.LOW)
            .withDefault(false)
            .withDescription("Whether a table skipped because of an incompatible schema change is reloaded from scratch "
                    + "instead of staying skipped until it is added again.");

    public static final Field.Set ALL_FIELDS = Field.setOf(
            HOSTNAME, PORT, USER, PASSWORD, DATABASE_NAME,
            SCHEMA_NAME, TABLE_INCLUDE_LIST, SLOT_NAME, PUBLICATION_NAME,
            SNAPSHOT_FETCH_SIZE, SNAPSHOT_BATCH_SIZE, SNAPSHOT_MAX_THREADS, SNAPSHOT_MAX_RETRIES, SNAPSHOT_RETRY_DELAY_MS,
            MAX_QUEUE_SIZE, MAX_BATCH_SIZE, POLL_INTERVAL_MS, STATUS_UPDATE_INTERVAL_MS,
            DESTINATION_RETRIES, DESTINATION_RETRY_DELAY_MS, RETRIABLE_RESTART_WAIT, MAX_RETRIES_ON_ERROR,
            OFFSET_STORAGE_FILE_FILENAME, SCHEMA_CHANGE_AUTO_RELOAD);

    /**
     * The configuration definition, for tooling built on Kafka's configuration support.
     */
    public static ConfigDef configDef() {
        final ConfigDef configDef = new ConfigDef();
        int order = 0;
        for (Field field : Field.setOf(HOSTNAME, PORT, USER, PASSWORD, DATABASE_NAME)) {
            field.addTo(configDef, GROUP_CONNECTION, ++order);
        }
        order = 0;
        for (Field field : Field.setOf(SCHEMA_NAME, TABLE_INCLUDE_LIST, SLOT_NAME, PUBLICATION_NAME, STATUS_UPDATE_INTERVAL_MS,
                OFFSET_STORAGE_FILE_FILENAME, SCHEMA_CHANGE_AUTO_RELOAD)) {
            field.addTo(configDef, GROUP_REPLICATION, ++order);
        }
        order = 0;
        for (Field field : Field.setOf(SNAPSHOT_FETCH_SIZE, SNAPSHOT_BATCH_SIZE, SNAPSHOT_MAX_THREADS, SNAPSHOT_MAX_RETRIES,
                SNAPSHOT_RETRY_DELAY_MS)) {
            field.addTo(configDef, GROUP_SNAPSHOT, ++order);
        }
        order = 0;
        for (Field field : Field.setOf(MAX_QUEUE_SIZE, MAX_BATCH_SIZE, POLL_INTERVAL_MS, DESTINATION_RETRIES, DESTINATION_RETRY_DELAY_MS,
                RETRIABLE_RESTART_WAIT, MAX_RETRIES_ON_ERROR)) {
            field.addTo(configDef, GROUP_ADVANCED, ++order);
        }
        return configDef;
    }

    private final Configuration config;

    public PostgresConnectorConfig(Configuration config) {
        this.config = config;
    }

    public Configuration getConfig() {
        return config;
    }

    /**
     * Validate all fields, passing each problem to the consumer.
     *
     * @return true if the configuration is valid
     */
    public boolean validateAndRecord(Consumer<String> problems) {
        return config.validateAndRecord(ALL_FIELDS, problems);
    }

    public String hostname() {
        return config.getString(HOSTNAME);
    }

    public int port() {
        return config.getInteger(PORT);
    }

    public String user() {
        return config.getString(USER);
    }

    public String password() {
        return config.getString(PASSWORD);
    }

    public String databaseName() {
        return config.getString(DATABASE_NAME);
    }

    /**
     * @return the logical name of the replicated database, used in thread names and log messages
     */
    public String getLogicalName() {
        final String name = databaseName();
        return name != null ? name : "postgres";
    }

    public String schemaName() {
        return config.getString(SCHEMA_NAME);
    }

    /**
     * @return the configured tables, qualified with {@link #schemaName()} where they were not; empty for whole-database mode
     */
    public List<TableId> tableIncludeList() {
        final List<TableId> tables = new ArrayList<>();
        for (String entry : config.getList(TABLE_INCLUDE_LIST)) {
            final TableId id = TableId.parse(entry);
            tables.add(id.schema() == null ? new TableId(schemaName(), id.table()) : id);
        }
        return Collections.unmodifiableList(tables);
    }

    public String slotName() {
        return config.getString(SLOT_NAME);
    }

    public String publicationName() {
        return config.getString(PUBLICATION_NAME);
    }

    public int snapshotFetchSize() {
        return config.getInteger(SNAPSHOT_FETCH_SIZE);
    }

    public int snapshotBatchSize() {
        return config.getInteger(SNAPSHOT_BATCH_SIZE);
    }

    public int snapshotMaxThreads() {
        return config.getInteger(SNAPSHOT_MAX_THREADS);
    }

    public int snapshotMaxRetries() {
        return config.getInteger(SNAPSHOT_MAX_RETRIES);
    }

    public Duration snapshotRetryDelay() {
        return config.getDuration(SNAPSHOT_RETRY_DELAY_MS, ChronoUnit.MILLIS);
    }

    public int getMaxQueueSize() {
        return config.getInteger(MAX_QUEUE_SIZE);
    }

    public int getMaxBatchSize() {
        return config.getInteger(MAX_BATCH_SIZE);
    }

    public Duration getPollInterval() {
        return config.getDuration(POLL_INTERVAL_MS, ChronoUnit.MILLIS);
    }

    public Duration statusUpdateInterval() {
        return Duration.ofMillis(config.getInteger(STATUS_UPDATE_INTERVAL_MS));
    }

    public int destinationRetries() {
        return config.getInteger(DESTINATION_RETRIES);
    }

    public Duration destinationRetryDelay() {
        return config.getDuration(DESTINATION_RETRY_DELAY_MS, ChronoUnit.MILLIS);
    }

    public Duration getRetriableRestartWait() {
        return config.getDuration(RETRIABLE_RESTART_WAIT, ChronoUnit.MILLIS);
    }

    public int getMaxRetriesOnError() {
        return config.getInteger(MAX_RETRIES_ON_ERROR);
    }

    /**
     * @return the offset file, or null if the state is only kept in memory
     */
    public Path offsetFile() {
        final String file = config.getString(OFFSET_STORAGE_FILE_FILENAME);
        return file == null || file.trim().isEmpty() ? null : Paths.get(file.trim());
    }

    public boolean schemaChangeAutoReload() {
        return config.getBoolean(SCHEMA_CHANGE_AUTO_RELOAD);
    }

    private static int validateReplicationSlotName(Configuration config, Field field, Field.ValidationOutput problems) {
        final String name = config.getString(field);
        int errors = 0;
        if (name != null) {
            if (!name.matches("[a-z0-9_]{1,63}")) {
                problems.accept(field, name, "Valid replication slot name must contain only digits, lowercase characters and underscores with length <= 63");
                ++errors;
            }
        }
        return errors;
    }

    private static int validateTableList(Configuration config, Field field, Field.ValidationOutput problems) {
        int errors = 0;
        for (String entry : config.getList(field)) {
            if (TableId.parse(entry) == null) {
                problems.accept(field, entry, "A table name of the form 'table' or 'schema.table' is expected");
                ++errors;
            }
        }
        return errors;
    }
}
