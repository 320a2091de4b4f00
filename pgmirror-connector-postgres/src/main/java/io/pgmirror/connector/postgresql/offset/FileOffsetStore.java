/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgmirror.connector.postgresql.offset;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import io.pgmirror.annotation.ThreadSafe;
import io.pgmirror.connector.postgresql.TableDescriptor;
import io.pgmirror.connector.postgresql.TableState;
import io.pgmirror.connector.postgresql.connection.Lsn;
import io.pgmirror.connector.postgresql.connection.ReplicaIdentityInfo;
import io.pgmirror.connector.postgresql.connection.ReplicaIdentityInfo.ReplicaIdentity;
import io.pgmirror.relational.Column;
import io.pgmirror.relational.TableId;

/**
 * An {@link OffsetStore} keeping the state as a JSON document in a local file.
 * <p>
 * Every save writes a sibling temporary file and moves it over the previous one, so a crash leaves either the old or
 * the new state behind, never a mix of both.
 */
@ThreadSafe
public class FileOffsetStore implements OffsetStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(FileOffsetStore.class);

    private static final int FORMAT_VERSION = 1;

    private final Path path;
    private final ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    public FileOffsetStore(Path path) {
        this.path = path;
    }

    public Path path() {
        return path;
    }

    @Override
    public synchronized Optional<OffsetState> load() {
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        final JsonNode document;
        try {
            final byte[] content = Files.readAllBytes(path);
            if (content.length == 0) {
                return Optional.empty();
            }
            document = mapper.readTree(content);
        }
        catch (JsonProcessingException e) {
            throw new OffsetStoreCorruptedException("Offset file " + path + " is not valid JSON", e);
        }
        catch (IOException e) {
            throw new OffsetStoreException("Unable to read offset file " + path, e);
        }
        final OffsetState state = read(document);
        LOGGER.info("Loaded {} from {}", state, path);
        return Optional.of(state);
    }

    @Override
    public synchronized void save(OffsetState state) {
        final Path temporary = path.resolveSibling(path.getFileName() + ".tmp");
        try {
            if (path.getParent() != null && !Files.exists(path.getParent())) {
                Files.createDirectories(path.getParent());
            }
            Files.write(temporary, mapper.writeValueAsBytes(write(state)));
            try {
                Files.move(temporary, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            }
            catch (AtomicMoveNotSupportedException e) {
                Files.move(temporary, path, StandardCopyOption.REPLACE_EXISTING);
            }
        }
        catch (IOException e) {
            throw new OffsetStoreException("Unable to write offset file " + path, e);
        }
        LOGGER.trace("Saved {} to {}", state, path);
    }

    @Override
    public synchronized void clear() {
        try {
            Files.deleteIfExists(path);
        }
        catch (IOException e) {
            throw new OffsetStoreException("Unable to delete offset file " + path, e);
        }
    }

    private ObjectNode write(OffsetState state) {
        final ObjectNode document = mapper.createObjectNode();
        document.put("version", FORMAT_VERSION);
        document.put("slot", state.slotName());
        document.put("confirmed_lsn", state.confirmedLsn().asLong());
        final ArrayNode tables = document.putArray("tables");
        for (TableDescriptor descriptor : state.tables()) {
            tables.add(write(descriptor));
        }
        return document;
    }

    private ObjectNode write(TableDescriptor descriptor) {
        final ObjectNode table = mapper.createObjectNode();
        table.put("schema", descriptor.id().schema());
        table.put("table", descriptor.id().table());
        if (!descriptor.destinationId().equals(descriptor.id())) {
            table.put("destination_schema", descriptor.destinationId().schema());
            table.put("destination_table", descriptor.destinationId().table());
        }
        table.put("generation", descriptor.generation());
        table.put("state", descriptor.state().name());
        if (descriptor.skipReason() != null) {
            table.put("skip_reason", descriptor.skipReason());
        }
        table.put("applied_lsn", descriptor.appliedLsn().asLong());
        table.put("relation_id", descriptor.relationId());
        if (descriptor.replicaIdentity() != null) {
            table.put("replica_identity", String.valueOf(descriptor.replicaIdentity().getReplicaIdentity().code()));
            if (descriptor.replicaIdentity().getIndexName() != null) {
                table.put("replica_identity_index", descriptor.replicaIdentity().getIndexName());
            }
        }
        final ArrayNode identity = table.putArray("identity");
        descriptor.identityColumns().forEach(identity::add);
        final ArrayNode columns = table.putArray("columns");
        for (Column column : descriptor.columns()) {
            final ObjectNode node = columns.addObject();
            node.put("name", column.name());
            node.put("position", column.position());
            node.put("type_oid", column.typeOid());
            node.put("type_name", column.typeName());
            node.put("type_modifier", column.typeModifier());
            node.put("array_dimensions", column.arrayDimensions());
            node.put("optional", column.isOptional());
        }
        table.put("fingerprint", descriptor.fingerprint());
        return table;
    }

    private OffsetState read(JsonNode document) {
        final int version = required(document, "version").asInt();
        if (version != FORMAT_VERSION) {
            throw new OffsetStoreCorruptedException("Offset file " + path + " has unsupported format version " + version);
        }
        final List<TableDescriptor> tables = new ArrayList<>();
        for (JsonNode table : required(document, "tables")) {
            tables.add(readTable(table));
        }
        return new OffsetState(required(document, "slot").asText(), Lsn.valueOf(required(document, "confirmed_lsn").asLong()), tables);
    }

    private TableDescriptor readTable(JsonNode table) {
        final TableId id = new TableId(required(table, "schema").asText(), required(table, "table").asText());
        final TableDescriptor.Builder builder = TableDescriptor.builder(id)
                .generation(required(table, "generation").asLong())
                .appliedLsn(Lsn.valueOf(required(table, "applied_lsn").asLong()))
                .relationId(required(table, "relation_id").asInt());
        if (table.hasNonNull("destination_table")) {
            builder.destinationId(new TableId(required(table, "destination_schema").asText(), table.get("destination_table").asText()));
        }
        try {
            builder.state(TableState.valueOf(required(table, "state").asText()));
            if (table.hasNonNull("replica_identity")) {
                final String code = table.get("replica_identity").asText();
                if (code.length() != 1) {
                    throw new IllegalArgumentException("Unknown replica identity '" + code + "'");
                }
                final String index = table.hasNonNull("replica_identity_index") ? table.get("replica_identity_index").asText() : null;
                builder.replicaIdentity(new ReplicaIdentityInfo(ReplicaIdentity.parse(code.charAt(0)), index));
            }
        }
        catch (IllegalArgumentException e) {
            throw new OffsetStoreCorruptedException("Offset file " + path + " has an invalid entry for table " + id, e);
        }
        if (table.hasNonNull("skip_reason")) {
            builder.skipReason(table.get("skip_reason").asText());
        }
        final List<Integer> identity = new ArrayList<>();
        for (JsonNode position : required(table, "identity")) {
            identity.add(position.asInt());
        }
        final List<Column> columns = new ArrayList<>();
        for (JsonNode column : required(table, "columns")) {
            columns.add(Column.editor()
                    .name(required(column, "name").asText())
                    .position(required(column, "position").asInt())
                    .type(column.hasNonNull("type_name") ? column.get("type_name").asText() : null, required(column, "type_oid").asInt())
                    .typeModifier(required(column, "type_modifier").asInt())
                    .arrayDimensions(required(column, "array_dimensions").asInt())
                    .optional(required(column, "optional").asBoolean())
                    .create());
        }
        for (Integer position : identity) {
            if (position < 0 || position >= columns.size()) {
                throw new OffsetStoreCorruptedException("Offset file " + path + " has an identity column outside of the columns of table " + id);
            }
        }
        final TableDescriptor descriptor = builder.columns(columns).identityColumns(identity).build();
        final String fingerprint = required(table, "fingerprint").asText();
        if (!fingerprint.equals(descriptor.fingerprint())) {
            throw new OffsetStoreCorruptedException("Offset file " + path + " has a fingerprint mismatch for table " + id);
        }
        return descriptor;
    }

    private JsonNode required(JsonNode node, String field) {
        final JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            throw new OffsetStoreCorruptedException("Offset file " + path + " misses the '" + field + "' field");
        }
        return value;
    }
}
