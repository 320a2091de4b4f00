/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgmirror.connector.postgresql;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.pgmirror.annotation.ThreadSafe;
import io.pgmirror.connector.postgresql.connection.PostgresConnection;

/**
 * A registry of types supported by a PostgreSQL instance. Allows lookup of the types according to OID.
 * <p>
 * The registry starts out with the built-in types that the value mapping knows about and is primed with the
 * types of the source database, including user defined enums, when a connection is available.
 */
@ThreadSafe
public class TypeRegistry {

    private static final Logger LOGGER = LoggerFactory.getLogger(TypeRegistry.class);

    private static final List<PostgresType> BUILTIN_TYPES = Collections.unmodifiableList(builtinTypes());

    /**
     * Reads a single type from the database.
     */
    @FunctionalInterface
    public interface TypeLoader {
        Optional<PostgresType> readType(int oid) throws SQLException;
    }

    private final Map<Integer, PostgresType> oidToType = new ConcurrentHashMap<>();

    public TypeRegistry() {
        BUILTIN_TYPES.forEach(this::addType);
    }

    private static List<PostgresType> builtinTypes() {
        final List<PostgresType> types = new ArrayList<>();
        types.add(PostgresType.base(PgOid.BOOL, "bool", 'B'));
        types.add(PostgresType.base(PgOid.INT2, "int2", 'N'));
        types.add(PostgresType.base(PgOid.INT4, "int4", 'N'));
        types.add(PostgresType.base(PgOid.INT8, "int8", 'N'));
        types.add(PostgresType.base(PgOid.FLOAT4, "float4", 'N'));
        types.add(PostgresType.base(PgOid.FLOAT8, "float8", 'N'));
        types.add(PostgresType.base(PgOid.NUMERIC, "numeric", 'N'));
        types.add(PostgresType.base(PgOid.TEXT, "text", 'S'));
        types.add(PostgresType.base(PgOid.VARCHAR, "varchar", 'S'));
        types.add(PostgresType.base(PgOid.BPCHAR, "bpchar", 'S'));
        types.add(PostgresType.base(PgOid.CHAR, "char", 'Z'));
        types.add(PostgresType.base(PgOid.NAME, "name", 'S'));
        types.add(PostgresType.base(PgOid.DATE, "date", 'D'));
        types.add(PostgresType.base(PgOid.TIME, "time", 'D'));
        types.add(PostgresType.base(PgOid.TIMESTAMP, "timestamp", 'D'));
        types.add(PostgresType.base(PgOid.TIMESTAMPTZ, "timestamptz", 'D'));
        types.add(PostgresType.base(PgOid.BYTEA, "bytea", 'U'));
        types.add(PostgresType.base(PgOid.UUID, "uuid", 'U'));
        types.add(PostgresType.base(PgOid.JSON, "json", 'U'));
        types.add(PostgresType.base(PgOid.JSONB_OID, "jsonb", 'U'));

        types.add(PostgresType.array(PgOid.BOOL_ARRAY, "_bool", PgOid.BOOL));
        types.add(PostgresType.array(PgOid.INT2_ARRAY, "_int2", PgOid.INT2));
        types.add(PostgresType.array(PgOid.INT4_ARRAY, "_int4", PgOid.INT4));
        types.add(PostgresType.array(PgOid.INT8_ARRAY, "_int8", PgOid.INT8));
        types.add(PostgresType.array(PgOid.FLOAT4_ARRAY, "_float4", PgOid.FLOAT4));
        types.add(PostgresType.array(PgOid.FLOAT8_ARRAY, "_float8", PgOid.FLOAT8));
        types.add(PostgresType.array(PgOid.NUMERIC_ARRAY, "_numeric", PgOid.NUMERIC));
        types.add(PostgresType.array(PgOid.TEXT_ARRAY, "_text", PgOid.TEXT));
        types.add(PostgresType.array(PgOid.VARCHAR_ARRAY, "_varchar", PgOid.VARCHAR));
        types.add(PostgresType.array(PgOid.BPCHAR_ARRAY, "_bpchar", PgOid.BPCHAR));
        types.add(PostgresType.array(PgOid.CHAR_ARRAY, "_char", PgOid.CHAR));
        types.add(PostgresType.array(PgOid.NAME_ARRAY, "_name", PgOid.NAME));
        types.add(PostgresType.array(PgOid.DATE_ARRAY, "_date", PgOid.DATE));
        types.add(PostgresType.array(PgOid.TIME_ARRAY, "_time", PgOid.TIME));
        types.add(PostgresType.array(PgOid.TIMESTAMP_ARRAY, "_timestamp", PgOid.TIMESTAMP));
        types.add(PostgresType.array(PgOid.TIMESTAMPTZ_ARRAY, "_timestamptz", PgOid.TIMESTAMPTZ));
        types.add(PostgresType.array(PgOid.BYTEA_ARRAY, "_bytea", PgOid.BYTEA));
        types.add(PostgresType.array(PgOid.UUID_ARRAY, "_uuid", PgOid.UUID));
        types.add(PostgresType.array(PgOid.JSON_ARRAY, "_json", PgOid.JSON));
        types.add(PostgresType.array(PgOid.JSONB_ARRAY, "_jsonb", PgOid.JSONB_OID));
        return types;
    }

    /**
     * @return the built-in types every registry starts with
     */
    public static List<PostgresType> getBuiltinTypes() {
        return BUILTIN_TYPES;
    }

    private void addType(PostgresType type) {
        oidToType.put(type.getOid(), type);
    }

    /**
     * Prime the registry with all types of the database the connection points to.
     *
     * @param connection the catalog connection; may not be null
     * @throws SQLException if the types cannot be read
     */
    public void prime(PostgresConnection connection) throws SQLException {
        final List<PostgresType> types = connection.readTypes();
        types.forEach(this::addType);
        LOGGER.debug("Type registry primed with {} types", types.size());
    }

    /**
     * @param oid - PostgreSQL OID
     * @return type associated with the given OID, or {@link PostgresType#UNKNOWN}
     */
    public PostgresType get(int oid) {
        final PostgresType type = oidToType.get(oid);
        if (type == null) {
            LOGGER.debug("Unknown OID {} requested", oid);
            return PostgresType.UNKNOWN;
        }
        return type;
    }

    /**
     * Look up the type, reading it from the database when it is not known yet, such as an enum created after the
     * registry was primed.
     *
     * @param oid - PostgreSQL OID
     * @param loader reads unknown types from the database
     * @return the type, or {@link PostgresType#UNKNOWN} if the database does not know it either
     * @throws SQLException if the type cannot be read
     */
    public PostgresType resolve(int oid, TypeLoader loader) throws SQLException {
        final PostgresType type = oidToType.get(oid);
        if (type != null) {
            return type;
        }
        LOGGER.trace("Type OID '{}' not cached, attempting to lookup from database.", oid);
        final Optional<PostgresType> loaded = loader.readType(oid);
        if (!loaded.isPresent()) {
            return PostgresType.UNKNOWN;
        }
        addType(loaded.get());
        if (loaded.get().isArrayType()) {
            resolve(loaded.get().getElementOid(), loader);
        }
        return loaded.get();
    }

    /**
     * Register a type; used when types are learned outside of {@link #prime(PostgresConnection)}.
     */
    public void register(PostgresType type) {
        addType(type);
    }
}
