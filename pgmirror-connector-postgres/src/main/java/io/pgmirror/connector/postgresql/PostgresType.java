/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgmirror.connector.postgresql;

import java.util.Objects;

import io.pgmirror.annotation.Immutable;

/**
 * A data type of a PostgreSQL instance, as described by {@code pg_type}.
 */
@Immutable
public final class PostgresType {

    public static final PostgresType UNKNOWN = new PostgresType(-1, "unknown", 'X', 0);

    private static final char CATEGORY_ARRAY = 'A';
    private static final char CATEGORY_ENUM = 'E';

    private final int oid;
    private final String name;
    private final char category;
    private final int elementOid;

    public PostgresType(int oid, String name, char category, int elementOid) {
        this.oid = oid;
        this.name = Objects.requireNonNull(name);
        this.category = category;
        this.elementOid = elementOid;
    }

    public static PostgresType base(int oid, String name, char category) {
        return new PostgresType(oid, name, category, 0);
    }

    public static PostgresType array(int oid, String name, int elementOid) {
        return new PostgresType(oid, name, CATEGORY_ARRAY, elementOid);
    }

    public static PostgresType enumType(int oid, String name) {
        return new PostgresType(oid, name, CATEGORY_ENUM, 0);
    }

    public int getOid() {
        return oid;
    }

    public String getName() {
        return name;
    }

    /**
     * @return the {@code typcategory} code of the type
     */
    public char getCategory() {
        return category;
    }

    /**
     * @return the oid of the element type of an array type, 0 otherwise
     */
    public int getElementOid() {
        return elementOid;
    }

    public boolean isArrayType() {
        return category == CATEGORY_ARRAY && elementOid != 0;
    }

    public boolean isEnumType() {
        return category == CATEGORY_ENUM;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        PostgresType that = (PostgresType) o;
        return oid == that.oid && category == that.category && elementOid == that.elementOid && name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return oid;
    }

    @Override
    public String toString() {
        return "PostgresType [name=" + name + ", oid=" + oid + (isArrayType() ? ", element=" + elementOid : "") + "]";
    }
}
