/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgmirror.relational;

import java.util.Objects;

import io.pgmirror.annotation.Immutable;

/**
 * A column of a replicated table, described by the source type it was declared with.
 */
@Immutable
public final class Column {

    /**
     * Obtain an editor that can be used to define a column.
     *
     * @return the editor; never null
     */
    public static ColumnEditor editor() {
        return new ColumnEditor();
    }

    private final String name;
    private final int position;
    private final int typeOid;
    private final String typeName;
    private final int typeModifier;
    private final int arrayDimensions;
    private final boolean optional;

    Column(String name, int position, int typeOid, String typeName, int typeModifier, int arrayDimensions, boolean optional) {
        this.name = Objects.requireNonNull(name, "column name");
        this.position = position;
        this.typeOid = typeOid;
        this.typeName = typeName;
        this.typeModifier = typeModifier;
        this.arrayDimensions = arrayDimensions;
        this.optional = optional;
    }

    public String name() {
        return name;
    }

    /**
     * The 1-based position of this column within its table.
     */
    public int position() {
        return position;
    }

    public int typeOid() {
        return typeOid;
    }

    public String typeName() {
        return typeName;
    }

    /**
     * The type modifier, such as the packed precision and scale of a {@code numeric}, or -1 if there is none.
     */
    public int typeModifier() {
        return typeModifier;
    }

    /**
     * The declared number of array dimensions; 0 for scalar columns. Array columns always report at least 1.
     */
    public int arrayDimensions() {
        return arrayDimensions;
    }

    public boolean isOptional() {
        return optional;
    }

    public ColumnEditor edit() {
        return editor()
                .name(name)
                .position(position)
                .type(typeName, typeOid)
                .typeModifier(typeModifier)
                .arrayDimensions(arrayDimensions)
                .optional(optional);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) {
            return true;
        }
        if (obj instanceof Column) {
            Column that = (Column) obj;
            return this.name.equals(that.name)
                    && this.position == that.position
                    && this.typeOid == that.typeOid
                    && Objects.equals(this.typeName, that.typeName)
                    && this.typeModifier == that.typeModifier
                    && this.arrayDimensions == that.arrayDimensions
                    && this.optional == that.optional;
        }
        return false;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(name).append(' ').append(typeName);
        if (typeModifier >= 0) {
            sb.append('(').append(typeModifier).append(')');
        }
        for (int i = 0; i < arrayDimensions; i++) {
            sb.append("[]");
        }
        if (!optional) {
            sb.append(" NOT NULL");
        }
        return sb.toString();
    }
}
