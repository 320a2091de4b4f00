/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgmirror.relational;

import io.pgmirror.annotation.NotThreadSafe;

/**
 * A mutable builder of {@link Column} definitions.
 */
@NotThreadSafe
public final class ColumnEditor {

    private String name;
    private int position = 1;
    private int typeOid;
    private String typeName;
    private int typeModifier = -1;
    private int arrayDimensions;
    private boolean optional = true;

    ColumnEditor() {
    }

    public ColumnEditor name(String name) {
        this.name = name;
        return this;
    }

    public ColumnEditor position(int position) {
        this.position = position;
        return this;
    }

    public ColumnEditor type(String typeName, int typeOid) {
        this.typeName = typeName;
        this.typeOid = typeOid;
        return this;
    }

    public ColumnEditor typeModifier(int typeModifier) {
        this.typeModifier = typeModifier;
        return this;
    }

    public ColumnEditor arrayDimensions(int arrayDimensions) {
        this.arrayDimensions = arrayDimensions;
        return this;
    }

    public ColumnEditor optional(boolean optional) {
        this.optional = optional;
        return this;
    }

    public Column create() {
        return new Column(name, position, typeOid, typeName, typeModifier, arrayDimensions, optional);
    }
}
