/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgmirror.relational;

/**
 * A function that converts the raw value of a column as read from the source into the value stored in the destination.
 */
@FunctionalInterface
public interface ValueConverter {

    /**
     * Convert the column's raw value.
     *
     * @param data the raw value; never null
     * @return the converted value
     */
    Object convert(Object data);

    /**
     * Return a new converter that returns {@code null} for {@code null} input and otherwise calls this converter.
     *
     * @return the null-safe converter; never null
     */
    default ValueConverter nullOr() {
        return (data) -> {
            if (data == null) {
                return null;
            }
            return convert(data);
        };
    }

    static ValueConverter passthrough() {
        return (data) -> data;
    }
}
