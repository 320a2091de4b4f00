/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgmirror.destination;

/**
 * Stands in for a column value that the source did not send because it was stored out of line and not modified.
 * A destination receiving it keeps whatever value it already holds for that column.
 */
public final class UnchangedToastedPlaceholder {

    private static final UnchangedToastedPlaceholder INSTANCE = new UnchangedToastedPlaceholder();

    public static UnchangedToastedPlaceholder getInstance() {
        return INSTANCE;
    }

    private UnchangedToastedPlaceholder() {
    }

    @Override
    public String toString() {
        return "__unchanged_toast_value";
    }
}
