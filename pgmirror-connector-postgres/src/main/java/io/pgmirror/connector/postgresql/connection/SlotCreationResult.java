/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgmirror.connector.postgresql.connection;

import io.pgmirror.annotation.Immutable;

/**
 * The outcome of {@code CREATE_REPLICATION_SLOT ... EXPORT_SNAPSHOT}: the position from which the slot streams
 * changes and the name of a snapshot that shows the database exactly as of that position.
 * <p>
 * The snapshot can only be imported while the replication connection that created it is open and idle.
 */
@Immutable
public final class SlotCreationResult {

    private final String slotName;
    private final Lsn consistentPoint;
    private final String snapshotName;
    private final String pluginName;

    public SlotCreationResult(String slotName, Lsn consistentPoint, String snapshotName, String pluginName) {
        this.slotName = slotName;
        this.consistentPoint = consistentPoint;
        this.snapshotName = snapshotName;
        this.pluginName = pluginName;
    }

    public String slotName() {
        return slotName;
    }

    public Lsn consistentPoint() {
        return consistentPoint;
    }

    public String snapshotName() {
        return snapshotName;
    }

    public String pluginName() {
        return pluginName;
    }

    @Override
    public String toString() {
        return "SlotCreationResult [slotName=" + slotName + ", consistentPoint=" + consistentPoint + ", snapshotName="
                + snapshotName + "]";
    }
}
