/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgmirror.connector.postgresql.connection;

import io.pgmirror.annotation.Immutable;

/**
 * The state of a replication slot as reported by {@code pg_replication_slots}.
 */
@Immutable
public final class SlotState {

    private final String slotName;
    private final String plugin;
    private final Lsn confirmedFlushLsn;
    private final boolean active;

    public SlotState(String slotName, String plugin, Lsn confirmedFlushLsn, boolean active) {
        this.slotName = slotName;
        this.plugin = plugin;
        this.confirmedFlushLsn = confirmedFlushLsn;
        this.active = active;
    }

    public String slotName() {
        return slotName;
    }

    public String plugin() {
        return plugin;
    }

    public Lsn confirmedFlushLsn() {
        return confirmedFlushLsn;
    }

    public boolean isActive() {
        return active;
    }

    @Override
    public String toString() {
        return "SlotState [slotName=" + slotName + ", plugin=" + plugin + ", confirmedFlushLsn=" + confirmedFlushLsn
                + ", active=" + active + "]";
    }
}
