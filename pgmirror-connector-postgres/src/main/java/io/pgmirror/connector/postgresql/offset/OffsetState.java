/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgmirror.connector.postgresql.offset;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import io.pgmirror.annotation.Immutable;
import io.pgmirror.connector.postgresql.TableDescriptor;
import io.pgmirror.connector.postgresql.connection.Lsn;

/**
 * The durable state of a replicated database: the position confirmed to the source and the descriptor of every
 * replicated table. Value converters of the descriptors are not part of the state.
 */
@Immutable
public final class OffsetState {

    private final String slotName;
    private final Lsn confirmedLsn;
    private final List<TableDescriptor> tables;

    public OffsetState(String slotName, Lsn confirmedLsn, List<TableDescriptor> tables) {
        this.slotName = Objects.requireNonNull(slotName);
        this.confirmedLsn = Objects.requireNonNull(confirmedLsn);
        this.tables = Collections.unmodifiableList(new ArrayList<>(tables));
    }

    public String slotName() {
        return slotName;
    }

    /**
     * @return the position up to which every change of every streaming table is applied
     */
    public Lsn confirmedLsn() {
        return confirmedLsn;
    }

    public List<TableDescriptor> tables() {
        return tables;
    }

    @Override
    public String toString() {
        return "OffsetState{slot=" + slotName + ", confirmed=" + confirmedLsn + ", tables=" + tables.size() + "}";
    }
}
