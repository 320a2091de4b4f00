/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgmirror.connector.postgresql.connection.pgoutput;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import io.pgmirror.annotation.Immutable;
import io.pgmirror.connector.postgresql.connection.ReplicationMessage;

/**
 * One or more tables were truncated.
 */
@Immutable
public final class TruncateMessage implements ReplicationMessage {

    private final List<Integer> relationIds;
    private final boolean cascade;
    private final boolean restartIdentity;

    public TruncateMessage(List<Integer> relationIds, boolean cascade, boolean restartIdentity) {
        this.relationIds = Collections.unmodifiableList(new ArrayList<>(relationIds));
        this.cascade = cascade;
        this.restartIdentity = restartIdentity;
    }

    @Override
    public Operation getOperation() {
        return Operation.TRUNCATE;
    }

    public List<Integer> getRelationIds() {
        return relationIds;
    }

    public boolean isCascade() {
        return cascade;
    }

    public boolean isRestartIdentity() {
        return restartIdentity;
    }

    @Override
    public String toString() {
        return "TRUNCATE" + relationIds;
    }
}
