/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgmirror.connector.postgresql.offset;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import io.pgmirror.annotation.ThreadSafe;

/**
 * An {@link OffsetStore} that keeps the state in memory, so it survives restarts of the replication but not of the
 * process.
 */
@ThreadSafe
public class MemoryOffsetStore implements OffsetStore {

    private final AtomicReference<OffsetState> state = new AtomicReference<>();

    @Override
    public Optional<OffsetState> load() {
        return Optional.ofNullable(state.get());
    }

    @Override
    public void save(OffsetState state) {
        this.state.set(state);
    }

    @Override
    public void clear() {
        state.set(null);
    }
}
