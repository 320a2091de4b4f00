/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgmirror.connector.postgresql.offset;

import java.util.Optional;

/**
 * Keeps the {@link OffsetState} of a replicated database across restarts.
 */
public interface OffsetStore {

    /**
     * Read the last saved state.
     *
     * @return the state, or empty if nothing was saved yet
     * @throws OffsetStoreCorruptedException if a state exists but cannot be read
     */
    Optional<OffsetState> load();

    /**
     * Replace the saved state. When this method returns the state survives a crash.
     *
     * @throws OffsetStoreException if the state could not be written
     */
    void save(OffsetState state);

    /**
     * Forget the saved state.
     */
    void clear();
}
