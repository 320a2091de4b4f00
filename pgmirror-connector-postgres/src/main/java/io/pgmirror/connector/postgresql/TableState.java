/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgmirror.connector.postgresql;

/**
 * The replication lifecycle of a table.
 */
public enum TableState {

    /**
     * Added, but no data has been loaded yet.
     */
    NOT_LOADED,

    /**
     * The initial load is running. Changes from the replication stream are not applied yet.
     */
    SNAPSHOTTING,

    /**
     * Loaded and kept up to date from the replication stream.
     */
    STREAMING,

    /**
     * No longer replicated until it is added again. Its rows stay as they were.
     */
    SKIPPED
}
