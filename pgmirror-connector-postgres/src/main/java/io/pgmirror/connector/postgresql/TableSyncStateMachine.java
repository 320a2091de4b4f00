/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgmirror.connector.postgresql;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.pgmirror.annotation.ThreadSafe;
import io.pgmirror.connector.postgresql.connection.Lsn;
import io.pgmirror.relational.TableId;

/**
 * Owns the descriptors of all replicated tables and moves them through their lifecycle:
 * <pre>
 *   NOT_LOADED --&gt; SNAPSHOTTING --&gt; STREAMING (--&gt; STREAMING on every applied batch)
 *        \______________\______________\_____&gt; SKIPPED
 * </pre>
 * Nothing leaves {@link TableState#SKIPPED}; adding the table again replaces its descriptor with a new
 * {@link TableState#NOT_LOADED} one. All changes are serialized by this class and readers only ever see immutable
 * descriptors.
 */
@ThreadSafe
public class TableSyncStateMachine {

    private static final Logger LOGGER = LoggerFactory.getLogger(TableSyncStateMachine.class);

    /**
     * Notified after every change of a descriptor, outside of the machine's lock.
     */
    @FunctionalInterface
    public interface Listener {
        /**
         * @param previous the descriptor before the change, null if the table was added
         * @param current the descriptor after the change, null if the table was removed
         */
        void onTransition(TableDescriptor previous, TableDescriptor current);
    }

    private final Map<TableId, TableDescriptor> tables = new LinkedHashMap<>();
    private final List<Listener> listeners = new CopyOnWriteArrayList<>();
    private long lastGeneration;

    public void addListener(Listener listener) {
        listeners.add(listener);
    }

    /**
     * Add a table, replacing any previous descriptor of it.
     *
     * @return the new {@link TableState#NOT_LOADED} descriptor
     */
    public TableDescriptor add(TableId tableId) {
        final TableDescriptor previous;
        final TableDescriptor current;
        synchronized (this) {
            previous = tables.get(tableId);
            current = TableDescriptor.notLoaded(tableId, ++lastGeneration);
            tables.put(tableId, current);
        }
        LOGGER.info("Table {} added for replication", tableId);
        notifyListeners(previous, current);
        return current;
    }

    /**
     * Put back a descriptor read from the offset store.
     */
    public TableDescriptor restore(TableDescriptor descriptor) {
        final TableDescriptor restored;
        synchronized (this) {
            lastGeneration = Math.max(lastGeneration, descriptor.generation());
            restored = descriptor;
            tables.put(descriptor.id(), restored);
        }
        LOGGER.debug("Restored {}", restored);
        notifyListeners(null, restored);
        return restored;
    }

    public Optional<TableDescriptor> remove(TableId tableId) {
        final TableDescriptor previous;
        synchronized (this) {
            previous = tables.remove(tableId);
        }
        if (previous != null) {
            LOGGER.info("Table {} removed from replication", tableId);
            notifyListeners(previous, null);
        }
        return Optional.ofNullable(previous);
    }

    /**
     * Begin (or restart) the initial load of the table.
     *
     * @throws IllegalStateException if the table is not waiting to be loaded
     */
    public TableDescriptor startSnapshot(TableId tableId, long generation) {
        return transition(tableId, generation, current -> {
            if (current.state() != TableState.NOT_LOADED && current.state() != TableState.SNAPSHOTTING) {
                throw illegal(current, TableState.SNAPSHOTTING);
            }
            return current.edit().state(TableState.SNAPSHOTTING).build();
        });
    }

    /**
     * Complete the initial load.
     *
     * @param loaded the descriptor describing the loaded table, whose applied position is the snapshot's consistent point
     * @return the streaming descriptor, or empty if the table was removed or re-added while it was loaded
     */
    public Optional<TableDescriptor> snapshotCompleted(TableDescriptor loaded) {
        try {
            return Optional.of(transition(loaded.id(), loaded.generation(), current -> {
                if (current.state() != TableState.SNAPSHOTTING) {
                    throw illegal(current, TableState.STREAMING);
                }
                return loaded.edit().state(TableState.STREAMING).skipReason(null).build();
            }));
        }
        catch (StaleGenerationException e) {
            LOGGER.info("Discarding load of table {} which changed while it was loaded", loaded.id());
            return Optional.empty();
        }
    }

    /**
     * Record that a transaction was applied to a streaming table.
     *
     * @return the updated descriptor, or empty if the table is no longer streaming in that generation
     */
    public Optional<TableDescriptor> applied(TableId tableId, long generation, Lsn lsn) {
        synchronized (this) {
            final TableDescriptor current = tables.get(tableId);
            if (current == null || current.generation() != generation || current.state() != TableState.STREAMING) {
                return Optional.empty();
            }
            if (!lsn.isAfter(current.appliedLsn())) {
                return Optional.of(current);
            }
            final TableDescriptor updated = current.edit().appliedLsn(lsn).build();
            tables.put(tableId, updated);
            return Optional.of(updated);
        }
    }

    /**
     * Record the relation id under which the replication stream refers to a streaming table.
     */
    public Optional<TableDescriptor> relationAccepted(TableId tableId, long generation, int relationId) {
        synchronized (this) {
            final TableDescriptor current = tables.get(tableId);
            if (current == null || current.generation() != generation || current.state() != TableState.STREAMING) {
                return Optional.empty();
            }
            if (current.relationId() == relationId) {
                return Optional.of(current);
            }
            final TableDescriptor updated = current.edit().relationId(relationId).build();
            tables.put(tableId, updated);
            return Optional.of(updated);
        }
    }

    /**
     * Stop replicating the table.
     *
     * @param reason why the table is skipped
     * @return true if the table was skipped by this call, false if it was already skipped or is not replicated
     */
    public boolean skip(TableId tableId, String reason) {
        final Optional<TableDescriptor> current = get(tableId);
        return current.isPresent() && skip(tableId, current.get().generation(), reason);
    }

    /**
     * Skip the table only if it is still in the given generation.
     */
    public boolean skip(TableId tableId, long generation, String reason) {
        final TableDescriptor previous;
        final TableDescriptor current;
        synchronized (this) {
            previous = tables.get(tableId);
            if (previous == null || previous.generation() != generation || previous.state() == TableState.SKIPPED) {
                return false;
            }
            current = previous.edit().state(TableState.SKIPPED).skipReason(reason).build();
            tables.put(tableId, current);
        }
        LOGGER.warn("Table {} is skipped from replication stream because of {}", tableId.table(), reason);
        notifyListeners(previous, current);
        return true;
    }

    public synchronized Optional<TableDescriptor> get(TableId tableId) {
        return Optional.ofNullable(tables.get(tableId));
    }

    /**
     * @return a snapshot of all descriptors in the order the tables were added
     */
    public synchronized List<TableDescriptor> descriptors() {
        return Collections.unmodifiableList(new ArrayList<>(tables.values()));
    }

    public synchronized Map<TableId, TableState> states() {
        final Map<TableId, TableState> states = new LinkedHashMap<>();
        tables.forEach((id, descriptor) -> states.put(id, descriptor.state()));
        return Collections.unmodifiableMap(states);
    }

    @FunctionalInterface
    private interface Transition {
        TableDescriptor apply(TableDescriptor current);
    }

    private TableDescriptor transition(TableId tableId, long generation, Transition transition) {
        final TableDescriptor previous;
        final TableDescriptor current;
        synchronized (this) {
            previous = tables.get(tableId);
            if (previous == null || previous.generation() != generation) {
                throw new StaleGenerationException(tableId, generation);
            }
            current = transition.apply(previous);
            tables.put(tableId, current);
        }
        LOGGER.debug("Table {} moved from {} to {}", tableId, previous.state(), current.state());
        notifyListeners(previous, current);
        return current;
    }

    private void notifyListeners(TableDescriptor previous, TableDescriptor current) {
        for (Listener listener : listeners) {
            listener.onTransition(previous, current);
        }
    }

    private static IllegalStateException illegal(TableDescriptor current, TableState target) {
        return new IllegalStateException("Table " + current.id() + " cannot move from " + current.state() + " to " + target);
    }

    /**
     * The table was removed or added again since the caller read its descriptor.
     */
    public static class StaleGenerationException extends IllegalStateException {

        private static final long serialVersionUID = 1L;

        StaleGenerationException(TableId tableId, long generation) {
            super("Table " + tableId + " is no longer in generation " + generation);
        }
    }
}
