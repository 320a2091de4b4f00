/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgmirror.connector.postgresql;

import java.io.IOException;
import java.sql.SQLException;
import java.util.Set;
import java.util.function.Consumer;

import io.pgmirror.connector.postgresql.connection.ReplicationSlotLostException;
import io.pgmirror.connector.postgresql.connection.ReplicationStreamException;
import io.pgmirror.connector.postgresql.connection.RetriableReplicationException;
import io.pgmirror.connector.postgresql.offset.OffsetStoreCorruptedException;
import io.pgmirror.destination.DestinationException;
import io.pgmirror.pipeline.ErrorHandler;
import io.pgmirror.util.Collect;

/**
 * Error handler for Postgres.
 * <p>
 * Lost connections are retriable, and so are SQL errors whose state denotes a connection problem, a server that
 * is shutting down or out of resources, or a transaction rolled back by a serialization failure or a deadlock.
 * A corrupt stream, a lost slot and a corrupt offset file are fatal whatever caused them.
 */
public class PostgresErrorHandler extends ErrorHandler {

    /**
     * Connection exceptions, insufficient resources, operator intervention and system errors, then serialization
     * failures and deadlocks.
     */
    private static final String[] RETRIABLE_SQL_STATES = { "08", "53", "57P", "58", "40001", "40P01" };

    public PostgresErrorHandler(Consumer<RuntimeException> listener) {
        super(listener);
    }

    @Override
    protected Set<Class<? extends Exception>> communicationExceptions() {
        return Collect.unmodifiableSet(IOException.class, SQLException.class, RetriableReplicationException.class);
    }

    @Override
    public boolean isRetriable(Throwable throwable) {
        if (isFatal(throwable)) {
            return false;
        }
        return super.isRetriable(throwable);
    }

    /**
     * Whether repeating the work that failed with the given throwable may succeed without any change to the source
     * or the destination. Besides the retriable failures this includes failed destination writes.
     *
     * @param throwable the failure; may be null
     * @return {@code true} for a transient failure, {@code false} for a failure that repeats on every attempt
     */
    public static boolean isTransient(Throwable throwable) {
        if (throwable == null || isFatal(throwable)) {
            return false;
        }
        for (Throwable t = throwable; t != null && t.getCause() != t; t = t.getCause()) {
            if (t instanceof IOException || t instanceof SQLException || t instanceof RetriableReplicationException
                    || t instanceof DestinationException) {
                return true;
            }
        }
        return false;
    }

    private static boolean isFatal(Throwable throwable) {
        for (Throwable t = throwable; t != null && t.getCause() != t; t = t.getCause()) {
            if (t instanceof ReplicationStreamException || t instanceof ReplicationSlotLostException
                    || t instanceof OffsetStoreCorruptedException) {
                return true;
            }
            if (t instanceof SQLException && !isRetriableState(((SQLException) t).getSQLState())) {
                return true;
            }
        }
        return false;
    }

    private static boolean isRetriableState(String sqlState) {
        if (sqlState == null) {
            return true;
        }
        for (String prefix : RETRIABLE_SQL_STATES) {
            if (sqlState.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }
}
