/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgmirror.connector.postgresql;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.EOFException;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

import org.apache.kafka.connect.errors.ConnectException;
import org.apache.kafka.connect.errors.RetriableException;
import org.junit.Test;

import io.pgmirror.connector.postgresql.connection.ReplicationSlotLostException;
import io.pgmirror.connector.postgresql.connection.ReplicationStreamException;
import io.pgmirror.connector.postgresql.connection.RetriableReplicationException;
import io.pgmirror.connector.postgresql.offset.OffsetStoreCorruptedException;
import io.pgmirror.destination.DestinationException;

public class PostgresErrorHandlerTest {

    private final List<RuntimeException> reported = new ArrayList<>();
    private final PostgresErrorHandler errorHandler = new PostgresErrorHandler(reported::add);

    @Test
    public void shouldRetryConnectionProblems() {
        assertThat(errorHandler.isRetriable(new EOFException())).isTrue();
        assertThat(errorHandler.isRetriable(new RetriableReplicationException("replication connection closed"))).isTrue();
        assertThat(errorHandler.isRetriable(new SQLException("connection failure", "08006"))).isTrue();
        assertThat(errorHandler.isRetriable(new SQLException("too many connections", "53300"))).isTrue();
        assertThat(errorHandler.isRetriable(new SQLException("terminating connection due to administrator command", "57P01"))).isTrue();
        assertThat(errorHandler.isRetriable(new SQLException("I/O error", "58030"))).isTrue();
        assertThat(errorHandler.isRetriable(new IllegalStateException("wrapped", new SQLException("broken pipe", "08006")))).isTrue();
    }

    @Test
    public void shouldNotRetryOtherSqlErrors() {
        assertThat(errorHandler.isRetriable(new SQLException("permission denied for table a", "42501"))).isFalse();
        assertThat(errorHandler.isRetriable(new SQLException("relation \"a\" does not exist", "42P01"))).isFalse();
        assertThat(errorHandler.isRetriable(new SQLException("query canceled", "57014"))).isFalse();
    }

    @Test
    public void shouldRetryRolledBackTransactions() {
        assertThat(errorHandler.isRetriable(new SQLException("could not serialize access due to concurrent update", "40001"))).isTrue();
        assertThat(errorHandler.isRetriable(new SQLException("deadlock detected", "40P01"))).isTrue();
        assertThat(errorHandler.isRetriable(new SQLException("integrity constraint violation", "40002"))).isFalse();
    }

    @Test
    public void shouldTellTransientFailuresFromRepeatingOnes() {
        assertThat(PostgresErrorHandler.isTransient(new SQLException("canceling statement due to conflict with recovery", "40001"))).isTrue();
        assertThat(PostgresErrorHandler.isTransient(new SQLException("connection failure", "08006"))).isTrue();
        assertThat(PostgresErrorHandler.isTransient(new EOFException())).isTrue();
        assertThat(PostgresErrorHandler.isTransient(new DestinationException("store unavailable"))).isTrue();
        assertThat(PostgresErrorHandler.isTransient(new IllegalStateException("wrapped", new DestinationException("store unavailable")))).isTrue();

        assertThat(PostgresErrorHandler.isTransient(new SQLException("permission denied for table a", "42501"))).isFalse();
        assertThat(PostgresErrorHandler.isTransient(new ValueConversionException("Cannot convert value 'x' of column 'c'"))).isFalse();
        assertThat(PostgresErrorHandler.isTransient(new NullPointerException())).isFalse();
        assertThat(PostgresErrorHandler.isTransient(new ReplicationStreamException("Truncated INSERT message", new EOFException()))).isFalse();
        assertThat(PostgresErrorHandler.isTransient(null)).isFalse();
    }

    @Test
    public void shouldNotRetryCorruptStateWhateverTheCause() {
        assertThat(errorHandler.isRetriable(new ReplicationStreamException("Truncated INSERT message", new EOFException()))).isFalse();
        assertThat(errorHandler.isRetriable(new ReplicationSlotLostException("Replication slot pgmirror does not exist"))).isFalse();
        assertThat(errorHandler.isRetriable(new OffsetStoreCorruptedException("Offset file is not valid JSON"))).isFalse();
        assertThat(errorHandler.isRetriable(new IllegalArgumentException("Unknown table"))).isFalse();
    }

    @Test
    public void shouldReportFailureToListener() {
        errorHandler.setProducerThrowable(new SQLException("connection failure", "08006"));
        assertThat(reported).hasSize(1);
        assertThat(reported.get(0)).isInstanceOf(RetriableException.class);

        errorHandler.reset();
        errorHandler.setProducerThrowable(new ReplicationSlotLostException("Replication slot pgmirror does not exist"));
        assertThat(reported).hasSize(2);
        assertThat(reported.get(1)).isInstanceOf(ConnectException.class).isNotInstanceOf(RetriableException.class)
                .hasMessage("An exception occurred in the replication pipeline. It will be stopped.");
    }
}
