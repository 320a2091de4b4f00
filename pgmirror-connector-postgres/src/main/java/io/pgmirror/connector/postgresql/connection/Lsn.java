/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgmirror.connector.postgresql.connection;

import java.util.Objects;

import org.postgresql.replication.LogSequenceNumber;

import io.pgmirror.annotation.Immutable;

/**
 * A position in the PostgreSQL write-ahead log. Printed in the server's {@code X/Y} notation.
 */
@Immutable
public final class Lsn implements Comparable<Lsn> {

    public static final Lsn INVALID = new Lsn(0L);

    private final long value;

    private Lsn(long value) {
        this.value = value;
    }

    public static Lsn valueOf(long value) {
        return value == 0L ? INVALID : new Lsn(value);
    }

    /**
     * Parse the {@code X/Y} notation.
     *
     * @param text the textual LSN; may be null
     * @return the LSN, or {@link #INVALID} for null or unparseable input
     */
    public static Lsn valueOf(String text) {
        if (text == null) {
            return INVALID;
        }
        return valueOf(LogSequenceNumber.valueOf(text.trim()).asLong());
    }

    public static Lsn valueOf(LogSequenceNumber lsn) {
        return lsn == null ? INVALID : valueOf(lsn.asLong());
    }

    public long asLong() {
        return value;
    }

    public LogSequenceNumber asLogSequenceNumber() {
        return LogSequenceNumber.valueOf(value);
    }

    public boolean isValid() {
        return value != 0L;
    }

    public boolean isAfter(Lsn other) {
        return compareTo(other) > 0;
    }

    public static Lsn max(Lsn a, Lsn b) {
        return a.compareTo(b) >= 0 ? a : b;
    }

    public static Lsn min(Lsn a, Lsn b) {
        return a.compareTo(b) <= 0 ? a : b;
    }

    @Override
    public int compareTo(Lsn o) {
        return Long.compareUnsigned(value, o.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return value == ((Lsn) o).value;
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(value);
    }

    @Override
    public String toString() {
        return Long.toHexString(value >>> 32).toUpperCase() + "/" + Long.toHexString(value & 0xFFFFFFFFL).toUpperCase();
    }
}
