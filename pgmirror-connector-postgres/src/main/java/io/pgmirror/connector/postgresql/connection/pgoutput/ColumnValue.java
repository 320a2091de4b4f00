/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgmirror.connector.postgresql.connection.pgoutput;

import java.nio.charset.StandardCharsets;

import io.pgmirror.annotation.Immutable;

/**
 * One column of a tuple as sent by the server.
 */
@Immutable
public final class ColumnValue {

    public enum Kind {
        NULL('n'),
        /**
         * The value was stored out of line and was not changed, so the server did not send it.
         */
        UNCHANGED_TOAST('u'),
        TEXT('t'),
        BINARY('b');

        private final char code;

        Kind(char code) {
            this.code = code;
        }

        public char code() {
            return code;
        }
    }

    private static final ColumnValue NULL = new ColumnValue(Kind.NULL, null);
    private static final ColumnValue UNCHANGED_TOAST = new ColumnValue(Kind.UNCHANGED_TOAST, null);

    public static ColumnValue nullValue() {
        return NULL;
    }

    public static ColumnValue unchangedToast() {
        return UNCHANGED_TOAST;
    }

    public static ColumnValue text(String value) {
        return new ColumnValue(Kind.TEXT, value.getBytes(StandardCharsets.UTF_8));
    }

    public static ColumnValue of(Kind kind, byte[] data) {
        return new ColumnValue(kind, data);
    }

    private final Kind kind;
    private final byte[] data;

    private ColumnValue(Kind kind, byte[] data) {
        this.kind = kind;
        this.data = data;
    }

    public Kind kind() {
        return kind;
    }

    public boolean isNull() {
        return kind == Kind.NULL;
    }

    public boolean isUnchangedToast() {
        return kind == Kind.UNCHANGED_TOAST;
    }

    /**
     * @return the value in the server's text output format, or null for null and unchanged values
     */
    public String asText() {
        return data == null ? null : new String(data, StandardCharsets.UTF_8);
    }

    public byte[] asBytes() {
        return data == null ? null : data.clone();
    }

    @Override
    public String toString() {
        switch (kind) {
            case TEXT:
                return asText();
            case BINARY:
                return "<" + data.length + " bytes>";
            default:
                return kind.name();
        }
    }
}
