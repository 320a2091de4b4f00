/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgmirror.relational;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import io.pgmirror.annotation.Immutable;

/**
 * Unique identifier for a table, made of an optional schema name and a table name.
 */
@Immutable
public final class TableId implements Comparable<TableId> {

    /**
     * Parse the supplied string, which is either {@code table} or {@code schema.table}. Either part may be
     * double quoted, in which case dots inside the quotes belong to the name and {@code ""} is a literal quote.
     *
     * @param str the string representation of the table identifier; may not be null
     * @return the table ID, or null if it could not be parsed
     */
    public static TableId parse(String str) {
        final List<String> parts = parseParts(str);
        if (parts.isEmpty() || parts.size() > 2) {
            return null;
        }
        if (parts.size() == 1) {
            return new TableId(null, parts.get(0));
        }
        return new TableId(parts.get(0), parts.get(1));
    }

    private static List<String> parseParts(String str) {
        List<String> parts = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean quoted = false;
        for (int i = 0; i < str.length(); i++) {
            char c = str.charAt(i);
            if (c == '"') {
                if (quoted && i + 1 < str.length() && str.charAt(i + 1) == '"') {
                    current.append('"');
                    i++;
                }
                else {
                    quoted = !quoted;
                }
            }
            else if (c == '.' && !quoted) {
                parts.add(current.toString().trim());
                current.setLength(0);
            }
            else {
                current.append(c);
            }
        }
        String last = current.toString().trim();
        if (!last.isEmpty() || !parts.isEmpty()) {
            parts.add(last);
        }
        return parts;
    }

    private final String schemaName;
    private final String tableName;
    private final String id;

    public TableId(String schemaName, String tableName) {
        this.schemaName = schemaName == null || schemaName.isEmpty() ? null : schemaName;
        this.tableName = Objects.requireNonNull(tableName, "table name");
        this.id = this.schemaName == null ? tableName : this.schemaName + "." + tableName;
    }

    public String schema() {
        return schemaName;
    }

    public String table() {
        return tableName;
    }

    public String identifier() {
        return id;
    }

    @Override
    public int compareTo(TableId that) {
        if (this == that) {
            return 0;
        }
        return this.id.compareTo(that.id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (obj instanceof TableId) {
            return this.compareTo((TableId) obj) == 0;
        }
        return false;
    }

    @Override
    public String toString() {
        return identifier();
    }

    /**
     * Returns a dot-separated String representation of this identifier, quoting all name parts with the {@code "} char.
     */
    public String toDoubleQuotedString() {
        StringBuilder quoted = new StringBuilder();
        if (schemaName != null) {
            quoted.append(quote(schemaName)).append('.');
        }
        return quoted.append(quote(tableName)).toString();
    }

    private static String quote(String identifierPart) {
        return '"' + identifierPart.replace("\"", "\"\"") + '"';
    }
}
