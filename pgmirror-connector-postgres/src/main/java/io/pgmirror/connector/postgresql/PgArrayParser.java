/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgmirror.connector.postgresql;

import java.util.ArrayList;
import java.util.List;

import io.pgmirror.annotation.NotThreadSafe;

/**
 * Parses the text output format of PostgreSQL arrays, such as <code>{{1,NULL},{"a b","NULL"}}</code>, into nested
 * lists. Elements are returned as strings in their own text output format; an unquoted {@code NULL} becomes
 * {@code null} while a quoted one stays the string {@code "NULL"}.
 */
@NotThreadSafe
public final class PgArrayParser {

    private final String text;
    private final char delimiter;
    private int pos;

    private PgArrayParser(String text, char delimiter) {
        this.text = text;
        this.delimiter = delimiter;
    }

    /**
     * Parse an array literal using the comma delimiter that all supported types use.
     *
     * @param text the array literal; may not be null
     * @return the elements, nested to the depth of the array
     * @throws ValueConversionException if the literal is malformed
     */
    public static List<Object> parse(String text) {
        return parse(text, ',');
    }

    public static List<Object> parse(String text, char delimiter) {
        final PgArrayParser parser = new PgArrayParser(text, delimiter);
        parser.skipDimensions();
        final List<Object> result = parser.readArray();
        parser.skipWhitespace();
        if (parser.pos != text.length()) {
            throw parser.malformed("unexpected trailing characters");
        }
        return result;
    }

    // arrays with non default lower bounds carry a prefix such as [0:1]={...}
    private void skipDimensions() {
        skipWhitespace();
        if (pos < text.length() && text.charAt(pos) == '[') {
            final int equals = text.indexOf('=', pos);
            if (equals < 0) {
                throw malformed("unterminated dimension decoration");
            }
            pos = equals + 1;
        }
    }

    private List<Object> readArray() {
        skipWhitespace();
        expect('{');
        final List<Object> elements = new ArrayList<>();
        skipWhitespace();
        if (peek() == '}') {
            pos++;
            return elements;
        }
        while (true) {
            skipWhitespace();
            final char c = peek();
            if (c == '{') {
                elements.add(readArray());
            }
            else if (c == '"') {
                elements.add(readQuoted());
            }
            else {
                elements.add(readUnquoted());
            }
            skipWhitespace();
            final char next = peek();
            pos++;
            if (next == '}') {
                return elements;
            }
            if (next != delimiter) {
                throw malformed("expected '" + delimiter + "' or '}' but found '" + next + "'");
            }
        }
    }

    private String readQuoted() {
        expect('"');
        final StringBuilder sb = new StringBuilder();
        while (true) {
            final char c = next();
            if (c == '"') {
                return sb.toString();
            }
            if (c == '\\') {
                sb.append(next());
            }
            else {
                sb.append(c);
            }
        }
    }

    private String readUnquoted() {
        final StringBuilder sb = new StringBuilder();
        while (pos < text.length()) {
            final char c = text.charAt(pos);
            if (c == delimiter || c == '}') {
                break;
            }
            if (c == '\\') {
                pos++;
                sb.append(next());
                continue;
            }
            sb.append(c);
            pos++;
        }
        final String value = sb.toString().trim();
        if (value.isEmpty()) {
            throw malformed("empty element");
        }
        return "NULL".equalsIgnoreCase(value) ? null : value;
    }

    private void skipWhitespace() {
        while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
            pos++;
        }
    }

    private char peek() {
        if (pos >= text.length()) {
            throw malformed("unexpected end of input");
        }
        return text.charAt(pos);
    }

    private char next() {
        final char c = peek();
        pos++;
        return c;
    }

    private void expect(char expected) {
        final char c = next();
        if (c != expected) {
            throw malformed("expected '" + expected + "' but found '" + c + "'");
        }
    }

    private ValueConversionException malformed(String problem) {
        return new ValueConversionException("Malformed array literal '" + text + "' at position " + pos + ": " + problem);
    }
}
