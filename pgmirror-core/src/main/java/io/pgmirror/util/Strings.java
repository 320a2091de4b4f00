/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgmirror.util;

/**
 * String-related utility methods.
 */
public final class Strings {

    /**
     * Converts the given duration into a human-readable string representation in the format {@code hh:mm:ss.SSS},
     * with trailing zeros of the milliseconds removed.
     *
     * @param durationInMillis the duration in milliseconds
     * @return the formatted duration
     */
    public static String duration(long durationInMillis) {
        long seconds = durationInMillis / 1000;
        long s = seconds % 60;
        long m = (seconds / 60) % 60;
        long h = (seconds / (60 * 60));
        long q = durationInMillis % 1000;

        StringBuilder result = new StringBuilder(15);
        appendTwoDigits(result, h).append(':');
        appendTwoDigits(result, m).append(':');
        appendTwoDigits(result, s).append('.');

        if (q == 0) {
            return result.append('0').toString();
        }
        String millis = String.format("%03d", q);
        int end = millis.length();
        while (millis.charAt(end - 1) == '0') {
            end--;
        }
        return result.append(millis, 0, end).toString();
    }

    private static StringBuilder appendTwoDigits(StringBuilder sb, long value) {
        if (value < 10) {
            sb.append('0');
        }
        return sb.append(value);
    }

    private Strings() {
    }
}
