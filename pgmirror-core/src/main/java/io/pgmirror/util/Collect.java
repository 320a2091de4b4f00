/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgmirror.util;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A set of utilities for more easily creating various kinds of collections.
 */
public final class Collect {

    @SafeVarargs
    public static <T> List<T> arrayListOf(T... values) {
        List<T> result = new ArrayList<>(values.length);
        Collections.addAll(result, values);
        return result;
    }

    @SafeVarargs
    public static <T> Set<T> unmodifiableSet(T... values) {
        return unmodifiableSet(arrayListOf(values));
    }

    public static <T> Set<T> unmodifiableSet(Collection<T> values) {
        return Collections.unmodifiableSet(new LinkedHashSet<>(values));
    }

    private Collect() {
    }
}
