package com.tpgsweep.orchestrator.materialize;

import com.tpgsweep.orchestrator.model.ParameterTuple;

import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Derives the directory name of an experiment unit from its tuple.
 *
 * Fields are sorted by key and rendered {@code key-value}, joined by
 * {@code _}. Booleans render as {@code True}/{@code False}, the spelling
 * downstream tooling greps for (e.g. {@code useInstrTrig-True}).
 * Equal field values always give the same id; the id does not depend on the
 * order fields were declared in.
 */
public final class ExperimentIds {

    static final String FIELD_SEPARATOR = "_";
    static final String KEY_VALUE_SEPARATOR = "-";

    private ExperimentIds() {}

    /**
     * @throws IllegalArgumentException if a key or value contains the field separator,
     *         which would make two different tuples share an id
     */
    public static String of(ParameterTuple tuple) {
        return of(tuple.identityFields());
    }

    public static String of(Map<String, ?> fields) {
        if (fields.isEmpty()) {
            throw new IllegalArgumentException("cannot derive an id from zero fields");
        }
        return new TreeMap<>(fields).entrySet().stream()
                .map(e -> checked(e.getKey()) + KEY_VALUE_SEPARATOR + checked(format(e.getValue())))
                .collect(Collectors.joining(FIELD_SEPARATOR));
    }

    static String format(Object value) {
        if (value instanceof Boolean b) {
            return b ? "True" : "False";
        }
        return String.valueOf(value);
    }

    private static String checked(String part) {
        if (part.contains(FIELD_SEPARATOR)) {
            throw new IllegalArgumentException(
                    "'" + part + "' contains the id separator '" + FIELD_SEPARATOR + "'");
        }
        return part;
    }
}
