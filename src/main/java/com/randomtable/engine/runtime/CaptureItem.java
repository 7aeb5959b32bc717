package com.randomtable.engine.runtime;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * A captured roll: its text plus its evaluated sets. A set value is either a
 * {@code String} or a nested {@code CaptureItem}, which is what makes
 * {@code $a.@b.@c} chains possible.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class CaptureItem {

    /** Pseudo-properties that end a property chain. */
    public static final String VALUE = "value";
    public static final String COUNT = "count";
    public static final String DESCRIPTION = "description";

    public final String value;
    public final Map<String, Object> sets;
    public final String description; // may be null

    public CaptureItem(String value, Map<String, Object> sets, String description) {
        this.value = value == null ? "" : value;
        this.sets = sets == null ? Collections.emptyMap() : Collections.unmodifiableMap(new LinkedHashMap<>(sets));
        this.description = description;
    }

    public static CaptureItem text(String value) {
        return new CaptureItem(value, null, null);
    }

    public static boolean isTerminal(String property) {
        return VALUE.equals(property) || COUNT.equals(property) || DESCRIPTION.equals(property);
    }

    /** Text of an evaluated set value: the string itself, or a nested item's value. */
    public static String textOf(Object setValue) {
        if (setValue == null) return null;
        if (setValue instanceof CaptureItem) return ((CaptureItem) setValue).value;
        return String.valueOf(setValue);
    }

    @Override
    public String toString() {
        return value;
    }
}
