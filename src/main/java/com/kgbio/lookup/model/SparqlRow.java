package com.kgbio.lookup.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A result row: variable name to bound value. Unbound variables are simply missing.
 */
public final class SparqlRow {
    private final Map<String, SparqlValue> bindings;

    public SparqlRow(Map<String, SparqlValue> bindings) {
        this.bindings = Collections.unmodifiableMap(new LinkedHashMap<>(bindings));
    }

    /** Plain string value of {@code var}, or null when unbound. */
    public String value(String var) {
        SparqlValue v = bindings.get(var);
        return v == null ? null : v.value();
    }

    @JsonValue
    public Map<String, SparqlValue> bindings() { return bindings; }

    @Override
    public boolean equals(Object o) {
        return o instanceof SparqlRow other && bindings.equals(other.bindings);
    }

    @Override
    public int hashCode() { return bindings.hashCode(); }

    @Override
    public String toString() { return bindings.toString(); }
}
