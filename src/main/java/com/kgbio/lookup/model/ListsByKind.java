package com.kgbio.lookup.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Multi-valued attributes grouped by category. Only categories with at least one value are present.
 */
public final class ListsByKind {
    private final Map<ListKind, List<LabeledValue>> byKind;

    public ListsByKind(Map<ListKind, List<LabeledValue>> byKind) {
        EnumMap<ListKind, List<LabeledValue>> copy = new EnumMap<>(ListKind.class);
        byKind.forEach((kind, values) -> {
            if (values != null && !values.isEmpty()) copy.put(kind, List.copyOf(values));
        });
        this.byKind = Collections.unmodifiableMap(copy);
    }

    public static ListsByKind empty() {
        return new ListsByKind(Map.of());
    }

    public List<LabeledValue> get(ListKind kind) {
        return byKind.getOrDefault(kind, List.of());
    }

    public Map<ListKind, List<LabeledValue>> asMap() { return byKind; }

    @JsonValue
    public Map<String, List<LabeledValue>> toJson() {
        Map<String, List<LabeledValue>> out = new LinkedHashMap<>();
        byKind.forEach((kind, values) -> out.put(kind.key(), values));
        return out;
    }

    @Override
    public String toString() { return toJson().toString(); }
}
