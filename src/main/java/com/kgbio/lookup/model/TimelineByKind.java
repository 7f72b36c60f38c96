package com.kgbio.lookup.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Time-qualified facts grouped by category, each list in chronological order.
 */
public final class TimelineByKind {
    private final Map<TimelineKind, List<TimelineEntry>> byKind;

    public TimelineByKind(Map<TimelineKind, List<TimelineEntry>> byKind) {
        EnumMap<TimelineKind, List<TimelineEntry>> copy = new EnumMap<>(TimelineKind.class);
        byKind.forEach((kind, entries) -> {
            if (entries != null && !entries.isEmpty()) copy.put(kind, List.copyOf(entries));
        });
        this.byKind = Collections.unmodifiableMap(copy);
    }

    public static TimelineByKind empty() {
        return new TimelineByKind(Map.of());
    }

    public List<TimelineEntry> get(TimelineKind kind) {
        return byKind.getOrDefault(kind, List.of());
    }

    public Map<TimelineKind, List<TimelineEntry>> asMap() { return byKind; }

    @JsonValue
    public Map<String, List<TimelineEntry>> toJson() {
        Map<String, List<TimelineEntry>> out = new LinkedHashMap<>();
        byKind.forEach((kind, entries) -> out.put(kind.key(), entries));
        return out;
    }

    @Override
    public String toString() { return toJson().toString(); }
}
