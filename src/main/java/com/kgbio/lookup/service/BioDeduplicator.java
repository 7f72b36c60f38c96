package com.kgbio.lookup.service;

import com.kgbio.lookup.model.LabeledValue;
import com.kgbio.lookup.model.TimelineEntry;
import com.kgbio.lookup.util.WikidataDates;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Order-preserving deduplication of list values and chronological ordering of timeline entries.
 */
@Component
public class BioDeduplicator {

    /**
     * Ascending by start, then point in time, then end; a missing or unparseable date sorts after
     * every known date, and label text breaks the remaining ties. Entries without any date end up last.
     */
    public static final Comparator<TimelineEntry> TIMELINE_ORDER = Comparator
            .comparing((TimelineEntry e) -> instantOrMax(e.start()))
            .thenComparing(e -> instantOrMax(e.pointInTime()))
            .thenComparing(e -> instantOrMax(e.end()))
            .thenComparing(e -> e.label() == null ? "" : e.label());

    /** First occurrence per {@code id} wins; relative order is kept. */
    public List<LabeledValue> dedupeList(List<LabeledValue> values) {
        Set<String> seen = new HashSet<>();
        List<LabeledValue> out = new ArrayList<>(values.size());
        for (LabeledValue v : values) {
            if (seen.add(v.id())) out.add(v);
        }
        return out;
    }

    /**
     * Entries are duplicates only when id and all three date qualifiers match; the same value with
     * different dates is a distinct fact. The sort is stable.
     */
    public List<TimelineEntry> dedupeAndSortTimeline(List<TimelineEntry> entries) {
        Set<TimelineKey> seen = new HashSet<>();
        List<TimelineEntry> out = new ArrayList<>(entries.size());
        for (TimelineEntry e : entries) {
            if (seen.add(new TimelineKey(e.id(), e.start(), e.end(), e.pointInTime()))) out.add(e);
        }
        out.sort(TIMELINE_ORDER);
        return out;
    }

    private static Instant instantOrMax(String timestamp) {
        return Objects.requireNonNullElse(WikidataDates.parse(timestamp), Instant.MAX);
    }

    private record TimelineKey(String id, String start, String end, String pointInTime) {}
}
