package com.kgbio.lookup.model;

import com.kgbio.lookup.util.EntityUris;

/**
 * A statement-derived fact valid over {@code start..end} or at {@code pointInTime}.
 * Timestamps are kept as the query service returned them, e.g. {@code 1972-01-05T00:00:00Z}.
 * All three may be null.
 */
public record TimelineEntry(String id, Identifier qid, String label,
                            String start, String end, String pointInTime) {

    public static TimelineEntry of(String id, String label, String start, String end, String pointInTime) {
        return new TimelineEntry(id, EntityUris.qidFromUri(id), label, start, end, pointInTime);
    }
}
