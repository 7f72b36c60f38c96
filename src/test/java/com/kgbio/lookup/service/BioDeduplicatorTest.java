package com.kgbio.lookup.service;

import com.kgbio.lookup.model.LabeledValue;
import com.kgbio.lookup.model.TimelineEntry;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.kgbio.lookup.service.LookupStubs.WD;
import static org.junit.jupiter.api.Assertions.*;

public class BioDeduplicatorTest {
    private final BioDeduplicator dedup = new BioDeduplicator();

    private static TimelineEntry entry(String qid, String label, String start, String end, String pit) {
        return TimelineEntry.of(WD + qid, label, start, end, pit);
    }

    @Test
    public void listDedupKeepsFirstSeenAndOrder() {
        List<LabeledValue> out = dedup.dedupeList(List.of(
                LabeledValue.of(WD + "Q3", "c"),
                LabeledValue.of(WD + "Q1", "a"),
                LabeledValue.of(WD + "Q3", "c again"),
                LabeledValue.of(WD + "Q2", "b")));
        assertEquals(List.of("c", "a", "b"), out.stream().map(LabeledValue::label).toList());
    }

    @Test
    public void sameValueWithDifferentDatesIsDistinct() {
        List<TimelineEntry> out = dedup.dedupeAndSortTimeline(List.of(
                entry("Q2333", "Hertha BSC", "2015-02-05T00:00:00Z", "2019-06-30T00:00:00Z", null),
                entry("Q2333", "Hertha BSC", "2021-01-25T00:00:00Z", null, null),
                entry("Q2333", "Hertha BSC", "2015-02-05T00:00:00Z", "2019-06-30T00:00:00Z", null)));
        assertEquals(2, out.size());
        assertEquals("2015-02-05T00:00:00Z", out.get(0).start());
        assertEquals("2021-01-25T00:00:00Z", out.get(1).start());
    }

    @Test
    public void undatedEntriesSortLastRegardlessOfLabel() {
        List<TimelineEntry> out = dedup.dedupeAndSortTimeline(List.of(
                entry("Q1", "AAA undated", null, null, null),
                entry("Q2", "zzz ended", null, "1990-01-01T00:00:00Z", null),
                entry("Q3", "mmm instant", null, null, "2001-01-01T00:00:00Z"),
                entry("Q4", "bbb started", "2010-01-01T00:00:00Z", null, null)));
        assertEquals(List.of("bbb started", "mmm instant", "zzz ended", "AAA undated"),
                out.stream().map(TimelineEntry::label).toList());
    }

    @Test
    public void tiesBreakOnLabelThenNullLabelFirst() {
        List<TimelineEntry> out = dedup.dedupeAndSortTimeline(List.of(
                entry("Q1", "Beta", "2000-01-01T00:00:00Z", null, null),
                entry("Q2", "Alpha", "2000-01-01T00:00:00Z", null, null),
                entry("Q3", null, "2000-01-01T00:00:00Z", null, null),
                entry("Q4", "Zed", null, null, null),
                entry("Q5", "Ann", null, null, null)));
        assertEquals(WD + "Q3", out.get(0).id());
        assertEquals("Alpha", out.get(1).label());
        assertEquals("Beta", out.get(2).label());
        assertEquals("Ann", out.get(3).label());
        assertEquals("Zed", out.get(4).label());
    }

    @Test
    public void startThenPointInTimeThenEnd() {
        List<TimelineEntry> out = dedup.dedupeAndSortTimeline(List.of(
                entry("Q1", "later end", "2000-01-01T00:00:00Z", "2005-01-01T00:00:00Z", null),
                entry("Q2", "earlier end", "2000-01-01T00:00:00Z", "2003-01-01T00:00:00Z", null),
                entry("Q3", "earlier start", "1999-01-01T00:00:00Z", "2010-01-01T00:00:00Z", null)));
        assertEquals(List.of("earlier start", "earlier end", "later end"), out.stream().map(TimelineEntry::label).toList());
    }

    @Test
    public void unparseableDateCountsAsMissing() {
        List<TimelineEntry> out = dedup.dedupeAndSortTimeline(List.of(
                entry("Q1", "garbled", "sometime", null, null),
                entry("Q2", "dated", "1950-01-01T00:00:00Z", null, null)));
        assertEquals("dated", out.get(0).label());
    }

    @Test
    public void orderingIsDeterministic() {
        List<TimelineEntry> in = List.of(
                entry("Q1", "b", null, null, null),
                entry("Q2", "a", "2001-01-01T00:00:00Z", null, null),
                entry("Q3", "c", null, null, "1999-01-01T00:00:00Z"));
        assertEquals(dedup.dedupeAndSortTimeline(in), dedup.dedupeAndSortTimeline(List.of(in.get(2), in.get(0), in.get(1))));
    }
}
