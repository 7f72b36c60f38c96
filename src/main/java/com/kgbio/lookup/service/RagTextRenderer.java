package com.kgbio.lookup.service;

import com.kgbio.lookup.model.CoreFacts;
import com.kgbio.lookup.model.LabeledValue;
import com.kgbio.lookup.model.ListKind;
import com.kgbio.lookup.model.ListsByKind;
import com.kgbio.lookup.model.TimelineByKind;
import com.kgbio.lookup.model.TimelineEntry;
import com.kgbio.lookup.model.TimelineKind;
import com.kgbio.lookup.util.WikidataDates;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Flattens a biography into short "Field: value" lines for a text-generation prompt.
 * Lines without data are left out rather than emitted blank.
 */
@Component
public class RagTextRenderer {
    static final int MAX_TIMELINE_ENTRIES = 30;
    static final List<TimelineKind> RENDERED_TIMELINE = List.of(
            TimelineKind.POSITION_HELD, TimelineKind.SPORTS_TEAM, TimelineKind.EMPLOYER, TimelineKind.EDUCATED_AT);

    public String render(CoreFacts core, ListsByKind lists, TimelineByKind timeline) {
        List<String> lines = new ArrayList<>();
        if (notEmpty(core.label())) lines.add("Name: " + core.label());
        if (notEmpty(core.description())) lines.add("Description: " + core.description());
        if (core.hasBirth()) lines.add("Born:" + dateAndPlace(core.dateOfBirth(), core.placeOfBirth()));
        if (core.hasDeath()) lines.add("Died:" + dateAndPlace(core.dateOfDeath(), core.placeOfDeath()));

        addLabels(lines, "Citizenship", lists.get(ListKind.CITIZENSHIP));
        addLabels(lines, "Occupation", lists.get(ListKind.OCCUPATION));
        addLabels(lines, "Awards", lists.get(ListKind.AWARD));
        addLabels(lines, "Notable works", lists.get(ListKind.NOTABLE_WORK));

        for (TimelineKind kind : RENDERED_TIMELINE) {
            List<TimelineEntry> entries = timeline.get(kind);
            if (entries.isEmpty()) continue;
            String joined = entries.stream()
                    .limit(MAX_TIMELINE_ENTRIES)
                    .map(e -> Objects.toString(e.label(), "") + formatSpan(e.start(), e.end(), e.pointInTime()))
                    .filter(RagTextRenderer::notEmpty)
                    .collect(Collectors.joining("; "));
            if (notEmpty(joined)) lines.add(kind.key() + ": " + joined);
        }
        return String.join("\n", lines);
    }

    /**
     * {@code " (1999)"} for an instant, {@code " (1999–2004)"} for an interval with either side
     * possibly blank, empty when there is no date at all.
     */
    static String formatSpan(String start, String end, String pointInTime) {
        String s = WikidataDates.year(start);
        String e = WikidataDates.year(end);
        if (s == null && e == null) {
            String p = WikidataDates.year(pointInTime);
            return p == null ? "" : " (" + p + ")";
        }
        return " (" + Objects.toString(s, "") + "–" + Objects.toString(e, "") + ")";
    }

    private static String dateAndPlace(String date, LabeledValue place) {
        StringBuilder sb = new StringBuilder();
        if (notEmpty(date)) sb.append(' ').append(date);
        String placeLabel = place == null ? null : place.label();
        if (notEmpty(placeLabel)) sb.append(" in ").append(placeLabel);
        return sb.toString();
    }

    private static void addLabels(List<String> lines, String title, List<LabeledValue> values) {
        List<String> labels = values.stream()
                .map(LabeledValue::label)
                .filter(RagTextRenderer::notEmpty)
                .collect(Collectors.toList());
        if (!labels.isEmpty()) lines.add(title + ": " + String.join("; ", labels));
    }

    private static boolean notEmpty(String s) {
        return s != null && !s.isEmpty();
    }
}
