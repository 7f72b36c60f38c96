package com.kgbio.lookup.service;

import com.kgbio.lookup.model.BioRow.CoreRow;
import com.kgbio.lookup.model.BioRow.ListRow;
import com.kgbio.lookup.model.BioRow.TimelineRow;
import com.kgbio.lookup.model.CoreFacts;
import com.kgbio.lookup.model.LabeledValue;
import com.kgbio.lookup.model.ListKind;
import com.kgbio.lookup.model.ListsByKind;
import com.kgbio.lookup.model.SparqlResult;
import com.kgbio.lookup.model.SparqlRow;
import com.kgbio.lookup.model.TimelineByKind;
import com.kgbio.lookup.model.TimelineEntry;
import com.kgbio.lookup.model.TimelineKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Maps raw rows of the three person queries into typed rows, then into grouped collections.
 * Incomplete rows (no {@code kind}, no {@code value}, or an unknown kind) are dropped, not errors.
 */
@Component
public class BioResultParser {
    private static final Logger log = LoggerFactory.getLogger(BioResultParser.class);

    private final BioDeduplicator deduplicator;

    public BioResultParser(BioDeduplicator deduplicator) {
        this.deduplicator = deduplicator;
    }

    public CoreFacts parseCore(SparqlResult result) {
        return result.rows().stream()
                .findFirst()
                .map(BioResultParser::toCoreRow)
                .map(CoreRow::facts)
                .orElseGet(CoreFacts::empty);
    }

    public ListsByKind parseLists(SparqlResult result) {
        Map<ListKind, List<LabeledValue>> grouped = new EnumMap<>(ListKind.class);
        for (SparqlRow raw : result.rows()) {
            toListRow(raw).ifPresent(row -> grouped.computeIfAbsent(row.kind(), k -> new ArrayList<>()).add(row.value()));
        }
        grouped.replaceAll((kind, values) -> deduplicator.dedupeList(values));
        return new ListsByKind(grouped);
    }

    public TimelineByKind parseTimeline(SparqlResult result) {
        Map<TimelineKind, List<TimelineEntry>> grouped = new EnumMap<>(TimelineKind.class);
        for (SparqlRow raw : result.rows()) {
            toTimelineRow(raw).ifPresent(row -> grouped.computeIfAbsent(row.kind(), k -> new ArrayList<>()).add(row.entry()));
        }
        grouped.replaceAll((kind, entries) -> deduplicator.dedupeAndSortTimeline(entries));
        return new TimelineByKind(grouped);
    }

    static CoreRow toCoreRow(SparqlRow b) {
        return new CoreRow(new CoreFacts(
                b.value("item"),
                b.value("itemLabel"),
                b.value("itemDescription"),
                b.value("dateOfBirth"),
                labeled(b, "placeOfBirth", "placeOfBirthLabel"),
                b.value("dateOfDeath"),
                labeled(b, "placeOfDeath", "placeOfDeathLabel"),
                labeled(b, "givenName", "givenNameLabel"),
                labeled(b, "familyName", "familyNameLabel"),
                b.value("nativeName"),
                labeled(b, "gender", "genderLabel"),
                b.value("image")));
    }

    static Optional<ListRow> toListRow(SparqlRow b) {
        String kindKey = b.value("kind");
        String value = b.value("value");
        if (isBlank(kindKey) || isBlank(value)) return Optional.empty();
        Optional<ListKind> kind = ListKind.fromKey(kindKey);
        if (kind.isEmpty()) {
            log.debug("Dropping list row with unknown kind '{}'", kindKey);
            return Optional.empty();
        }
        return Optional.of(new ListRow(kind.get(), LabeledValue.of(value, b.value("valueLabel"))));
    }

    static Optional<TimelineRow> toTimelineRow(SparqlRow b) {
        String kindKey = b.value("kind");
        String value = b.value("value");
        if (isBlank(kindKey) || isBlank(value)) return Optional.empty();
        Optional<TimelineKind> kind = TimelineKind.fromKey(kindKey);
        if (kind.isEmpty()) {
            log.debug("Dropping timeline row with unknown kind '{}'", kindKey);
            return Optional.empty();
        }
        TimelineEntry entry = TimelineEntry.of(value, b.value("valueLabel"),
                b.value("start"), b.value("end"), b.value("pointInTime"));
        return Optional.of(new TimelineRow(kind.get(), entry));
    }

    private static LabeledValue labeled(SparqlRow b, String idVar, String labelVar) {
        String id = b.value(idVar);
        if (isBlank(id)) return null;
        return LabeledValue.of(id, b.value(labelVar));
    }

    private static boolean isBlank(String s) {
        return s == null || s.isEmpty();
    }
}
