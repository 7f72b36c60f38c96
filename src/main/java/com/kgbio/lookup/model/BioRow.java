package com.kgbio.lookup.model;

/**
 * Typed view of a biography query row; each variant carries only what its query can produce.
 */
public interface BioRow {

    record CoreRow(CoreFacts facts) implements BioRow {}

    record ListRow(ListKind kind, LabeledValue value) implements BioRow {}

    record TimelineRow(TimelineKind kind, TimelineEntry entry) implements BioRow {}
}
