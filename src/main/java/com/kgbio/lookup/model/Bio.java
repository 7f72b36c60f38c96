package com.kgbio.lookup.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Aggregated biography of one person, built fresh for each request and never mutated afterwards.
 *
 * @param id          resource URI of the person (or the bare QID when the core query returned nothing)
 * @param qid         entity identifier of the person
 * @param ragText     flattened text rendering for a downstream text-generation step
 */
@JsonPropertyOrder({"id", "qid", "label", "description", "core", "lists", "timeline", "rag_text"})
public record Bio(
        String id,
        Identifier qid,
        String label,
        String description,
        CoreFacts core,
        ListsByKind lists,
        TimelineByKind timeline,
        @JsonProperty("rag_text") String ragText) {
}
