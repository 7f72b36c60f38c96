package com.kgbio.lookup.model;

import com.kgbio.lookup.util.EntityUris;

/**
 * Reference to another graph node (or a plain literal) with its human readable label.
 *
 * @param id    full resource URI, or the literal value when the node is not a graph entity
 * @param qid   entity identifier taken from {@code id}; null for literals
 * @param label label in the requested language, may be null
 */
public record LabeledValue(String id, Identifier qid, String label) {

    public static LabeledValue of(String id, String label) {
        return new LabeledValue(id, EntityUris.qidFromUri(id), label);
    }
}
