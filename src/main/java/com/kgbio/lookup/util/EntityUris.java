package com.kgbio.lookup.util;

import com.kgbio.lookup.model.Identifier;

/**
 * Entity identifiers embedded in resource URIs, e.g. {@code http://www.wikidata.org/entity/Q2338559}.
 */
public final class EntityUris {
    static final String ENTITY_MARKER = "/entity/";

    private EntityUris() {}

    /**
     * Text after the last {@code /entity/} marker as an entity id. Null for literals, for URIs
     * without the marker and for suffixes that are not a QID (property or lexeme URIs).
     */
    public static Identifier qidFromUri(String uri) {
        if (uri == null || uri.isEmpty()) return null;
        int idx = uri.lastIndexOf(ENTITY_MARKER);
        if (idx < 0) return null;
        String tail = uri.substring(idx + ENTITY_MARKER.length());
        return IdentifierValidator.isValid(tail, Identifier.Kind.ENTITY) ? Identifier.entity(tail) : null;
    }
}
