package com.kgbio.lookup.model;

import com.fasterxml.jackson.annotation.JsonValue;
import com.kgbio.lookup.exception.ValidationException;

import java.util.regex.Pattern;

/**
 * Stable graph identifier: an entity ({@code Q<digits>}) or a property ({@code P<digits>}).
 * An instance always holds a value that matched its kind's pattern, so it can be embedded
 * into query text as is.
 */
public record Identifier(Kind kind, String value) {

    public enum Kind {
        ENTITY("entity", Pattern.compile("^Q\\d+$"), "item"),
        PROPERTY("property", Pattern.compile("^P\\d+$"), "property");

        private final String label;
        private final Pattern pattern;
        private final String searchType;

        Kind(String label, Pattern pattern, String searchType) {
            this.label = label;
            this.pattern = pattern;
            this.searchType = searchType;
        }

        public boolean matches(String raw) {
            return raw != null && pattern.matcher(raw).matches();
        }

        /** Value of the {@code type} parameter of the search endpoint. */
        public String searchType() { return searchType; }

        @Override
        public String toString() { return label; }
    }

    public Identifier {
        if (kind == null) {
            throw new ValidationException("identifier kind is required");
        }
        if (!kind.matches(value)) {
            throw new ValidationException("invalid " + kind + " id: " + value);
        }
    }

    public static Identifier entity(String raw) {
        return new Identifier(Kind.ENTITY, raw);
    }

    public static Identifier property(String raw) {
        return new Identifier(Kind.PROPERTY, raw);
    }

    @JsonValue
    @Override
    public String toString() { return value; }
}
