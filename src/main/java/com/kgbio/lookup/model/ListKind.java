package com.kgbio.lookup.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * Multi-valued attribute categories and the direct property each one is read from.
 */
public enum ListKind {
    CITIZENSHIP("citizenship", "P27"),
    OCCUPATION("occupation", "P106"),
    FIELD_OF_WORK("field_of_work", "P101"),
    LANGUAGE_SPOKEN("language_spoken", "P1412"),
    AWARD("award", "P166"),
    NOTABLE_WORK("notable_work", "P800"),
    SPOUSE("spouse", "P26"),
    CHILD("child", "P40"),
    MEMBER_OF("member_of", "P463");

    private final String key;
    private final Identifier property;

    ListKind(String key, String property) {
        this.key = key;
        this.property = Identifier.property(property);
    }

    @JsonValue
    public String key() { return key; }

    public Identifier property() { return property; }

    public static Optional<ListKind> fromKey(String key) {
        return Arrays.stream(values()).filter(k -> k.key.equals(key)).findFirst();
    }
}
