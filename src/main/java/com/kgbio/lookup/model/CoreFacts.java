package com.kgbio.lookup.model;

/**
 * Fixed-shape biographical attributes of a person. Every field may be null.
 * Dates are the raw timestamps returned by the query service.
 */
public record CoreFacts(
        String id,
        String label,
        String description,
        String dateOfBirth,
        LabeledValue placeOfBirth,
        String dateOfDeath,
        LabeledValue placeOfDeath,
        LabeledValue givenName,
        LabeledValue familyName,
        String nativeName,
        LabeledValue gender,
        String image) {

    public static CoreFacts empty() {
        return new CoreFacts(null, null, null, null, null, null, null, null, null, null, null, null);
    }

    public boolean hasBirth() {
        return dateOfBirth != null || labelOf(placeOfBirth) != null;
    }

    public boolean hasDeath() {
        return dateOfDeath != null || labelOf(placeOfDeath) != null;
    }

    static String labelOf(LabeledValue value) {
        return value == null ? null : value.label();
    }
}
