package com.kgbio.lookup.util;

import com.kgbio.lookup.exception.ValidationException;
import com.kgbio.lookup.model.Identifier;

import java.util.regex.Pattern;

/**
 * Guards every point where text becomes part of a query: identifiers and language tags.
 */
public final class IdentifierValidator {
    private static final Pattern LANGUAGE = Pattern.compile("^[a-zA-Z]{2,3}(-[a-zA-Z0-9]+)*$");
    private static final Pattern BARE_DIGITS = Pattern.compile("^\\d+$");

    private IdentifierValidator() {}

    /**
     * @throws ValidationException with message {@code invalid <kind> id: <raw>} on mismatch
     */
    public static Identifier validate(String raw, Identifier.Kind kind) {
        return new Identifier(kind, raw);
    }

    public static boolean isValid(String raw, Identifier.Kind kind) {
        return kind != null && kind.matches(raw);
    }

    /**
     * Lenient form used where a user types an entity id directly: surrounding whitespace is
     * dropped and bare digits get the {@code Q} prefix. Anything else must already be a QID.
     */
    public static Identifier normalizeEntity(String raw) {
        String trimmed = raw == null ? null : raw.trim();
        if (trimmed != null && BARE_DIGITS.matcher(trimmed).matches()) {
            trimmed = "Q" + trimmed;
        }
        return validate(trimmed, Identifier.Kind.ENTITY);
    }

    public static String validateLanguage(String language) {
        if (language == null || !LANGUAGE.matcher(language).matches()) {
            throw new ValidationException("invalid language: " + language);
        }
        return language;
    }
}
