package com.kgbio.lookup.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * Time-qualified relationship categories. {@code inverse} kinds are statements made on the
 * related item pointing back at the person (e.g. a team's head coach statement).
 */
public enum TimelineKind {
    POSITION_HELD("position_held", "P39", false),
    SPORTS_TEAM("sports_team", "P54", false),
    COACHED_TEAM("coached_team", "P6087", false),
    HEAD_COACH_OF("head_coach_of", "P286", true),
    EMPLOYER("employer", "P108", false),
    EDUCATED_AT("educated_at", "P69", false);

    private final String key;
    private final Identifier property;
    private final boolean inverse;

    TimelineKind(String key, String property, boolean inverse) {
        this.key = key;
        this.property = Identifier.property(property);
        this.inverse = inverse;
    }

    @JsonValue
    public String key() { return key; }

    public Identifier property() { return property; }

    public boolean isInverse() { return inverse; }

    public static Optional<TimelineKind> fromKey(String key) {
        return Arrays.stream(values()).filter(k -> k.key.equals(key)).findFirst();
    }
}
