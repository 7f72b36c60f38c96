package com.kgbio.lookup.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Result of a statement lookup: either the biography of the matched person together with the
 * statement row it came from, or the reason nothing was found.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class LookupOutcome {

    public enum NotFoundReason {
        ENTITY_NOT_FOUND,
        PROPERTY_NOT_FOUND,
        NO_MATCHING_STATEMENT,
        VALUE_NOT_AN_ENTITY;

        @JsonValue
        public String key() { return name().toLowerCase(); }
    }

    private final Bio bio;
    private final SparqlRow statement;
    private final NotFoundReason reason;

    private LookupOutcome(Bio bio, SparqlRow statement, NotFoundReason reason) {
        this.bio = bio;
        this.statement = statement;
        this.reason = reason;
    }

    public static LookupOutcome found(Bio bio, SparqlRow statement) {
        return new LookupOutcome(bio, statement, null);
    }

    public static LookupOutcome notFound(NotFoundReason reason) {
        return new LookupOutcome(null, null, reason);
    }

    public boolean isFound() { return bio != null; }
    public Bio getBio() { return bio; }
    public SparqlRow getStatement() { return statement; }
    public NotFoundReason getReason() { return reason; }

    @Override
    public String toString() {
        return isFound() ? "found(" + bio.qid() + ")" : "notFound(" + reason.key() + ")";
    }
}
