package com.kgbio.lookup.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One bound variable of a result row, as in the SPARQL 1.1 JSON results format.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SparqlValue(
        String type,
        String value,
        String datatype,
        @JsonProperty("xml:lang") String lang) {

    public static SparqlValue literal(String value) {
        return new SparqlValue("literal", value, null, null);
    }

    public static SparqlValue uri(String value) {
        return new SparqlValue("uri", value, null, null);
    }
}
