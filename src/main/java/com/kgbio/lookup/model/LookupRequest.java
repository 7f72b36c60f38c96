package com.kgbio.lookup.model;

/**
 * Free-text question parts produced by the extraction step: which property of which entity, when.
 */
public record LookupRequest(String entityText, String propertyText, YearFilter year, String language) {

    public LookupRequest {
        if (year == null) year = YearFilter.current();
    }
}
