package com.kgbio.lookup.model;

/**
 * Request-scoped result of the resolve step, passed down the lookup chain instead of being
 * stored on a shared client.
 */
public record ResolvedLookup(Identifier entity, Identifier property, YearFilter year, String language) {}
